// FILE: Command.java
package org.foxesworld.viewbridge.engine.dispatch;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * One request to the owner thread: kind, optional string payload, two integer
 * parameters and an optional attachment. Immutable apart from its completion.
 *
 * <p>The completion future is the response half of the handshake. Waiting on it cannot
 * be interrupted because a submitted command always runs to completion.</p>
 */
public final class Command {

    private final CommandKind kind;
    private final String str;
    private final int int1;
    private final int int2;
    private final Object attachment;
    private final CompletableFuture<Integer> done = new CompletableFuture<>();

    private Command(CommandKind kind, String str, int int1, int int2, Object attachment) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.str = str;
        this.int1 = int1;
        this.int2 = int2;
        this.attachment = attachment;
    }

    public static Command of(CommandKind kind) {
        return new Command(kind, null, 0, 0, null);
    }

    public static Command of(CommandKind kind, String str, int int1, int int2) {
        return new Command(kind, str, int1, int2, null);
    }

    public static Command withAttachment(CommandKind kind, int int1, Object attachment) {
        return new Command(kind, null, int1, 0, attachment);
    }

    public CommandKind kind() { return kind; }
    public String str() { return str; }
    public int int1() { return int1; }
    public int int2() { return int2; }
    public Object attachment() { return attachment; }

    public boolean isDone() {
        return done.isDone();
    }

    void complete(int resultCode) {
        done.complete(resultCode);
    }

    /**
     * Wait up to {@code millis} for the owner to publish the result code.
     * Interrupts are remembered and restored, never acted upon.
     *
     * @return the code, or null if the command is still pending
     */
    Integer awaitFor(long millis) {
        boolean interrupted = false;
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(millis);
        try {
            while (true) {
                long left = deadline - System.nanoTime();
                try {
                    return left <= 0L ? done.getNow(null) : done.get(left, TimeUnit.NANOSECONDS);
                } catch (InterruptedException e) {
                    interrupted = true;
                } catch (TimeoutException e) {
                    return null;
                } catch (ExecutionException e) {
                    throw new IllegalStateException("command " + kind + " completed exceptionally", e.getCause());
                }
            }
        } finally {
            if (interrupted) Thread.currentThread().interrupt();
        }
    }

    @Override
    public String toString() {
        return "Command{" + kind + ", int1=" + int1 + ", int2=" + int2
                + (str != null ? ", str=" + str.length() + " chars" : "") + '}';
    }
}
