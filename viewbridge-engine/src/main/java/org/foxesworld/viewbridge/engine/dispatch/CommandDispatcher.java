// FILE: CommandDispatcher.java
package org.foxesworld.viewbridge.engine.dispatch;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.foxesworld.viewbridge.engine.ResultCodes;

import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * The single owner of the engine: "any thread -> owner thread" call/response bridge.
 *
 * <p>Design:</p>
 * <ul>
 *   <li>{@link #submit(Command)} blocks the caller until the owner executed the command and published its code</li>
 *   <li>a fair {@link ReentrantLock} is held by the submitter across hand-off and wait: at most one command is outstanding</li>
 *   <li>the request channel has depth one; the response channel is the command's own future</li>
 *   <li>a {@link CommandKind#QUIT} command is the last one the owner executes</li>
 * </ul>
 *
 * <p>Author: Calista Verner</p>
 */
public final class CommandDispatcher implements AutoCloseable {

    private static final Logger log = LogManager.getLogger(CommandDispatcher.class);

    private final CommandHandler handler;
    private final String threadName;

    private final ReentrantLock handshake = new ReentrantLock(true);
    private final BlockingQueue<Command> requests = new ArrayBlockingQueue<>(1);

    private volatile Thread owner;
    private volatile boolean running;

    public CommandDispatcher(CommandHandler handler) {
        this(handler, "viewbridge-owner");
    }

    public CommandDispatcher(CommandHandler handler, String threadName) {
        this.handler = Objects.requireNonNull(handler, "handler");
        this.threadName = Objects.requireNonNull(threadName, "threadName");
    }

    // ---------------------------------------------------------------------
    // LIFECYCLE
    // ---------------------------------------------------------------------

    public synchronized void start() {
        if (owner != null) {
            log.warn("[vb/dispatch] already started, skipping");
            return;
        }
        running = true;
        Thread t = new Thread(this::loop, threadName);
        t.setDaemon(true);
        owner = t;
        t.start();
        log.debug("[vb/dispatch] owner thread '{}' started", threadName);
    }

    public boolean isRunning() {
        return running;
    }

    public boolean isOwnerThread() {
        return Thread.currentThread() == owner;
    }

    public Thread ownerThread() {
        return owner;
    }

    /**
     * Submit a QUIT (when the owner still runs) and join the owner thread.
     *
     * @return true if the owner terminated within {@code joinMillis}
     */
    public boolean stop(long joinMillis) {
        Thread t = owner;
        if (t == null) return true;
        if (t == Thread.currentThread()) {
            throw new IllegalStateException("stop() called from the owner thread");
        }
        if (running) submit(Command.of(CommandKind.QUIT));
        try {
            t.join(Math.max(1L, joinMillis));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        boolean stopped = !t.isAlive();
        if (!stopped) log.warn("[vb/dispatch] owner thread did not stop within {} ms", joinMillis);
        return stopped;
    }

    @Override
    public void close() {
        stop(5_000L);
    }

    // ---------------------------------------------------------------------
    // SUBMIT
    // ---------------------------------------------------------------------

    public int submit(CommandKind kind) {
        return submit(Command.of(kind));
    }

    public int submit(CommandKind kind, String str, int int1, int int2) {
        return submit(Command.of(kind, str, int1, int2));
    }

    /**
     * Hand {@code cmd} to the owner and wait for its result code.
     *
     * @throws IllegalStateException when called from the owner thread (it would wait on itself)
     */
    public int submit(Command cmd) {
        Objects.requireNonNull(cmd, "cmd");
        Thread t = owner;
        if (t == null || !running) return ResultCodes.DISPATCHER_STOPPED;
        if (Thread.currentThread() == t) {
            throw new IllegalStateException("submit(" + cmd.kind() + ") from the owner thread would deadlock");
        }

        handshake.lock();
        try {
            if (!running) return ResultCodes.DISPATCHER_STOPPED;
            if (!handOff(cmd)) return ResultCodes.DISPATCHER_STOPPED;
            return awaitResult(cmd, t);
        } finally {
            handshake.unlock();
        }
    }

    private boolean handOff(Command cmd) {
        boolean interrupted = false;
        try {
            while (true) {
                try {
                    // bounded offer so a dead owner cannot strand the submitter
                    if (requests.offer(cmd, 50, TimeUnit.MILLISECONDS)) return true;
                    if (!running) return false;
                } catch (InterruptedException e) {
                    interrupted = true;
                }
            }
        } finally {
            if (interrupted) Thread.currentThread().interrupt();
        }
    }

    private int awaitResult(Command cmd, Thread ownerThread) {
        while (true) {
            Integer rc = cmd.awaitFor(100L);
            if (rc != null) return rc;
            if (!ownerThread.isAlive()) {
                // owner died without taking or finishing it
                requests.remove(cmd);
                cmd.complete(ResultCodes.DISPATCHER_STOPPED);
                Integer last = cmd.awaitFor(0L);
                return last != null ? last : ResultCodes.DISPATCHER_STOPPED;
            }
        }
    }

    // ---------------------------------------------------------------------
    // OWNER LOOP
    // ---------------------------------------------------------------------

    private void loop() {
        log.debug("[vb/dispatch] owner loop entered");
        Command cmd = null;
        try {
            while (true) {
                cmd = requests.take();
                int rc = execute(cmd);
                if (cmd.kind() == CommandKind.QUIT) {
                    running = false;
                    cmd.complete(rc);
                    log.debug("[vb/dispatch] quit executed, owner loop exits");
                    return;
                }
                cmd.complete(rc);
                cmd = null;
            }
        } catch (InterruptedException e) {
            log.warn("[vb/dispatch] owner thread interrupted, stopping");
            Thread.currentThread().interrupt();
        } finally {
            running = false;
            if (cmd != null && !cmd.isDone()) cmd.complete(ResultCodes.DISPATCHER_STOPPED);
            Command pending = requests.poll();
            if (pending != null) pending.complete(ResultCodes.DISPATCHER_STOPPED);
        }
    }

    private int execute(Command cmd) {
        try {
            return handler.handle(cmd);
        } catch (Throwable t) {
            log.error("[vb/dispatch] {} failed", cmd, t);
            return ResultCodes.ENGINE_ERROR;
        }
    }
}
