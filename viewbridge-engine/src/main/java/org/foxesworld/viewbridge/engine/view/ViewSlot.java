// FILE: ViewSlot.java
package org.foxesworld.viewbridge.engine.view;

import org.foxesworld.viewbridge.core.io.Utf8;
import org.foxesworld.viewbridge.core.queue.BoundedQueue;
import org.foxesworld.viewbridge.core.queue.EvictOldestRing;
import org.foxesworld.viewbridge.core.queue.RejectNewestQueue;
import org.foxesworld.viewbridge.engine.PixelLock;
import org.foxesworld.viewbridge.engine.spi.EngineSurface;

/**
 * State of one render surface, addressed by its fixed index in the {@link ViewRegistry}.
 *
 * <p>Slots are allocated once and reused. Input queues are fed from caller threads and
 * drained by the owner on tick; message queues are fed by the owner (console sink, script
 * bridge) and popped by callers. Every queue has its own lock. The engine surface and the
 * deferred payload are touched on the owner thread only.</p>
 */
public final class ViewSlot {

    public static final int POINTER_QUEUE_MAX = 64;
    public static final int WHEEL_QUEUE_MAX = 16;
    public static final int KEY_QUEUE_MAX = 32;
    public static final int SCRIPT_QUEUE_MAX = 32;
    public static final int CONSOLE_QUEUE_MAX = 64;
    public static final int MESSAGE_QUEUE_MAX = 64;

    /** Longest stored console/application message, in UTF-8 bytes. */
    public static final int MESSAGE_MAX_BYTES = 2047;
    /** Scripts must be shorter than this many UTF-8 bytes to be queued. */
    public static final int SCRIPT_BUFFER_BYTES = 1024;
    public static final int KEY_TEXT_MAX_BYTES = 31;

    private final int id;

    private final BoundedQueue<PointerEvent> pointer = new RejectNewestQueue<>(POINTER_QUEUE_MAX);
    private final BoundedQueue<WheelEvent> wheel = new RejectNewestQueue<>(WHEEL_QUEUE_MAX);
    private final BoundedQueue<KeyInput> keys = new RejectNewestQueue<>(KEY_QUEUE_MAX);
    private final BoundedQueue<String> scripts = new RejectNewestQueue<>(SCRIPT_QUEUE_MAX);
    private final BoundedQueue<byte[]> console = new EvictOldestRing<>(CONSOLE_QUEUE_MAX);
    private final BoundedQueue<byte[]> messages = new EvictOldestRing<>(MESSAGE_QUEUE_MAX);

    private final LoadStateMachine load;

    private volatile boolean live;
    private volatile int generation;
    private volatile int width;
    private volatile int height;
    private volatile int rowBytes;
    private volatile boolean bindingsInstalled;
    private volatile PixelLock pixelLock;

    // owner thread only
    private EngineSurface surface;
    private String pendingPayload;
    private boolean pendingIsUrl;

    ViewSlot(int id, LoadStateMachine load) {
        this.id = id;
        this.load = load;
    }

    public int id() { return id; }
    public boolean isLive() { return live; }

    /** Bumped on every release; input offered under an older generation is refused. */
    public int generation() { return generation; }
    public int width() { return width; }
    public int height() { return height; }
    public int rowBytes() { return rowBytes; }
    public LoadStateMachine load() { return load; }
    public EngineSurface surface() { return surface; }

    public boolean bindingsInstalled() { return bindingsInstalled; }
    public void setBindingsInstalled(boolean installed) { this.bindingsInstalled = installed; }

    public PixelLock pixelLock() { return pixelLock; }
    public void setPixelLock(PixelLock lock) { this.pixelLock = lock; }

    // ---------------------------------------------------------------------
    // lifecycle (owner thread, via ViewRegistry)
    // ---------------------------------------------------------------------

    void occupy(EngineSurface surface, int width, int height, int rowBytes) {
        clearQueues();
        this.surface = surface;
        this.width = width;
        this.height = height;
        this.rowBytes = rowBytes;
        this.bindingsInstalled = false;
        this.pixelLock = null;
        this.pendingPayload = null;
        this.pendingIsUrl = false;
        load.reset();
        this.live = true;
    }

    void clear() {
        this.live = false;
        this.generation++;
        clearQueues();
        this.surface = null;
        this.width = 0;
        this.height = 0;
        this.rowBytes = 0;
        this.bindingsInstalled = false;
        this.pixelLock = null;
        releasePayload();
        load.reset();
    }

    private void clearQueues() {
        pointer.clear();
        wheel.clear();
        keys.clear();
        scripts.clear();
        console.clear();
        messages.clear();
    }

    // ---------------------------------------------------------------------
    // deferred payload (owner thread)
    // ---------------------------------------------------------------------

    public void storePayload(String payload, boolean isUrl) {
        this.pendingPayload = payload;
        this.pendingIsUrl = isUrl;
    }

    public String pendingPayload() { return pendingPayload; }
    public boolean pendingIsUrl() { return pendingIsUrl; }

    public void releasePayload() {
        this.pendingPayload = null;
        this.pendingIsUrl = false;
    }

    // ---------------------------------------------------------------------
    // input (caller threads)
    // ---------------------------------------------------------------------

    // Callers pass the generation they read before checking liveness. The offer is
    // refused if the slot was released since, even when the id has been reused.

    public boolean enqueuePointer(int gen, int type, int x, int y, int button) {
        return admit(gen, pointer, new PointerEvent(type, x, y, button));
    }

    public boolean enqueueWheel(int gen, int type, int dx, int dy) {
        return admit(gen, wheel, new WheelEvent(type, dx, dy));
    }

    public boolean enqueueKey(int gen, int type, int keyCode, int modifiers, String text) {
        byte[] t = Utf8.encodeTruncated(text, KEY_TEXT_MAX_BYTES);
        return admit(gen, keys, new KeyInput(type, keyCode, modifiers, Utf8.decode(t, t.length)));
    }

    public boolean enqueueScript(int gen, String script) {
        if (script == null) return false;
        if (Utf8.encode(script).length >= SCRIPT_BUFFER_BYTES) return false;
        return admit(gen, scripts, script);
    }

    private <T> boolean admit(int gen, BoundedQueue<T> queue, T item) {
        if (!live || generation != gen) return false;
        return queue.offerIf(() -> live && generation == gen, item);
    }

    public BoundedQueue<PointerEvent> pointerQueue() { return pointer; }
    public BoundedQueue<WheelEvent> wheelQueue() { return wheel; }
    public BoundedQueue<KeyInput> keyQueue() { return keys; }
    public BoundedQueue<String> scriptQueue() { return scripts; }

    // ---------------------------------------------------------------------
    // output
    // ---------------------------------------------------------------------

    /** Console message from the engine; long messages are truncated. */
    public void pushConsole(String message) {
        if (!live || message == null || message.isEmpty()) return;
        console.offer(Utf8.encodeTruncated(message, MESSAGE_MAX_BYTES));
    }

    /**
     * Application message from the script bridge; messages above the size limit are dropped.
     *
     * @return true if queued
     */
    public boolean pushMessage(String message) {
        if (!live || message == null) return false;
        byte[] bytes = Utf8.encode(message);
        if (bytes.length > MESSAGE_MAX_BYTES) return false;
        return messages.offer(bytes);
    }

    public byte[] pollConsole() {
        return console.poll();
    }

    public byte[] pollMessage() {
        return messages.poll();
    }

    public BoundedQueue<byte[]> consoleQueue() { return console; }
    public BoundedQueue<byte[]> messageQueue() { return messages; }

    @Override
    public String toString() {
        return "ViewSlot{" + id + (live ? ", " + width + "x" + height + ", " + load.state() : ", free") + '}';
    }
}
