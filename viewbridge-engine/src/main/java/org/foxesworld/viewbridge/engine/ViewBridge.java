// FILE: ViewBridge.java
// Author: Calista Verner
// Caller-facing API: any thread in, owner thread to the engine

package org.foxesworld.viewbridge.engine;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.core.config.Configurator;
import org.foxesworld.viewbridge.core.io.Utf8;
import org.foxesworld.viewbridge.core.pixel.PixelSwizzle;
import org.foxesworld.viewbridge.engine.clipboard.SystemClipboard;
import org.foxesworld.viewbridge.engine.dispatch.Command;
import org.foxesworld.viewbridge.engine.dispatch.CommandDispatcher;
import org.foxesworld.viewbridge.engine.dispatch.CommandKind;
import org.foxesworld.viewbridge.engine.message.MessageCodec;
import org.foxesworld.viewbridge.engine.spi.EngineClipboard;
import org.foxesworld.viewbridge.engine.spi.RenderEngine;
import org.foxesworld.viewbridge.engine.vfs.VfsTreeLoader;
import org.foxesworld.viewbridge.engine.vfs.VirtualFileOverlay;
import org.foxesworld.viewbridge.engine.view.ViewRegistry;
import org.foxesworld.viewbridge.engine.view.ViewRuntime;
import org.foxesworld.viewbridge.engine.view.ViewSlot;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Multi-view access to one single-threaded rendering engine.
 *
 * <p>Engine work (init, view creation, loads, tick, pixel access) is handed to the owner
 * thread and the calling thread blocks until it finished. Input, script and message
 * queues and the file overlay are touched directly from the calling thread.</p>
 *
 * <pre>{@code
 * try (ViewBridge bridge = ViewBridge.start(BridgeOptions.defaults(), engine)) {
 *     int id = bridge.createViewAsync(800, 600, "file:///app/index.html");
 *     while (running) {
 *         bridge.tick();
 *         ...
 *     }
 * }
 * }</pre>
 */
public final class ViewBridge implements AutoCloseable {

    private static final Logger log = LogManager.getLogger(ViewBridge.class);

    /** Logger raised to DEBUG when the bridge is initialized with {@code debug}. */
    public static final String LOGGER_ROOT = "org.foxesworld.viewbridge";

    private final RenderEngine engine;
    private final BridgeOptions options;
    private final EngineClipboard clipboard;
    private final VirtualFileOverlay overlay;

    private final Object lifecycle = new Object();
    private Integer initStatus;
    private boolean shutdown;

    private volatile ViewRuntime runtime;
    private volatile CommandDispatcher dispatcher;

    public ViewBridge(RenderEngine engine) {
        this(engine, BridgeOptions.fromSystemProperties());
    }

    public ViewBridge(RenderEngine engine, BridgeOptions options) {
        this(engine, options, SystemClipboard.createDefault());
    }

    public ViewBridge(RenderEngine engine, BridgeOptions options, EngineClipboard clipboard) {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.options = Objects.requireNonNull(options, "options");
        this.clipboard = Objects.requireNonNull(clipboard, "clipboard");
        this.overlay = new VirtualFileOverlay(options.baseDirectory());
    }

    /**
     * Create a bridge and initialize it with the options' base directory and debug flag.
     *
     * @throws ViewBridgeException if the engine cannot be brought up
     */
    public static ViewBridge start(BridgeOptions options, RenderEngine engine) {
        ViewBridge bridge = new ViewBridge(engine, options);
        int rc = bridge.init(options.baseDirectory(), options.debug());
        if (rc < 0) {
            bridge.shutdown();
            throw new ViewBridgeException("ViewBridge init failed", rc);
        }
        return bridge;
    }

    // ---------------------------------------------------------------------
    // LIFECYCLE
    // ---------------------------------------------------------------------

    /**
     * Start the owner thread and create the engine. Only the first call does anything;
     * later calls return its status.
     *
     * @param baseDirectory disk root for resources (null keeps the configured one)
     * @param debug         raise bridge logging to DEBUG and ask the engine for verbose output
     * @return {@link ResultCodes#OK} or a negative code
     */
    public int init(Path baseDirectory, boolean debug) {
        synchronized (lifecycle) {
            if (initStatus != null) return initStatus;
            if (shutdown) return ResultCodes.DISPATCHER_STOPPED;

            BridgeOptions opts = options.withBase(
                    baseDirectory != null ? baseDirectory : options.baseDirectory(),
                    debug || options.debug());
            if (opts.debug()) {
                Configurator.setLevel(LOGGER_ROOT, Level.DEBUG);
                log.debug("[vb/bridge] debug logging enabled");
            }
            overlay.setBaseDirectory(opts.baseDirectory());

            ViewRuntime rt = new ViewRuntime(opts, engine, overlay, clipboard);
            CommandDispatcher d = new CommandDispatcher(rt);
            runtime = rt;
            dispatcher = d;
            d.start();

            int rc = d.submit(CommandKind.INIT);
            initStatus = rc;
            if (rc < 0) log.error("[vb/bridge] init failed: {}", ResultCodes.describe(rc));
            else log.info("[vb/bridge] initialized");
            return rc;
        }
    }

    public boolean isInitialized() {
        ViewRuntime rt = runtime;
        return rt != null && rt.engineCreated();
    }

    /**
     * Destroy every view, release the engine, stop the owner thread and clear the overlay.
     * Safe to call more than once and after a failed init.
     */
    public void shutdown() {
        synchronized (lifecycle) {
            if (shutdown) return;
            shutdown = true;
            CommandDispatcher d = dispatcher;
            if (d != null) {
                try {
                    d.stop(options.shutdownJoinMillis());
                } catch (RuntimeException e) {
                    log.warn("[vb/bridge] owner stop failed: {}", e.toString());
                }
            }
            overlay.clear();
            log.info("[vb/bridge] shut down");
        }
    }

    @Override
    public void close() {
        shutdown();
    }

    // ---------------------------------------------------------------------
    // VIEWS
    // ---------------------------------------------------------------------

    /** @return view id or a negative code */
    public int createView(int width, int height) {
        return submit(Command.of(CommandKind.CREATE_VIEW, null, width, height));
    }

    /**
     * Allocate a view and return at once; {@code url} is loaded over the next ticks.
     * Poll {@link #isReady(int)}.
     */
    public int createViewAsync(int width, int height, String url) {
        return submit(Command.of(CommandKind.CREATE_VIEW_ASYNC, url, width, height));
    }

    public int createViewWithHtml(int width, int height, String html) {
        return submit(Command.of(CommandKind.CREATE_VIEW_WITH_HTML, html, width, height));
    }

    public int createViewWithUrl(int width, int height, String url) {
        return submit(Command.of(CommandKind.CREATE_VIEW_WITH_URL, url, width, height));
    }

    /** Idempotent; unknown ids are ignored. */
    public void destroyView(int id) {
        if (!ViewRegistry.inRange(id)) return;
        submit(Command.of(CommandKind.DESTROY_VIEW, null, id, 0));
    }

    public boolean isReady(int id) {
        ViewSlot s = slot(id);
        return s != null && s.load().isReady();
    }

    public boolean hasBindings(int id) {
        ViewSlot s = slot(id);
        return s != null && s.bindingsInstalled();
    }

    public int loadHtml(int id, String html) {
        return submit(Command.of(CommandKind.LOAD_HTML, html, id, 0));
    }

    public int loadUrl(int id, String url) {
        return submit(Command.of(CommandKind.LOAD_URL, url, id, 0));
    }

    public int tick() {
        return submit(Command.of(CommandKind.TICK));
    }

    public int width(int id) {
        ViewSlot s = slot(id);
        return s == null ? 0 : s.width();
    }

    public int height(int id) {
        ViewSlot s = slot(id);
        return s == null ? 0 : s.height();
    }

    public int rowBytes(int id) {
        ViewSlot s = slot(id);
        return s == null ? 0 : s.rowBytes();
    }

    public int liveViews() {
        ViewRuntime rt = runtime;
        return rt == null ? 0 : rt.registry().liveSlots().size();
    }

    // ---------------------------------------------------------------------
    // INPUT & SCRIPTS (queued, applied on the next tick)
    // ---------------------------------------------------------------------

    /** @return false if the event was dropped (unknown view or full queue) */
    public boolean fireMouse(int id, int type, int x, int y, int button) {
        ViewSlot s = anySlot(id);
        return s != null && s.enqueuePointer(s.generation(), type, x, y, button);
    }

    public boolean fireScroll(int id, int type, int dx, int dy) {
        ViewSlot s = anySlot(id);
        return s != null && s.enqueueWheel(s.generation(), type, dx, dy);
    }

    public boolean fireKey(int id, int type, int keyCode, int modifiers, String text) {
        ViewSlot s = anySlot(id);
        return s != null && s.enqueueKey(s.generation(), type, keyCode, modifiers, text);
    }

    /** Queue a script; scripts of {@value ViewSlot#SCRIPT_BUFFER_BYTES} UTF-8 bytes or more are dropped. */
    public boolean evalScript(int id, String script) {
        ViewSlot s = anySlot(id);
        return s != null && s.enqueueScript(s.generation(), script);
    }

    /**
     * Serialize {@code data} to JSON and hand it to the page's {@code window.host.receive}
     * on the next tick.
     */
    public boolean send(int id, Object data) {
        ViewSlot s = anySlot(id);
        if (s == null) return false;
        boolean queued = s.enqueueScript(s.generation(), MessageCodec.receiveScript(data));
        if (!queued) log.debug("[vb/bridge] send to view {} dropped", id);
        return queued;
    }

    // ---------------------------------------------------------------------
    // MESSAGES
    // ---------------------------------------------------------------------

    /**
     * Pop the oldest application message into {@code buffer}.
     *
     * @return bytes copied (the message is cut to the buffer), 0 when none is queued
     */
    public int getMessage(int id, byte[] buffer) {
        ViewSlot s = slot(id);
        return s == null ? 0 : copyOut(s.pollMessage(), buffer);
    }

    public int getConsoleMessage(int id, byte[] buffer) {
        ViewSlot s = slot(id);
        return s == null ? 0 : copyOut(s.pollConsole(), buffer);
    }

    public String pollMessage(int id) {
        ViewSlot s = slot(id);
        return s == null ? null : decode(s.pollMessage());
    }

    public String pollConsoleMessage(int id) {
        ViewSlot s = slot(id);
        return s == null ? null : decode(s.pollConsole());
    }

    private static int copyOut(byte[] msg, byte[] buffer) {
        if (msg == null || buffer == null || buffer.length == 0) return 0;
        int n = Math.min(msg.length, buffer.length);
        System.arraycopy(msg, 0, buffer, 0, n);
        return n;
    }

    private static String decode(byte[] msg) {
        return msg == null ? null : Utf8.decode(msg, msg.length);
    }

    // ---------------------------------------------------------------------
    // PIXELS
    // ---------------------------------------------------------------------

    /**
     * Lock the view's pixels. Pair with {@link #unlockPixels(int)}.
     *
     * @return the lock, or null for an unknown view or a surface without pixels
     */
    public PixelLock getPixels(int id) {
        int rc = submit(Command.of(CommandKind.LOCK_PIXELS, null, id, 0));
        if (rc < 0) return null;
        ViewSlot s = slot(id);
        return s == null ? null : s.pixelLock();
    }

    /** Release the lock and clear the dirty region. */
    public void unlockPixels(int id) {
        submit(Command.of(CommandKind.UNLOCK_PIXELS, null, id, 0));
    }

    /**
     * Copy the view as packed RGBA into {@code dest} when something was painted since the
     * previous readback.
     *
     * @return 1 if {@code dest} now holds new pixels, otherwise 0
     */
    public int copyPixelsRGBA(int id, byte[] dest) {
        ViewSlot s = slot(id);
        if (s == null || dest == null) return 0;
        int need = PixelSwizzle.packedSize(s.width(), s.height());
        if (dest.length < need) {
            log.warn("[vb/bridge] copyPixelsRGBA({}): destination has {} bytes, needs {}", id, dest.length, need);
            return 0;
        }
        return submit(Command.withAttachment(CommandKind.COPY_PIXELS, id, dest)) == 1 ? 1 : 0;
    }

    // ---------------------------------------------------------------------
    // VIRTUAL FILES
    // ---------------------------------------------------------------------

    /** Register or replace an in-memory file; it shadows a disk file with the same path. */
    public boolean vfsRegister(String path, byte[] data) {
        return overlay.register(path, data);
    }

    /** Register every file under {@code dir}, keyed by its path relative to {@code dir}. */
    public int vfsRegisterTree(Path dir) throws IOException {
        return new VfsTreeLoader(overlay, options.vfsIgnoredDirs()).load(dir);
    }

    public void vfsClear() {
        overlay.clear();
    }

    public int vfsCount() {
        return overlay.count();
    }

    // ---------------------------------------------------------------------
    // INTERNALS
    // ---------------------------------------------------------------------

    private int submit(Command cmd) {
        CommandDispatcher d = dispatcher;
        if (d == null) return ResultCodes.NO_ENGINE;
        return d.submit(cmd);
    }

    private ViewSlot slot(int id) {
        ViewRuntime rt = runtime;
        return rt == null ? null : rt.registry().live(id);
    }

    /** Slot for {@code id} whether live or not; enqueueing re-checks liveness against its generation. */
    private ViewSlot anySlot(int id) {
        ViewRuntime rt = runtime;
        return rt == null ? null : rt.registry().slotAt(id);
    }
}
