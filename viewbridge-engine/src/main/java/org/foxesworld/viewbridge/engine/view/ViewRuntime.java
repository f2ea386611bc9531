// FILE: ViewRuntime.java
package org.foxesworld.viewbridge.engine.view;

// Author: Calista Verner

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.foxesworld.viewbridge.core.ViewBridgePlatform;
import org.foxesworld.viewbridge.core.pixel.PixelSwizzle;
import org.foxesworld.viewbridge.engine.BridgeOptions;
import org.foxesworld.viewbridge.engine.PixelLock;
import org.foxesworld.viewbridge.engine.ResultCodes;
import org.foxesworld.viewbridge.engine.dispatch.Command;
import org.foxesworld.viewbridge.engine.dispatch.CommandHandler;
import org.foxesworld.viewbridge.engine.spi.ConsoleLevel;
import org.foxesworld.viewbridge.engine.spi.EngineClipboard;
import org.foxesworld.viewbridge.engine.spi.EngineConfig;
import org.foxesworld.viewbridge.engine.spi.EngineSurface;
import org.foxesworld.viewbridge.engine.spi.KeyEventType;
import org.foxesworld.viewbridge.engine.spi.RenderEngine;
import org.foxesworld.viewbridge.engine.vfs.VirtualFileOverlay;

import java.nio.ByteBuffer;
import java.util.Objects;

/**
 * Executes commands against the engine and the view registry. Runs on the owner thread only.
 *
 * <p>Every engine call in the process goes through here. Handlers return result codes;
 * exceptions escape to the dispatcher, which reports them as {@link ResultCodes#ENGINE_ERROR}.</p>
 */
public final class ViewRuntime implements CommandHandler {

    private static final Logger log = LogManager.getLogger(ViewRuntime.class);

    /** Global native function installed into every page. */
    public static final String NATIVE_SEND = "__hostSend";

    /** Exposes the native function as {@code window.host.send}, keeping what the page already put on {@code window.host}. */
    public static final String HOST_NAMESPACE_SCRIPT =
            "window.host=window.host||{};window.host.send=window.__hostSend;";

    public static final String RESOURCE_PATH_PREFIX = "/";

    private final BridgeOptions options;
    private final RenderEngine engine;
    private final VirtualFileOverlay overlay;
    private final EngineClipboard clipboard;
    private final ViewRegistry registry;

    private volatile boolean engineCreated;

    public ViewRuntime(BridgeOptions options, RenderEngine engine, VirtualFileOverlay overlay, EngineClipboard clipboard) {
        this.options = Objects.requireNonNull(options, "options");
        this.engine = Objects.requireNonNull(engine, "engine");
        this.overlay = Objects.requireNonNull(overlay, "overlay");
        this.clipboard = Objects.requireNonNull(clipboard, "clipboard");
        this.registry = new ViewRegistry(options);
    }

    public ViewRegistry registry() {
        return registry;
    }

    public boolean engineCreated() {
        return engineCreated;
    }

    @Override
    public int handle(Command cmd) {
        return switch (cmd.kind()) {
            case INIT -> init();
            case CREATE_VIEW -> createView(cmd.int1(), cmd.int2());
            case CREATE_VIEW_ASYNC -> createViewAsync(cmd.int1(), cmd.int2(), cmd.str());
            case CREATE_VIEW_WITH_HTML -> createViewWithContent(cmd.int1(), cmd.int2(), cmd.str(), false);
            case CREATE_VIEW_WITH_URL -> createViewWithContent(cmd.int1(), cmd.int2(), cmd.str(), true);
            case DESTROY_VIEW -> destroyView(cmd.int1());
            case LOAD_HTML -> load(cmd.int1(), cmd.str(), false);
            case LOAD_URL -> load(cmd.int1(), cmd.str(), true);
            case TICK -> tick();
            case LOCK_PIXELS -> lockPixels(cmd.int1());
            case UNLOCK_PIXELS -> unlockPixels(cmd.int1());
            case COPY_PIXELS -> copyPixels(cmd.int1(), (byte[]) cmd.attachment());
            case QUIT -> quit();
        };
    }

    // ---------------------------------------------------------------------
    // ENGINE LIFECYCLE
    // ---------------------------------------------------------------------

    private int init() {
        if (engineCreated) {
            log.warn("[vb/runtime] engine already created, ignoring init");
            return ResultCodes.OK;
        }
        log.info("[vb/runtime] init: {}", ViewBridgePlatform.describe());
        log.info("[vb/runtime] base directory = {}", overlay.baseDirectory());

        engine.installFileSystem(overlay);
        engine.installClipboard(clipboard);

        boolean ok;
        try {
            ok = engine.create(new EngineConfig(overlay.baseDirectory(), options.debug(), RESOURCE_PATH_PREFIX));
        } catch (RuntimeException e) {
            log.error("[vb/runtime] engine construction threw", e);
            ok = false;
        }
        registry.resetAll();
        if (!ok) {
            log.error("[vb/runtime] engine could not be created");
            return ResultCodes.INIT_FAILED;
        }
        engineCreated = true;
        log.info("[vb/runtime] engine created ({})", options);
        return ResultCodes.OK;
    }

    private int quit() {
        if (!engineCreated) return ResultCodes.OK;
        for (ViewSlot slot : registry.liveSlots()) {
            try {
                destroyView(slot.id());
            } catch (RuntimeException e) {
                log.warn("[vb/runtime] destroying view {} on quit failed: {}", slot.id(), e.toString());
                registry.release(slot.id());
            }
        }
        try {
            engine.destroy();
        } catch (RuntimeException e) {
            log.warn("[vb/runtime] engine destroy failed: {}", e.toString());
        }
        engineCreated = false;
        log.info("[vb/runtime] engine released");
        return ResultCodes.OK;
    }

    // ---------------------------------------------------------------------
    // VIEWS
    // ---------------------------------------------------------------------

    private int createView(int width, int height) {
        int rc = allocate(width, height);
        if (rc < 0) return rc;
        ViewSlot slot = registry.live(rc);
        warmup(options.createWarmupSteps());
        engine.render();
        installBindings(slot);
        log.debug("[vb/runtime] view {} created ({}x{})", rc, width, height);
        return rc;
    }

    private int createViewAsync(int width, int height, String url) {
        int rc = allocate(width, height);
        if (rc < 0) return rc;
        ViewSlot slot = registry.live(rc);
        slot.storePayload(url == null ? "" : url, true);
        slot.load().startPriming();
        log.debug("[vb/runtime] view {} created async, priming '{}'", rc, url);
        return rc;
    }

    private int createViewWithContent(int width, int height, String payload, boolean isUrl) {
        int rc = allocate(width, height);
        if (rc < 0) return rc;
        ViewSlot slot = registry.live(rc);
        issue(slot, payload, isUrl);
        engine.update();
        installBindings(slot);
        log.debug("[vb/runtime] view {} created with {}", rc, isUrl ? "url" : "html");
        return rc;
    }

    /** @return slot id or a negative code */
    private int allocate(int width, int height) {
        if (!engineCreated) return ResultCodes.NO_ENGINE;
        int id = registry.lowestFree();
        if (id < 0) {
            log.warn("[vb/runtime] no free view slot ({} live)", registry.liveCount());
            return ResultCodes.NO_FREE_SLOT;
        }
        EngineSurface surface = engine.createSurface(width, height);
        if (surface == null) {
            log.warn("[vb/runtime] engine rejected surface {}x{}", width, height);
            return ResultCodes.SURFACE_FAILED;
        }
        ViewSlot slot = registry.occupy(id, surface, surface.width(), surface.height(), surface.rowBytes());
        surface.setConsoleSink((level, message, sourceId, line, column) -> onConsole(slot, level, message, sourceId, line));
        surface.focus();
        return id;
    }

    private int destroyView(int id) {
        ViewSlot slot = registry.live(id);
        if (slot == null) return ResultCodes.OK;
        EngineSurface surface = slot.surface();
        try {
            if (slot.pixelLock() != null) surface.unlockPixels();
            surface.destroy();
        } finally {
            registry.release(id);
        }
        log.debug("[vb/runtime] view {} destroyed", id);
        return ResultCodes.OK;
    }

    private int load(int id, String payload, boolean isUrl) {
        if (!engineCreated) return ResultCodes.NO_ENGINE;
        ViewSlot slot = registry.live(id);
        if (slot == null) return ResultCodes.INVALID_VIEW;

        if (!slot.load().isReady()) {
            log.debug("[vb/runtime] view {}: explicit load supersedes deferred content", id);
            slot.releasePayload();
        }
        slot.load().markReady();
        issue(slot, payload, isUrl);
        warmup(options.loadWarmupSteps());
        engine.render();
        installBindings(slot);
        return ResultCodes.OK;
    }

    private void issue(ViewSlot slot, String payload, boolean isUrl) {
        slot.setBindingsInstalled(false);
        String p = payload == null ? "" : payload;
        if (isUrl) slot.surface().loadUrl(p);
        else slot.surface().loadHtml(p);
    }

    private void warmup(int steps) {
        for (int i = 0; i < steps; i++) {
            engine.update();
            if (options.warmupDelayMillis() > 0L) {
                try {
                    Thread.sleep(options.warmupDelayMillis());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.warn("[vb/runtime] warm-up interrupted after {} of {} steps", i + 1, steps);
                    return;
                }
            }
        }
    }

    // ---------------------------------------------------------------------
    // TICK
    // ---------------------------------------------------------------------

    private int tick() {
        if (!engineCreated) return ResultCodes.NO_ENGINE;
        for (ViewSlot slot : registry.liveSlots()) {
            drainInput(slot);
            advanceLoad(slot);
        }
        engine.update();
        engine.refreshDisplay(0);
        engine.render();
        return ResultCodes.OK;
    }

    private void drainInput(ViewSlot slot) {
        EngineSurface surface = slot.surface();
        int maxX = Math.max(0, slot.width() - 1);
        int maxY = Math.max(0, slot.height() - 1);

        slot.pointerQueue().drain(e -> surface.fireMouse(e.type(), clamp(e.x(), maxX), clamp(e.y(), maxY), e.button()));
        slot.wheelQueue().drain(e -> surface.fireScroll(e.type(), e.dx(), e.dy()));
        slot.keyQueue().drain(e -> surface.fireKey(KeyEventType.fromInputCode(e.type()), e.modifiers(), e.keyCode(), e.text()));
        slot.scriptQueue().drain(surface::evaluateScript);
    }

    private static int clamp(int v, int max) {
        return v < 0 ? 0 : Math.min(v, max);
    }

    private void advanceLoad(ViewSlot slot) {
        switch (slot.load().onTick(slot.bindingsInstalled())) {
            case ISSUE_LOAD -> {
                String payload = slot.pendingPayload();
                boolean isUrl = slot.pendingIsUrl();
                slot.releasePayload();
                issue(slot, payload, isUrl);
                log.debug("[vb/runtime] view {}: deferred content issued", slot.id());
            }
            case FINISH_BINDING -> {
                engine.render();
                boolean ok = installBindings(slot);
                log.debug("[vb/runtime] view {} ready (bindings {})", slot.id(), ok ? "installed" : "pending");
            }
            case RETRY_BINDINGS -> installBindings(slot);
            case REPORT_BINDING_FAILURE -> {
                String msg = "[viewbridge] script bindings could not be installed after "
                        + options.bindingRetryBudget() + " ticks; window.host.send is unavailable";
                slot.pushConsole(msg);
                log.warn("[vb/runtime] view {}: bindings not installed after {} retries", slot.id(), options.bindingRetryBudget());
            }
            case NONE -> {
            }
        }
    }

    /** @return true if the native send function and the host namespace are in place */
    private boolean installBindings(ViewSlot slot) {
        EngineSurface surface = slot.surface();
        boolean ok = surface.bindNativeFunction(NATIVE_SEND, msg -> {
            if (!slot.pushMessage(msg)) log.debug("[vb/runtime] view {}: message dropped", slot.id());
        });
        if (ok) surface.evaluateScript(HOST_NAMESPACE_SCRIPT);
        slot.setBindingsInstalled(ok);
        return ok;
    }

    private void onConsole(ViewSlot slot, ConsoleLevel level, String message, String sourceId, int line) {
        if (log.isDebugEnabled()) {
            log.debug("[vb/console] view {} {} {}:{} {}", slot.id(), level, sourceId, line, message);
        }
        slot.pushConsole(message);
    }

    // ---------------------------------------------------------------------
    // PIXELS
    // ---------------------------------------------------------------------

    private int lockPixels(int id) {
        ViewSlot slot = registry.live(id);
        if (slot == null) return ResultCodes.INVALID_VIEW;
        if (slot.pixelLock() != null) return ResultCodes.OK;

        EngineSurface surface = slot.surface();
        ByteBuffer pixels = surface.lockPixels();
        if (pixels == null) return ResultCodes.NO_PIXELS;
        slot.setPixelLock(new PixelLock(id, pixels, surface.width(), surface.height(), surface.rowBytes(), surface.isDirty()));
        return ResultCodes.OK;
    }

    private int unlockPixels(int id) {
        ViewSlot slot = registry.live(id);
        if (slot == null) return ResultCodes.INVALID_VIEW;
        if (slot.pixelLock() == null) return ResultCodes.OK;
        EngineSurface surface = slot.surface();
        surface.unlockPixels();
        surface.clearDirty();
        slot.setPixelLock(null);
        return ResultCodes.OK;
    }

    /** @return 1 if new pixels were copied into {@code dest}, 0 if nothing changed, or a negative code */
    private int copyPixels(int id, byte[] dest) {
        ViewSlot slot = registry.live(id);
        if (slot == null) return ResultCodes.INVALID_VIEW;

        PixelLock held = slot.pixelLock();
        if (held != null) {
            // caller's lock stays in place; only the dirty flag is consumed
            EngineSurface surface = slot.surface();
            if (!surface.isDirty()) return 0;
            PixelSwizzle.bgraToRgba(held.pixels(), held.width(), held.height(), held.rowBytes(), dest);
            surface.clearDirty();
            return 1;
        }

        int rc = lockPixels(id);
        if (rc < 0) return rc;
        PixelLock lock = slot.pixelLock();
        try {
            if (!lock.dirty()) return 0;
            PixelSwizzle.bgraToRgba(lock.pixels(), lock.width(), lock.height(), lock.rowBytes(), dest);
            return 1;
        } finally {
            unlockPixels(id);
        }
    }
}
