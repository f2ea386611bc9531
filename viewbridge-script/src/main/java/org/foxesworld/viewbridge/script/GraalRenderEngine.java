// FILE: GraalRenderEngine.java
package org.foxesworld.viewbridge.script;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.foxesworld.viewbridge.engine.spi.EngineClipboard;
import org.foxesworld.viewbridge.engine.spi.EngineConfig;
import org.foxesworld.viewbridge.engine.spi.EngineFileSystem;
import org.foxesworld.viewbridge.engine.spi.EngineResource;
import org.foxesworld.viewbridge.engine.spi.EngineSurface;
import org.foxesworld.viewbridge.engine.spi.RenderEngine;
import org.foxesworld.viewbridge.script.cache.SourceCache;
import org.graalvm.polyglot.Context;
import org.graalvm.polyglot.Engine;
import org.graalvm.polyglot.HostAccess;
import org.graalvm.polyglot.PolyglotException;
import org.graalvm.polyglot.Source;

import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Headless {@link RenderEngine} on GraalVM JavaScript.
 *
 * <p>Each surface runs its page in its own polyglot {@link Context} on a shared
 * {@link Engine}; a new context is created for every load. Pages get a small browser-like
 * global scope (console, events, timers, animation frames, a read-only document) and paint
 * their body background into a BGRA buffer. There is no layout or text rendering.</p>
 *
 * <p>Thread confined: the first thread that touches the engine becomes the owner.
 * All subsequent interactions must occur on the same thread.</p>
 *
 * <p>Security: host class lookup is disabled; host access is restricted to
 * members annotated with {@link HostAccess.Export}.</p>
 */
public final class GraalRenderEngine implements RenderEngine {

    private static final Logger log = LogManager.getLogger(GraalRenderEngine.class);

    static final String BOOTSTRAP_RESOURCE = "viewbridge/script/bootstrap.js";

    /** Largest accepted surface edge in pixels. */
    public static final int MAX_SURFACE_EDGE = 8192;

    private final SourceCache sources;
    private final List<GraalSurface> surfaces = new ArrayList<>();

    private volatile Thread ownerThread;

    private EngineFileSystem fileSystem;
    private EngineClipboard clipboard;
    private EngineConfig config;
    private Engine polyglot;
    private Source bootstrap;

    public GraalRenderEngine() {
        this(SourceCache.defaults());
    }

    public GraalRenderEngine(SourceCache sources) {
        this.sources = Objects.requireNonNull(sources, "sources");
    }

    // ---------------------------------------------------------------------
    // Thread ownership
    // ---------------------------------------------------------------------

    void assertOwnerThread() {
        Thread t = Thread.currentThread();
        Thread owner = ownerThread;
        if (owner == null) {
            ownerThread = t;
            return;
        }
        if (owner != t) {
            throw new IllegalStateException("GraalRenderEngine is thread confined. Owner=" + owner.getName()
                    + ", current=" + t.getName());
        }
    }

    // ---------------------------------------------------------------------
    // RenderEngine
    // ---------------------------------------------------------------------

    @Override
    public void installFileSystem(EngineFileSystem fileSystem) {
        assertOwnerThread();
        this.fileSystem = fileSystem;
    }

    @Override
    public void installClipboard(EngineClipboard clipboard) {
        assertOwnerThread();
        this.clipboard = clipboard;
    }

    @Override
    public boolean create(EngineConfig config) {
        assertOwnerThread();
        if (polyglot != null) return true;
        this.config = config;
        try {
            this.bootstrap = loadBootstrap();
            this.polyglot = Engine.newBuilder()
                    .option("engine.WarnInterpreterOnly", "false")
                    .build();
        } catch (IOException | IllegalArgumentException | IllegalStateException | PolyglotException e) {
            log.error("[vb/graal] engine creation failed", e);
            return false;
        }
        log.info("[vb/graal] engine created (graal {}, debug={})", polyglot.getVersion(), config != null && config.debug());
        return true;
    }

    @Override
    public EngineSurface createSurface(int width, int height) {
        assertOwnerThread();
        requireCreated();
        if (width <= 0 || height <= 0 || width > MAX_SURFACE_EDGE || height > MAX_SURFACE_EDGE) {
            log.warn("[vb/graal] rejected surface size {}x{}", width, height);
            return null;
        }
        GraalSurface s = new GraalSurface(this, width, height);
        surfaces.add(s);
        return s;
    }

    @Override
    public void update() {
        assertOwnerThread();
        for (GraalSurface s : List.copyOf(surfaces)) s.update();
    }

    @Override
    public void refreshDisplay(int displayId) {
        assertOwnerThread();
        for (GraalSurface s : List.copyOf(surfaces)) s.runAnimationFrames();
    }

    @Override
    public void render() {
        assertOwnerThread();
        for (GraalSurface s : surfaces) s.paint();
    }

    @Override
    public void destroy() {
        assertOwnerThread();
        for (GraalSurface s : List.copyOf(surfaces)) s.destroy();
        surfaces.clear();
        if (polyglot != null) {
            polyglot.close(true);
            polyglot = null;
        }
        sources.invalidateAll();
        log.info("[vb/graal] engine destroyed");
    }

    public int surfaceCount() {
        return surfaces.size();
    }

    // ---------------------------------------------------------------------
    // Surface services
    // ---------------------------------------------------------------------

    Context newContext() {
        requireCreated();
        return Context.newBuilder("js")
                .engine(polyglot)
                .allowHostAccess(HostAccess.newBuilder(HostAccess.NONE)
                        .allowAccessAnnotatedBy(HostAccess.Export.class)
                        .build())
                .allowHostClassLookup(className -> false)
                .allowAllAccess(false)
                .build();
    }

    Source bootstrap() {
        return bootstrap;
    }

    SourceCache sources() {
        return sources;
    }

    EngineClipboard clipboard() {
        return clipboard;
    }

    boolean debug() {
        return config != null && config.debug();
    }

    void forget(GraalSurface surface) {
        surfaces.remove(surface);
    }

    /**
     * Read a resource through the installed file system.
     *
     * @return the bytes, or null when the file system has nothing under {@code path}
     */
    byte[] readResource(String path) {
        EngineFileSystem fs = fileSystem;
        if (fs == null || path == null) return null;
        try (EngineResource r = fs.open(path)) {
            if (r == null) return null;
            ByteBuffer data = r.data();
            byte[] out = new byte[data.remaining()];
            data.get(out);
            return out;
        }
    }

    private void requireCreated() {
        if (polyglot == null) throw new IllegalStateException("GraalRenderEngine not created");
    }

    private static Source loadBootstrap() throws IOException {
        try (InputStream in = GraalRenderEngine.class.getClassLoader().getResourceAsStream(BOOTSTRAP_RESOURCE)) {
            if (in == null) throw new IOException("missing resource " + BOOTSTRAP_RESOURCE);
            String code = new String(in.readAllBytes(), StandardCharsets.UTF_8);
            return Source.newBuilder("js", code, "viewbridge:bootstrap.js").buildLiteral();
        }
    }
}
