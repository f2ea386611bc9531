// FILE: GraalSurface.java
package org.foxesworld.viewbridge.script;

// Author: Calista Verner

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.foxesworld.viewbridge.engine.spi.ConsoleLevel;
import org.foxesworld.viewbridge.engine.spi.ConsoleSink;
import org.foxesworld.viewbridge.engine.spi.EngineClipboard;
import org.foxesworld.viewbridge.engine.spi.EngineSurface;
import org.foxesworld.viewbridge.engine.spi.KeyEventType;
import org.foxesworld.viewbridge.engine.spi.NativeFunction;
import org.foxesworld.viewbridge.engine.vfs.PathNorm;
import org.foxesworld.viewbridge.script.html.HtmlDocumentParser;
import org.foxesworld.viewbridge.script.html.PageDocument;
import org.foxesworld.viewbridge.script.html.PageScript;
import org.foxesworld.viewbridge.script.paint.DirtyRegion;
import org.graalvm.polyglot.Context;
import org.graalvm.polyglot.PolyglotException;
import org.graalvm.polyglot.SourceSection;
import org.graalvm.polyglot.Value;
import org.graalvm.polyglot.proxy.ProxyExecutable;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * One headless page. Loads are deferred to the next {@link #update()}, which parses the
 * document, creates a fresh script context and runs the page's scripts.
 */
final class GraalSurface implements EngineSurface {

    private static final Logger log = LogManager.getLogger(GraalSurface.class);

    private static final ConsoleSink NO_SINK = (level, message, sourceId, line, column) -> { };

    private record PendingLoad(String payload, boolean isUrl) {}

    private final GraalRenderEngine owner;
    private final HtmlDocumentParser parser = new HtmlDocumentParser();
    private final int width;
    private final int height;
    private final int rowBytes;
    private final ByteBuffer pixels;
    private final DirtyRegion dirty = new DirtyRegion();

    private ConsoleSink sink = NO_SINK;
    private PendingLoad pending;
    private PageDocument page;
    private String baseDir = "";
    private Context ctx;
    private long epochNanos;
    private int evalSeq;

    private boolean focused;
    private boolean locked;
    private boolean needsPaint;
    private boolean destroyed;

    GraalSurface(GraalRenderEngine owner, int width, int height) {
        this.owner = owner;
        this.width = width;
        this.height = height;
        this.rowBytes = width * 4;
        this.pixels = ByteBuffer.allocate(rowBytes * height);
    }

    // ---------------------------------------------------------------------
    // EngineSurface
    // ---------------------------------------------------------------------

    @Override
    public void setConsoleSink(ConsoleSink sink) {
        owner.assertOwnerThread();
        this.sink = sink == null ? NO_SINK : sink;
    }

    @Override
    public void focus() {
        owner.assertOwnerThread();
        focused = true;
    }

    @Override
    public void loadHtml(String html) {
        owner.assertOwnerThread();
        pending = new PendingLoad(html == null ? "" : html, false);
    }

    @Override
    public void loadUrl(String url) {
        owner.assertOwnerThread();
        pending = new PendingLoad(url == null ? "" : url, true);
    }

    @Override
    public void fireMouse(int type, int x, int y, int button) {
        owner.assertOwnerThread();
        markIfWork(callPage("__vbMouse", type, x, y, button));
    }

    @Override
    public void fireScroll(int type, int dx, int dy) {
        owner.assertOwnerThread();
        markIfWork(callPage("__vbWheel", type, dx, dy));
    }

    @Override
    public void fireKey(KeyEventType type, int modifiers, int keyCode, String text) {
        owner.assertOwnerThread();
        if (!focused) return;
        String domType = switch (type) {
            case KEY_DOWN, RAW_KEY_DOWN -> "keydown";
            case KEY_UP -> "keyup";
            case CHAR -> "keypress";
        };
        markIfWork(callPage("__vbKey", domType, keyCode, text == null ? "" : text, modifiers));
    }

    @Override
    public void evaluateScript(String script) {
        owner.assertOwnerThread();
        if (destroyed || script == null) return;
        ensureContext();
        eval(script, "eval-" + (++evalSeq));
    }

    @Override
    public boolean bindNativeFunction(String name, NativeFunction fn) {
        owner.assertOwnerThread();
        if (destroyed || pending != null) return false;
        ensureContext();
        ProxyExecutable proxy = args -> {
            String arg = "";
            if (args.length > 0) arg = args[0].isString() ? args[0].asString() : args[0].toString();
            fn.call(arg);
            return null;
        };
        ctx.getBindings("js").putMember(name, proxy);
        return true;
    }

    @Override
    public ByteBuffer lockPixels() {
        owner.assertOwnerThread();
        if (destroyed) return null;
        locked = true;
        return pixels.asReadOnlyBuffer();
    }

    @Override
    public void unlockPixels() {
        owner.assertOwnerThread();
        locked = false;
    }

    @Override
    public int width() { return width; }

    @Override
    public int height() { return height; }

    @Override
    public int rowBytes() { return rowBytes; }

    @Override
    public boolean isDirty() {
        return !dirty.isEmpty();
    }

    @Override
    public void clearDirty() {
        owner.assertOwnerThread();
        dirty.clear();
    }

    @Override
    public void destroy() {
        owner.assertOwnerThread();
        if (destroyed) return;
        destroyed = true;
        pending = null;
        closeContext();
        owner.forget(this);
    }

    // ---------------------------------------------------------------------
    // Engine-driven steps
    // ---------------------------------------------------------------------

    void update() {
        if (destroyed) return;
        if (pending != null) {
            PendingLoad p = pending;
            pending = null;
            commit(p);
            return;
        }
        if (ctx != null) markIfWork(callPage("__vbRunTimers", nowMillis()));
    }

    void runAnimationFrames() {
        if (destroyed || ctx == null) return;
        markIfWork(callPage("__vbRunFrames", nowMillis()));
    }

    void paint() {
        if (destroyed || locked || !needsPaint || page == null) return;
        String override = "";
        Value bg = callPageQuiet("__vbBackground");
        if (bg != null && bg.isString()) override = bg.asString();

        int argb = page.backgroundArgb(override);
        byte b = (byte) argb;
        byte g = (byte) (argb >>> 8);
        byte r = (byte) (argb >>> 16);
        byte a = (byte) (argb >>> 24);
        for (int y = 0; y < height; y++) {
            int row = y * rowBytes;
            for (int x = 0; x < width; x++) {
                int i = row + x * 4;
                pixels.put(i, b);
                pixels.put(i + 1, g);
                pixels.put(i + 2, r);
                pixels.put(i + 3, a);
            }
        }
        dirty.add(0, 0, width, height);
        needsPaint = false;
    }

    // ---------------------------------------------------------------------
    // Loading
    // ---------------------------------------------------------------------

    private void commit(PendingLoad p) {
        closeContext();
        PageDocument doc;
        if (p.isUrl()) {
            String path = PathNorm.normalize(p.payload());
            baseDir = dirnameOf(path);
            doc = readPage(p.payload());
        } else {
            baseDir = "";
            doc = PageDocument.fromHtml(p.payload(), "inline.html");
        }
        start(doc, p.isUrl() ? p.payload() : "about:srcdoc");

        List<PageScript> scripts = page.scripts();
        for (int i = 0; i < scripts.size() && ctx != null; i++) {
            PageScript s = scripts.get(i);
            if (s.isExternal()) runExternal(s.src());
            else eval(s.code(), page.name() + "#script" + i);
        }
        callPage("__vbLoaded");
        log.debug("[vb/graal] loaded '{}' ({} scripts)", page.name(), scripts.size());
    }

    private PageDocument readPage(String url) {
        byte[] bytes = owner.readResource(url);
        if (bytes == null) {
            console(ConsoleLevel.ERROR, "Failed to load " + url, url, 0, 0);
            return PageDocument.fromHtml("", url);
        }
        try {
            return parser.parse(bytes, url);
        } catch (IOException e) {
            console(ConsoleLevel.ERROR, "Failed to parse " + url + ": " + e.getMessage(), url, 0, 0);
            return PageDocument.fromHtml("", url);
        }
    }

    private void runExternal(String src) {
        String path = src.regionMatches(true, 0, "file:///", 0, 8) ? PathNorm.normalize(src) : PathNorm.join(baseDir, src);
        byte[] bytes = owner.readResource(path);
        if (bytes == null) {
            console(ConsoleLevel.ERROR, "Failed to load script: " + src, page.name(), 0, 0);
            return;
        }
        eval(new String(bytes, StandardCharsets.UTF_8), path);
    }

    private void ensureContext() {
        if (ctx == null) start(PageDocument.blank(), PageDocument.BLANK_NAME);
    }

    private void start(PageDocument doc, String href) {
        page = doc;
        ctx = owner.newContext();
        epochNanos = System.nanoTime();

        Value g = ctx.getBindings("js");
        g.putMember("__vbConsole", (ProxyExecutable) args -> {
            ConsoleLevel level = levelOf(args.length > 0 ? args[0].asString() : "log");
            String msg = args.length > 1 ? args[1].asString() : "";
            console(level, msg, page.name(), 0, 0);
            return null;
        });
        g.putMember("__vbElement", (ProxyExecutable) args -> page.elementProxy(args.length > 0 ? args[0].asString() : ""));
        g.putMember("__vbClipRead", (ProxyExecutable) args -> {
            EngineClipboard cb = owner.clipboard();
            return cb == null ? "" : cb.readPlainText();
        });
        g.putMember("__vbClipWrite", (ProxyExecutable) args -> {
            EngineClipboard cb = owner.clipboard();
            if (cb != null) cb.writePlainText(args.length > 0 ? args[0].asString() : "");
            return null;
        });

        ctx.eval(owner.bootstrap());
        callPage("__vbInitDocument", doc.title(), doc.background(), href);
        needsPaint = true;
    }

    private void closeContext() {
        Context c = ctx;
        ctx = null;
        if (c == null) return;
        try {
            c.close(true);
        } catch (PolyglotException | IllegalStateException e) {
            log.warn("[vb/graal] closing page context failed: {}", e.toString());
        }
    }

    // ---------------------------------------------------------------------
    // Script helpers
    // ---------------------------------------------------------------------

    private void eval(String code, String name) {
        try {
            ctx.eval(owner.sources().get(name, code));
            needsPaint = true;
        } catch (PolyglotException e) {
            reportScriptError(e, name);
        }
    }

    /** Call a bootstrap hook; script errors are reported to the console sink. */
    private Value callPage(String fn, Object... args) {
        if (ctx == null || destroyed) return null;
        try {
            Value f = ctx.getBindings("js").getMember(fn);
            if (f == null || !f.canExecute()) return null;
            return f.execute(args);
        } catch (PolyglotException e) {
            reportScriptError(e, page.name());
            return null;
        }
    }

    /** Hooks return how many handlers ran; anything that ran may have changed the page. */
    private void markIfWork(Value ran) {
        if (ran != null && ran.fitsInInt() && ran.asInt() > 0) needsPaint = true;
    }

    private Value callPageQuiet(String fn) {
        if (ctx == null) return null;
        try {
            Value f = ctx.getBindings("js").getMember(fn);
            return (f == null || !f.canExecute()) ? null : f.execute();
        } catch (PolyglotException e) {
            log.debug("[vb/graal] {} failed: {}", fn, e.getMessage());
            return null;
        }
    }

    private void reportScriptError(PolyglotException e, String name) {
        SourceSection loc = e.getSourceLocation();
        String source = loc != null ? loc.getSource().getName() : name;
        int line = loc != null ? loc.getStartLine() : 0;
        int column = loc != null ? loc.getStartColumn() : 0;
        String msg = e.isHostException()
                ? "Uncaught host exception: " + e.asHostException()
                : "Uncaught " + e.getMessage();
        if (owner.debug()) log.debug("[vb/graal] script error in {}:{}: {}", source, line, msg);
        console(ConsoleLevel.ERROR, msg, source, line, column);
    }

    private void console(ConsoleLevel level, String message, String sourceId, int line, int column) {
        sink.onMessage(level, message, sourceId, line, column);
    }

    private double nowMillis() {
        return (System.nanoTime() - epochNanos) / 1_000_000.0;
    }

    private static ConsoleLevel levelOf(String name) {
        return switch (name) {
            case "warn" -> ConsoleLevel.WARNING;
            case "error" -> ConsoleLevel.ERROR;
            case "debug" -> ConsoleLevel.DEBUG;
            case "info" -> ConsoleLevel.INFO;
            default -> ConsoleLevel.LOG;
        };
    }

    private static String dirnameOf(String path) {
        int idx = path.lastIndexOf('/');
        return idx < 0 ? "" : path.substring(0, idx);
    }
}
