package org.foxesworld.viewbridge.engine;

import org.foxesworld.viewbridge.engine.spi.ConsoleLevel;
import org.foxesworld.viewbridge.engine.spi.ConsoleSink;
import org.foxesworld.viewbridge.engine.spi.EngineClipboard;
import org.foxesworld.viewbridge.engine.spi.EngineConfig;
import org.foxesworld.viewbridge.engine.spi.EngineFileSystem;
import org.foxesworld.viewbridge.engine.spi.EngineSurface;
import org.foxesworld.viewbridge.engine.spi.KeyEventType;
import org.foxesworld.viewbridge.engine.spi.NativeFunction;
import org.foxesworld.viewbridge.engine.spi.RenderEngine;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Engine fake that records every call and the thread it arrived on.
 *
 * <p>Scripts understand two commands: {@code console:<text>} emits a console message and
 * {@code native:<name>:<arg>} calls a bound native function.</p>
 */
final class RecordingEngine implements RenderEngine {

    final List<String> calls = new CopyOnWriteArrayList<>();
    final Set<String> callThreads = ConcurrentHashMap.newKeySet();
    final List<Surface> surfaces = new CopyOnWriteArrayList<>();

    volatile boolean createSucceeds = true;
    volatile boolean bindingsSucceed = true;
    volatile EngineFileSystem fileSystem;
    volatile EngineClipboard clipboard;
    volatile EngineConfig config;

    private void record(String call) {
        calls.add(call);
        callThreads.add(Thread.currentThread().getName());
    }

    long count(String prefix) {
        return calls.stream().filter(c -> c.startsWith(prefix)).count();
    }

    @Override
    public void installFileSystem(EngineFileSystem fileSystem) {
        record("installFileSystem");
        this.fileSystem = fileSystem;
    }

    @Override
    public void installClipboard(EngineClipboard clipboard) {
        record("installClipboard");
        this.clipboard = clipboard;
    }

    @Override
    public boolean create(EngineConfig config) {
        record("create");
        this.config = config;
        return createSucceeds;
    }

    @Override
    public EngineSurface createSurface(int width, int height) {
        record("createSurface " + width + "x" + height);
        if (width <= 0 || height <= 0) return null;
        Surface s = new Surface(width, height);
        surfaces.add(s);
        return s;
    }

    @Override
    public void update() {
        record("update");
    }

    @Override
    public void refreshDisplay(int displayId) {
        record("refreshDisplay " + displayId);
    }

    @Override
    public void render() {
        record("render");
        for (Surface s : surfaces) {
            if (!s.destroyed && !s.locked) s.dirty = true;
        }
    }

    @Override
    public void destroy() {
        record("destroy");
    }

    final class Surface implements EngineSurface {
        final int width;
        final int height;
        final ByteBuffer pixels;
        final List<String> events = new ArrayList<>();
        final Map<String, NativeFunction> natives = new HashMap<>();
        ConsoleSink sink;
        String content;
        boolean dirty;
        boolean locked;
        boolean destroyed;

        Surface(int width, int height) {
            this.width = width;
            this.height = height;
            this.pixels = ByteBuffer.allocate(width * height * 4);
            for (int i = 0; i < pixels.capacity(); i += 4) {
                pixels.put(i, (byte) 0x30);     // B
                pixels.put(i + 1, (byte) 0x20); // G
                pixels.put(i + 2, (byte) 0x10); // R
                pixels.put(i + 3, (byte) 0xFF); // A
            }
        }

        @Override
        public void setConsoleSink(ConsoleSink sink) {
            record("setConsoleSink");
            this.sink = sink;
        }

        @Override
        public void focus() {
            record("focus");
        }

        @Override
        public void loadHtml(String html) {
            record("loadHtml");
            content = html;
        }

        @Override
        public void loadUrl(String url) {
            record("loadUrl " + url);
            content = url;
        }

        @Override
        public void fireMouse(int type, int x, int y, int button) {
            record("fireMouse");
            events.add("mouse " + type + " " + x + "," + y + " " + button);
        }

        @Override
        public void fireScroll(int type, int dx, int dy) {
            record("fireScroll");
            events.add("scroll " + type + " " + dx + "," + dy);
        }

        @Override
        public void fireKey(KeyEventType type, int modifiers, int keyCode, String text) {
            record("fireKey");
            events.add("key " + type + " " + modifiers + " " + keyCode + " " + text);
        }

        @Override
        public void evaluateScript(String script) {
            record("evaluateScript");
            events.add("script " + script);
            if (script.startsWith("console:")) {
                sink.onMessage(ConsoleLevel.LOG, script.substring("console:".length()), "test", 1, 1);
            } else if (script.startsWith("native:")) {
                String[] parts = script.split(":", 3);
                NativeFunction fn = natives.get(parts[1]);
                if (fn != null) fn.call(parts[2]);
            }
        }

        @Override
        public boolean bindNativeFunction(String name, NativeFunction fn) {
            record("bindNativeFunction " + name);
            if (!bindingsSucceed) return false;
            natives.put(name, fn);
            return true;
        }

        @Override
        public ByteBuffer lockPixels() {
            record("lockPixels");
            locked = true;
            return pixels.asReadOnlyBuffer();
        }

        @Override
        public void unlockPixels() {
            record("unlockPixels");
            locked = false;
        }

        @Override
        public int width() {
            return width;
        }

        @Override
        public int height() {
            return height;
        }

        @Override
        public int rowBytes() {
            return width * 4;
        }

        @Override
        public boolean isDirty() {
            return dirty;
        }

        @Override
        public void clearDirty() {
            record("clearDirty");
            dirty = false;
        }

        @Override
        public void destroy() {
            record("destroySurface");
            destroyed = true;
        }
    }
}
