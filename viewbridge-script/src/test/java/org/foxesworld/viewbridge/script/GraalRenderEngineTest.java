package org.foxesworld.viewbridge.script;

import org.foxesworld.viewbridge.engine.BridgeOptions;
import org.foxesworld.viewbridge.engine.ResultCodes;
import org.foxesworld.viewbridge.engine.ViewBridge;
import org.foxesworld.viewbridge.engine.clipboard.InMemoryClipboard;
import org.foxesworld.viewbridge.engine.spi.EngineConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class GraalRenderEngineTest {

    @TempDir
    Path base;

    private GraalRenderEngine engine;
    private InMemoryClipboard clipboard;
    private ViewBridge bridge;

    @BeforeEach
    void setUp() {
        engine = new GraalRenderEngine();
        clipboard = new InMemoryClipboard();
        BridgeOptions options = BridgeOptions.builder()
                .baseDirectory(base)
                .warmupDelayMillis(0)
                .build();
        bridge = new ViewBridge(engine, options, clipboard);
        assertEquals(ResultCodes.OK, bridge.init(base, false));
    }

    @AfterEach
    void tearDown() {
        bridge.shutdown();
    }

    private void register(String path, String content) {
        assertTrue(bridge.vfsRegister(path, content.getBytes(StandardCharsets.UTF_8)));
    }

    private List<String> console(int id) {
        List<String> out = new ArrayList<>();
        String m;
        while ((m = bridge.pollConsoleMessage(id)) != null) out.add(m);
        return out;
    }

    private int page(String html) {
        int id = bridge.createView(100, 50);
        assertTrue(id >= 0);
        assertEquals(ResultCodes.OK, bridge.loadHtml(id, html));
        return id;
    }

    @Test
    void inlineScriptsWriteToTheConsole() {
        int id = page("<html><body><script>console.log('hello', 1 + 1); console.warn({a: 1});</script></body></html>");
        assertEquals(List.of("hello 2", "{\"a\":1}"), console(id));
    }

    @Test
    void timersRunDuringUpdates() {
        int id = page("<script>setTimeout(function () { console.log('later'); }, 0);</script>");
        assertEquals(List.of("later"), console(id));
    }

    @Test
    void pageMessagesReachTheHost() {
        int id = page("<p>app</p>");
        assertTrue(bridge.hasBindings(id));
        assertTrue(bridge.evalScript(id, "window.host.send(JSON.stringify({type: 'ping'}));"));
        bridge.tick();
        assertEquals("{\"type\":\"ping\"}", bridge.pollMessage(id));
        assertNull(bridge.pollMessage(id));
    }

    @Test
    void hostMessagesReachThePage() {
        int id = page("<script>window.host = { receive: function (d) { console.log('got ' + d.n + ' ' + d.s); } };</script>");
        assertTrue(bridge.hasBindings(id));
        assertTrue(bridge.send(id, Map.of("n", 5, "s", "a\"b")));
        bridge.tick();
        assertEquals(List.of("got 5 a\"b"), console(id));

        bridge.evalScript(id, "window.host.send('still here');");
        bridge.tick();
        assertEquals("still here", bridge.pollMessage(id));
    }

    @Test
    void urlPagesLoadThroughTheOverlayWithRelativeScripts() {
        register("app/index.html", "<html><head><title>App</title></head><body>"
                + "<script src=\"js/main.js\"></script>"
                + "<script src=\"js/missing.js\"></script>"
                + "<script>console.log(document.title + ' ' + location.href);</script>"
                + "</body></html>");
        register("app/js/main.js", "console.log('main ran');");

        int id = bridge.createViewWithUrl(100, 50, "file:///app/index.html");
        assertTrue(id >= 0);
        assertEquals(List.of("main ran", "Failed to load script: js/missing.js", "App file:///app/index.html"), console(id));
    }

    @Test
    void diskFilesAreUsedWhenNotRegistered() throws Exception {
        Files.createDirectories(base.resolve("web"));
        Files.writeString(base.resolve("web/page.html"), "<script>console.log('from disk');</script>");
        int id = bridge.createViewWithUrl(10, 10, "web/page.html");
        assertEquals(List.of("from disk"), console(id));
    }

    @Test
    void missingPageIsReported() {
        int id = bridge.createViewWithUrl(10, 10, "file:///nowhere.html");
        List<String> msgs = console(id);
        assertEquals(1, msgs.size());
        assertTrue(msgs.get(0).startsWith("Failed to load"), msgs.get(0));
    }

    @Test
    void asyncViewBecomesReadyWithBindings() {
        register("ui/index.html", "<script>console.log('ui up');</script>");
        int id = bridge.createViewAsync(64, 32, "file:///ui/index.html");
        for (int t = 0; t < 4; t++) {
            bridge.tick();
            assertFalse(bridge.isReady(id));
        }
        bridge.tick();
        assertTrue(bridge.isReady(id));
        assertTrue(bridge.hasBindings(id));
        assertEquals(List.of("ui up"), console(id));
    }

    @Test
    void backgroundColorIsPainted() {
        int id = page("<html><body style=\"margin:0; background-color: #ff0000\"></body></html>");
        byte[] rgba = new byte[100 * 50 * 4];
        assertEquals(1, bridge.copyPixelsRGBA(id, rgba));
        assertEquals((byte) 0xFF, rgba[0]);
        assertEquals(0, rgba[1]);
        assertEquals(0, rgba[2]);
        assertEquals((byte) 0xFF, rgba[3]);
        assertEquals((byte) 0xFF, rgba[rgba.length - 4]);

        assertEquals(0, bridge.copyPixelsRGBA(id, rgba));
    }

    @Test
    void scriptStyleChangesRepaint() {
        int id = page("<p>x</p>");
        byte[] rgba = new byte[100 * 50 * 4];
        assertEquals(1, bridge.copyPixelsRGBA(id, rgba));
        assertEquals((byte) 0xFF, rgba[1], "white by default");

        bridge.evalScript(id, "document.body.style.backgroundColor = 'rgb(0, 0, 255)';");
        bridge.tick();
        assertEquals(1, bridge.copyPixelsRGBA(id, rgba));
        assertEquals(0, rgba[0]);
        assertEquals(0, rgba[1]);
        assertEquals((byte) 0xFF, rgba[2]);
    }

    @Test
    void mouseEventsAreClampedBeforeDispatch() {
        int id = page("<script>document.addEventListener('mousedown', function (e) {"
                + " console.log('down ' + e.clientX + ',' + e.clientY + ' ' + e.button); });</script>");
        assertTrue(bridge.fireMouse(id, 1, 250, 10, 1));
        bridge.tick();
        assertEquals(List.of("down 99,10 0"), console(id));
    }

    @Test
    void keyAndWheelEventsReachListeners() {
        int id = page("<script>"
                + "window.addEventListener('keydown', function (e) { console.log('key ' + e.keyCode + ' ' + e.key); });"
                + "document.addEventListener('wheel', function (e) { console.log('wheel ' + e.deltaY); });"
                + "</script>");
        bridge.fireKey(id, 1, 65, 0, "a");
        bridge.fireScroll(id, 0, 0, -120);
        bridge.tick();
        assertEquals(List.of("wheel -120", "key 65 a"), console(id));
    }

    @Test
    void elementsAreReadable() {
        int id = page("<div id=\"greet\" class=\"big\" data-x=\"7\">Hi there</div>"
                + "<script>var el = document.getElementById('greet');"
                + "console.log(el.tagName + ' ' + el.textContent + ' ' + el.className + ' ' + el.attributes['data-x']);"
                + "console.log(document.getElementById('none'));</script>");
        assertEquals(List.of("DIV Hi there big 7", "null"), console(id));
    }

    @Test
    void scriptErrorsGoToTheConsole() {
        int id = page("<p/>");
        bridge.evalScript(id, "throw new Error('boom');");
        bridge.evalScript(id, "document.addEventListener('mouseup', function () { undefinedFn(); });");
        bridge.tick();
        bridge.fireMouse(id, 2, 1, 1, 1);
        bridge.tick();
        List<String> msgs = console(id);
        assertEquals(2, msgs.size(), msgs.toString());
        assertTrue(msgs.get(0).contains("boom"), msgs.get(0));
        assertTrue(msgs.get(1).startsWith("Uncaught"), msgs.get(1));
    }

    @Test
    void clipboardIsSharedWithThePage() {
        clipboard.writePlainText("copied");
        int id = page("<script>navigator.clipboard.readText().then(function (t) { console.log('clip ' + t); });"
                + "navigator.clipboard.writeText('from page');</script>");
        assertEquals(List.of("clip copied"), console(id));
        assertEquals("from page", clipboard.readPlainText());
    }

    @Test
    void reloadStartsAFreshScriptContext() {
        int id = page("<script>var counter = 41;</script>");
        bridge.loadHtml(id, "<script>console.log(typeof counter);</script>");
        assertEquals(List.of("undefined"), console(id));
        assertTrue(bridge.hasBindings(id));
    }

    @Test
    void rejectsUnusableSurfaceSizes() {
        assertEquals(ResultCodes.SURFACE_FAILED, bridge.createView(0, 10));
        assertEquals(ResultCodes.SURFACE_FAILED, bridge.createView(10, GraalRenderEngine.MAX_SURFACE_EDGE + 1));
    }

    @Test
    void destroyedViewsLeaveTheEngine() {
        int a = bridge.createView(10, 10);
        bridge.createView(10, 10);
        bridge.destroyView(a);
        assertEquals(1, bridge.liveViews());
    }

    @Test
    void engineIsConfinedToItsFirstThread() throws Exception {
        GraalRenderEngine direct = new GraalRenderEngine();
        assertTrue(direct.create(new EngineConfig(base, false, "/")));
        try {
            AtomicReference<Throwable> failure = new AtomicReference<>();
            Thread other = new Thread(() -> {
                try {
                    direct.update();
                } catch (Throwable t) {
                    failure.set(t);
                }
            });
            other.start();
            other.join();
            assertInstanceOf(IllegalStateException.class, failure.get());
            assertEquals(0, direct.surfaceCount());
        } finally {
            direct.destroy();
        }
    }
}
