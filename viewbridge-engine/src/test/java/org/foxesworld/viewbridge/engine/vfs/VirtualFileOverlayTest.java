package org.foxesworld.viewbridge.engine.vfs;

import org.foxesworld.viewbridge.engine.spi.EngineResource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class VirtualFileOverlayTest {

    @TempDir
    Path root;

    private Path base;
    private VirtualFileOverlay overlay;

    @BeforeEach
    void setUp() throws Exception {
        base = Files.createDirectories(root.resolve("assets"));
        Files.createDirectories(base.resolve("app"));
        Files.writeString(base.resolve("app/index.html"), "<p>disk</p>");
        Files.writeString(base.resolve("app/only-on-disk.css"), "body{}");
        Files.writeString(root.resolve("secret.txt"), "nope");
        overlay = new VirtualFileOverlay(base);
    }

    private static String text(EngineResource r) {
        ByteBuffer b = r.data();
        byte[] out = new byte[b.remaining()];
        b.get(out);
        return new String(out, StandardCharsets.UTF_8);
    }

    @Test
    void memoryEntriesShadowDiskFiles() {
        overlay.register("app/index.html", "<p>memory</p>".getBytes(StandardCharsets.UTF_8));
        try (EngineResource r = overlay.open("file:///app/index.html")) {
            assertEquals("<p>memory</p>", text(r));
        }
        assertEquals(0, overlay.outstandingDiskReads());
    }

    @Test
    void lookupsIgnoreCase() {
        overlay.register("UI/Main.JS", new byte[]{1, 2, 3});
        assertTrue(overlay.fileExists("ui/main.js"));
        assertTrue(overlay.isRegistered("file:///Ui/MAIN.js"));
        try (EngineResource r = overlay.open("/ui/main.js")) {
            assertEquals(3, r.length());
        }
    }

    @Test
    void diskFallbackIsReleasedWhenClosed() {
        EngineResource r = overlay.open("app/only-on-disk.css");
        assertNotNull(r);
        assertEquals("body{}", text(r));
        assertEquals(1, overlay.outstandingDiskReads());
        r.close();
        r.close();
        assertEquals(0, overlay.outstandingDiskReads());
    }

    @Test
    void pathsEscapingTheBaseAreAbsent() {
        assertFalse(overlay.fileExists("../secret.txt"));
        assertNull(overlay.open("app/../../secret.txt"));
        assertFalse(overlay.fileExists("app"));
    }

    @Test
    void missingFilesAreAbsent() {
        assertFalse(overlay.fileExists("app/missing.html"));
        assertNull(overlay.open("app/missing.html"));
        assertNull(overlay.open(""));
    }

    @Test
    void mimeTypeAndCharsetFollowTheExtension() {
        assertEquals("text/html", overlay.mimeType("app/index.html"));
        assertEquals("application/javascript", overlay.mimeType("file:///x/y.JS?v=3"));
        assertEquals("image/png", overlay.mimeType("a.png#frag"));
        assertEquals(MimeTypes.UNKNOWN, overlay.mimeType("README"));
        assertEquals(MimeTypes.UNKNOWN, overlay.mimeType("archive.xyz"));
        assertEquals("utf-8", overlay.charset("app/index.html"));
    }

    @Test
    void registerReplacesAndCopies() {
        byte[] data = "one".getBytes(StandardCharsets.UTF_8);
        assertTrue(overlay.register("a.txt", data));
        data[0] = 'X';
        assertTrue(overlay.register("A.TXT", "two".getBytes(StandardCharsets.UTF_8)));
        assertEquals(1, overlay.count());
        try (EngineResource r = overlay.open("a.txt")) {
            assertEquals("two", text(r));
        }
    }

    @Test
    void emptyPathsAndContentAreNotRegistered() {
        assertFalse(overlay.register("", new byte[]{1}));
        assertFalse(overlay.register("file:///", new byte[]{1}));
        assertFalse(overlay.register("empty.txt", new byte[0]));
        assertFalse(overlay.register("null.txt", null));
        assertEquals(0, overlay.count());
    }

    @Test
    void queryAndFragmentAreStripped() {
        overlay.register("page.html?x=1#top", new byte[]{1});
        assertTrue(overlay.fileExists("page.html"));
        assertTrue(overlay.fileExists("./page.html?y=2"));
    }

    @Test
    void clearDropsMemoryEntriesOnly() {
        overlay.register("app/index.html", "<p>memory</p>".getBytes(StandardCharsets.UTF_8));
        overlay.clear();
        assertEquals(0, overlay.count());
        try (EngineResource r = overlay.open("app/index.html")) {
            assertEquals("<p>disk</p>", text(r));
        }
    }

    @Test
    void resourcesAreReadOnly() {
        overlay.register("a.bin", new byte[]{1, 2});
        try (EngineResource r = overlay.open("a.bin")) {
            assertTrue(r.data().isReadOnly());
        }
    }
}
