package org.foxesworld.viewbridge.engine.vfs;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class VfsTreeLoaderTest {

    @TempDir
    Path dir;

    @Test
    void registersFilesRelativeToTheRootAndSkipsIgnoredDirectories() throws IOException {
        Files.createDirectories(dir.resolve("ui/img"));
        Files.createDirectories(dir.resolve("node_modules/pkg"));
        Files.writeString(dir.resolve("ui/index.html"), "<html></html>");
        Files.write(dir.resolve("ui/img/logo.png"), new byte[]{(byte) 0x89, 'P', 'N', 'G'});
        Files.writeString(dir.resolve("node_modules/pkg/index.js"), "x");
        Files.write(dir.resolve("ui/empty.txt"), new byte[0]);

        VirtualFileOverlay overlay = new VirtualFileOverlay(dir.resolve("elsewhere"));
        int n = new VfsTreeLoader(overlay, Set.of("node_modules")).load(dir);

        assertEquals(2, n);
        assertTrue(overlay.isRegistered("ui/index.html"));
        assertTrue(overlay.isRegistered("file:///UI/img/logo.png"));
        assertFalse(overlay.isRegistered("node_modules/pkg/index.js"));
        assertFalse(overlay.isRegistered("ui/empty.txt"));
    }

    @Test
    void missingRootFails() {
        VfsTreeLoader loader = new VfsTreeLoader(new VirtualFileOverlay(dir), Set.of());
        assertThrows(IOException.class, () -> loader.load(dir.resolve("absent")));
    }
}
