package org.foxesworld.viewbridge.engine.vfs;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Objects;
import java.util.Set;

/**
 * Registers every regular file under a directory, keyed by its path relative to the root.
 * Directories whose name is in the ignore set are skipped with their subtree.
 */
public final class VfsTreeLoader {

    private static final Logger log = LogManager.getLogger(VfsTreeLoader.class);

    private final VirtualFileOverlay overlay;
    private final Set<String> ignoredDirNames;

    public VfsTreeLoader(VirtualFileOverlay overlay, Set<String> ignoredDirNames) {
        this.overlay = Objects.requireNonNull(overlay, "overlay");
        this.ignoredDirNames = Set.copyOf(ignoredDirNames);
    }

    /**
     * @return number of files registered
     */
    public int load(Path root) throws IOException {
        Path base = root.toAbsolutePath().normalize();
        if (!Files.isDirectory(base)) throw new IOException("not a directory: " + base);

        int[] count = {0};
        Files.walkFileTree(base, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                if (!dir.equals(base) && ignoredDirNames.contains(dir.getFileName().toString())) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                if (!attrs.isRegularFile()) return FileVisitResult.CONTINUE;
                String rel = base.relativize(file).toString().replace('\\', '/');
                if (overlay.register(rel, Files.readAllBytes(file))) count[0]++;
                return FileVisitResult.CONTINUE;
            }
        });

        log.info("[vb/vfs] registered {} files from {}", count[0], base);
        return count[0];
    }
}
