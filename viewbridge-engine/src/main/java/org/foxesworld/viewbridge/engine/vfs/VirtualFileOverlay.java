// FILE: VirtualFileOverlay.java
package org.foxesworld.viewbridge.engine.vfs;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.foxesworld.viewbridge.engine.spi.EngineFileSystem;
import org.foxesworld.viewbridge.engine.spi.EngineResource;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory files layered over a disk directory.
 *
 * <p>Lookup order: registered entries, then a regular file under the base directory, then
 * nothing. Registration is safe from any thread; engine lookups arrive on the owner thread.</p>
 */
public final class VirtualFileOverlay implements EngineFileSystem {

    private static final Logger log = LogManager.getLogger(VirtualFileOverlay.class);

    private final ConcurrentHashMap<String, byte[]> entries = new ConcurrentHashMap<>();
    private final AtomicInteger ownedOpen = new AtomicInteger();

    private volatile Path baseDirectory;

    public VirtualFileOverlay() {
        this(Path.of("."));
    }

    public VirtualFileOverlay(Path baseDirectory) {
        setBaseDirectory(baseDirectory);
    }

    public void setBaseDirectory(Path dir) {
        this.baseDirectory = (dir == null ? Path.of(".") : dir).toAbsolutePath().normalize();
    }

    public Path baseDirectory() {
        return baseDirectory;
    }

    // ---------------------------------------------------------------------
    // REGISTRY
    // ---------------------------------------------------------------------

    /**
     * Insert or replace {@code path}. The bytes are copied.
     *
     * @return false when the path is empty after normalization or there is no content
     */
    public boolean register(String path, byte[] data) {
        String key = PathNorm.key(path);
        if (key.isEmpty()) {
            log.warn("[vb/vfs] refusing to register empty path '{}'", path);
            return false;
        }
        if (data == null || data.length == 0) {
            log.debug("[vb/vfs] skipping empty content for '{}'", key);
            return false;
        }
        byte[] prev = entries.put(key, Arrays.copyOf(data, data.length));
        log.debug("[vb/vfs] {} '{}' ({} bytes)", prev == null ? "registered" : "replaced", key, data.length);
        return true;
    }

    public void clear() {
        int n = entries.size();
        entries.clear();
        if (n > 0) log.debug("[vb/vfs] cleared {} entries", n);
    }

    public int count() {
        return entries.size();
    }

    public boolean isRegistered(String path) {
        return entries.containsKey(PathNorm.key(path));
    }

    /** Disk reads handed to the engine and not yet closed. */
    public int outstandingDiskReads() {
        return ownedOpen.get();
    }

    // ---------------------------------------------------------------------
    // ENGINE FILE SYSTEM
    // ---------------------------------------------------------------------

    @Override
    public boolean fileExists(String path) {
        return entries.containsKey(PathNorm.key(path)) || diskFile(path) != null;
    }

    @Override
    public String mimeType(String path) {
        return MimeTypes.forPath(path);
    }

    @Override
    public String charset(String path) {
        return MimeTypes.CHARSET;
    }

    @Override
    public EngineResource open(String path) {
        String key = PathNorm.key(path);
        byte[] mem = entries.get(key);
        if (mem != null) {
            return VfsResource.borrowed(key, mem);
        }

        Path file = diskFile(path);
        if (file == null) {
            log.debug("[vb/vfs] not found: '{}'", path);
            return null;
        }
        try {
            byte[] bytes = Files.readAllBytes(file);
            ownedOpen.incrementAndGet();
            return VfsResource.owned(PathNorm.normalize(path), bytes, ownedOpen::decrementAndGet);
        } catch (IOException e) {
            log.warn("[vb/vfs] failed to read {}: {}", file, e.toString());
            return null;
        }
    }

    /** Regular file under the base directory for {@code path}, or null (also for escaping paths). */
    private Path diskFile(String path) {
        String rel = PathNorm.normalize(path);
        if (rel.isEmpty()) return null;
        Path base = baseDirectory;
        try {
            Path p = base.resolve(rel).normalize();
            if (!p.startsWith(base)) {
                log.debug("[vb/vfs] path escapes base directory: '{}'", path);
                return null;
            }
            return Files.isRegularFile(p) ? p : null;
        } catch (InvalidPathException e) {
            log.debug("[vb/vfs] invalid path '{}': {}", path, e.getMessage());
            return null;
        }
    }
}
