package org.foxesworld.viewbridge.engine.vfs;

import org.foxesworld.viewbridge.engine.spi.EngineResource;

import java.nio.ByteBuffer;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Resource handed to the engine. Overlay entries are borrowed (a read-only view over the
 * registered bytes); disk reads are owned by the overlay until the engine closes them,
 * at which point the release callback runs exactly once.
 */
final class VfsResource implements EngineResource {

    private final String path;
    private final ByteBuffer data;
    private final Runnable onRelease;
    private final AtomicBoolean closed = new AtomicBoolean();

    private VfsResource(String path, ByteBuffer data, Runnable onRelease) {
        this.path = path;
        this.data = data;
        this.onRelease = onRelease;
    }

    static VfsResource borrowed(String path, byte[] bytes) {
        return new VfsResource(path, ByteBuffer.wrap(bytes).asReadOnlyBuffer(), null);
    }

    static VfsResource owned(String path, byte[] bytes, Runnable onRelease) {
        return new VfsResource(path, ByteBuffer.wrap(bytes).asReadOnlyBuffer(), onRelease);
    }

    boolean isOwned() {
        return onRelease != null;
    }

    boolean isClosed() {
        return closed.get();
    }

    @Override
    public String path() {
        return path;
    }

    @Override
    public ByteBuffer data() {
        return data.duplicate();
    }

    @Override
    public int length() {
        return data.capacity();
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true) && onRelease != null) onRelease.run();
    }
}
