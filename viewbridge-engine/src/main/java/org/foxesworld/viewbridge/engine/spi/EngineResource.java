package org.foxesworld.viewbridge.engine.spi;

import java.nio.ByteBuffer;

/**
 * Bytes handed to the engine by {@link EngineFileSystem#open(String)}.
 * Closing signals that the engine no longer needs the buffer.
 */
public interface EngineResource extends AutoCloseable {

    String path();

    /** Read-only view of the content. */
    ByteBuffer data();

    int length();

    @Override
    void close();
}
