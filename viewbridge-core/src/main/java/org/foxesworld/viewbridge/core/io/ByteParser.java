package org.foxesworld.viewbridge.core.io;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Objects;

/**
 * Base for turning raw resource bytes into a typed document.
 * <p>
 * The engine copies resources out of the file system before parsing, so the only
 * entry point is {@link #parse(byte[], String)}. Failures are logged with the resource
 * name and rethrown.
 */
public abstract class ByteParser<T> {
    private static final Logger logger = LoggerFactory.getLogger(ByteParser.class);

    /**
     * Parse the given bytes.
     * @param data never null
     * @param name resource name for diagnostics and relative lookups, may be empty
     * @throws IOException on parse error
     */
    protected abstract T parseBytes(byte[] data, String name) throws IOException;

    public T parse(byte[] data, String name) throws IOException {
        Objects.requireNonNull(data, "Data byte array cannot be null");
        String n = name == null ? "" : name;
        try {
            return parseBytes(data, n);
        } catch (IOException | RuntimeException ex) {
            logger.error("Failed to parse '{}' ({} bytes): {}", n, data.length, ex.getMessage(), ex);
            throw ex;
        }
    }
}
