package org.foxesworld.viewbridge.core.io;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * UTF-8 helpers for fixed-size message slots.
 */
public final class Utf8 {

    private Utf8() {}

    public static byte[] encode(String s) {
        return s == null ? new byte[0] : s.getBytes(StandardCharsets.UTF_8);
    }

    public static String decode(byte[] bytes, int length) {
        return new String(bytes, 0, length, StandardCharsets.UTF_8);
    }

    /**
     * Cut {@code bytes} to at most {@code maxBytes}, backing off so that no multi-byte
     * sequence is split.
     */
    public static byte[] truncate(byte[] bytes, int maxBytes) {
        if (bytes.length <= maxBytes) return bytes;
        int end = Math.max(0, maxBytes);
        // step back over continuation bytes (10xxxxxx) to the start of the cut sequence
        while (end > 0 && (bytes[end] & 0xC0) == 0x80) end--;
        return Arrays.copyOf(bytes, end);
    }

    /** Encode and truncate in one step. */
    public static byte[] encodeTruncated(String s, int maxBytes) {
        return truncate(encode(s), maxBytes);
    }
}
