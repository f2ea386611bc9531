package org.foxesworld.viewbridge.core.pixel;

import java.nio.ByteBuffer;

/**
 * BGRA (engine surface order, rows padded to {@code rowBytes}) to tightly packed RGBA.
 */
public final class PixelSwizzle {

    private PixelSwizzle() {}

    public static int packedSize(int width, int height) {
        return width * height * 4;
    }

    /**
     * Convert {@code height} rows of {@code width} BGRA pixels from {@code src} into {@code dst}.
     * {@code src} is read with absolute indexes; its position is not changed.
     */
    public static void bgraToRgba(ByteBuffer src, int width, int height, int rowBytes, byte[] dst) {
        if (rowBytes < width * 4) throw new IllegalArgumentException("rowBytes " + rowBytes + " < width*4");
        if (dst.length < packedSize(width, height)) {
            throw new IllegalArgumentException("destination too small: " + dst.length + " < " + packedSize(width, height));
        }
        int d = 0;
        for (int y = 0; y < height; y++) {
            int row = y * rowBytes;
            for (int x = 0; x < width * 4; x += 4) {
                int s = row + x;
                dst[d]     = src.get(s + 2);
                dst[d + 1] = src.get(s + 1);
                dst[d + 2] = src.get(s);
                dst[d + 3] = src.get(s + 3);
                d += 4;
            }
        }
    }
}
