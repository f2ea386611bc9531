package org.foxesworld.viewbridge.engine;

import java.nio.ByteBuffer;

/**
 * A locked view of a surface's BGRA pixel memory, valid until {@code unlockPixels(viewId)}.
 *
 * @param viewId   the view the pixels belong to
 * @param pixels   read-only buffer, {@code rowBytes * height} bytes
 * @param width    width in pixels
 * @param height   height in pixels
 * @param rowBytes bytes per row (may exceed {@code width * 4})
 * @param dirty    true when something was painted since the last unlock
 */
public record PixelLock(int viewId, ByteBuffer pixels, int width, int height, int rowBytes, boolean dirty) {
}
