package org.foxesworld.viewbridge.engine.spi;

import java.nio.ByteBuffer;

/**
 * One engine render surface (a "view" on the engine side). Owner thread only.
 */
public interface EngineSurface {

    void setConsoleSink(ConsoleSink sink);

    void focus();

    void loadHtml(String html);

    void loadUrl(String url);

    void fireMouse(int type, int x, int y, int button);

    void fireScroll(int type, int dx, int dy);

    void fireKey(KeyEventType type, int modifiers, int keyCode, String text);

    void evaluateScript(String script);

    /**
     * Expose {@code fn} as a global function called {@code name} in the surface's script context.
     *
     * @return false if the script context is not available yet (content still loading)
     */
    boolean bindNativeFunction(String name, NativeFunction fn);

    /**
     * Lock the backing pixel memory (BGRA, rows of {@link #rowBytes()} bytes).
     * The engine does not paint into a locked surface.
     *
     * @return a read-only view, or null if the surface has no pixel memory
     */
    ByteBuffer lockPixels();

    void unlockPixels();

    int width();

    int height();

    int rowBytes();

    /** True when the dirty region is non-empty (something was painted since the last clear). */
    boolean isDirty();

    void clearDirty();

    void destroy();
}
