// FILE: RenderEngine.java
package org.foxesworld.viewbridge.engine.spi;

/**
 * The embedded, non-reentrant rendering engine.
 *
 * <p>Thread confined: every method is called from the dispatcher's owner thread only,
 * from {@link #create(EngineConfig)} to {@link #destroy()}. Implementations may assume
 * that and are encouraged to assert it.</p>
 */
public interface RenderEngine {

    /** Resource loader consulted by the engine whenever content references a file. Called before create. */
    void installFileSystem(EngineFileSystem fileSystem);

    /** Clipboard used for copy/paste inside content. Called before create. */
    void installClipboard(EngineClipboard clipboard);

    /**
     * Build the engine instance (the renderer).
     *
     * @return false if the engine cannot be constructed
     */
    boolean create(EngineConfig config);

    /**
     * @return a new surface, or null if the engine rejects the parameters
     */
    EngineSurface createSurface(int width, int height);

    /** One processing step: timers, pending loads, script jobs. */
    void update();

    /** Notify the engine that display {@code displayId} refreshed. */
    void refreshDisplay(int displayId);

    /** Paint every surface with pending changes into its pixel buffer. */
    void render();

    /** Release the engine instance. Surfaces are already destroyed at this point. */
    void destroy();
}
