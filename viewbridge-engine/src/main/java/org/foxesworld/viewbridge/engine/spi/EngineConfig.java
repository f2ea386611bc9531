package org.foxesworld.viewbridge.engine.spi;

import java.nio.file.Path;

/**
 * Engine construction parameters.
 *
 * @param baseDirectory      disk root for resources and engine logs
 * @param debug              verbose engine logging
 * @param resourcePathPrefix prefix under which the engine looks up its own bundled resources
 */
public record EngineConfig(Path baseDirectory, boolean debug, String resourcePathPrefix) {
}
