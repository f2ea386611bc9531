package org.foxesworld.viewbridge.engine.spi;

/**
 * Receives diagnostic (console) messages produced by a surface's content.
 */
@FunctionalInterface
public interface ConsoleSink {

    void onMessage(ConsoleLevel level, String message, String sourceId, int line, int column);
}
