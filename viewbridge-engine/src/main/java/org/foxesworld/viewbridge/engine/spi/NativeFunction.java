package org.foxesworld.viewbridge.engine.spi;

/**
 * Host function callable from content scripts with a single string argument.
 */
@FunctionalInterface
public interface NativeFunction {

    void call(String argument);
}
