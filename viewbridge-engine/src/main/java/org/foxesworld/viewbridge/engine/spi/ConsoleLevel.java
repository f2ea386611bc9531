package org.foxesworld.viewbridge.engine.spi;

public enum ConsoleLevel {
    LOG,
    WARNING,
    ERROR,
    DEBUG,
    INFO
}
