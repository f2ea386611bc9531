package org.foxesworld.viewbridge.core;

public final class ViewBridgePlatform {
    public static final String NAME = "ViewBridge";
    public static final String VERSION = "1.0.0";

    public static String java() {
        return System.getProperty("java.version");
    }

    public static String os() {
        return System.getProperty("os.name") + " " + System.getProperty("os.version");
    }

    public static String describe() {
        return NAME + " " + VERSION + " (java " + java() + ", " + os() + ")";
    }

    private ViewBridgePlatform() {}
}
