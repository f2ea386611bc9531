package org.foxesworld.viewbridge.engine;

/**
 * Status codes returned across the caller boundary. Non-negative means success
 * (for view creation the value is the view id).
 */
public final class ResultCodes {

    public static final int OK = 0;

    /** All view slots are live. Destroy a view before retrying. */
    public static final int NO_FREE_SLOT = -1;

    /** The engine handle does not exist (init not called, failed, or after shutdown). */
    public static final int NO_ENGINE = -2;

    /** The id is out of range or the slot is not live. */
    public static final int INVALID_VIEW = -3;

    /** The surface has no pixel memory to lock. */
    public static final int NO_PIXELS = -4;

    /** The engine could not be constructed. */
    public static final int INIT_FAILED = -10;

    /** The engine rejected the surface parameters. */
    public static final int SURFACE_FAILED = -11;

    /** An engine call threw while the command was executing. */
    public static final int ENGINE_ERROR = -12;

    /** The owner thread is not running. */
    public static final int DISPATCHER_STOPPED = -20;

    public static boolean isError(int code) {
        return code < 0;
    }

    public static String describe(int code) {
        return switch (code) {
            case NO_FREE_SLOT -> "no free view slot";
            case NO_ENGINE -> "engine not initialized";
            case INVALID_VIEW -> "invalid view";
            case NO_PIXELS -> "surface has no pixels";
            case INIT_FAILED -> "engine initialization failed";
            case SURFACE_FAILED -> "surface creation failed";
            case ENGINE_ERROR -> "engine error";
            case DISPATCHER_STOPPED -> "dispatcher stopped";
            default -> code >= 0 ? "ok" : "error " + code;
        };
    }

    private ResultCodes() {}
}
