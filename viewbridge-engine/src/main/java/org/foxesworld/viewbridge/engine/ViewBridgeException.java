package org.foxesworld.viewbridge.engine;

/**
 * Fatal bridge failure (the engine could not be brought up).
 */
public class ViewBridgeException extends RuntimeException {

    private final int code;

    public ViewBridgeException(String message, int code) {
        super(message + " (" + ResultCodes.describe(code) + ", code " + code + ")");
        this.code = code;
    }

    public ViewBridgeException(String message, Throwable cause) {
        super(message, cause);
        this.code = ResultCodes.ENGINE_ERROR;
    }

    public int code() {
        return code;
    }
}
