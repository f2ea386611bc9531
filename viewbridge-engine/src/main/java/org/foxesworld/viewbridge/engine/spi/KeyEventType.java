package org.foxesworld.viewbridge.engine.spi;

/**
 * Key event types in the engine's own order.
 *
 * <p>Callers use a different numbering (0=RawKeyDown, 1=KeyDown, 2=KeyUp, 3=Char);
 * {@link #fromInputCode(int)} maps it.</p>
 */
public enum KeyEventType {
    KEY_DOWN,
    KEY_UP,
    RAW_KEY_DOWN,
    CHAR;

    public static KeyEventType fromInputCode(int code) {
        return switch (code) {
            case 0 -> RAW_KEY_DOWN;
            case 1 -> KEY_DOWN;
            case 2 -> KEY_UP;
            default -> CHAR;
        };
    }
}
