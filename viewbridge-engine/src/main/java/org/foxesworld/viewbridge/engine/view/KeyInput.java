package org.foxesworld.viewbridge.engine.view;

/**
 * Queued key event in caller numbering (0=RawKeyDown, 1=KeyDown, 2=KeyUp, 3=Char).
 */
public record KeyInput(int type, int keyCode, int modifiers, String text) {

    public static final int RAW_KEY_DOWN = 0;
    public static final int KEY_DOWN = 1;
    public static final int KEY_UP = 2;
    public static final int CHAR = 3;

    public static final int MOD_ALT = 1;
    public static final int MOD_CTRL = 2;
    public static final int MOD_META = 4;
    public static final int MOD_SHIFT = 8;

    public KeyInput {
        text = text == null ? "" : text;
    }
}
