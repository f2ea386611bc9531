package org.foxesworld.viewbridge.engine.view;

/** Queued mouse move/press/release. Coordinates are clamped when the event is fired. */
public record PointerEvent(int type, int x, int y, int button) {

    public static final int MOVED = 0;
    public static final int DOWN = 1;
    public static final int UP = 2;

    public static final int BUTTON_NONE = 0;
    public static final int BUTTON_LEFT = 1;
    public static final int BUTTON_MIDDLE = 2;
    public static final int BUTTON_RIGHT = 3;
}
