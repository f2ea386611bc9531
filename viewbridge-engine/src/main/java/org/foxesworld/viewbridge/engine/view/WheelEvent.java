package org.foxesworld.viewbridge.engine.view;

public record WheelEvent(int type, int dx, int dy) {

    public static final int BY_PIXEL = 0;
    public static final int BY_PAGE = 1;
}
