package org.foxesworld.viewbridge.script.paint;

/**
 * Union of painted rectangles since the last clear, in pixels. Owner thread only.
 */
public final class DirtyRegion {

    private int left, top, right, bottom; // right/bottom exclusive
    private boolean empty = true;

    public void add(int x, int y, int w, int h) {
        if (w <= 0 || h <= 0) return;
        if (empty) {
            left = x;
            top = y;
            right = x + w;
            bottom = y + h;
            empty = false;
            return;
        }
        left = Math.min(left, x);
        top = Math.min(top, y);
        right = Math.max(right, x + w);
        bottom = Math.max(bottom, y + h);
    }

    public boolean isEmpty() {
        return empty;
    }

    public void clear() {
        empty = true;
        left = top = right = bottom = 0;
    }

    public int left() { return left; }
    public int top() { return top; }
    public int width() { return empty ? 0 : right - left; }
    public int height() { return empty ? 0 : bottom - top; }

    @Override
    public String toString() {
        return empty ? "DirtyRegion{empty}" : "DirtyRegion{" + left + "," + top + " " + width() + "x" + height() + '}';
    }
}
