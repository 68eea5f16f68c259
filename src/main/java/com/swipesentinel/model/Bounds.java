package com.swipesentinel.model;

/**
 * Screen-space bounding rectangle of a UI node, as reported by UiAutomator
 * ({@code [x1,y1][x2,y2]}).
 */
public record Bounds(int x1, int y1, int x2, int y2) {

    public int centerX() { return (x1 + x2) / 2; }
    public int centerY() { return (y1 + y2) / 2; }
    public int width()   { return Math.max(0, x2 - x1); }
    public int height()  { return Math.max(0, y2 - y1); }
}
