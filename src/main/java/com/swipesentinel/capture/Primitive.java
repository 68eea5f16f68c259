package com.swipesentinel.capture;

/**
 * One device-level action. Only the fields relevant to {@code kind} are set;
 * use the static factories.
 */
public record Primitive(
        PrimitiveKind kind,
        int x,
        int y,
        int toX,
        int toY,
        long durationMs,
        String text,
        int keyCode) {

    /** Android KEYCODE_BACK. */
    public static final int KEYCODE_BACK = 4;

    public static Primitive tap(int x, int y) {
        return new Primitive(PrimitiveKind.TAP, x, y, 0, 0, 0, null, 0);
    }

    public static Primitive swipe(int fromX, int fromY, int toX, int toY, long durationMs) {
        return new Primitive(PrimitiveKind.SWIPE, fromX, fromY, toX, toY, durationMs, null, 0);
    }

    public static Primitive type(String text) {
        return new Primitive(PrimitiveKind.TYPE, 0, 0, 0, 0, 0, text, 0);
    }

    public static Primitive key(int keyCode) {
        return new Primitive(PrimitiveKind.KEY, 0, 0, 0, 0, 0, null, keyCode);
    }

    public static Primitive back() {
        return new Primitive(PrimitiveKind.BACK, 0, 0, 0, 0, 0, null, KEYCODE_BACK);
    }

    @Override
    public String toString() {
        return switch (kind) {
            case TAP   -> "tap(" + x + "," + y + ")";
            case SWIPE -> "swipe(" + x + "," + y + "->" + toX + "," + toY + ")";
            case TYPE  -> "type(" + (text != null ? text.length() : 0) + " chars)";
            case KEY   -> "key(" + keyCode + ")";
            case BACK  -> "back";
        };
    }
}
