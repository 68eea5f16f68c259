package com.swipesentinel.capture;

/** Outcome of one primitive: ok, or error with a transport-level detail. */
public record PrimitiveResult(boolean ok, String detail) {

    public static PrimitiveResult success() {
        return new PrimitiveResult(true, null);
    }

    public static PrimitiveResult error(String detail) {
        return new PrimitiveResult(false, detail);
    }
}
