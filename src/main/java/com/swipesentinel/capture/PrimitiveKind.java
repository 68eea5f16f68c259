package com.swipesentinel.capture;

/** Device-level actions the capture adapter accepts. */
public enum PrimitiveKind {
    TAP,
    SWIPE,
    TYPE,
    KEY,
    BACK
}
