package com.swipesentinel.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Symbolic classification of the current on-screen state.
 *
 * The set is closed: every observation maps to exactly one value, with
 * {@link #UNKNOWN} as the fall-through when no matcher recognises the screen.
 * The lower-case wire value is what packets, datasets and baselines carry.
 */
public enum ScreenType {

    DISCOVER_CARD("discover_card"),
    MATCHES_LIST("matches_list"),
    MATCHES_EMPTY("matches_empty"),
    CHAT_THREAD("chat_thread"),
    TAB_SHELL("tab_shell"),
    OVERLAY_PAYWALL("overlay_paywall"),
    OVERLAY_GENERIC("overlay_generic"),
    UNKNOWN("unknown");

    private final String wireName;

    ScreenType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() { return wireName; }

    public boolean isOverlay() {
        return this == OVERLAY_PAYWALL || this == OVERLAY_GENERIC;
    }

    @JsonCreator
    public static ScreenType fromWire(String value) {
        if (value == null) return UNKNOWN;
        String v = value.trim().toLowerCase();
        for (ScreenType t : values()) {
            if (t.wireName.equals(v) || t.name().equalsIgnoreCase(v)) return t;
        }
        throw new IllegalArgumentException("Unknown screen type: " + value);
    }

    @Override
    public String toString() { return wireName; }
}
