package com.swipesentinel.regression;

import com.swipesentinel.core.ConfigException;

import java.util.Locale;

/** How message text is compared against the baseline. */
public enum MessageTolerance {
    /** Any difference in text is drift. */
    EXACT,
    /** Drift when the judge scores differ by more than the configured delta. */
    JUDGE,
    /** Only the action is compared. */
    IGNORE;

    public static MessageTolerance parse(String raw) {
        try {
            return valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new ConfigException("message tolerance must be exact, judge or ignore, got: " + raw);
        }
    }
}
