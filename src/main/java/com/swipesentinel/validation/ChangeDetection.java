package com.swipesentinel.validation;

import com.swipesentinel.core.ConfigException;

import java.util.Locale;

/** What counts as "the screen changed" after an action. */
public enum ChangeDetection {
    /** Only a different screen type counts. */
    SCREEN_TYPE,
    /** A different screen type or a different content fingerprint counts. */
    SCREEN_TYPE_OR_CONTENT;

    public static ChangeDetection parse(String raw) {
        try {
            return valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new ConfigException(
                "validation.change_detection must be screen_type or screen_type_or_content, got: " + raw);
        }
    }
}
