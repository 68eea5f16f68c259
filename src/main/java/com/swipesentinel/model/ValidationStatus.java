package com.swipesentinel.model;

import com.fasterxml.jackson.annotation.JsonValue;

/** How a post-action check was resolved. */
public enum ValidationStatus {
    /** The screen changed as required. */
    PASSED,
    /** The action required a screen change and none was observed. */
    FAILED,
    /** Nothing was issued to the device (dry run), so no transition was expected. */
    SKIPPED_DRY_RUN,
    /** The action is not in the must-change set; passed without re-observing. */
    NOT_REQUIRED;

    @JsonValue
    public String wireName() { return name().toLowerCase(); }
}
