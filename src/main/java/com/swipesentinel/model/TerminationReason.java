package com.swipesentinel.model;

import com.fasterxml.jackson.annotation.JsonValue;

/** Why a live session stopped. Recorded in the action log. */
public enum TerminationReason {
    /** Stopped on request, before the next cycle. */
    COMPLETED,
    /** The consecutive validation-failure streak reached its threshold. */
    ABORTED_VALIDATION,
    /** A step or time budget ran out. */
    ABORTED_BUDGET,
    /** The device transport failed and foreground recovery did not help. */
    ABORTED_TRANSPORT,
    /** The decision engine failed with no fallback configured, or an unexpected error. */
    ERROR;

    @JsonValue
    public String wireName() { return name().toLowerCase(); }
}
