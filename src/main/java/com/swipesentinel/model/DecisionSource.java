package com.swipesentinel.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Which policy produced an {@link ActionPlan}. */
public enum DecisionSource {
    DETERMINISTIC,
    LLM,
    LLM_FALLBACK;

    @JsonValue
    public String wireName() { return name().toLowerCase(); }

    @JsonCreator
    public static DecisionSource fromWire(String value) {
        return valueOf(value.trim().toUpperCase());
    }
}
