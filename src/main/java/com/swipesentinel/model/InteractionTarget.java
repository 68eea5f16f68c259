package com.swipesentinel.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A tappable affordance found in one observation.
 *
 * {@code targetId} is scoped to the observation it came from and must never be
 * used as a key across captures.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record InteractionTarget(
        @JsonProperty("target_id") String targetId,
        TargetKind kind,
        String label,
        Bounds bounds,
        @JsonProperty("tap_x") int tapX,
        @JsonProperty("tap_y") int tapY,
        @JsonProperty("context_text") List<String> contextText) {

    public InteractionTarget {
        contextText = contextText != null ? List.copyOf(contextText) : List.of();
    }
}
