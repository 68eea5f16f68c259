package com.swipesentinel.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Result of one post-action check.
 *
 * {@code postScreenType} is null when no re-observation was made.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ValidationOutcome(
        @JsonProperty("action_id") String actionId,
        @JsonProperty("pre_screen_type") ScreenType preScreenType,
        @JsonProperty("post_screen_type") ScreenType postScreenType,
        boolean changed,
        boolean passed,
        ValidationStatus status) {
}
