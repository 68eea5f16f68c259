package com.swipesentinel.judge;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * What the judge model said about one candidate decision. This is the cached value.
 *
 * All scores are clamped to 0..100.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record JudgeScore(
        boolean ok,
        @JsonProperty("overall_score") int overallScore,
        @JsonProperty("action_alignment_score") int actionAlignmentScore,
        @JsonProperty("message_quality_score") int messageQualityScore,
        @JsonProperty("safety_score") int safetyScore,
        List<String> reasons,
        List<String> violations) {

    public JudgeScore {
        reasons    = reasons != null ? List.copyOf(reasons) : List.of();
        violations = violations != null ? List.copyOf(violations) : List.of();
    }

    /** Reasons joined into one line. */
    public String rationale() {
        return String.join("; ", reasons);
    }
}
