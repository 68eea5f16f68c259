package com.swipesentinel.regression;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One case whose decision moved away from the baseline.
 *
 * @param messageDelta present when the message text drifted
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DriftReport(
        @JsonProperty("case_id") String caseId,
        @JsonProperty("baseline_action") String baselineAction,
        @JsonProperty("observed_action") String observedAction,
        @JsonProperty("action_changed") boolean actionChanged,
        @JsonProperty("message_delta") MessageDelta messageDelta) {

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record MessageDelta(
            @JsonProperty("baseline_text") String baselineText,
            @JsonProperty("observed_text") String observedText,
            @JsonProperty("baseline_judge_score") Integer baselineJudgeScore,
            @JsonProperty("observed_judge_score") Integer observedJudgeScore) {
    }
}
