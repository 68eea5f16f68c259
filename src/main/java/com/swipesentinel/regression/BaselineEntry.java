package com.swipesentinel.regression;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/** The decision a previous run produced for one case. */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record BaselineEntry(
        @JsonProperty("case_id") String caseId,
        @JsonProperty("action_id") String actionId,
        @JsonProperty("message_text") String messageText,
        @JsonProperty("judge_score") Integer judgeScore) {
}
