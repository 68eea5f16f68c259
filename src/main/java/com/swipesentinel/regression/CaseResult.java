package com.swipesentinel.regression;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;
import com.swipesentinel.judge.JudgeVerdict;
import com.swipesentinel.model.DecisionSource;
import com.swipesentinel.model.LlmTrace;

import java.util.List;

/** Outcome of replaying one {@link RegressionCase}. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CaseResult(
        @JsonProperty("case_id") String caseId,
        Status status,
        @JsonProperty("action_id") String actionId,
        @JsonProperty("message_text") String messageText,
        String reason,
        DecisionSource source,
        List<String> failures,
        @JsonProperty("llm_trace") LlmTrace llmTrace,
        JudgeVerdict judge) {

    public enum Status {
        /** Decision accepted by every check. */
        PASSED,
        /** A decision was made but a check rejected it. */
        FAILED,
        /** The engine returned no decision. */
        ERROR;

        @JsonValue
        public String wireName() { return name().toLowerCase(); }
    }

    public CaseResult {
        failures = failures != null ? List.copyOf(failures) : List.of();
    }

    public boolean isPassed() {
        return status == Status.PASSED;
    }
}
