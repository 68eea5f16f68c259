package com.swipesentinel.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * The audit unit: one record per decision cycle, appended to the packet log and
 * never modified after it is written.
 *
 * The fields needed to replay the decision offline ({@code screenType},
 * {@code qualityScore}, {@code qualityFeatures}, {@code availableActions},
 * {@code observedStrings}, {@code counters}, the loop state and the instruction)
 * are all present so a packet log can be turned into a regression dataset without
 * the device. Loop state is recorded as it was when the decision was taken.
 *
 * @param screenshotRef path of the cycle's screenshot, when one was captured
 * @param xmlRef        path of the cycle's raw accessibility tree
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record Packet(
        Instant ts,
        String session,
        int iteration,
        @JsonProperty("screen_type") ScreenType screenType,
        @JsonProperty("matcher_id") String matcherId,
        @JsonProperty("quality_score") int qualityScore,
        @JsonProperty("quality_score_version") String qualityScoreVersion,
        @JsonProperty("quality_features") QualityFeatures qualityFeatures,
        @JsonProperty("available_actions") List<String> availableActions,
        @JsonProperty("observed_strings") List<String> observedStrings,
        RunCounters counters,
        @JsonProperty("last_action") String lastAction,
        @JsonProperty("consecutive_validation_failures") int consecutiveValidationFailures,
        @JsonProperty("forced_action_consumed") boolean forcedActionConsumed,
        @JsonProperty("nl_query") String nlQuery,
        ActionPlan decision,
        @JsonProperty("llm_trace") LlmTrace llmTrace,
        ExecutionRecord execution,
        ValidationOutcome validation,
        @JsonProperty("screenshot_ref") String screenshotRef,
        @JsonProperty("xml_ref") String xmlRef) {

    public Packet {
        availableActions = availableActions != null ? List.copyOf(availableActions) : List.of();
        observedStrings  = observedStrings != null ? List.copyOf(observedStrings) : List.of();
    }
}
