package com.swipesentinel.regression;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.swipesentinel.model.PacketContext;
import com.swipesentinel.model.QualityFeatures;
import com.swipesentinel.model.RunCounters;
import com.swipesentinel.model.ScreenType;

import java.util.List;

/**
 * The stored decision inputs of a regression case: the {@link PacketContext}
 * fields that survive outside the live cycle. Interaction targets are not
 * stored; their ids are only meaningful within one observation.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record CasePacket(
        @JsonProperty("screen_type") ScreenType screenType,
        @JsonProperty("quality_score") int qualityScore,
        @JsonProperty("quality_score_version") String qualityScoreVersion,
        @JsonProperty("quality_features") QualityFeatures qualityFeatures,
        @JsonProperty("available_actions") List<String> availableActions,
        @JsonProperty("observed_strings") List<String> observedStrings,
        RunCounters counters,
        @JsonProperty("last_action") String lastAction,
        @JsonProperty("consecutive_validation_failures") int consecutiveValidationFailures,
        @JsonProperty("forced_action_consumed") boolean forcedActionConsumed) {

    public CasePacket {
        availableActions = availableActions != null ? List.copyOf(availableActions) : List.of();
        observedStrings  = observedStrings != null ? List.copyOf(observedStrings) : List.of();
    }

    public PacketContext toContext() {
        return PacketContext.builder()
            .screenType(screenType)
            .qualityScore(qualityScore)
            .qualityScoreVersion(qualityScoreVersion != null ? qualityScoreVersion : "quality_score_v1")
            .qualityFeatures(qualityFeatures)
            .availableActions(availableActions)
            .observedStrings(observedStrings)
            .counters(counters)
            .lastAction(lastAction)
            .consecutiveValidationFailures(consecutiveValidationFailures)
            .forcedActionConsumed(forcedActionConsumed)
            .build();
    }
}
