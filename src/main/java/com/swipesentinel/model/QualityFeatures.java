package com.swipesentinel.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Named features the quality score is computed from. Carried on every packet
 * and sent to the model as part of the packet context.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record QualityFeatures(
        @JsonProperty("profile_name_candidate") String profileNameCandidate,
        @JsonProperty("prompt_answer") String promptAnswer,
        @JsonProperty("like_targets") List<String> likeTargets,
        @JsonProperty("quality_flags") List<String> qualityFlags) {

    public static final String FLAG_SELFIE_VERIFIED = "selfie_verified";
    public static final String FLAG_ACTIVE_TODAY    = "active_today";
    public static final String FLAG_VOICE_PROMPT    = "has_voice_prompt";

    public QualityFeatures {
        likeTargets  = likeTargets != null ? List.copyOf(likeTargets) : List.of();
        qualityFlags = qualityFlags != null ? List.copyOf(qualityFlags) : List.of();
    }

    public static QualityFeatures empty() {
        return new QualityFeatures(null, null, List.of(), List.of());
    }

    public boolean hasFlag(String flag) {
        return qualityFlags.contains(flag);
    }
}
