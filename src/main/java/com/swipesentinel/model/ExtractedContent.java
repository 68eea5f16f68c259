package com.swipesentinel.model;

import java.util.List;

/**
 * Structured content derived from one observation.
 *
 * @param qualityScore   0–100, produced by the scorer named in {@code scoreVersion}
 * @param threadLines    non-chrome lines visible on a chat thread, oldest first
 * @param completenessPct share of profile signals found (name, prompts, like targets, flags, bio)
 */
public record ExtractedContent(
        ScreenType screenType,
        QualityFeatures features,
        int qualityScore,
        String scoreVersion,
        List<PromptPair> promptPairs,
        List<String> bioCandidates,
        List<String> threadLines,
        int completenessPct) {

    public ExtractedContent {
        promptPairs   = promptPairs != null ? List.copyOf(promptPairs) : List.of();
        bioCandidates = bioCandidates != null ? List.copyOf(bioCandidates) : List.of();
        threadLines   = threadLines != null ? List.copyOf(threadLines) : List.of();
    }
}
