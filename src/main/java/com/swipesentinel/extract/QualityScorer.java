package com.swipesentinel.extract;

import com.swipesentinel.model.QualityFeatures;
import com.swipesentinel.model.ScreenType;

/**
 * Weighted sum over named quality features, clamped to 0–100.
 *
 * Weights are versioned: packets record {@link #VERSION} next to the score so a
 * later scorer can coexist with logs produced by this one.
 *
 * <pre>
 *   discover card         +20
 *   selfie verified       +20
 *   active today          +15
 *   voice prompt          +10
 *   prompt answer         +15
 *   like targets (max 3)  +8 each
 *   profile name          +8
 *   matches-empty screen  always 0
 * </pre>
 */
public class QualityScorer {

    public static final String VERSION = "quality_score_v1";

    public static final int MIN_SCORE = 0;
    public static final int MAX_SCORE = 100;

    static final int W_DISCOVER_CARD = 20;
    static final int W_SELFIE        = 20;
    static final int W_ACTIVE_TODAY  = 15;
    static final int W_VOICE_PROMPT  = 10;
    static final int W_PROMPT_ANSWER = 15;
    static final int W_LIKE_TARGET   = 8;
    static final int MAX_LIKE_TARGETS_SCORED = 3;
    static final int W_PROFILE_NAME  = 8;

    public int score(ScreenType screenType, QualityFeatures features) {
        if (screenType == ScreenType.MATCHES_EMPTY) return 0;

        int score = 0;
        if (screenType == ScreenType.DISCOVER_CARD) score += W_DISCOVER_CARD;
        if (features.hasFlag(QualityFeatures.FLAG_SELFIE_VERIFIED)) score += W_SELFIE;
        if (features.hasFlag(QualityFeatures.FLAG_ACTIVE_TODAY))    score += W_ACTIVE_TODAY;
        if (features.hasFlag(QualityFeatures.FLAG_VOICE_PROMPT))    score += W_VOICE_PROMPT;
        if (notBlank(features.promptAnswer()))                      score += W_PROMPT_ANSWER;
        score += W_LIKE_TARGET * Math.min(features.likeTargets().size(), MAX_LIKE_TARGETS_SCORED);
        if (notBlank(features.profileNameCandidate()))              score += W_PROFILE_NAME;

        return Math.max(MIN_SCORE, Math.min(MAX_SCORE, score));
    }

    private static boolean notBlank(String s) {
        return s != null && !s.isBlank();
    }
}
