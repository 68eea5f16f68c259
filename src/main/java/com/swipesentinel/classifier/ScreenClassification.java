package com.swipesentinel.classifier;

import com.swipesentinel.model.ScreenType;

/**
 * Output of {@link ScreenClassifier#classify}.
 *
 * @param matcherId id of the winning matcher, or {@code "fallthrough"} for UNKNOWN
 * @param evidence  the observed string or identifier that triggered the match, may be null
 */
public record ScreenClassification(ScreenType screenType, String matcherId, String evidence) {

    public static final String FALLTHROUGH = "fallthrough";

    public static ScreenClassification unknown() {
        return new ScreenClassification(ScreenType.UNKNOWN, FALLTHROUGH, null);
    }
}
