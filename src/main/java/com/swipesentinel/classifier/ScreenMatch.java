package com.swipesentinel.classifier;

import com.swipesentinel.model.ScreenType;

/**
 * Result of one {@link ScreenMatcher}: either MATCHED with the evidence string
 * that triggered it, or NO_MATCH.
 *
 * Immutable -- use the static factories.
 */
public final class ScreenMatch {

    private final boolean    matched;
    private final String     matcherId;
    private final ScreenType screenType;
    private final String     evidence;

    private ScreenMatch(boolean matched, String matcherId, ScreenType screenType, String evidence) {
        this.matched    = matched;
        this.matcherId  = matcherId;
        this.screenType = screenType;
        this.evidence   = evidence;
    }

    public static ScreenMatch matched(String matcherId, ScreenType screenType, String evidence) {
        return new ScreenMatch(true, matcherId, screenType, evidence);
    }

    public static ScreenMatch noMatch(String matcherId) {
        return new ScreenMatch(false, matcherId, null, null);
    }

    public boolean    isMatched()     { return matched; }
    public String     getMatcherId()  { return matcherId; }
    public ScreenType getScreenType() { return screenType; }
    public String     getEvidence()   { return evidence; }

    @Override
    public String toString() {
        return matched
            ? String.format("ScreenMatch{MATCHED, matcher=%s, screen=%s, evidence='%s'}", matcherId, screenType, evidence)
            : String.format("ScreenMatch{NO_MATCH, matcher=%s}", matcherId);
    }
}
