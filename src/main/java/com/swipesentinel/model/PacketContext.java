package com.swipesentinel.model;

import java.util.Collections;
import java.util.List;

/**
 * Everything the Decision Engine may look at for one decision.
 *
 * Built by the live session from the current observation and loop state, or by
 * the regression runner from a stored case. Both variants of the engine receive
 * the same object, so live and replayed decisions see identical inputs.
 *
 * Immutable - use {@link #builder()}.
 */
public final class PacketContext {

    private final ScreenType              screenType;
    private final int                     qualityScore;
    private final String                  qualityScoreVersion;
    private final QualityFeatures         qualityFeatures;
    private final List<String>            availableActions;
    private final List<String>            observedStrings;
    private final List<InteractionTarget> targets;
    private final RunCounters             counters;
    private final String                  lastAction;
    private final int                     consecutiveValidationFailures;
    private final boolean                 forcedActionConsumed;
    private final byte[]                  screenshotPng;

    private PacketContext(Builder b) {
        this.screenType                    = b.screenType;
        this.qualityScore                  = b.qualityScore;
        this.qualityScoreVersion           = b.qualityScoreVersion;
        this.qualityFeatures               = b.qualityFeatures != null ? b.qualityFeatures : QualityFeatures.empty();
        this.availableActions              = List.copyOf(b.availableActions);
        this.observedStrings               = List.copyOf(b.observedStrings);
        this.targets                       = List.copyOf(b.targets);
        this.counters                      = b.counters != null ? b.counters : RunCounters.zero();
        this.lastAction                    = b.lastAction;
        this.consecutiveValidationFailures = b.consecutiveValidationFailures;
        this.forcedActionConsumed          = b.forcedActionConsumed;
        this.screenshotPng                 = b.screenshotPng;
    }

    // ── Getters ───────────────────────────────────────────────────────────────

    public ScreenType              getScreenType()                    { return screenType; }
    public int                     getQualityScore()                  { return qualityScore; }
    public String                  getQualityScoreVersion()           { return qualityScoreVersion; }
    public QualityFeatures         getQualityFeatures()               { return qualityFeatures; }
    public List<String>            getAvailableActions()              { return availableActions; }
    public List<String>            getObservedStrings()               { return observedStrings; }
    public List<InteractionTarget> getTargets()                       { return targets; }
    public RunCounters             getCounters()                      { return counters; }
    public String                  getLastAction()                    { return lastAction; }
    public int                     getConsecutiveValidationFailures() { return consecutiveValidationFailures; }
    public boolean                 isForcedActionConsumed()           { return forcedActionConsumed; }
    public byte[]                  getScreenshotPng()                 { return screenshotPng; }
    public boolean                 hasScreenshot()                    { return screenshotPng != null && screenshotPng.length > 0; }

    public boolean isAvailable(String actionId) {
        return availableActions.contains(actionId);
    }

    /** Returns a copy of this context with a different action set. */
    public PacketContext withAvailableActions(List<String> actions) {
        return toBuilder().availableActions(actions).build();
    }

    public Builder toBuilder() {
        return builder()
            .screenType(screenType)
            .qualityScore(qualityScore)
            .qualityScoreVersion(qualityScoreVersion)
            .qualityFeatures(qualityFeatures)
            .availableActions(availableActions)
            .observedStrings(observedStrings)
            .targets(targets)
            .counters(counters)
            .lastAction(lastAction)
            .consecutiveValidationFailures(consecutiveValidationFailures)
            .forcedActionConsumed(forcedActionConsumed)
            .screenshotPng(screenshotPng);
    }

    // ── Builder ───────────────────────────────────────────────────────────────

    public static Builder builder() { return new Builder(); }

    public static class Builder {
        private ScreenType              screenType = ScreenType.UNKNOWN;
        private int                     qualityScore;
        private String                  qualityScoreVersion = "quality_score_v1";
        private QualityFeatures         qualityFeatures;
        private List<String>            availableActions = Collections.emptyList();
        private List<String>            observedStrings = Collections.emptyList();
        private List<InteractionTarget> targets = Collections.emptyList();
        private RunCounters             counters;
        private String                  lastAction;
        private int                     consecutiveValidationFailures;
        private boolean                 forcedActionConsumed;
        private byte[]                  screenshotPng;

        public Builder screenType(ScreenType t)                  { this.screenType = t != null ? t : ScreenType.UNKNOWN; return this; }
        public Builder qualityScore(int s)                       { this.qualityScore = s; return this; }
        public Builder qualityScoreVersion(String v)             { this.qualityScoreVersion = v; return this; }
        public Builder qualityFeatures(QualityFeatures f)        { this.qualityFeatures = f; return this; }
        public Builder availableActions(List<String> a)          { this.availableActions = a != null ? a : Collections.emptyList(); return this; }
        public Builder observedStrings(List<String> s)           { this.observedStrings = s != null ? s : Collections.emptyList(); return this; }
        public Builder targets(List<InteractionTarget> t)        { this.targets = t != null ? t : Collections.emptyList(); return this; }
        public Builder counters(RunCounters c)                   { this.counters = c; return this; }
        public Builder lastAction(String a)                      { this.lastAction = a; return this; }
        public Builder consecutiveValidationFailures(int n)      { this.consecutiveValidationFailures = n; return this; }
        public Builder forcedActionConsumed(boolean b)           { this.forcedActionConsumed = b; return this; }
        public Builder screenshotPng(byte[] png)                 { this.screenshotPng = png; return this; }

        public PacketContext build() {
            return new PacketContext(this);
        }
    }

    @Override
    public String toString() {
        return String.format("PacketContext{screen=%s, score=%d, available=%s, counters=%s}",
            screenType, qualityScore, availableActions, counters);
    }
}
