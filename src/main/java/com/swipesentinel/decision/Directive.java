package com.swipesentinel.decision;

import java.util.List;

/**
 * The parsed form of a natural-language run instruction.
 *
 * Parsed once per run and consulted on every cycle; never re-parsed. Every
 * override is nullable: {@code null} means "keep the configured value".
 *
 * @param query            the original instruction text, or {@code null}
 * @param forceActionOnce  an action to take exactly once, as soon as it is available
 * @param allowedActions   optional subset of catalog actions the run may use
 */
public record Directive(
        String query,
        Goal goal,
        String forceActionOnce,
        Integer maxActions,
        Integer maxLikes,
        Integer maxPasses,
        Integer maxMessages,
        Integer minQualityScoreLike,
        Integer maxRuntimeSeconds,
        Boolean dryRun,
        Boolean messageEnabled,
        List<String> allowedActions) {

    public Directive {
        goal = goal != null ? goal : Goal.SWIPE;
        allowedActions = allowedActions != null ? List.copyOf(allowedActions) : null;
    }

    /** No instruction: swipe goal, nothing forced, nothing overridden. */
    public static Directive none() {
        return new Directive(null, Goal.SWIPE, null, null, null, null, null, null, null, null, null, null);
    }

    public boolean hasForcedAction() {
        return forceActionOnce != null;
    }
}
