package com.swipesentinel.decision;

import java.util.List;

/**
 * Result of checking a proposed decision against the action space and the
 * message rules.
 *
 * @param issues                   stable issue codes; empty when the decision is acceptable
 * @param mentionsProfileName      personalization signal, reported only
 * @param mentionsPromptKeyword    personalization signal, reported only
 */
public record DecisionCheck(
        List<String> issues,
        boolean mentionsProfileName,
        boolean mentionsPromptKeyword) {

    public DecisionCheck {
        issues = List.copyOf(issues);
    }

    public boolean ok() {
        return issues.isEmpty();
    }
}
