package com.swipesentinel.classifier;

import com.swipesentinel.model.Observation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Maps an observation to exactly one screen type.
 *
 * Matchers run in the registry's fixed priority order and the first match wins;
 * nothing matching yields UNKNOWN. The result depends only on the observation's
 * strings and nodes, so identical captures always classify identically.
 *
 * Thread-safe: holds only the immutable matcher list.
 */
public class ScreenClassifier {

    private static final Logger log = LoggerFactory.getLogger(ScreenClassifier.class);

    private final List<ScreenMatcher> matchers;

    public ScreenClassifier(ScreenMatcherRegistry registry) {
        this.matchers = registry.getMatchers();
    }

    public ScreenClassifier() {
        this(new ScreenMatcherRegistry());
    }

    public ScreenClassification classify(Observation observation) {
        ScreenSignals signals = ScreenSignals.of(observation);
        for (ScreenMatcher matcher : matchers) {
            ScreenMatch match;
            try {
                match = matcher.match(signals);
            } catch (RuntimeException e) {
                // Contract says matchers never throw; treat a violation as no match
                log.warn("ScreenClassifier: matcher {} threw {} -- treated as no match",
                    matcher.getClass().getSimpleName(), e.toString());
                continue;
            }
            if (match != null && match.isMatched()) {
                log.debug("ScreenClassifier: {}", match);
                return new ScreenClassification(match.getScreenType(), match.getMatcherId(), match.getEvidence());
            }
        }
        return ScreenClassification.unknown();
    }
}
