package com.swipesentinel.classifier.matchers;

import com.swipesentinel.classifier.ClassifiesScreen;
import com.swipesentinel.classifier.ScreenMatch;
import com.swipesentinel.classifier.ScreenMatcher;
import com.swipesentinel.classifier.ScreenSignals;
import com.swipesentinel.model.ScreenType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

// ── overlay-paywall ───────────────────────────────────────────────────────────

/**
 * The daily like allowance is used up and an upsell sheet covers the feed.
 * Highest priority: the sheet sits over a card whose labels are still in the tree.
 */
@ClassifiesScreen(id = "overlay-paywall", screen = ScreenType.OVERLAY_PAYWALL, priority = 10)
class PaywallMatcher implements ScreenMatcher {

    private static final Logger log = LoggerFactory.getLogger(PaywallMatcher.class);

    @Override
    public ScreenMatch match(ScreenSignals signals) {
        try {
            return signals.findContaining("out of free likes")
                .map(hit -> ScreenMatch.matched("overlay-paywall", ScreenType.OVERLAY_PAYWALL, hit))
                .orElseGet(() -> ScreenMatch.noMatch("overlay-paywall"));
        } catch (Exception e) {
            log.warn("PaywallMatcher: evaluation failed, treated as no match: {}", e.toString());
            return ScreenMatch.noMatch("overlay-paywall");
        }
    }
}

// ── overlay-generic ───────────────────────────────────────────────────────────

/** Any bottom sheet with a "Close sheet" affordance, including the rose upsell. */
@ClassifiesScreen(id = "overlay-generic", screen = ScreenType.OVERLAY_GENERIC, priority = 20)
class GenericOverlayMatcher implements ScreenMatcher {

    private static final Logger log = LoggerFactory.getLogger(GenericOverlayMatcher.class);

    @Override
    public ScreenMatch match(ScreenSignals signals) {
        try {
            Optional<String> hit = signals.hasExact("close sheet")
                ? Optional.of("close sheet")
                : signals.findContaining("catch their eye by sending a rose");
            return hit
                .map(h -> ScreenMatch.matched("overlay-generic", ScreenType.OVERLAY_GENERIC, h))
                .orElseGet(() -> ScreenMatch.noMatch("overlay-generic"));
        } catch (Exception e) {
            log.warn("GenericOverlayMatcher: evaluation failed, treated as no match: {}", e.toString());
            return ScreenMatch.noMatch("overlay-generic");
        }
    }
}
