package com.swipesentinel.classifier.matchers;

import com.swipesentinel.classifier.ClassifiesScreen;
import com.swipesentinel.classifier.ScreenMatch;
import com.swipesentinel.classifier.ScreenMatcher;
import com.swipesentinel.classifier.ScreenSignals;
import com.swipesentinel.model.ScreenType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Recognises a profile card on the Discover feed.
 *
 * Matches when both a like affordance and a pass affordance are labelled, or when
 * the like-with-comment composer is open (the pass button is hidden behind it).
 *
 * Runs after the overlay and empty-state rules: a paywall sheet on top of a card
 * still exposes the card's like labels.
 */
@ClassifiesScreen(id = "discover-card", screen = ScreenType.DISCOVER_CARD, priority = 40)
public class DiscoverCardMatcher implements ScreenMatcher {

    private static final Logger log = LoggerFactory.getLogger(DiscoverCardMatcher.class);

    private static final String ID = "discover-card";

    private static final List<String> COMPOSER_SIGNALS = List.of(
        "edit comment", "add a comment", "send like with message");

    @Override
    public ScreenMatch match(ScreenSignals signals) {
        try {
            Optional<String> like = signals.findStartingWith("like ")
                .or(() -> signals.findContaining("send like with message"));
            Optional<String> pass = signals.hasExact("skip")
                ? Optional.of("skip")
                : signals.findStartingWith("skip ")
                    .or(() -> signals.findContaining("undo the previous pass rating"));

            if (like.isPresent() && pass.isPresent()) {
                return ScreenMatch.matched(ID, ScreenType.DISCOVER_CARD, like.get() + " | " + pass.get());
            }
            for (String signal : COMPOSER_SIGNALS) {
                Optional<String> hit = signals.findContaining(signal);
                if (hit.isPresent()) {
                    return ScreenMatch.matched(ID, ScreenType.DISCOVER_CARD, hit.get());
                }
            }
            return ScreenMatch.noMatch(ID);
        } catch (Exception e) {
            log.warn("DiscoverCardMatcher: evaluation failed, treated as no match: {}", e.toString());
            return ScreenMatch.noMatch(ID);
        }
    }
}
