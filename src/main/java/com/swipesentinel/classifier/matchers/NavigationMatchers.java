package com.swipesentinel.classifier.matchers;

import com.swipesentinel.classifier.ClassifiesScreen;
import com.swipesentinel.classifier.ScreenMatch;
import com.swipesentinel.classifier.ScreenMatcher;
import com.swipesentinel.classifier.ScreenSignals;
import com.swipesentinel.model.ScreenType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

// ── matches-empty ─────────────────────────────────────────────────────────────

@ClassifiesScreen(id = "matches-empty", screen = ScreenType.MATCHES_EMPTY, priority = 30)
class MatchesEmptyMatcher implements ScreenMatcher {

    private static final Logger log = LoggerFactory.getLogger(MatchesEmptyMatcher.class);

    @Override
    public ScreenMatch match(ScreenSignals signals) {
        try {
            return signals.findContaining("no matches yet")
                .or(() -> signals.findContaining("when a like is mutual"))
                .map(hit -> ScreenMatch.matched("matches-empty", ScreenType.MATCHES_EMPTY, hit))
                .orElseGet(() -> ScreenMatch.noMatch("matches-empty"));
        } catch (Exception e) {
            log.warn("MatchesEmptyMatcher: evaluation failed, treated as no match: {}", e.toString());
            return ScreenMatch.noMatch("matches-empty");
        }
    }
}

// ── chat-thread ───────────────────────────────────────────────────────────────

/** An open conversation: message composer label, bare "Send" button, or the input's view id. */
@ClassifiesScreen(id = "chat-thread", screen = ScreenType.CHAT_THREAD, priority = 50)
class ChatThreadMatcher implements ScreenMatcher {

    private static final Logger log = LoggerFactory.getLogger(ChatThreadMatcher.class);

    @Override
    public ScreenMatch match(ScreenSignals signals) {
        try {
            Optional<String> hit = signals.findContaining("type a message");
            if (hit.isEmpty() && signals.hasExact("send")) hit = Optional.of("send");
            if (hit.isEmpty()) hit = signals.findResourceIdEndingWith(":id/message_input");
            return hit
                .map(h -> ScreenMatch.matched("chat-thread", ScreenType.CHAT_THREAD, h))
                .orElseGet(() -> ScreenMatch.noMatch("chat-thread"));
        } catch (Exception e) {
            log.warn("ChatThreadMatcher: evaluation failed, treated as no match: {}", e.toString());
            return ScreenMatch.noMatch("chat-thread");
        }
    }
}

// ── matches-list ──────────────────────────────────────────────────────────────

/** The Matches tab with at least one conversation row. */
@ClassifiesScreen(id = "matches-list", screen = ScreenType.MATCHES_LIST, priority = 60)
class MatchesListMatcher implements ScreenMatcher {

    private static final Logger log = LoggerFactory.getLogger(MatchesListMatcher.class);

    @Override
    public ScreenMatch match(ScreenSignals signals) {
        try {
            if (!signals.hasExact("matches")) return ScreenMatch.noMatch("matches-list");
            return signals.findContaining("your turn")
                .or(() -> signals.findContaining("their turn"))
                .or(() -> signals.findResourceIdContaining(":id/match_row"))
                .map(hit -> ScreenMatch.matched("matches-list", ScreenType.MATCHES_LIST, hit))
                .orElseGet(() -> ScreenMatch.noMatch("matches-list"));
        } catch (Exception e) {
            log.warn("MatchesListMatcher: evaluation failed, treated as no match: {}", e.toString());
            return ScreenMatch.noMatch("matches-list");
        }
    }
}

// ── tab-shell ─────────────────────────────────────────────────────────────────

/** Bottom navigation is visible but nothing more specific was recognised. */
@ClassifiesScreen(id = "tab-shell", screen = ScreenType.TAB_SHELL, priority = 70)
class TabShellMatcher implements ScreenMatcher {

    private static final Logger log = LoggerFactory.getLogger(TabShellMatcher.class);

    @Override
    public ScreenMatch match(ScreenSignals signals) {
        try {
            if (signals.hasExact("matches") && signals.hasExact("discover")) {
                return ScreenMatch.matched("tab-shell", ScreenType.TAB_SHELL, "matches | discover");
            }
            return ScreenMatch.noMatch("tab-shell");
        } catch (Exception e) {
            log.warn("TabShellMatcher: evaluation failed, treated as no match: {}", e.toString());
            return ScreenMatch.noMatch("tab-shell");
        }
    }
}
