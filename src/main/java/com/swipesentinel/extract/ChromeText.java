package com.swipesentinel.extract;

import java.util.Locale;
import java.util.Set;

/**
 * App-level UI labels ("chrome") that are never profile or conversation content.
 */
final class ChromeText {

    private static final Set<String> EXACT = Set.of(
        "discover", "matches", "likes you", "standouts", "profile hub", "back", "more",
        "send", "skip", "close", "close sheet", "boost your profile", "upgrade to hingex",
        "send like", "add a comment", "edit comment");

    private static final String[] FRAGMENTS = {
        "type a message", "when a like is mutual", "no matches yet", "like photo",
        "like prompt", "voice prompt", "rose", "send like with message",
        "undo the previous pass rating", "your turn", "their turn"
    };

    private ChromeText() {}

    static boolean isChrome(String text) {
        String lowered = text == null ? "" : text.trim().toLowerCase(Locale.ROOT);
        if (lowered.isEmpty()) return true;
        if (EXACT.contains(lowered)) return true;
        for (String f : FRAGMENTS) {
            if (lowered.contains(f)) return true;
        }
        return lowered.startsWith("like ") || lowered.startsWith("prompt:");
    }
}
