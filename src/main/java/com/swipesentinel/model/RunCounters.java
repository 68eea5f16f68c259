package com.swipesentinel.model;

/**
 * Per-session action counters at the start of a cycle. Immutable snapshot; the
 * session produces a new one after each executed action.
 */
public record RunCounters(int actions, int likes, int passes, int messages) {

    public static RunCounters zero() { return new RunCounters(0, 0, 0, 0); }

    public RunCounters after(String actionId) {
        return switch (actionId) {
            case "like"         -> new RunCounters(actions + 1, likes + 1, passes, messages);
            case "pass"         -> new RunCounters(actions + 1, likes, passes + 1, messages);
            case "send_message" -> new RunCounters(actions + 1, likes, passes, messages + 1);
            default             -> new RunCounters(actions + 1, likes, passes, messages);
        };
    }
}
