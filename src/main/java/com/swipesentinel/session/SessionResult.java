package com.swipesentinel.session;

import com.swipesentinel.model.RunCounters;
import com.swipesentinel.model.TerminationReason;

import java.nio.file.Path;
import java.time.Duration;

/**
 * How a {@link LiveSession} ended.
 *
 * @param detail short machine-readable cause, e.g. {@code max_actions} or the decision error kind
 */
public record SessionResult(
        String sessionName,
        TerminationReason terminationReason,
        String detail,
        int iterations,
        RunCounters counters,
        Duration elapsed,
        Path packetLog,
        Path actionLog) {

    public boolean isCompleted() {
        return terminationReason == TerminationReason.COMPLETED;
    }
}
