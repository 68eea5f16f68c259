package com.swipesentinel.executor;

/**
 * The result of a single handler's execution attempt.
 *
 *   EXECUTED   - every primitive in the action's sequence was issued successfully
 *   SKIPPED    - nothing was issued (dry run, or wait)
 *   FAILED     - a required target was missing or a primitive returned an error
 *   NOT_FOUND  - no handler was registered for this action id
 */
public enum ActionOutcome {
    EXECUTED,
    SKIPPED,
    FAILED,
    NOT_FOUND
}
