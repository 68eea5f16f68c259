package com.swipesentinel.executor;

import com.swipesentinel.model.ExecutionRecord;

/**
 * The result of executing one {@link com.swipesentinel.model.ActionPlan}.
 *
 * Immutable - use the static factories.
 */
public class ActionResult {

    private final ActionOutcome outcome;
    private final String        message;
    private final Throwable     error;            // non-null only for unexpected handler exceptions
    private final int           primitivesIssued;
    private final boolean       transportFailure;

    private ActionResult(ActionOutcome outcome, String message, Throwable error,
                         int primitivesIssued, boolean transportFailure) {
        this.outcome          = outcome;
        this.message          = message;
        this.error            = error;
        this.primitivesIssued = primitivesIssued;
        this.transportFailure = transportFailure;
    }

    // ── Static factories ──────────────────────────────────────────────────────

    public static ActionResult executed(String message, int primitivesIssued) {
        return new ActionResult(ActionOutcome.EXECUTED, message, null, primitivesIssued, false);
    }

    public static ActionResult skipped(String reason) {
        return new ActionResult(ActionOutcome.SKIPPED, reason, null, 0, false);
    }

    public static ActionResult failed(String message, int primitivesIssued) {
        return new ActionResult(ActionOutcome.FAILED, message, null, primitivesIssued, false);
    }

    public static ActionResult failed(String message, Throwable cause) {
        return new ActionResult(ActionOutcome.FAILED, message, cause, 0, false);
    }

    /** A primitive came back with an error from the device transport. */
    public static ActionResult transportFailed(String message, int primitivesIssued) {
        return new ActionResult(ActionOutcome.FAILED, message, null, primitivesIssued, true);
    }

    public static ActionResult notFound(String actionId) {
        return new ActionResult(ActionOutcome.NOT_FOUND,
            "No handler registered for action: " + actionId, null, 0, false);
    }

    // ── Getters ───────────────────────────────────────────────────────────────

    public ActionOutcome getOutcome()          { return outcome; }
    public String        getMessage()          { return message; }
    public Throwable     getError()            { return error; }
    public int           getPrimitivesIssued() { return primitivesIssued; }
    public boolean       isTransportFailure()  { return transportFailure; }

    public boolean isExecuted()  { return outcome == ActionOutcome.EXECUTED; }
    public boolean isSkipped()   { return outcome == ActionOutcome.SKIPPED; }
    public boolean isFailed()    { return outcome == ActionOutcome.FAILED; }
    public boolean isNotFound()  { return outcome == ActionOutcome.NOT_FOUND; }

    /** Packet-log view of this result. */
    public ExecutionRecord toRecord() {
        return new ExecutionRecord(outcome.name().toLowerCase(), message, primitivesIssued, transportFailure);
    }

    @Override
    public String toString() {
        return String.format("ActionResult{outcome=%s, primitives=%d, message='%s'}",
            outcome, primitivesIssued, message);
    }
}
