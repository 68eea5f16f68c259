package com.swipesentinel.decision;

import com.swipesentinel.api.ModelErrorKind;
import com.swipesentinel.model.ActionPlan;
import com.swipesentinel.model.LlmTrace;

/**
 * Tagged result of one decision.
 *
 *   OK       - the configured engine produced an accepted plan
 *   FALLBACK - the model failed and the deterministic rules produced the plan
 *   ERROR    - no plan; the cycle or case is reported as failed
 *
 * Callers branch on {@link #getKind()}. Immutable - use the static factories.
 */
public final class DecisionOutcome {

    public enum Kind { OK, FALLBACK, ERROR }

    private final Kind           kind;
    private final ActionPlan     plan;        // null only for ERROR
    private final ModelErrorKind errorKind;   // set for ERROR and FALLBACK
    private final String         detail;
    private final LlmTrace       llmTrace;    // null for purely deterministic decisions
    private final DecisionCheck  check;       // null when no output validation ran

    private DecisionOutcome(Kind kind, ActionPlan plan, ModelErrorKind errorKind, String detail,
                            LlmTrace llmTrace, DecisionCheck check) {
        this.kind      = kind;
        this.plan      = plan;
        this.errorKind = errorKind;
        this.detail    = detail;
        this.llmTrace  = llmTrace;
        this.check     = check;
    }

    // ── Static factories ──────────────────────────────────────────────────────

    public static DecisionOutcome ok(ActionPlan plan) {
        return new DecisionOutcome(Kind.OK, plan, null, null, null, null);
    }

    public static DecisionOutcome ok(ActionPlan plan, LlmTrace trace, DecisionCheck check) {
        return new DecisionOutcome(Kind.OK, plan, null, null, trace, check);
    }

    /**
     * @param plan a deterministic plan; re-labelled here as {@code llm_fallback}
     */
    public static DecisionOutcome fallback(ActionPlan plan, ModelErrorKind kind, String detail, LlmTrace trace) {
        String reason = fallbackReason(kind, detail);
        return new DecisionOutcome(Kind.FALLBACK, plan.asFallback(reason), kind, detail, trace, null);
    }

    public static DecisionOutcome error(ModelErrorKind kind, String detail, LlmTrace trace) {
        return new DecisionOutcome(Kind.ERROR, null, kind, detail, trace, null);
    }

    public static DecisionOutcome error(ModelErrorKind kind, String detail, LlmTrace trace, DecisionCheck check) {
        return new DecisionOutcome(Kind.ERROR, null, kind, detail, trace, check);
    }

    static String fallbackReason(ModelErrorKind kind, String detail) {
        return "llm_failed_fallback:" + kind.wireName() + ":" + (detail != null ? detail : "");
    }

    // ── Getters ───────────────────────────────────────────────────────────────

    public Kind           getKind()      { return kind; }
    public ActionPlan     getPlan()      { return plan; }
    public ModelErrorKind getErrorKind() { return errorKind; }
    public String         getDetail()    { return detail; }
    public LlmTrace       getLlmTrace()  { return llmTrace; }
    public DecisionCheck  getCheck()     { return check; }

    public boolean isOk()       { return kind == Kind.OK; }
    public boolean isFallback() { return kind == Kind.FALLBACK; }
    public boolean isError()    { return kind == Kind.ERROR; }
    public boolean hasPlan()    { return plan != null; }

    @Override
    public String toString() {
        return isError()
            ? String.format("DecisionOutcome{ERROR, kind=%s, detail='%s'}", errorKind, detail)
            : String.format("DecisionOutcome{%s, action=%s, reason='%s'}", kind, plan.actionId(), plan.reason());
    }
}
