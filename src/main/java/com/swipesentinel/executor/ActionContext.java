package com.swipesentinel.executor;

import com.swipesentinel.capture.CaptureAdapter;
import com.swipesentinel.capture.Primitive;
import com.swipesentinel.capture.PrimitiveResult;
import com.swipesentinel.capture.TransportException;
import com.swipesentinel.extract.TargetExtractor;
import com.swipesentinel.model.ActionPlan;
import com.swipesentinel.model.InteractionTarget;
import com.swipesentinel.model.ScreenType;
import com.swipesentinel.model.TargetKind;

import java.util.List;
import java.util.Optional;

/**
 * Passed to every {@link ActionHandler} when it is invoked. One instance per
 * executed plan; not shared between cycles.
 *
 * Carries:
 *   - the plan being executed and the screen it was decided on
 *   - the interaction targets of the current observation
 *   - the capture adapter, reachable only through {@link #issue} and {@link #reobserve}
 *   - a running count of primitives issued and the last transport error
 */
public class ActionContext {

    private final ActionPlan      plan;
    private final ScreenType      screenType;
    private final CaptureAdapter  adapter;
    private final TargetExtractor targetExtractor;
    private final long            settleMs;

    private List<InteractionTarget> targets;
    private boolean                 reobserved;
    private int                     primitivesIssued;
    private String                  lastTransportError;

    public ActionContext(ActionPlan plan, ScreenType screenType, List<InteractionTarget> targets,
                         CaptureAdapter adapter, TargetExtractor targetExtractor, long settleMs) {
        this.plan            = plan;
        this.screenType      = screenType;
        this.targets         = List.copyOf(targets);
        this.adapter         = adapter;
        this.targetExtractor = targetExtractor;
        this.settleMs        = settleMs;
    }

    public ActionPlan              getPlan()             { return plan; }
    public ScreenType              getScreenType()       { return screenType; }
    public List<InteractionTarget> getTargets()          { return targets; }
    public int                     getPrimitivesIssued() { return primitivesIssued; }

    // ── Targets ───────────────────────────────────────────────────────────────

    /**
     * The target to act on for {@code kind}: the planned target when the plan names
     * one of that kind, otherwise the first target of that kind. After
     * {@link #reobserve()} the planned id no longer applies.
     */
    public Optional<InteractionTarget> resolveTarget(TargetKind kind) {
        if (plan.targetId() != null && !reobserved) {
            Optional<InteractionTarget> planned = findById(plan.targetId());
            if (planned.isPresent() && planned.get().kind() == kind) return planned;
        }
        return targets.stream().filter(t -> t.kind() == kind).findFirst();
    }

    public Optional<InteractionTarget> findById(String targetId) {
        return targets.stream().filter(t -> t.targetId().equals(targetId)).findFirst();
    }

    /**
     * Waits the settle delay, captures a fresh observation and replaces the target
     * list with its targets. Used by multi-screen sequences such as discover messaging.
     */
    public void reobserve() throws TransportException {
        sleepSettle();
        this.targets = targetExtractor.extract(adapter.observe());
        this.reobserved = true;
    }

    // ── Primitives ────────────────────────────────────────────────────────────

    /** Issues one primitive; returns false and remembers the error if the transport reports one. */
    public boolean issue(Primitive primitive) {
        primitivesIssued++;
        PrimitiveResult result = adapter.execute(primitive);
        if (!result.ok()) {
            lastTransportError = primitive + ": " + result.detail();
            return false;
        }
        return true;
    }

    public boolean tap(InteractionTarget target) {
        return issue(Primitive.tap(target.tapX(), target.tapY()));
    }

    // ── Result helpers ────────────────────────────────────────────────────────

    public ActionResult executed(String message) {
        return ActionResult.executed(message, primitivesIssued);
    }

    public ActionResult failed(String message) {
        return ActionResult.failed(message, primitivesIssued);
    }

    public ActionResult transportFailed(String step) {
        return ActionResult.transportFailed(step + " failed: " + lastTransportError, primitivesIssued);
    }

    public ActionResult missingTarget(TargetKind kind) {
        return failed("target_missing: no " + kind.wireName() + " on " + screenType.wireName());
    }

    private void sleepSettle() {
        if (settleMs <= 0) return;
        try {
            Thread.sleep(settleMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
