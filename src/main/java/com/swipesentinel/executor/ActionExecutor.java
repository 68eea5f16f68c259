package com.swipesentinel.executor;

import com.swipesentinel.action.ActionCatalog;
import com.swipesentinel.action.ActionCatalogEntry;
import com.swipesentinel.capture.CaptureAdapter;
import com.swipesentinel.extract.TargetExtractor;
import com.swipesentinel.model.ActionPlan;
import com.swipesentinel.model.InteractionTarget;
import com.swipesentinel.model.ScreenType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Turns an {@link ActionPlan} into device primitives through the registered handler.
 *
 * ## Execution model
 *
 *   1. Dry run: no handler runs and no primitive is issued. The result is
 *      SKIPPED with a "DryRun:" message naming the human action.
 *   2. A planned {@code target_id} that is not in the current observation fails
 *      the action with {@code target_not_found}. No other target is substituted.
 *   3. Otherwise the handler for the action id runs; a handler exception is
 *      caught and reported as FAILED.
 *
 * Keeps run totals for {@link #logSummary()}.
 */
public class ActionExecutor {

    private static final Logger log = LoggerFactory.getLogger(ActionExecutor.class);

    private final ActionHandlerRegistry registry;
    private final CaptureAdapter        adapter;
    private final TargetExtractor       targetExtractor;
    private final long                  settleMs;
    private final boolean               dryRun;

    private int executed;
    private int skipped;
    private int failed;
    private int notFound;

    public ActionExecutor(ActionHandlerRegistry registry, CaptureAdapter adapter,
                          TargetExtractor targetExtractor, long settleMs, boolean dryRun) {
        this.registry        = registry;
        this.adapter         = adapter;
        this.targetExtractor = targetExtractor;
        this.settleMs        = settleMs;
        this.dryRun          = dryRun;
    }

    // ── Primary API ───────────────────────────────────────────────────────────

    public ActionResult execute(ActionPlan plan, ScreenType screenType, List<InteractionTarget> targets) {
        ActionResult result = dispatch(plan, screenType, targets);
        count(result);
        log.info("ActionExecutor: {} '{}' - {}", result.getOutcome(), plan.actionId(), result.getMessage());
        return result;
    }

    public boolean isDryRun() {
        return dryRun;
    }

    /** Logs run totals at INFO. */
    public void logSummary() {
        log.info("ActionExecutor: Complete - executed={}, skipped={}, failed={}, notFound={}",
            executed, skipped, failed, notFound);
    }

    // ── Private helpers ───────────────────────────────────────────────────────

    private ActionResult dispatch(ActionPlan plan, ScreenType screenType, List<InteractionTarget> targets) {
        if (dryRun) {
            String human = ActionCatalog.find(plan.actionId())
                .map(ActionCatalogEntry::getHumanAction)
                .orElse(plan.actionId());
            String target = plan.targetId() != null ? " (" + plan.targetId() + ")" : "";
            return ActionResult.skipped("DryRun: " + human + target);
        }

        if (plan.targetId() != null
                && targets.stream().noneMatch(t -> t.targetId().equals(plan.targetId()))) {
            return ActionResult.failed("target_not_found: " + plan.targetId(), 0);
        }

        return registry.find(plan.actionId())
            .map(handler -> {
                ActionContext ctx = new ActionContext(plan, screenType, targets, adapter, targetExtractor, settleMs);
                try {
                    return handler.execute(ctx);
                } catch (RuntimeException e) {
                    log.error("ActionExecutor: handler for '{}' threw: {}", plan.actionId(), e.getMessage(), e);
                    return ActionResult.failed("Handler threw: " + e.getMessage(), e);
                }
            })
            .orElseGet(() -> ActionResult.notFound(plan.actionId()));
    }

    private void count(ActionResult r) {
        switch (r.getOutcome()) {
            case EXECUTED  -> executed++;
            case SKIPPED   -> skipped++;
            case FAILED    -> failed++;
            case NOT_FOUND -> notFound++;
        }
    }
}
