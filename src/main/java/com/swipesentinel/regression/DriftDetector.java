package com.swipesentinel.regression;

import com.swipesentinel.model.ActionPlan;

import java.util.Objects;
import java.util.Optional;

/**
 * Compares one observed decision with its baseline entry.
 *
 * An action change is always drift. Message text is compared according to the
 * {@link MessageTolerance}; under JUDGE, a missing score on either side counts
 * as drift so an unscored message is never silently accepted.
 */
public class DriftDetector {

    private final MessageTolerance tolerance;
    private final int              maxJudgeScoreDelta;

    public DriftDetector(MessageTolerance tolerance, int maxJudgeScoreDelta) {
        this.tolerance          = tolerance;
        this.maxJudgeScoreDelta = maxJudgeScoreDelta;
    }

    public Optional<DriftReport> compare(BaselineEntry baseline, ActionPlan observed, Integer observedJudgeScore) {
        boolean actionChanged = !baseline.actionId().equals(observed.actionId());
        DriftReport.MessageDelta delta = actionChanged ? null : messageDelta(baseline, observed, observedJudgeScore);

        if (!actionChanged && delta == null) return Optional.empty();
        if (actionChanged && !Objects.equals(baseline.messageText(), observed.messageText())) {
            delta = new DriftReport.MessageDelta(baseline.messageText(), observed.messageText(),
                baseline.judgeScore(), observedJudgeScore);
        }
        return Optional.of(new DriftReport(baseline.caseId(), baseline.actionId(), observed.actionId(),
            actionChanged, delta));
    }

    private DriftReport.MessageDelta messageDelta(BaselineEntry baseline, ActionPlan observed, Integer observedScore) {
        String before = baseline.messageText();
        String after  = observed.messageText();
        boolean drifted = switch (tolerance) {
            case IGNORE -> false;
            case EXACT  -> !Objects.equals(before, after);
            case JUDGE  -> {
                if (Objects.equals(before, after)) yield false;
                if (baseline.judgeScore() == null || observedScore == null) yield true;
                yield Math.abs(baseline.judgeScore() - observedScore) > maxJudgeScoreDelta;
            }
        };
        return drifted ? new DriftReport.MessageDelta(before, after, baseline.judgeScore(), observedScore) : null;
    }
}
