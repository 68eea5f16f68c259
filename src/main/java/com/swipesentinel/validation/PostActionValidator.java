package com.swipesentinel.validation;

import com.swipesentinel.capture.CaptureAdapter;
import com.swipesentinel.capture.TransportException;
import com.swipesentinel.classifier.ScreenClassifier;
import com.swipesentinel.core.Sleeper;
import com.swipesentinel.extract.ContentFingerprint;
import com.swipesentinel.model.Observation;
import com.swipesentinel.model.ScreenType;
import com.swipesentinel.model.ValidationOutcome;
import com.swipesentinel.model.ValidationStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks that an executed action moved the app to a different state.
 *
 * <pre>
 *   IDLE -> ISSUED -> AWAITING_CHECK -> PASSED | FAILED -> IDLE
 *                                                   \
 *                                                    -> ABORTED (streak reached threshold)
 * </pre>
 *
 * A check costs at most one settle sleep and one observation, so it always ends
 * within one settle window plus the transport timeout. The consecutive-failure
 * streak lives for the whole run; any pass resets it. ABORTED is terminal.
 *
 * Not thread-safe: one instance per session.
 */
public class PostActionValidator {

    private static final Logger log = LoggerFactory.getLogger(PostActionValidator.class);

    public enum State { IDLE, ISSUED, AWAITING_CHECK, PASSED, FAILED, ABORTED }

    private final ValidationConfig config;
    private final ScreenClassifier classifier;
    private final CaptureAdapter   adapter;
    private final Sleeper          sleeper;

    private State state = State.IDLE;
    private int   consecutiveFailures;

    public PostActionValidator(ValidationConfig config, ScreenClassifier classifier, CaptureAdapter adapter) {
        this(config, classifier, adapter, Sleeper.SYSTEM);
    }

    public PostActionValidator(ValidationConfig config, ScreenClassifier classifier,
                               CaptureAdapter adapter, Sleeper sleeper) {
        this.config     = config;
        this.classifier = classifier;
        this.adapter    = adapter;
        this.sleeper    = sleeper;
    }

    // ── Primary API ───────────────────────────────────────────────────────────

    /**
     * Validates one executed action.
     *
     * @param actionId         the action that was executed
     * @param preScreenType    screen type of the observation the action was decided on
     * @param preFingerprint   {@link ContentFingerprint} of that observation
     * @param primitivesIssued how many primitives reached the device; zero means nothing to check
     * @param dryRun           whether the run is a dry run
     */
    public ValidationOutcome validate(String actionId, ScreenType preScreenType, String preFingerprint,
                                      int primitivesIssued, boolean dryRun) {
        if (state == State.ABORTED) {
            throw new IllegalStateException("PostActionValidator: already aborted after "
                + consecutiveFailures + " consecutive failures");
        }
        state = State.ISSUED;

        if (!config.isEnabled() || !config.requiresChange(actionId)) {
            return settle(new ValidationOutcome(actionId, preScreenType, null, false, true,
                ValidationStatus.NOT_REQUIRED));
        }
        if (dryRun) {
            return settle(new ValidationOutcome(actionId, preScreenType, null, false, true,
                ValidationStatus.SKIPPED_DRY_RUN));
        }
        if (primitivesIssued == 0) {
            return settle(new ValidationOutcome(actionId, preScreenType, null, false, true,
                ValidationStatus.NOT_REQUIRED));
        }

        state = State.AWAITING_CHECK;
        if (!pause()) {
            return fail(new ValidationOutcome(actionId, preScreenType, null, false, false,
                ValidationStatus.FAILED), "interrupted during settle delay");
        }

        Observation post;
        try {
            post = adapter.observe();
        } catch (TransportException e) {
            return fail(new ValidationOutcome(actionId, preScreenType, null, false, false,
                ValidationStatus.FAILED), "re-observe failed: " + e.getMessage());
        }

        ScreenType postType = classifier.classify(post).screenType();
        boolean changed = postType != preScreenType;
        if (!changed && config.getChangeDetection() == ChangeDetection.SCREEN_TYPE_OR_CONTENT) {
            changed = !ContentFingerprint.of(post).equals(preFingerprint);
        }

        if (changed) {
            consecutiveFailures = 0;
            return settle(new ValidationOutcome(actionId, preScreenType, postType, true, true,
                ValidationStatus.PASSED));
        }
        return fail(new ValidationOutcome(actionId, preScreenType, postType, false, false,
            ValidationStatus.FAILED), "screen unchanged");
    }

    // ── State ─────────────────────────────────────────────────────────────────

    public State   getState()               { return state; }
    public int     getConsecutiveFailures() { return consecutiveFailures; }
    public boolean isAborted()              { return state == State.ABORTED; }

    // ── Private helpers ───────────────────────────────────────────────────────

    private ValidationOutcome settle(ValidationOutcome outcome) {
        state = State.PASSED;
        log.debug("PostActionValidator: {} -> {}", outcome.actionId(), outcome.status().wireName());
        state = State.IDLE;
        return outcome;
    }

    private ValidationOutcome fail(ValidationOutcome outcome, String why) {
        state = State.FAILED;
        consecutiveFailures++;
        log.warn("PostActionValidator: '{}' failed validation ({}), streak {}/{}",
            outcome.actionId(), why, consecutiveFailures, config.getMaxConsecutiveFailures());
        if (consecutiveFailures >= config.getMaxConsecutiveFailures()) {
            state = State.ABORTED;
            log.error("PostActionValidator: ABORTED after {} consecutive failures", consecutiveFailures);
        } else {
            state = State.IDLE;
        }
        return outcome;
    }

    private boolean pause() {
        if (config.getSettleMs() <= 0) return true;
        try {
            sleeper.sleep(config.getSettleMs());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
