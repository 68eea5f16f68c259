package com.swipesentinel.session;

import com.swipesentinel.action.ActionSpaceBuilder;
import com.swipesentinel.audit.ActionLog;
import com.swipesentinel.audit.ActionLogWriter;
import com.swipesentinel.audit.FrameWriter;
import com.swipesentinel.audit.PacketLogger;
import com.swipesentinel.capture.CaptureAdapter;
import com.swipesentinel.capture.TransportException;
import com.swipesentinel.classifier.ScreenClassification;
import com.swipesentinel.classifier.ScreenClassifier;
import com.swipesentinel.core.Sleeper;
import com.swipesentinel.decision.DecisionEngine;
import com.swipesentinel.decision.DecisionOutcome;
import com.swipesentinel.decision.DeterministicPolicy;
import com.swipesentinel.decision.Directive;
import com.swipesentinel.decision.PolicyProfile;
import com.swipesentinel.executor.ActionExecutor;
import com.swipesentinel.executor.ActionHandlerRegistry;
import com.swipesentinel.executor.ActionResult;
import com.swipesentinel.extract.ContentExtractor;
import com.swipesentinel.extract.ContentFingerprint;
import com.swipesentinel.extract.TargetExtractor;
import com.swipesentinel.model.ActionPlan;
import com.swipesentinel.model.ExtractedContent;
import com.swipesentinel.model.InteractionTarget;
import com.swipesentinel.model.Observation;
import com.swipesentinel.model.Packet;
import com.swipesentinel.model.PacketContext;
import com.swipesentinel.model.RunCounters;
import com.swipesentinel.model.ScreenType;
import com.swipesentinel.model.TerminationReason;
import com.swipesentinel.model.ValidationOutcome;
import com.swipesentinel.validation.PostActionValidator;
import com.swipesentinel.validation.ValidationConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * One live run against the device: observe, classify, extract, build the action
 * space, decide, execute, validate, log; repeat until a stop condition.
 *
 * ## Stop conditions (checked in this order before every cycle)
 *   1. stop requested                    -> completed
 *   2. cycle budget or runtime exhausted -> aborted_budget
 * and during a cycle:
 *   - observation fails after foreground recovery -> aborted_transport
 *   - decision ERROR                               -> error
 *   - validation streak reached its threshold      -> aborted_validation
 *
 * The loop state (counters, last action, forced-action flag) belongs to this
 * instance and is only touched by the thread running {@link #run()}. The
 * decision engine must have been built from the same profile passed here.
 */
public class LiveSession {

    private static final Logger log = LoggerFactory.getLogger(LiveSession.class);

    private final SessionConfig      config;
    private final ValidationConfig   validationConfig;
    private final DecisionEngine     engine;
    private final PolicyProfile      profile;
    private final Directive          directive;
    private final CaptureAdapter     adapter;
    private final Sleeper            sleeper;
    private final Clock              clock;

    private final ScreenClassifier   classifier       = new ScreenClassifier();
    private final ContentExtractor   contentExtractor = new ContentExtractor();
    private final TargetExtractor    targetExtractor  = new TargetExtractor();
    private final ActionLogWriter    actionLogWriter  = new ActionLogWriter();

    private volatile boolean stopRequested;

    // ── Loop state ────────────────────────────────────────────────────────────
    private RunCounters counters = RunCounters.zero();
    private String      lastAction;
    private boolean     forcedActionConsumed;
    private int         iteration;

    public LiveSession(SessionConfig config, ValidationConfig validationConfig, DecisionEngine engine,
                       PolicyProfile profile, Directive directive, CaptureAdapter adapter) {
        this(config, validationConfig, engine, profile, directive, adapter, Sleeper.SYSTEM, Clock.systemUTC());
    }

    public LiveSession(SessionConfig config, ValidationConfig validationConfig, DecisionEngine engine,
                       PolicyProfile profile, Directive directive, CaptureAdapter adapter,
                       Sleeper sleeper, Clock clock) {
        this.config           = config;
        this.validationConfig = validationConfig;
        this.engine           = engine;
        this.profile          = profile;
        this.directive        = directive != null ? directive : Directive.none();
        this.adapter          = adapter;
        this.sleeper          = sleeper;
        this.clock            = clock;
    }

    public String getName() { return config.getSessionName(); }

    /** Asks the loop to stop before its next cycle. The cycle in flight finishes. */
    public void requestStop() {
        stopRequested = true;
        log.info("LiveSession: [{}] stop requested", getName());
    }

    public boolean isStopRequested() { return stopRequested; }

    // ── Primary API ───────────────────────────────────────────────────────────

    public SessionResult run() {
        boolean dryRun     = directive.dryRun() != null ? directive.dryRun() : config.isDryRun();
        int     maxActions = directive.maxActions() != null ? directive.maxActions() : config.getMaxActions();
        int     maxRuntime = directive.maxRuntimeSeconds() != null
            ? directive.maxRuntimeSeconds() : config.getMaxRuntimeSeconds();

        ActionSpaceBuilder  spaceBuilder = new ActionSpaceBuilder(
            profile.getMessagePolicy().enabled(), directive.allowedActions());
        ActionExecutor      executor     = new ActionExecutor(new ActionHandlerRegistry(), adapter,
            targetExtractor, validationConfig.getSettleMs(), dryRun);
        PostActionValidator validator    = new PostActionValidator(validationConfig, classifier, adapter, sleeper);
        FrameWriter         frames       = new FrameWriter(config.framesDir());

        Instant started = clock.instant();
        List<ActionLog.Entry> entries = new ArrayList<>();
        TerminationReason reason = null;
        String detail = null;

        log.info("LiveSession: [{}] starting - engine={}, dryRun={}, maxActions={}, maxRuntime={}s, goal={}",
            getName(), engine.label(), dryRun, maxActions, maxRuntime, directive.goal());

        try (PacketLogger packets = new PacketLogger(config.packetLogPath())) {
            while (reason == null) {
                if (stopRequested) {
                    reason = TerminationReason.COMPLETED;
                    detail = "stop_requested";
                    break;
                }
                if (iteration >= maxActions) {
                    reason = TerminationReason.ABORTED_BUDGET;
                    detail = "max_actions";
                    break;
                }
                if (Duration.between(started, clock.instant()).getSeconds() >= maxRuntime) {
                    reason = TerminationReason.ABORTED_BUDGET;
                    detail = "max_runtime";
                    break;
                }
                iteration++;

                // ── Observe ──
                Observation obs;
                try {
                    obs = observeWithRecovery();
                } catch (TransportException e) {
                    reason = TerminationReason.ABORTED_TRANSPORT;
                    detail = e.getMessage();
                    break;
                }
                FrameWriter.Frame frame = frames.write(iteration, obs);

                // ── Classify / extract / action space ──
                ScreenClassification classification = classifier.classify(obs);
                ScreenType screenType = classification.screenType();
                ExtractedContent content = contentExtractor.extract(obs, screenType);
                List<InteractionTarget> targets = targetExtractor.extract(obs);
                List<String> available = spaceBuilder.build(screenType, targets);

                PacketContext ctx = PacketContext.builder()
                    .screenType(screenType)
                    .qualityScore(content.qualityScore())
                    .qualityScoreVersion(content.scoreVersion())
                    .qualityFeatures(content.features())
                    .availableActions(available)
                    .observedStrings(obs.rawStrings())
                    .targets(targets)
                    .counters(counters)
                    .lastAction(lastAction)
                    .consecutiveValidationFailures(validator.getConsecutiveFailures())
                    .forcedActionConsumed(forcedActionConsumed)
                    .screenshotPng(obs.screenshotPng())
                    .build();

                // ── Decide ──
                DecisionOutcome outcome = engine.decide(ctx, directive);
                if (outcome.isError()) {
                    packets.append(packet(ctx, classification, frame, null, outcome, null, null));
                    reason = TerminationReason.ERROR;
                    detail = "decision_" + outcome.getErrorKind().wireName() + ": " + outcome.getDetail();
                    break;
                }
                ActionPlan plan = outcome.getPlan();
                if (DeterministicPolicy.FORCED_REASON.equals(plan.reason())) {
                    forcedActionConsumed = true;
                }

                // ── Execute / validate ──
                ActionResult result = executor.execute(plan, screenType, targets);
                ValidationOutcome validation = validator.validate(plan.actionId(), screenType,
                    ContentFingerprint.of(obs), result.getPrimitivesIssued(), dryRun);

                if (!result.isFailed() && !result.isNotFound()) {
                    counters = counters.after(plan.actionId());
                }
                lastAction = plan.actionId();

                packets.append(packet(ctx, classification, frame, plan, outcome, result, validation));
                entries.add(new ActionLog.Entry(iteration, screenType, plan.actionId(), plan.reason(),
                    plan.source(), result.toRecord().outcome(), validation.status()));

                if (validator.isAborted()) {
                    reason = TerminationReason.ABORTED_VALIDATION;
                    detail = "consecutive_validation_failures=" + validator.getConsecutiveFailures();
                    break;
                }
                if (result.isTransportFailure() && !recoverForeground()) {
                    reason = TerminationReason.ABORTED_TRANSPORT;
                    detail = result.getMessage();
                    break;
                }

                if (!pause(config.getLoopSleepMs())) {
                    reason = TerminationReason.COMPLETED;
                    detail = "interrupted";
                }
            }
        } catch (IOException e) {
            log.error("LiveSession: [{}] failed to close packet log: {}", getName(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("LiveSession: [{}] unexpected error in cycle {}: {}", getName(), iteration, e.getMessage(), e);
            reason = TerminationReason.ERROR;
            detail = e.getClass().getSimpleName() + ": " + e.getMessage();
        }

        if (reason == null) {
            reason = TerminationReason.ERROR;
            detail = "loop ended without a termination reason";
        }

        Instant finished = clock.instant();
        ActionLog actionLog = new ActionLog(ActionLog.CONTRACT, getName(), engine.label(), dryRun,
            directive.query(), started, finished, reason, detail, iteration, counters,
            config.packetLogPath().toString(), entries);
        actionLogWriter.write(config.actionLogPath(), actionLog);
        executor.logSummary();

        SessionResult sessionResult = new SessionResult(getName(), reason, detail, iteration, counters,
            Duration.between(started, finished), config.packetLogPath(), config.actionLogPath());
        log.info("LiveSession: [{}] finished - {} ({}), iterations={}, counters={}",
            getName(), reason.wireName(), detail, iteration, counters);
        return sessionResult;
    }

    // ── Transport recovery ────────────────────────────────────────────────────

    /**
     * Observes; on a transport error, or when another app holds the foreground,
     * tries to bring the target app back up to the configured number of times.
     */
    private Observation observeWithRecovery() throws TransportException {
        TransportException last;
        try {
            Observation obs = adapter.observe();
            if (isForeground(obs)) return obs;
            last = new TransportException("foreground package is " + obs.packageName()
                + ", expected " + config.getTargetPackage());
        } catch (TransportException e) {
            last = e;
        }

        for (int attempt = 1; attempt <= config.getRecoveryMaxAttempts(); attempt++) {
            log.warn("LiveSession: [{}] recovery attempt {}/{} after: {}",
                getName(), attempt, config.getRecoveryMaxAttempts(), last.getMessage());
            if (!pause(config.getRecoveryCooldownMs())) break;
            try {
                adapter.ensureForeground(config.getTargetPackage());
                Observation obs = adapter.observe();
                if (isForeground(obs)) return obs;
                last = new TransportException("foreground package is " + obs.packageName()
                    + ", expected " + config.getTargetPackage());
            } catch (TransportException e) {
                last = e;
            }
        }
        log.error("LiveSession: [{}] transport recovery exhausted: {}", getName(), last.getMessage());
        throw last;
    }

    private boolean recoverForeground() {
        for (int attempt = 1; attempt <= config.getRecoveryMaxAttempts(); attempt++) {
            if (!pause(config.getRecoveryCooldownMs())) return false;
            try {
                if (adapter.ensureForeground(config.getTargetPackage())) return true;
            } catch (TransportException e) {
                log.warn("LiveSession: [{}] foreground recovery attempt {} failed: {}",
                    getName(), attempt, e.getMessage());
            }
        }
        return false;
    }

    private boolean isForeground(Observation obs) {
        return obs.packageName() == null || obs.packageName().equals(config.getTargetPackage());
    }

    // ── Private helpers ───────────────────────────────────────────────────────

    private Packet packet(PacketContext ctx, ScreenClassification classification, FrameWriter.Frame frame,
                          ActionPlan plan, DecisionOutcome outcome, ActionResult result,
                          ValidationOutcome validation) {
        return new Packet(
            clock.instant(),
            getName(),
            iteration,
            ctx.getScreenType(),
            classification.matcherId(),
            ctx.getQualityScore(),
            ctx.getQualityScoreVersion(),
            ctx.getQualityFeatures(),
            ctx.getAvailableActions(),
            ctx.getObservedStrings(),
            ctx.getCounters(),
            ctx.getLastAction(),
            ctx.getConsecutiveValidationFailures(),
            ctx.isForcedActionConsumed(),
            directive.query(),
            plan,
            outcome.getLlmTrace(),
            result != null ? result.toRecord() : null,
            validation,
            frame.screenshotRef(),
            frame.xmlRef());
    }

    private boolean pause(long millis) {
        if (millis <= 0) return true;
        try {
            sleeper.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            stopRequested = true;
            return false;
        }
    }
}
