package com.swipesentinel.regression;

import com.swipesentinel.core.ConfigException;
import com.swipesentinel.decision.DecisionCheck;
import com.swipesentinel.decision.DecisionEngine;
import com.swipesentinel.decision.DecisionEngineConfig;
import com.swipesentinel.decision.DecisionOutcome;
import com.swipesentinel.decision.DecisionOutputValidator;
import com.swipesentinel.decision.Directive;
import com.swipesentinel.decision.DirectiveParser;
import com.swipesentinel.decision.PolicyProfile;
import com.swipesentinel.judge.JudgeVerdict;
import com.swipesentinel.judge.ModelJudge;
import com.swipesentinel.model.ActionPlan;
import com.swipesentinel.model.PacketContext;
import com.swipesentinel.prompt.PromptEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Replays a dataset through the Decision Engine, exactly as the live loop would
 * decide, and checks every answer.
 *
 * Per case:
 *   1. parse the case's instruction and apply it to the profile
 *   2. decide on the stored packet
 *   3. check the action against the expected set, the message constraints and the output validator
 *   4. optionally ask the judge (cached, budgeted); a not-ok verdict or a score
 *      under pass_score fails the case
 *   5. with a baseline, compare against the entry of the same case id
 *
 * Cases run sequentially; the judge cache is the only state shared between them.
 */
public class RegressionRunner {

    private static final Logger log = LoggerFactory.getLogger(RegressionRunner.class);

    /** Builds the engine for a case's effective profile. */
    @FunctionalInterface
    public interface EngineFactory {
        DecisionEngine create(PolicyProfile profile);
    }

    private final DecisionEngineConfig    engineConfig;
    private final EngineFactory           engineFactory;
    private final PolicyProfile           profile;
    private final ModelJudge              judge;        // null when the judge is disabled
    private final RegressionConfig        config;
    private final DirectiveParser         directiveParser = new DirectiveParser();
    private final DecisionOutputValidator validator       = new DecisionOutputValidator();
    private final PromptEngine            promptEngine    = new PromptEngine();
    private final DriftDetector           driftDetector;

    public RegressionRunner(DecisionEngineConfig engineConfig, EngineFactory engineFactory, PolicyProfile profile,
                            ModelJudge judge, RegressionConfig config) {
        this.engineConfig  = engineConfig;
        this.engineFactory = engineFactory;
        this.profile       = profile;
        this.judge         = judge;
        this.config        = config;
        this.driftDetector = new DriftDetector(config.getMessageTolerance(), config.getMaxJudgeScoreDelta());
    }

    // ── Primary API ───────────────────────────────────────────────────────────

    /**
     * @param baseline decisions to compare against, or null for no drift detection
     * @throws ConfigException when the baseline was recorded for another model or temperature
     */
    public RunOutcomeReport run(List<RegressionCase> cases, Baseline baseline) {
        if (baseline != null) requireCompatible(baseline);

        Instant started = Instant.now();
        List<CaseResult> results = new ArrayList<>();
        List<DriftReport> drift = new ArrayList<>();
        List<String> baselineMissing = new ArrayList<>();
        int scored = 0, cached = 0, skipped = 0, judgeErrors = 0;

        int limit = config.getMaxCases() > 0 ? Math.min(config.getMaxCases(), cases.size()) : cases.size();
        for (RegressionCase c : cases.subList(0, limit)) {
            CaseResult result = runCase(c);
            results.add(result);

            if (result.judge() != null) {
                switch (result.judge().status()) {
                    case SCORED  -> scored++;
                    case CACHED  -> cached++;
                    case SKIPPED -> skipped++;
                    case ERROR   -> judgeErrors++;
                }
            }

            if (baseline != null) {
                Optional<BaselineEntry> entry = baseline.find(c.caseId());
                if (entry.isEmpty()) {
                    baselineMissing.add(c.caseId());
                } else {
                    detectDrift(entry.get(), result).ifPresent(drift::add);
                }
            }
            log.info("RegressionRunner: {} -> {} ({}){}", c.caseId(), result.actionId(), result.status().wireName(),
                result.failures().isEmpty() ? "" : " " + result.failures());
        }

        int passed  = (int) results.stream().filter(CaseResult::isPassed).count();
        int errored = (int) results.stream().filter(r -> r.status() == CaseResult.Status.ERROR).count();
        int failed  = results.size() - passed - errored;

        RunOutcomeReport.JudgeSummary judgeSummary = judge == null ? null
            : new RunOutcomeReport.JudgeSummary(scored, cached, skipped, judgeErrors,
                judge.getInvocations(), judge.getConfig().getMaxInvocations());

        int exit;
        if (skipped > 0 && passed == 0) {
            exit = RunOutcomeReport.EXIT_HARD;
        } else if (failed + errored > 0 || (config.isFailOnDrift() && !drift.isEmpty())) {
            exit = RunOutcomeReport.EXIT_FAILURES;
        } else {
            exit = RunOutcomeReport.EXIT_OK;
        }

        RunOutcomeReport report = new RunOutcomeReport(RunOutcomeReport.CONTRACT, engineConfig.label(),
            engineConfig.modelId(), baselineTemperature(), started, Instant.now(),
            results.size(), passed, failed, errored, judgeSummary, baselineMissing, drift, results, exit);
        logSummary(report);
        return report;
    }

    /** A fresh baseline holding the decisions of {@code report}, in case order. */
    public Baseline toBaseline(RunOutcomeReport report) {
        List<BaselineEntry> entries = new ArrayList<>();
        for (CaseResult r : report.cases()) {
            if (r.actionId() == null) continue;
            Integer judgeScore = r.judge() != null ? r.judge().overallScore() : null;
            entries.add(new BaselineEntry(r.caseId(), r.actionId(), r.messageText(), judgeScore));
        }
        return new Baseline(Baseline.CONTRACT, engineConfig.label(), engineConfig.modelId(),
            baselineTemperature(), Instant.now(), entries);
    }

    // ── Per case ──────────────────────────────────────────────────────────────

    CaseResult runCase(RegressionCase c) {
        Directive directive = directiveParser.parse(c.nlQuery());
        PolicyProfile caseProfile = profile.withDirective(directive);
        PacketContext ctx = c.packet().toContext();

        DecisionOutcome outcome = engineFactory.create(caseProfile).decide(ctx, directive);
        if (outcome.isError()) {
            return new CaseResult(c.caseId(), CaseResult.Status.ERROR, null, null, null, null,
                List.of("decision_error:" + outcome.getErrorKind().wireName() + ":" + outcome.getDetail()),
                outcome.getLlmTrace(), null);
        }

        ActionPlan plan = outcome.getPlan();
        List<String> failures = new ArrayList<>();
        if (!c.expectedActionSet().contains(plan.actionId())) {
            failures.add("unexpected_action:" + plan.actionId() + " expected_any=" + c.expectedActionSet());
        }
        if (c.expectedMessageConstraints() != null) {
            failures.addAll(c.expectedMessageConstraints().check(plan, ctx.getQualityFeatures().profileNameCandidate()));
        }
        DecisionCheck check = validator.validate(plan.actionId(), plan.reason(), plan.messageText(),
            plan.targetId(), ctx, caseProfile.getPersonaSpec());
        for (String issue : check.issues()) failures.add("validation:" + issue);

        JudgeVerdict verdict = null;
        if (judge != null) {
            verdict = judge.score(promptEngine.packetJson(ctx, engineConfig.getMaxObservedStrings()),
                caseProfile, c.nlQuery(), plan);
            switch (verdict.status()) {
                case SKIPPED -> failures.add("judge_skipped");
                case ERROR   -> failures.add("judge_error:" + verdict.detail());
                default      -> {
                    if (!verdict.score().ok()) {
                        failures.add("judge_not_ok" + (verdict.score().violations().isEmpty()
                            ? "" : ":" + String.join(",", verdict.score().violations())));
                    }
                    int passScore = judge.getConfig().getPassScore();
                    if (verdict.overallScore() < passScore) {
                        failures.add("judge_score_below:" + verdict.overallScore() + "<" + passScore);
                    }
                }
            }
        }

        CaseResult.Status status = failures.isEmpty() ? CaseResult.Status.PASSED : CaseResult.Status.FAILED;
        return new CaseResult(c.caseId(), status, plan.actionId(), plan.messageText(), plan.reason(),
            plan.source(), failures, outcome.getLlmTrace(), verdict);
    }

    // ── Private helpers ───────────────────────────────────────────────────────

    private Optional<DriftReport> detectDrift(BaselineEntry entry, CaseResult result) {
        if (result.actionId() == null) {
            return Optional.of(new DriftReport(entry.caseId(), entry.actionId(), null, true, null));
        }
        ActionPlan observed = new ActionPlan(result.actionId(), null, result.messageText(), result.reason(),
            result.source(), null);
        Integer judgeScore = result.judge() != null ? result.judge().overallScore() : null;
        return driftDetector.compare(entry, observed, judgeScore);
    }

    private void requireCompatible(Baseline baseline) {
        if (!Objects.equals(baseline.modelId(), engineConfig.modelId())) {
            throw new ConfigException("Baseline was recorded for model '" + baseline.modelId()
                + "' but the engine is '" + engineConfig.modelId() + "'");
        }
        if (!Objects.equals(baseline.temperature(), baselineTemperature())) {
            throw new ConfigException("Baseline was recorded at temperature " + baseline.temperature()
                + " but the engine runs at " + baselineTemperature());
        }
    }

    /** Temperature as recorded in baselines; null for the rule engine. */
    private Double baselineTemperature() {
        return engineConfig.isLlm() ? engineConfig.getTemperature() : null;
    }

    private void logSummary(RunOutcomeReport r) {
        log.info("RegressionRunner: Complete - engine={}, cases={}, passed={}, failed={}, errored={}, drift={}, baselineMissing={}, exit={}",
            r.engineLabel(), r.total(), r.passed(), r.failed(), r.errored(), r.drift().size(),
            r.baselineMissing().size(), r.exitStatus());
    }
}
