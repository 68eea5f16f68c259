package com.swipesentinel.regression;

import com.swipesentinel.api.ModelErrorKind;
import com.swipesentinel.core.ConfigException;
import com.swipesentinel.decision.DecisionEngine;
import com.swipesentinel.decision.DecisionEngineConfig;
import com.swipesentinel.decision.PolicyProfile;
import com.swipesentinel.judge.JudgeCache;
import com.swipesentinel.judge.JudgeConfig;
import com.swipesentinel.judge.ModelJudge;
import com.swipesentinel.support.FakeModelClient;
import org.testng.annotations.BeforeClass;
import org.testng.annotations.Test;

import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Dataset replay against the rule engine, with and without baseline and judge.
 */
public class RegressionRunnerTest {

    private static final DecisionEngineConfig DETERMINISTIC = DecisionEngineConfig.builder().build();

    private static final String JUDGE_88 = """
        {"ok": true, "overall_score": 88, "action_alignment_score": 90, "message_quality_score": 80,
         "safety_score": 100, "reasons": ["consistent"], "violations": []}
        """;

    private static final String JUDGE_NOT_OK = """
        {"ok": false, "overall_score": 70, "action_alignment_score": 40, "message_quality_score": 80,
         "safety_score": 100, "reasons": ["liked a blocked topic"], "violations": ["ignored_block_keyword"]}
        """;

    private final PolicyProfile profile = PolicyProfile.defaults();
    private List<RegressionCase> cases;

    static Path datasetFixture() {
        try {
            return Path.of(RegressionRunnerTest.class.getResource("/fixtures/regression/swipe_cases.jsonl").toURI());
        } catch (URISyntaxException e) {
            throw new IllegalStateException(e);
        }
    }

    @BeforeClass
    public void loadDataset() {
        cases = new DatasetLoader().load(datasetFixture());
    }

    private RegressionRunner runner(ModelJudge judge, RegressionConfig config) {
        return new RegressionRunner(DETERMINISTIC, p -> DecisionEngine.create(DETERMINISTIC, p),
            profile, judge, config);
    }

    private RegressionRunner runner() {
        return runner(null, RegressionConfig.builder().build());
    }

    private static ModelJudge judge(int maxInvocations, int passScore) {
        return judge(maxInvocations, passScore, JUDGE_88);
    }

    private static ModelJudge judge(int maxInvocations, int passScore, String answer) {
        JudgeConfig config = JudgeConfig.builder()
            .enabled(true).maxInvocations(maxInvocations).passScore(passScore).build();
        return new ModelJudge(FakeModelClient.replying(answer), config, new JudgeCache());
    }

    // ════════════════════════════════════════════════════════════════════════
    // Plain replay
    // ════════════════════════════════════════════════════════════════════════

    @Test
    public void fixtureDataset_allCasesPass() {
        RunOutcomeReport report = runner().run(cases, null);

        assertThat(report.total()).isEqualTo(3);
        assertThat(report.passed()).isEqualTo(3);
        assertThat(report.exitStatus()).isEqualTo(RunOutcomeReport.EXIT_OK);
        assertThat(report.engineLabel()).isEqualTo("deterministic");
        assertThat(report.judge()).isNull();
        assertThat(report.cases()).extracting(CaseResult::actionId).containsExactly("like", "pass", "pass");
    }

    @Test
    public void forcedCase_usesItsOwnInstruction() {
        CaseResult forced = runner().run(cases, null).cases().get(2);

        assertThat(forced.caseId()).isEqualTo("card_forced_pass");
        assertThat(forced.reason()).isEqualTo("natural_language_forced_action");
    }

    @Test
    public void unexpectedAction_failsCaseWithExitOne() {
        RegressionCase low = cases.get(1);
        RegressionCase wrongExpectation = new RegressionCase(low.contractVersion(), low.caseId(), low.nlQuery(),
            low.packet(), List.of("like"), null);

        RunOutcomeReport report = runner().run(List.of(wrongExpectation), null);

        assertThat(report.failed()).isEqualTo(1);
        assertThat(report.exitStatus()).isEqualTo(RunOutcomeReport.EXIT_FAILURES);
        assertThat(report.cases().get(0).failures()).containsExactly("unexpected_action:pass expected_any=[like]");
    }

    @Test
    public void maxCases_limitsReplay() {
        RunOutcomeReport report = runner(null, RegressionConfig.builder().maxCases(1).build()).run(cases, null);

        assertThat(report.total()).isEqualTo(1);
    }

    @Test
    public void decisionError_isErroredCase() {
        DecisionEngineConfig llm = DecisionEngineConfig.builder()
            .engineType(DecisionEngineConfig.EngineType.LLM).apiKey("sk-test").build();
        RegressionRunner runner = new RegressionRunner(llm,
            p -> DecisionEngine.create(llm, p, FakeModelClient.failing(ModelErrorKind.AUTH, "HTTP 401")),
            profile, null, RegressionConfig.builder().build());

        RunOutcomeReport report = runner.run(cases.subList(0, 1), null);

        assertThat(report.errored()).isEqualTo(1);
        assertThat(report.cases().get(0).status()).isEqualTo(CaseResult.Status.ERROR);
        assertThat(report.cases().get(0).failures().get(0)).startsWith("decision_error:auth:");
        assertThat(report.exitStatus()).isEqualTo(RunOutcomeReport.EXIT_FAILURES);
    }

    // ════════════════════════════════════════════════════════════════════════
    // Baseline
    // ════════════════════════════════════════════════════════════════════════

    @Test
    public void ownBaseline_showsNoDrift() {
        RegressionRunner runner = runner();
        Baseline baseline = runner.toBaseline(runner.run(cases, null));

        RunOutcomeReport report = runner.run(cases, baseline);

        assertThat(baseline.modelId()).isEqualTo("deterministic");
        assertThat(baseline.temperature()).isNull();
        assertThat(baseline.entries()).hasSize(3);
        assertThat(report.drift()).isEmpty();
        assertThat(report.baselineMissing()).isEmpty();
    }

    @Test
    public void changedAction_isDrift() {
        Baseline baseline = new Baseline(Baseline.CONTRACT, "deterministic", "deterministic", null, Instant.now(),
            List.of(new BaselineEntry("card_high_score", "pass", null, null)));

        RunOutcomeReport report = runner().run(cases, baseline);

        assertThat(report.drift()).hasSize(1);
        DriftReport drift = report.drift().get(0);
        assertThat(drift.caseId()).isEqualTo("card_high_score");
        assertThat(drift.baselineAction()).isEqualTo("pass");
        assertThat(drift.observedAction()).isEqualTo("like");
        assertThat(drift.actionChanged()).isTrue();
        assertThat(report.baselineMissing()).containsExactly("card_low_score", "card_forced_pass");
        assertThat(report.exitStatus()).isEqualTo(RunOutcomeReport.EXIT_OK);
    }

    @Test
    public void failOnDrift_turnsDriftIntoExitOne() {
        Baseline baseline = new Baseline(Baseline.CONTRACT, "deterministic", "deterministic", null, Instant.now(),
            List.of(new BaselineEntry("card_high_score", "pass", null, null)));

        RunOutcomeReport report = runner(null, RegressionConfig.builder().failOnDrift(true).build())
            .run(cases, baseline);

        assertThat(report.exitStatus()).isEqualTo(RunOutcomeReport.EXIT_FAILURES);
    }

    @Test
    public void baselineForAnotherModel_isRejected() {
        Baseline baseline = new Baseline(Baseline.CONTRACT, "llm:gpt-4o@0.1", "gpt-4o", 0.1, Instant.now(),
            List.of());

        assertThatThrownBy(() -> runner().run(cases, baseline))
            .isInstanceOf(ConfigException.class)
            .hasMessageContaining("gpt-4o");
    }

    // ════════════════════════════════════════════════════════════════════════
    // Judge
    // ════════════════════════════════════════════════════════════════════════

    @Test
    public void judge_scoresAndCountsInvocations() {
        RunOutcomeReport report = runner(judge(10, 0), RegressionConfig.builder().build()).run(cases, null);

        assertThat(report.passed()).isEqualTo(3);
        assertThat(report.judge().scored()).isEqualTo(3);
        assertThat(report.judge().invocations()).isEqualTo(3);
        assertThat(report.cases().get(0).judge().overallScore()).isEqualTo(88);
    }

    @Test
    public void judge_belowPassScore_failsCase() {
        RunOutcomeReport report = runner(judge(10, 90), RegressionConfig.builder().build())
            .run(cases.subList(0, 1), null);

        assertThat(report.cases().get(0).failures()).containsExactly("judge_score_below:88<90");
    }

    @Test
    public void judge_notOkVerdict_failsCaseAtAnyPassScore() {
        RunOutcomeReport report = runner(judge(10, 0, JUDGE_NOT_OK), RegressionConfig.builder().build())
            .run(cases.subList(0, 1), null);

        assertThat(report.passed()).isZero();
        assertThat(report.cases().get(0).failures()).containsExactly("judge_not_ok:ignored_block_keyword");
        assertThat(report.exitStatus()).isEqualTo(RunOutcomeReport.EXIT_FAILURES);
    }

    @Test
    public void judgeBudgetSpentBeforeAnyPass_isHardFailure() {
        RunOutcomeReport report = runner(judge(0, 0), RegressionConfig.builder().build()).run(cases, null);

        assertThat(report.passed()).isZero();
        assertThat(report.judge().skipped()).isEqualTo(3);
        assertThat(report.cases()).allSatisfy(c -> assertThat(c.failures()).contains("judge_skipped"));
        assertThat(report.exitStatus()).isEqualTo(RunOutcomeReport.EXIT_HARD);
    }

    @Test
    public void judgeBudgetSpentAfterAPass_isOrdinaryFailure() {
        RunOutcomeReport report = runner(judge(1, 0), RegressionConfig.builder().build()).run(cases, null);

        assertThat(report.passed()).isEqualTo(1);
        assertThat(report.judge().skipped()).isEqualTo(2);
        assertThat(report.exitStatus()).isEqualTo(RunOutcomeReport.EXIT_FAILURES);
    }

    // ════════════════════════════════════════════════════════════════════════
    // Report file
    // ════════════════════════════════════════════════════════════════════════

    @Test
    public void report_writeThenRead() throws Exception {
        RunOutcomeReport report = runner().run(cases, null);
        Path path = Files.createTempDirectory("swipesentinel-report").resolve("report.json");
        RunOutcomeReportWriter writer = new RunOutcomeReportWriter();

        writer.write(path, report);
        RunOutcomeReport read = writer.read(path);

        assertThat(read.contract()).isEqualTo(RunOutcomeReport.CONTRACT);
        assertThat(read.passed()).isEqualTo(3);
        assertThat(read.cases()).extracting(CaseResult::caseId)
            .containsExactly("card_high_score", "card_low_score", "card_forced_pass");
    }
}
