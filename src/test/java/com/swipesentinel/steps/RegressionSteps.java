package com.swipesentinel.steps;

import com.swipesentinel.context.ScenarioContext;
import com.swipesentinel.decision.DecisionEngine;
import com.swipesentinel.decision.DecisionEngineConfig;
import com.swipesentinel.regression.Baseline;
import com.swipesentinel.regression.BaselineEntry;
import com.swipesentinel.regression.BaselineStore;
import com.swipesentinel.regression.CaseResult;
import com.swipesentinel.regression.DatasetLoader;
import com.swipesentinel.regression.DriftReport;
import com.swipesentinel.regression.RegressionConfig;
import com.swipesentinel.regression.RegressionRunner;
import com.swipesentinel.regression.RunOutcomeReport;
import io.cucumber.java.en.Given;
import io.cucumber.java.en.Then;
import io.cucumber.java.en.When;

import java.net.URISyntaxException;
import java.net.URL;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Step definitions for dataset replay with the rule engine.
 *
 * Steps covered:
 *   Given the regression dataset "..."
 *   When the dataset is replayed with the rule engine
 *   When the dataset is replayed against a baseline written from the previous replay
 *   Then every case passes
 *   Then case "..." chose "..."
 *   Given a baseline where case "..." chose "..."
 *   When the dataset is replayed against that baseline
 *   Then no drift is reported
 *   Then case "..." drifted from "..." to "..."
 */
public class RegressionSteps {

    private static final DecisionEngineConfig RULES = DecisionEngineConfig.builder().build();

    private final ScenarioContext ctx;

    private Baseline baseline;

    public RegressionSteps(ScenarioContext ctx) {
        this.ctx = ctx;
    }

    private RegressionRunner runner() {
        return new RegressionRunner(RULES, p -> DecisionEngine.create(RULES, p), ctx.getProfile(), null,
            RegressionConfig.builder().build());
    }

    @Given("the regression dataset {string}")
    public void theRegressionDataset(String name) throws URISyntaxException {
        URL resource = getClass().getResource("/fixtures/regression/" + name);
        assertThat(resource).as("dataset fixture %s", name).isNotNull();
        ctx.setCases(new DatasetLoader().load(Path.of(resource.toURI())));
    }

    @When("the dataset is replayed with the rule engine")
    public void theDatasetIsReplayed() {
        ctx.setLastReport(runner().run(ctx.getCases(), null));
    }

    @When("the dataset is replayed against a baseline written from the previous replay")
    public void theDatasetIsReplayedAgainstBaseline() {
        RegressionRunner runner = runner();
        Path path = ctx.getArtifactsDir().resolve("baseline.json");
        BaselineStore store = new BaselineStore();
        store.write(path, runner.toBaseline(ctx.getLastReport()));

        Baseline baseline = store.load(path);
        ctx.setLastReport(runner.run(ctx.getCases(), baseline));
    }

    @Then("every case passes")
    public void everyCasePasses() {
        RunOutcomeReport report = ctx.getLastReport();
        assertThat(report.passed()).isEqualTo(report.total());
        assertThat(report.exitStatus()).isEqualTo(RunOutcomeReport.EXIT_OK);
    }

    @Then("case {string} chose {string}")
    public void caseChose(String caseId, String actionId) {
        assertThat(ctx.getLastReport().cases())
            .filteredOn(c -> c.caseId().equals(caseId))
            .extracting(CaseResult::actionId)
            .containsExactly(actionId);
    }

    @Then("no drift is reported")
    public void noDriftIsReported() {
        assertThat(ctx.getLastReport().drift()).isEmpty();
        assertThat(ctx.getLastReport().baselineMissing()).isEmpty();
    }

    // ── Handwritten baseline ──────────────────────────────────────────────────

    @Given("a baseline where case {string} chose {string}")
    public void aBaselineWhereCaseChose(String caseId, String actionId) {
        baseline = new Baseline(Baseline.CONTRACT, RULES.label(), RULES.modelId(), null, Instant.now(),
            List.of(new BaselineEntry(caseId, actionId, null, null)));
    }

    @When("the dataset is replayed against that baseline")
    public void theDatasetIsReplayedAgainstThatBaseline() {
        ctx.setLastReport(runner().run(ctx.getCases(), baseline));
    }

    @Then("case {string} drifted from {string} to {string}")
    public void caseDrifted(String caseId, String from, String to) {
        assertThat(ctx.getLastReport().drift())
            .containsExactly(new DriftReport(caseId, from, to, true, null));
    }
}
