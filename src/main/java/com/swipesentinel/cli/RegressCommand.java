package com.swipesentinel.cli;

import com.swipesentinel.api.ModelApiGateway;
import com.swipesentinel.api.ModelClient;
import com.swipesentinel.core.AgentConfig;
import com.swipesentinel.decision.DecisionEngine;
import com.swipesentinel.decision.DecisionEngineConfig;
import com.swipesentinel.judge.ModelJudge;
import com.swipesentinel.regression.Baseline;
import com.swipesentinel.regression.BaselineStore;
import com.swipesentinel.regression.DatasetLoader;
import com.swipesentinel.regression.MessageTolerance;
import com.swipesentinel.regression.RegressionCase;
import com.swipesentinel.regression.RegressionConfig;
import com.swipesentinel.regression.RegressionRunner;
import com.swipesentinel.regression.RunOutcomeReport;
import com.swipesentinel.regression.RunOutcomeReportWriter;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Replays a regression dataset through the configured decision engine.
 *
 * With {@code --baseline} the decisions are compared against a stored baseline
 * (drift); with {@code --write-baseline} they replace it instead.
 */
@Command(name = "regress", description = "Replay a regression dataset, optionally against a baseline")
class RegressCommand extends SwipeSentinelCommand {

    @Option(names = {"-d", "--dataset"}, required = true, description = "Dataset JSONL (regression_case.v1)")
    private Path dataset;

    @Option(names = {"-b", "--baseline"}, description = "Baseline JSON to compare against (or write)")
    private Path baselinePath;

    @Option(names = "--write-baseline", description = "Record this run's decisions as the baseline")
    private boolean writeBaseline;

    @Option(names = "--fail-on-drift", description = "Exit 1 when any case drifts from the baseline")
    private boolean failOnDrift;

    @Option(names = {"-r", "--report"}, description = "Where to write the run outcome report")
    private Path reportPath;

    @Option(names = "--message-tolerance", description = "exact, judge or ignore (default: exact)")
    private String messageTolerance = "exact";

    @Option(names = "--judge-delta", description = "Judge score change tolerated with --message-tolerance judge")
    private int judgeDelta = RegressionConfig.DEFAULT_JUDGE_DELTA;

    @Option(names = "--max-cases", description = "Replay only the first N cases (0 = all)")
    private int maxCases;

    @Override
    protected int execute() {
        AgentConfig config = loadConfig();
        RegressionConfig regression = RegressionConfig.builder()
            .datasetPath(dataset)
            .baselinePath(baselinePath)
            .reportPath(reportPath)
            .writeBaseline(writeBaseline)
            .failOnDrift(failOnDrift)
            .messageTolerance(MessageTolerance.parse(messageTolerance))
            .maxJudgeScoreDelta(judgeDelta)
            .maxCases(maxCases)
            .build();

        List<RegressionCase> cases = new DatasetLoader().load(regression.getDatasetPath());
        BaselineStore baselineStore = new BaselineStore();
        Baseline baseline = null;
        if (baselinePath != null && !writeBaseline) {
            if (!Files.exists(baselinePath)) {
                System.err.println("[CONFIG] Baseline not found: " + baselinePath
                    + " (use --write-baseline to create it)");
                return EXIT_CONFIG;
            }
            baseline = baselineStore.load(baselinePath);
        }

        DecisionEngineConfig engineConfig = config.decisionEngine();
        ModelClient client = engineConfig.isLlm()
            ? new ModelApiGateway(engineConfig.getBaseUrl(), engineConfig.getApiKey(),
                                  engineConfig.getTimeoutSeconds(), engineConfig.getRetryBackoffMs(),
                                  engineConfig.isLogPrompts())
            : null;
        ModelJudge judge = config.judge().isEnabled() ? ModelJudge.create(config.judge()) : null;

        RegressionRunner runner = new RegressionRunner(engineConfig,
            profile -> DecisionEngine.create(engineConfig, profile, client),
            config.profile(), judge, regression);
        RunOutcomeReport report = runner.run(cases, baseline);

        if (reportPath != null) new RunOutcomeReportWriter().write(reportPath, report);
        if (writeBaseline) baselineStore.write(baselinePath, runner.toBaseline(report));

        System.out.printf("Regression (%s): %d case(s) - %d passed, %d failed, %d errored%n",
            report.engineLabel(), report.total(), report.passed(), report.failed(), report.errored());
        report.cases().stream()
            .filter(c -> !c.isPassed())
            .forEach(c -> System.out.printf("  [%s] %s -> %s %s%n",
                c.status().wireName().toUpperCase(), c.caseId(), c.actionId(), c.failures()));
        if (!report.drift().isEmpty()) {
            System.out.printf("  drift: %d case(s)%n", report.drift().size());
            report.drift().forEach(d -> System.out.printf("    %s: %s -> %s%n",
                d.caseId(), d.baselineAction(), d.observedAction()));
        }
        if (!report.baselineMissing().isEmpty()) {
            System.out.printf("  not in baseline: %s%n", report.baselineMissing());
        }
        return report.exitStatus();
    }
}
