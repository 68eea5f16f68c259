package com.swipesentinel.cli;

import com.swipesentinel.audit.PacketLogger;
import com.swipesentinel.model.ActionPlan;
import com.swipesentinel.model.Packet;
import com.swipesentinel.model.QualityFeatures;
import com.swipesentinel.model.RunCounters;
import com.swipesentinel.model.ScreenType;
import com.swipesentinel.regression.BaselineStore;
import com.swipesentinel.regression.DatasetLoader;
import com.swipesentinel.regression.RegressionCase;
import com.swipesentinel.regression.RunOutcomeReportWriter;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Subcommands end to end with the rule engine; exit codes are the contract.
 */
public class SwipeSentinelCliTest {

    private Path dir;
    private Path config;
    private Path dataset;

    @BeforeMethod
    public void setUp() throws IOException, URISyntaxException {
        dir     = Files.createTempDirectory("swipesentinel-cli");
        config  = Files.writeString(dir.resolve("agent.json"), "{}");
        dataset = Path.of(getClass().getResource("/fixtures/regression/swipe_cases.jsonl").toURI());
    }

    private static int run(String... args) {
        return SwipeSentinelCli.newCommandLine().execute(args);
    }

    // ════════════════════════════════════════════════════════════════════════
    // regress
    // ════════════════════════════════════════════════════════════════════════

    @Test
    public void regress_passingDataset_exitsZeroAndWritesReport() {
        Path report = dir.resolve("out/report.json");

        int exit = run("regress", "-c", config.toString(), "-d", dataset.toString(), "-r", report.toString());

        assertThat(exit).isZero();
        assertThat(new RunOutcomeReportWriter().read(report).passed()).isEqualTo(3);
    }

    @Test
    public void regress_writeThenCompareBaseline() {
        Path baseline = dir.resolve("baseline.json");

        assertThat(run("regress", "-c", config.toString(), "-d", dataset.toString(),
            "-b", baseline.toString(), "--write-baseline")).isZero();
        assertThat(new BaselineStore().load(baseline).entries()).hasSize(3);

        assertThat(run("regress", "-c", config.toString(), "-d", dataset.toString(),
            "-b", baseline.toString(), "--fail-on-drift")).isZero();
    }

    @Test
    public void regress_missingBaseline_isConfigError() {
        int exit = run("regress", "-c", config.toString(), "-d", dataset.toString(),
            "-b", dir.resolve("absent.json").toString());

        assertThat(exit).isEqualTo(SwipeSentinelCommand.EXIT_CONFIG);
    }

    @Test
    public void regress_badTolerance_isConfigError() {
        int exit = run("regress", "-c", config.toString(), "-d", dataset.toString(),
            "--message-tolerance", "fuzzy");

        assertThat(exit).isEqualTo(SwipeSentinelCommand.EXIT_CONFIG);
    }

    @Test
    public void regress_missingDataset_isConfigError() {
        int exit = run("regress", "-c", config.toString(), "-d", dir.resolve("none.jsonl").toString());

        assertThat(exit).isEqualTo(SwipeSentinelCommand.EXIT_CONFIG);
    }

    @Test
    public void regress_withoutDatasetOption_isUsageError() {
        assertThat(run("regress", "-c", config.toString())).isEqualTo(2);
    }

    // ════════════════════════════════════════════════════════════════════════
    // build-dataset
    // ════════════════════════════════════════════════════════════════════════

    private Path packetLog() throws IOException {
        Path path = dir.resolve("session_packets.jsonl");
        try (PacketLogger logger = new PacketLogger(path)) {
            for (int i = 1; i <= 3; i++) {
                logger.append(new Packet(Instant.parse("2026-01-01T12:00:00Z"), "session", i,
                    ScreenType.DISCOVER_CARD, "discover_card", 94, "quality_score_v1", QualityFeatures.empty(),
                    List.of("like", "pass", "wait"), List.of("Ana"), RunCounters.zero(), null, 0, false, null,
                    ActionPlan.deterministic("like", "score>=70", null), null, null, null, null, null));
            }
        }
        return path;
    }

    @Test
    public void buildDataset_writesLoadableCases() throws IOException {
        Path out = dir.resolve("dataset.jsonl");

        int exit = run("build-dataset", "-c", config.toString(), "--packets", packetLog().toString(),
            "-o", out.toString(), "--max-rows", "2");

        assertThat(exit).isZero();
        List<RegressionCase> cases = new DatasetLoader().load(out);
        assertThat(cases).hasSize(2);
        assertThat(cases).allSatisfy(c -> assertThat(c.expectedActionSet()).containsExactly("like"));
    }

    @Test
    public void buildDataset_unknownScreenType_isConfigError() throws IOException {
        int exit = run("build-dataset", "-c", config.toString(), "--packets", packetLog().toString(),
            "-o", dir.resolve("x.jsonl").toString(), "--screen-types", "discover_card,lobby");

        assertThat(exit).isEqualTo(SwipeSentinelCommand.EXIT_CONFIG);
    }

    @Test
    public void buildDataset_nothingMatches_exitsOne() throws IOException {
        int exit = run("build-dataset", "-c", config.toString(), "--packets", packetLog().toString(),
            "-o", dir.resolve("x.jsonl").toString(), "--screen-types", "chat_thread");

        assertThat(exit).isEqualTo(SwipeSentinelCommand.EXIT_FAILED);
    }

    // ════════════════════════════════════════════════════════════════════════
    // run
    // ════════════════════════════════════════════════════════════════════════

    @Test
    public void run_invalidConfig_failsBeforeTouchingDevice() throws IOException {
        Path bad = Files.writeString(dir.resolve("bad.json"), "{\"session\": {\"max_actions\": 0}}");

        assertThat(run("run", "-c", bad.toString())).isEqualTo(SwipeSentinelCommand.EXIT_CONFIG);
    }
}
