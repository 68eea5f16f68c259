package com.swipesentinel.regression;

import com.swipesentinel.core.ConfigException;
import com.swipesentinel.model.ActionPlan;
import com.swipesentinel.model.Packet;
import com.swipesentinel.model.QualityFeatures;
import com.swipesentinel.model.RunCounters;
import com.swipesentinel.model.ScreenType;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Dataset loading rules and dataset construction from packet logs.
 */
public class DatasetLoaderTest {

    private static final String VALID = "{\"case_id\":\"c1\",\"packet\":{\"screen_type\":\"discover_card\","
        + "\"quality_score\":80,\"available_actions\":[\"like\",\"pass\"],"
        + "\"counters\":{\"actions\":0,\"likes\":0,\"passes\":0,\"messages\":0}},"
        + "\"expected_action_set\":[\"like\"]}";

    private final DatasetLoader loader = new DatasetLoader();
    private Path dir;

    @BeforeMethod
    public void createDir() throws IOException {
        dir = Files.createTempDirectory("swipesentinel-dataset");
    }

    private Path write(String... lines) throws IOException {
        Path path = dir.resolve("cases.jsonl");
        Files.write(path, List.of(lines));
        return path;
    }

    // ════════════════════════════════════════════════════════════════════════
    // Loading
    // ════════════════════════════════════════════════════════════════════════

    @Test
    public void fixture_loadsInFileOrder() {
        List<RegressionCase> cases = loader.load(RegressionRunnerTest.datasetFixture());

        assertThat(cases).extracting(RegressionCase::caseId)
            .containsExactly("card_high_score", "card_low_score", "card_forced_pass");
        assertThat(cases.get(0).packet().qualityFeatures().qualityFlags()).contains("selfie_verified");
        assertThat(cases.get(1).packet().counters()).isEqualTo(new RunCounters(3, 1, 2, 0));
    }

    @Test
    public void missingContractVersion_isAccepted() throws IOException {
        assertThat(loader.load(write(VALID))).hasSize(1);
    }

    @Test
    public void wrongContractVersion_isRejected() throws IOException {
        Path path = write(VALID.replace("{\"case_id\"", "{\"contract_version\":\"regression_case.v0\",\"case_id\""));

        assertThatThrownBy(() -> loader.load(path))
            .isInstanceOf(ConfigException.class)
            .hasMessageContaining("regression_case.v0");
    }

    @Test
    public void duplicateCaseId_isRejected() throws IOException {
        Path path = write(VALID, VALID);

        assertThatThrownBy(() -> loader.load(path))
            .isInstanceOf(ConfigException.class)
            .hasMessageContaining(":2: duplicate case_id 'c1'");
    }

    @Test
    public void unknownExpectedAction_isRejected() throws IOException {
        Path path = write(VALID.replace("\"expected_action_set\":[\"like\"]", "\"expected_action_set\":[\"super_like\"]"));

        assertThatThrownBy(() -> loader.load(path))
            .isInstanceOf(ConfigException.class)
            .hasMessageContaining("super_like");
    }

    @Test
    public void emptyExpectedSet_isRejected() throws IOException {
        Path path = write(VALID.replace("\"expected_action_set\":[\"like\"]", "\"expected_action_set\":[]"));

        assertThatThrownBy(() -> loader.load(path))
            .isInstanceOf(ConfigException.class)
            .hasMessageContaining("expected_action_set must not be empty");
    }

    @Test
    public void unparseableLine_isRejected() throws IOException {
        Path path = write(VALID, "{broken");

        assertThatThrownBy(() -> loader.load(path))
            .isInstanceOf(ConfigException.class)
            .hasMessageContaining("cases.jsonl:2: unparseable case");
    }

    @Test
    public void emptyFile_isRejected() throws IOException {
        Path path = write("", "  ");

        assertThatThrownBy(() -> loader.load(path))
            .isInstanceOf(ConfigException.class)
            .hasMessageContaining("contains no cases");
    }

    @Test
    public void missingFile_isRejected() {
        assertThatThrownBy(() -> loader.load(dir.resolve("absent.jsonl")))
            .isInstanceOf(ConfigException.class)
            .hasMessageContaining("Dataset not found");
    }

    // ════════════════════════════════════════════════════════════════════════
    // Building from packets
    // ════════════════════════════════════════════════════════════════════════

    private static Packet packet(int iteration, ScreenType type, String actionId) {
        return new Packet(Instant.parse("2026-01-01T12:00:00Z"), "run 1", iteration, type, type.wireName(), 80,
            "quality_score_v1", QualityFeatures.empty(), List.of("like", "pass", "wait"), List.of("Ana"),
            RunCounters.zero(), null, 0, false, null, actionId != null ? ActionPlan.deterministic(actionId, "r", null) : null,
            null, null, null, null, null);
    }

    @Test
    public void builder_expectsTheActionTaken() {
        List<RegressionCase> cases = new DatasetBuilder().build(
            List.of(packet(1, ScreenType.DISCOVER_CARD, "like")), Set.of(), 10, "swipe");

        assertThat(cases).hasSize(1);
        assertThat(cases.get(0).caseId()).isEqualTo("run_1_iter_1_discover_card");
        assertThat(cases.get(0).expectedActionSet()).containsExactly("like");
        assertThat(cases.get(0).nlQuery()).isEqualTo("swipe");
    }

    @Test
    public void builder_skipsPacketsWithoutDecision() {
        List<RegressionCase> cases = new DatasetBuilder().build(List.of(
            packet(1, ScreenType.DISCOVER_CARD, null),
            packet(2, ScreenType.DISCOVER_CARD, "pass")), Set.of(), 10, null);

        assertThat(cases).extracting(RegressionCase::caseId).containsExactly("run_1_iter_2_discover_card");
    }

    @Test
    public void builder_filtersScreenTypesAndCapsRows() {
        List<RegressionCase> cases = new DatasetBuilder().build(List.of(
            packet(1, ScreenType.MATCHES_LIST, "open_thread"),
            packet(2, ScreenType.DISCOVER_CARD, "like"),
            packet(3, ScreenType.DISCOVER_CARD, "pass"),
            packet(4, ScreenType.DISCOVER_CARD, "like")), Set.of(ScreenType.DISCOVER_CARD), 2, null);

        assertThat(cases).extracting(RegressionCase::expectedActionSet)
            .containsExactly(List.of("like"), List.of("pass"));
    }

    @Test
    public void builder_outputLoadsBack() {
        List<RegressionCase> built = new DatasetBuilder().build(List.of(
            packet(1, ScreenType.DISCOVER_CARD, "like"),
            packet(1, ScreenType.DISCOVER_CARD, "pass")), Set.of(), 10, "swipe");
        Path path = dir.resolve("built.jsonl");

        new DatasetBuilder().write(path, built);
        List<RegressionCase> loaded = loader.load(path);

        assertThat(loaded).extracting(RegressionCase::caseId)
            .containsExactly("run_1_iter_1_discover_card", "run_1_iter_1_discover_card_2");
        assertThat(loaded.get(0).contractVersion()).isEqualTo(RegressionCase.CONTRACT);
    }
}
