package com.swipesentinel.audit;

import com.swipesentinel.core.ConfigException;
import com.swipesentinel.model.ActionPlan;
import com.swipesentinel.model.DecisionSource;
import com.swipesentinel.model.ExecutionRecord;
import com.swipesentinel.model.Packet;
import com.swipesentinel.model.QualityFeatures;
import com.swipesentinel.model.RunCounters;
import com.swipesentinel.model.ScreenType;
import com.swipesentinel.model.TerminationReason;
import com.swipesentinel.model.ValidationOutcome;
import com.swipesentinel.model.ValidationStatus;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class PacketLoggerTest {

    private static final Instant TS = Instant.parse("2026-01-01T12:00:00Z");

    private Path dir;

    @BeforeMethod
    public void createDir() throws IOException {
        dir = Files.createTempDirectory("swipesentinel-audit");
    }

    private static Packet packet(int iteration, String actionId) {
        return new Packet(TS, "audit", iteration, ScreenType.DISCOVER_CARD, "discover_card", 94, "v1",
            new QualityFeatures("Ana", "Sunday farmers market", List.of("Like Ana's photo"), List.of()),
            List.of("like", "pass", "wait"), List.of("Ana", "Skip Ana"), RunCounters.zero(), null, 0, false, "swipe",
            ActionPlan.deterministic(actionId, "score>=70", null), null,
            new ExecutionRecord("executed", "Tapped like_button:5", 1, false),
            new ValidationOutcome(actionId, ScreenType.DISCOVER_CARD, ScreenType.DISCOVER_CARD, true, true,
                ValidationStatus.PASSED),
            null, null);
    }

    // ════════════════════════════════════════════════════════════════════════
    // Packet log
    // ════════════════════════════════════════════════════════════════════════

    @Test
    public void append_writesOneLinePerPacket() throws IOException {
        Path path = dir.resolve("nested/audit_packets.jsonl");
        try (PacketLogger logger = new PacketLogger(path)) {
            logger.append(packet(1, "like"));
            logger.append(packet(2, "pass"));
            assertThat(logger.getWritten()).isEqualTo(2);
        }

        List<String> lines = Files.readAllLines(path, StandardCharsets.UTF_8);
        assertThat(lines).hasSize(2);
        assertThat(lines.get(0))
            .contains("\"screen_type\":\"discover_card\"")
            .contains("\"quality_score\":94")
            .contains("\"action_id\":\"like\"");
    }

    @Test
    public void readAll_restoresPackets() throws IOException {
        Path path = dir.resolve("read_packets.jsonl");
        try (PacketLogger logger = new PacketLogger(path)) {
            logger.append(packet(1, "like"));
            logger.append(packet(2, "pass"));
        }

        List<Packet> packets = PacketLogger.readAll(path);

        assertThat(packets).extracting(Packet::iteration).containsExactly(1, 2);
        assertThat(packets.get(1).decision().actionId()).isEqualTo("pass");
        assertThat(packets.get(1).decision().source()).isEqualTo(DecisionSource.DETERMINISTIC);
        assertThat(packets.get(0).qualityFeatures().profileNameCandidate()).isEqualTo("Ana");
        assertThat(packets.get(0).validation().status()).isEqualTo(ValidationStatus.PASSED);
        assertThat(packets.get(0).nlQuery()).isEqualTo("swipe");
        assertThat(packets.get(0).lastAction()).isNull();
    }

    @Test
    public void reopen_appendsRatherThanTruncates() throws IOException {
        Path path = dir.resolve("append_packets.jsonl");
        try (PacketLogger logger = new PacketLogger(path)) {
            logger.append(packet(1, "like"));
        }
        try (PacketLogger logger = new PacketLogger(path)) {
            logger.append(packet(2, "like"));
        }

        assertThat(PacketLogger.readAll(path)).hasSize(2);
    }

    @Test
    public void reopen_afterTornWrite_startsOnFreshLine() throws IOException {
        Path path = dir.resolve("torn_packets.jsonl");
        Files.writeString(path, "{\"ts\":\"2026-01-01T00:00:00Z\",\"sess");

        try (PacketLogger logger = new PacketLogger(path)) {
            logger.append(packet(1, "like"));
        }

        assertThat(Files.readAllLines(path, StandardCharsets.UTF_8)).hasSize(2);
        assertThat(PacketLogger.readAll(path)).extracting(Packet::iteration).containsExactly(1);
    }

    @Test
    public void readAll_skipsTruncatedLastPacket() throws IOException {
        Path path = dir.resolve("crashed_packets.jsonl");
        try (PacketLogger logger = new PacketLogger(path)) {
            logger.append(packet(1, "like"));
            logger.append(packet(2, "pass"));
        }
        Files.writeString(path, "{\"ts\":\"2026-01-01T12:00:00Z\",\"session\":\"au",
            StandardCharsets.UTF_8, StandardOpenOption.APPEND);

        assertThat(PacketLogger.readAll(path)).extracting(Packet::iteration).containsExactly(1, 2);
    }

    @Test
    public void readAll_missingFile_throws() {
        assertThatThrownBy(() -> PacketLogger.readAll(dir.resolve("absent.jsonl")))
            .isInstanceOf(ConfigException.class)
            .hasMessageContaining("not found");
    }

    @Test
    public void readAll_badLine_namesLineNumber() throws IOException {
        Path path = dir.resolve("bad.jsonl");
        Files.writeString(path, "\nnot a packet\n");

        assertThatThrownBy(() -> PacketLogger.readAll(path))
            .isInstanceOf(ConfigException.class)
            .hasMessageContaining("bad.jsonl:2");
    }

    // ════════════════════════════════════════════════════════════════════════
    // Action log
    // ════════════════════════════════════════════════════════════════════════

    @Test
    public void actionLog_writeThenRead() {
        Path path = dir.resolve("audit_action_log.json");
        ActionLog actionLog = new ActionLog(ActionLog.CONTRACT, "audit", "deterministic", true, "swipe",
            TS, TS.plusSeconds(30), TerminationReason.ABORTED_BUDGET, "max_actions", 1,
            new RunCounters(1, 1, 0, 0), "audit_packets.jsonl",
            List.of(new ActionLog.Entry(1, ScreenType.DISCOVER_CARD, "like", "score>=70",
                DecisionSource.DETERMINISTIC, "skipped", ValidationStatus.SKIPPED_DRY_RUN)));
        ActionLogWriter writer = new ActionLogWriter();

        writer.write(path, actionLog);

        assertThat(Files.exists(dir.resolve("audit_action_log.json.tmp"))).isFalse();
        assertThat(writer.read(path)).isEqualTo(actionLog);
    }
}
