package com.swipesentinel.regression;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.swipesentinel.model.Packet;
import com.swipesentinel.model.ScreenType;
import com.swipesentinel.util.JsonSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Turns a packet log into a regression dataset.
 *
 * Each packet that carries a decision becomes one case whose expected action
 * set is the action taken at the time. Packets without a decision (the cycle
 * ended in a decision error) are skipped. The loop state recorded on the packet
 * and the session's instruction travel with the case, so replay decides on the
 * same inputs the live loop saw.
 */
public class DatasetBuilder {

    private static final Logger log = LoggerFactory.getLogger(DatasetBuilder.class);

    private final ObjectMapper mapper = JsonSupport.compactMapper();

    /**
     * @param screenTypes when non-empty, only packets of these screen types are kept
     * @param maxRows     at most this many cases are produced
     * @param nlQuery     instruction stored on every case; null keeps each packet's own
     */
    public List<RegressionCase> build(List<Packet> packets, Set<ScreenType> screenTypes, int maxRows, String nlQuery) {
        List<RegressionCase> cases = new ArrayList<>();
        Set<String> ids = new LinkedHashSet<>();
        for (Packet p : packets) {
            if (cases.size() >= maxRows) break;
            if (p.decision() == null) continue;
            if (!screenTypes.isEmpty() && !screenTypes.contains(p.screenType())) continue;

            String caseId = uniqueId(safeId(p.session() + "_iter_" + p.iteration() + "_" + p.screenType().wireName()), ids);
            CasePacket packet = new CasePacket(p.screenType(), p.qualityScore(), p.qualityScoreVersion(),
                p.qualityFeatures(), p.availableActions(), p.observedStrings(), p.counters(),
                p.lastAction(), p.consecutiveValidationFailures(), p.forcedActionConsumed());
            String query = nlQuery != null ? nlQuery : p.nlQuery();
            cases.add(new RegressionCase(RegressionCase.CONTRACT, caseId, query, packet,
                List.of(p.decision().actionId()), null));
        }
        log.info("DatasetBuilder: {} case(s) from {} packet(s)", cases.size(), packets.size());
        return cases;
    }

    public void write(Path path, List<RegressionCase> cases) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            try (BufferedWriter w = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
                for (RegressionCase c : cases) {
                    w.write(mapper.writeValueAsString(c));
                    w.newLine();
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("DatasetBuilder: failed to write " + path, e);
        }
        log.info("DatasetBuilder: wrote {} case(s) to {}", cases.size(), path.toAbsolutePath());
    }

    static String safeId(String raw) {
        StringBuilder sb = new StringBuilder();
        for (char ch : (raw != null ? raw.trim() : "").toCharArray()) {
            sb.append(Character.isLetterOrDigit(ch) || ch == '-' || ch == '_' ? ch : '_');
        }
        return sb.length() > 0 ? sb.toString() : "case";
    }

    private static String uniqueId(String base, Set<String> taken) {
        String id = base;
        for (int n = 2; !taken.add(id); n++) id = base + "_" + n;
        return id;
    }
}
