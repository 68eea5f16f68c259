package com.swipesentinel.judge;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.swipesentinel.core.ConfigException;
import com.swipesentinel.util.Hashing;
import com.swipesentinel.util.JsonSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Memo of judge answers keyed by {@code sha256(model_id | packet_fingerprint | response_fingerprint)}.
 *
 * Entries are never replaced once written. With a path, the cache is loaded
 * lazily from a JSONL file of {@code {ts, key, value}} rows and every new entry
 * is appended to it; without one it lives for the process only. Unreadable rows
 * in an existing file are skipped with a warning.
 */
public class JudgeCache {

    private static final Logger log = LoggerFactory.getLogger(JudgeCache.class);

    private final Path                    path;   // null = in-memory only
    private final ObjectMapper            mapper = JsonSupport.compactMapper();
    private final Map<String, JudgeScore> index  = new ConcurrentHashMap<>();
    private boolean                       loaded;

    public JudgeCache() {
        this(null);
    }

    public JudgeCache(Path path) {
        this.path = path;
    }

    public static String key(String modelId, String packetFingerprint, String responseFingerprint) {
        return Hashing.sha256Hex(modelId + "|" + packetFingerprint + "|" + responseFingerprint);
    }

    public synchronized Optional<JudgeScore> get(String key) {
        load();
        return Optional.ofNullable(index.get(key));
    }

    /** Stores an entry unless the key is already present. */
    public synchronized void put(String key, JudgeScore value) {
        load();
        if (index.putIfAbsent(key, value) != null) return;
        if (path == null) return;
        ObjectNode row = mapper.createObjectNode();
        row.put("ts", Instant.now().toString());
        row.put("key", key);
        row.set("value", mapper.valueToTree(value));
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            Files.writeString(path, row.toString() + System.lineSeparator(), StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            throw new UncheckedIOException("JudgeCache: failed to append to " + path, e);
        }
    }

    public synchronized int size() {
        load();
        return index.size();
    }

    public Path getPath() { return path; }

    // ── Loading ───────────────────────────────────────────────────────────────

    private void load() {
        if (loaded) return;
        loaded = true;
        if (path == null || !Files.exists(path)) return;
        if (Files.isDirectory(path)) throw new ConfigException("Judge cache path is a directory: " + path);

        List<String> lines;
        try {
            lines = Files.readAllLines(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ConfigException("Cannot read judge cache " + path + ": " + e.getMessage(), e);
        }
        int skipped = 0;
        for (String line : lines) {
            if (line.isBlank()) continue;
            try {
                JsonNode row = mapper.readTree(line);
                String key = row.path("key").asText(null);
                JsonNode value = row.get("value");
                if (key == null || value == null || !value.isObject()) {
                    skipped++;
                    continue;
                }
                index.putIfAbsent(key, mapper.treeToValue(value, JudgeScore.class));
            } catch (IOException e) {
                skipped++;
            }
        }
        log.info("JudgeCache: loaded {} entries from {}{}", index.size(), path,
            skipped > 0 ? " (" + skipped + " unreadable rows skipped)" : "");
    }
}
