package com.swipesentinel.regression;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.swipesentinel.action.ActionCatalog;
import com.swipesentinel.core.ConfigException;
import com.swipesentinel.util.JsonSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Reads a dataset JSONL file into {@link RegressionCase}s, in file order.
 *
 * The whole file is rejected ({@link ConfigException}) on the first bad line:
 * unparseable JSON, a wrong contract version, a missing case id, packet or
 * expected action set, a duplicate case id, or an action id outside the catalog.
 */
public class DatasetLoader {

    private static final Logger log = LoggerFactory.getLogger(DatasetLoader.class);

    private final ObjectMapper mapper = JsonSupport.compactMapper();

    public List<RegressionCase> load(Path path) {
        if (!Files.isRegularFile(path)) throw new ConfigException("Dataset not found: " + path);
        List<String> lines;
        try {
            lines = Files.readAllLines(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ConfigException("Cannot read dataset " + path + ": " + e.getMessage(), e);
        }

        List<RegressionCase> cases = new ArrayList<>();
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i).trim();
            if (line.isEmpty()) continue;
            String where = path + ":" + (i + 1);

            RegressionCase c;
            try {
                c = mapper.readValue(line, RegressionCase.class);
            } catch (JsonProcessingException e) {
                throw new ConfigException(where + ": unparseable case: " + e.getOriginalMessage(), e);
            }
            validate(c, where);
            if (!ids.add(c.caseId())) throw new ConfigException(where + ": duplicate case_id '" + c.caseId() + "'");
            cases.add(c);
        }
        if (cases.isEmpty()) throw new ConfigException("Dataset " + path + " contains no cases");
        log.info("DatasetLoader: loaded {} case(s) from {}", cases.size(), path);
        return cases;
    }

    private static void validate(RegressionCase c, String where) {
        if (c.contractVersion() != null && !RegressionCase.CONTRACT.equals(c.contractVersion())) {
            throw new ConfigException(where + ": unsupported contract_version '" + c.contractVersion()
                + "', expected " + RegressionCase.CONTRACT);
        }
        if (c.caseId() == null || c.caseId().isBlank()) throw new ConfigException(where + ": case_id is required");
        if (c.packet() == null)                           throw new ConfigException(where + ": packet is required");
        if (c.packet().screenType() == null)              throw new ConfigException(where + ": packet.screen_type is required");
        if (c.expectedActionSet().isEmpty()) {
            throw new ConfigException(where + ": expected_action_set must not be empty");
        }
        for (String a : c.expectedActionSet())        requireCatalogAction(a, where, "expected_action_set");
        for (String a : c.packet().availableActions()) requireCatalogAction(a, where, "packet.available_actions");
    }

    private static void requireCatalogAction(String actionId, String where, String field) {
        if (!ActionCatalog.contains(actionId)) {
            throw new ConfigException(where + ": " + field + " names unknown action '" + actionId
                + "'. Known: " + ActionCatalog.describeIds());
        }
    }
}
