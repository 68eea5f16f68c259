package com.swipesentinel.regression;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.swipesentinel.core.ConfigException;
import com.swipesentinel.util.JsonSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.HashSet;
import java.util.Set;

/**
 * Loads and writes baseline documents.
 *
 * Writing always replaces the whole file (tmp file + atomic move); entries from
 * an existing baseline are never merged in.
 */
public class BaselineStore {

    private static final Logger log = LoggerFactory.getLogger(BaselineStore.class);

    private final ObjectMapper mapper = JsonSupport.prettyMapper();

    /** @throws ConfigException if the file is missing, unparseable, of another contract, or has duplicate ids */
    public Baseline load(Path path) {
        if (!Files.isRegularFile(path)) throw new ConfigException("Baseline not found: " + path);
        Baseline baseline;
        try {
            baseline = mapper.readValue(path.toFile(), Baseline.class);
        } catch (IOException e) {
            throw new ConfigException("Cannot parse baseline " + path + ": " + e.getMessage(), e);
        }
        if (!Baseline.CONTRACT.equals(baseline.contractVersion())) {
            throw new ConfigException("Baseline " + path + " has contract_version '" + baseline.contractVersion()
                + "', expected " + Baseline.CONTRACT);
        }
        Set<String> ids = new HashSet<>();
        for (BaselineEntry e : baseline.entries()) {
            if (e.caseId() == null || e.actionId() == null) {
                throw new ConfigException("Baseline " + path + " has an entry without case_id or action_id");
            }
            if (!ids.add(e.caseId())) {
                throw new ConfigException("Baseline " + path + " has duplicate case_id '" + e.caseId() + "'");
            }
        }
        log.info("BaselineStore: loaded {} entries ({}) from {}", baseline.entries().size(), baseline.engineLabel(), path);
        return baseline;
    }

    public void write(Path path, Baseline baseline) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
            mapper.writeValue(tmp.toFile(), baseline);
            Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new UncheckedIOException("BaselineStore: failed to write " + path, e);
        }
        log.info("BaselineStore: wrote {} entries ({}) to {}", baseline.entries().size(),
            baseline.engineLabel(), path.toAbsolutePath());
    }
}
