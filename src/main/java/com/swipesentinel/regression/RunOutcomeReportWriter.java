package com.swipesentinel.regression;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.swipesentinel.util.JsonSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/** Writes a {@link RunOutcomeReport} atomically as pretty-printed JSON. */
public class RunOutcomeReportWriter {

    private static final Logger log = LoggerFactory.getLogger(RunOutcomeReportWriter.class);

    private final ObjectMapper mapper = JsonSupport.prettyMapper();

    public void write(Path path, RunOutcomeReport report) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
            mapper.writeValue(tmp.toFile(), report);
            Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new UncheckedIOException("RunOutcomeReportWriter: failed to write " + path, e);
        }
        log.info("RunOutcomeReportWriter: wrote {} (exit={})", path.toAbsolutePath(), report.exitStatus());
    }

    public RunOutcomeReport read(Path path) {
        try {
            return mapper.readValue(path.toFile(), RunOutcomeReport.class);
        } catch (IOException e) {
            throw new UncheckedIOException("RunOutcomeReportWriter: failed to read " + path, e);
        }
    }
}
