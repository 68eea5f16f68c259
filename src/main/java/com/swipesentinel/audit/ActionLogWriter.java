package com.swipesentinel.audit;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.swipesentinel.util.JsonSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Writes an {@link ActionLog} as one pretty-printed JSON document.
 *
 * The document is written to a sibling {@code .tmp} file and moved into place, so
 * readers never see a partial log.
 */
public class ActionLogWriter {

    private static final Logger log = LoggerFactory.getLogger(ActionLogWriter.class);

    private final ObjectMapper mapper = JsonSupport.prettyMapper();

    public void write(Path path, ActionLog actionLog) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
            mapper.writeValue(tmp.toFile(), actionLog);
            Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new UncheckedIOException("ActionLogWriter: failed to write " + path, e);
        }
        log.info("ActionLogWriter: wrote {} ({} actions, {})",
            path.toAbsolutePath(), actionLog.actions().size(), actionLog.terminationReason().wireName());
    }

    public ActionLog read(Path path) {
        try {
            return mapper.readValue(path.toFile(), ActionLog.class);
        } catch (IOException e) {
            throw new UncheckedIOException("ActionLogWriter: failed to read " + path, e);
        }
    }
}
