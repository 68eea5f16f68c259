package com.swipesentinel.audit;

import com.swipesentinel.model.Observation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Persists the raw inputs of each cycle next to the packet log:
 * {@code packet_0001.xml} and, when a screenshot was taken, {@code packet_0001.png}.
 *
 * A frame that cannot be written is logged and left out of the packet; the
 * packet itself is still appended.
 */
public class FrameWriter {

    private static final Logger log = LoggerFactory.getLogger(FrameWriter.class);

    private final Path dir;

    public FrameWriter(Path dir) {
        this.dir = dir;
    }

    public record Frame(String screenshotRef, String xmlRef) {
        static final Frame NONE = new Frame(null, null);
    }

    public Frame write(int iteration, Observation obs) {
        String stem = String.format("packet_%04d", iteration);
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            log.warn("FrameWriter: cannot create {}: {}", dir, e.getMessage());
            return Frame.NONE;
        }

        String xmlRef = null;
        if (obs.pageSource() != null) {
            Path xml = dir.resolve(stem + ".xml");
            try {
                Files.writeString(xml, obs.pageSource(), StandardCharsets.UTF_8);
                xmlRef = xml.toString();
            } catch (IOException e) {
                log.warn("FrameWriter: failed to write {}: {}", xml, e.getMessage());
            }
        }

        String screenshotRef = null;
        if (obs.hasScreenshot()) {
            Path png = dir.resolve(stem + ".png");
            try {
                Files.write(png, obs.screenshotPng());
                screenshotRef = png.toString();
            } catch (IOException e) {
                log.warn("FrameWriter: failed to write {}: {}", png, e.getMessage());
            }
        }
        return new Frame(screenshotRef, xmlRef);
    }
}
