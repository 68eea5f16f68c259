package com.swipesentinel.model;

import java.time.Instant;
import java.util.List;

/**
 * A raw capture of the device screen for one decision cycle.
 *
 * Created once per cycle by the {@link com.swipesentinel.capture.CaptureAdapter}
 * and never modified afterwards. The screen type is not part of the raw capture;
 * it is derived by the classifier and recorded on the packet.
 *
 * @param rawStrings   de-duplicated visible strings (text and content-desc), in tree order
 * @param nodes        every node of the accessibility tree, in tree order
 * @param packageName  foreground application package, when the tree reports one
 * @param screenshotPng PNG bytes, or null when no screenshot was taken
 * @param pageSource    the raw accessibility tree the nodes were parsed from, if any
 */
public record Observation(
        List<String> rawStrings,
        List<UiNode> nodes,
        String packageName,
        byte[] screenshotPng,
        String pageSource,
        Instant capturedAt) {

    public Observation {
        rawStrings = rawStrings != null ? List.copyOf(rawStrings) : List.of();
        nodes      = nodes != null ? List.copyOf(nodes) : List.of();
        capturedAt = capturedAt != null ? capturedAt : Instant.now();
    }

    /** Convenience for tests and replay: strings only, no nodes or screenshot. */
    public static Observation ofStrings(List<String> strings) {
        return new Observation(strings, List.of(), null, null, null, Instant.now());
    }

    public boolean hasScreenshot() {
        return screenshotPng != null && screenshotPng.length > 0;
    }
}
