package com.swipesentinel.extract;

import com.swipesentinel.model.Observation;
import com.swipesentinel.util.Hashing;

import java.util.Locale;
import java.util.stream.Collectors;

/** Stable hash of an observation's visible text, used to detect in-place screen changes. */
public final class ContentFingerprint {

    private ContentFingerprint() {}

    public static String of(Observation observation) {
        String joined = observation.rawStrings().stream()
            .map(s -> s.trim().toLowerCase(Locale.ROOT))
            .filter(s -> !s.isEmpty())
            .collect(Collectors.joining("\n"));
        return Hashing.sha256Hex(joined);
    }
}
