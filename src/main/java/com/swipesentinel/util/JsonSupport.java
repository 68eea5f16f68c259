package com.swipesentinel.util;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Shared {@link ObjectMapper} configurations.
 *
 * Instants are written as ISO-8601 strings. Unknown properties are tolerated on
 * read; strict files (configs, profiles) check their own keys.
 */
public final class JsonSupport {

    private JsonSupport() {}

    /** Single-line output: packet log lines, JSONL stores, request bodies. */
    public static ObjectMapper compactMapper() {
        return new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    /** Indented output: action logs, baselines, reports. */
    public static ObjectMapper prettyMapper() {
        return compactMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }
}
