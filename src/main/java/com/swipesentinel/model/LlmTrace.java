package com.swipesentinel.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Usage and latency metadata for one model call, recorded on the packet.
 *
 * @param attempts number of HTTP attempts made (1, or 2 after a transient retry)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record LlmTrace(
        boolean ok,
        String model,
        @JsonProperty("latency_ms") long latencyMs,
        @JsonProperty("input_tokens") int inputTokens,
        @JsonProperty("output_tokens") int outputTokens,
        int attempts,
        @JsonProperty("error_kind") String errorKind,
        String error) {

    public static LlmTrace success(String model, long latencyMs, int inputTokens, int outputTokens, int attempts) {
        return new LlmTrace(true, model, latencyMs, inputTokens, outputTokens, attempts, null, null);
    }

    public static LlmTrace failure(String model, long latencyMs, int attempts, String errorKind, String error) {
        return new LlmTrace(false, model, latencyMs, 0, 0, attempts, errorKind, error);
    }
}
