package com.swipesentinel.api;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Why a model call produced no usable decision.
 *
 *   TIMEOUT            - no response within the configured timeout        (retried once)
 *   RATE_LIMIT         - HTTP 429 without a quota error code              (retried once)
 *   TRANSPORT          - connection refused, reset, DNS failure           (retried once)
 *   SERVER             - HTTP 5xx                                         (retried once)
 *   QUOTA              - HTTP 429 with insufficient_quota
 *   AUTH               - HTTP 401 / 403
 *   BAD_REQUEST        - HTTP 400 / 404 / 422 and other 4xx
 *   MALFORMED_RESPONSE - body or content is not the expected JSON shape
 *   INVALID_DECISION   - well-formed JSON that fails decision validation
 */
public enum ModelErrorKind {
    TIMEOUT(true),
    RATE_LIMIT(true),
    TRANSPORT(true),
    SERVER(true),
    QUOTA(false),
    AUTH(false),
    BAD_REQUEST(false),
    MALFORMED_RESPONSE(false),
    INVALID_DECISION(false);

    private final boolean transientError;

    ModelErrorKind(boolean transientError) {
        this.transientError = transientError;
    }

    public boolean isTransient() {
        return transientError;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
