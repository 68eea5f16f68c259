package com.swipesentinel.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/** Audit summary of what the executor did with a plan. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExecutionRecord(
        String outcome,
        String message,
        @JsonProperty("primitives_issued") int primitivesIssued,
        @JsonProperty("transport_failure") boolean transportFailure) {
}
