package com.swipesentinel.regression;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Recorded decisions for a dataset under one engine configuration (model and
 * temperature). Entries keep dataset order; case ids are unique.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Baseline(
        @JsonProperty("contract_version") String contractVersion,
        @JsonProperty("engine_label") String engineLabel,
        @JsonProperty("model_id") String modelId,
        Double temperature,
        @JsonProperty("created_at") Instant createdAt,
        List<BaselineEntry> entries) {

    public static final String CONTRACT = "baseline.v1";

    public Baseline {
        entries = entries != null ? List.copyOf(entries) : List.of();
    }

    @JsonIgnore
    public Optional<BaselineEntry> find(String caseId) {
        return entries.stream().filter(e -> e.caseId().equals(caseId)).findFirst();
    }

    @JsonIgnore
    public Map<String, BaselineEntry> byCaseId() {
        Map<String, BaselineEntry> map = new LinkedHashMap<>();
        for (BaselineEntry e : entries) map.put(e.caseId(), e);
        return map;
    }
}
