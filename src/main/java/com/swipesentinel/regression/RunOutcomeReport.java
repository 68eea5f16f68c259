package com.swipesentinel.regression;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Aggregate result of one regression run, written as a JSON document.
 *
 * Exit status:
 *   0 - every case passed (and, with fail-on-drift, no drift)
 *   1 - at least one case failed or errored, or drift with fail-on-drift
 *   2 - hard failure: the judge budget ran out before any case passed
 * Unparseable datasets and config errors never reach a report; the CLI maps
 * them to 2 directly.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RunOutcomeReport(
        String contract,
        @JsonProperty("engine_label") String engineLabel,
        @JsonProperty("model_id") String modelId,
        Double temperature,
        @JsonProperty("started_at") Instant startedAt,
        @JsonProperty("finished_at") Instant finishedAt,
        int total,
        int passed,
        int failed,
        int errored,
        JudgeSummary judge,
        @JsonProperty("baseline_missing") List<String> baselineMissing,
        List<DriftReport> drift,
        List<CaseResult> cases,
        @JsonProperty("exit_status") int exitStatus) {

    public static final String CONTRACT = "regression_report.v1";

    public static final int EXIT_OK       = 0;
    public static final int EXIT_FAILURES = 1;
    public static final int EXIT_HARD     = 2;

    public RunOutcomeReport {
        baselineMissing = baselineMissing != null ? List.copyOf(baselineMissing) : List.of();
        drift           = drift != null ? List.copyOf(drift) : List.of();
        cases           = cases != null ? List.copyOf(cases) : List.of();
    }

    /** Judge activity for the run; absent when the judge is disabled. */
    public record JudgeSummary(int scored, int cached, int skipped, int errors, int invocations,
                               @JsonProperty("max_invocations") int maxInvocations) {
    }

    @JsonIgnore
    public boolean hasDrift() {
        return !drift.isEmpty();
    }
}
