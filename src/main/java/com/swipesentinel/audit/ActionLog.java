package com.swipesentinel.audit;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.swipesentinel.model.DecisionSource;
import com.swipesentinel.model.RunCounters;
import com.swipesentinel.model.ScreenType;
import com.swipesentinel.model.TerminationReason;
import com.swipesentinel.model.ValidationStatus;

import java.time.Instant;
import java.util.List;

/**
 * Per-run summary document ({@code action_log.v1}). Written once, when the run ends.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ActionLog(
        String contract,
        String session,
        @JsonProperty("engine_label") String engineLabel,
        @JsonProperty("dry_run") boolean dryRun,
        @JsonProperty("nl_query") String nlQuery,
        @JsonProperty("started_at") Instant startedAt,
        @JsonProperty("finished_at") Instant finishedAt,
        @JsonProperty("termination_reason") TerminationReason terminationReason,
        @JsonProperty("termination_detail") String terminationDetail,
        int iterations,
        RunCounters counters,
        @JsonProperty("packet_log") String packetLog,
        List<Entry> actions) {

    public static final String CONTRACT = "action_log.v1";

    public ActionLog {
        actions = actions != null ? List.copyOf(actions) : List.of();
    }

    /** One executed (or skipped) action. */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Entry(
            int iteration,
            @JsonProperty("screen_type") ScreenType screenType,
            @JsonProperty("action_id") String actionId,
            String reason,
            DecisionSource source,
            String outcome,
            @JsonProperty("validation_status") ValidationStatus validationStatus) {
    }
}
