package com.swipesentinel.judge;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Result of asking the judge about one case.
 *
 *   SCORED  - the judge model was called and answered
 *   CACHED  - an identical request was answered before; no model call, no budget used
 *   SKIPPED - the invocation budget was exhausted; never counts as passing
 *   ERROR   - the call failed or the answer could not be read
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JudgeVerdict(Status status, JudgeScore score, String detail) {

    public enum Status {
        SCORED, CACHED, SKIPPED, ERROR;

        @JsonValue
        public String wireName() { return name().toLowerCase(); }
    }

    public static JudgeVerdict scored(JudgeScore score)  { return new JudgeVerdict(Status.SCORED, score, null); }
    public static JudgeVerdict cached(JudgeScore score)  { return new JudgeVerdict(Status.CACHED, score, null); }
    public static JudgeVerdict skipped(String why)       { return new JudgeVerdict(Status.SKIPPED, null, why); }
    public static JudgeVerdict error(String detail)      { return new JudgeVerdict(Status.ERROR, null, detail); }

    public boolean hasScore() {
        return score != null;
    }

    /** Overall score, or null when the judge did not score. */
    public Integer overallScore() {
        return score != null ? score.overallScore() : null;
    }
}
