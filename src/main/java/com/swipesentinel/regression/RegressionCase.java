package com.swipesentinel.regression;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One fixed decision input plus what an acceptable answer looks like.
 * One line of a dataset JSONL file.
 *
 * @param expectedActionSet actions that count as a pass; never empty
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record RegressionCase(
        @JsonProperty("contract_version") String contractVersion,
        @JsonProperty("case_id") String caseId,
        @JsonProperty("nl_query") String nlQuery,
        CasePacket packet,
        @JsonProperty("expected_action_set") List<String> expectedActionSet,
        @JsonProperty("expected_message_constraints") MessageConstraints expectedMessageConstraints) {

    public static final String CONTRACT = "regression_case.v1";

    public RegressionCase {
        expectedActionSet = expectedActionSet != null ? List.copyOf(expectedActionSet) : List.of();
    }
}
