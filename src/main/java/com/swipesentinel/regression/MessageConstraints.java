package com.swipesentinel.regression;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.swipesentinel.model.ActionPlan;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Optional expectations about the message a case should produce. Every field is
 * nullable; a null field is not checked.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record MessageConstraints(
        Boolean required,
        @JsonProperty("max_chars") Integer maxChars,
        @JsonProperty("require_question") Boolean requireQuestion,
        @JsonProperty("must_mention_name") Boolean mustMentionName,
        @JsonProperty("forbidden_substrings") List<String> forbiddenSubstrings) {

    public MessageConstraints {
        forbiddenSubstrings = forbiddenSubstrings != null ? List.copyOf(forbiddenSubstrings) : List.of();
    }

    /**
     * @param profileName the name candidate of the case, used by {@code must_mention_name}
     * @return failure tags; empty when every declared constraint holds
     */
    public List<String> check(ActionPlan plan, String profileName) {
        List<String> failures = new ArrayList<>();
        String text = plan.messageText();

        if (Boolean.TRUE.equals(required) && !plan.hasMessage()) {
            failures.add("message_required");
        }
        if (text == null || text.isBlank()) return failures;

        if (maxChars != null && text.length() > maxChars) {
            failures.add("message_too_long:" + text.length() + ">" + maxChars);
        }
        if (Boolean.TRUE.equals(requireQuestion) && !text.contains("?")) {
            failures.add("message_missing_question");
        }
        if (Boolean.TRUE.equals(mustMentionName)) {
            if (profileName == null || profileName.isBlank()) {
                failures.add("message_name_unknown");
            } else if (!text.toLowerCase(Locale.ROOT).contains(profileName.toLowerCase(Locale.ROOT))) {
                failures.add("message_missing_name");
            }
        }
        String lower = text.toLowerCase(Locale.ROOT);
        for (String forbidden : forbiddenSubstrings) {
            if (!forbidden.isBlank() && lower.contains(forbidden.toLowerCase(Locale.ROOT))) {
                failures.add("message_contains_forbidden:" + forbidden);
            }
        }
        return failures;
    }
}
