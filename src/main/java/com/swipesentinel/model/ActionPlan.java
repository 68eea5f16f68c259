package com.swipesentinel.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The Decision Engine's choice for one cycle. Produced once, consumed exactly
 * once by the executor.
 *
 * @param targetId       optional target within the current observation
 * @param messageText    text to send, only for message-bearing actions
 * @param fallbackReason set only when {@code source == LLM_FALLBACK}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record ActionPlan(
        @JsonProperty("action_id") String actionId,
        @JsonProperty("target_id") String targetId,
        @JsonProperty("message_text") String messageText,
        String reason,
        DecisionSource source,
        @JsonProperty("fallback_reason") String fallbackReason) {

    public static ActionPlan deterministic(String actionId, String reason, String messageText) {
        return new ActionPlan(actionId, null, messageText, reason, DecisionSource.DETERMINISTIC, null);
    }

    public static ActionPlan llm(String actionId, String targetId, String reason, String messageText) {
        return new ActionPlan(actionId, targetId, messageText, reason, DecisionSource.LLM, null);
    }

    /** Re-labels a deterministic plan as the product of a model fallback. */
    public ActionPlan asFallback(String fallbackReason) {
        return new ActionPlan(actionId, targetId, messageText, reason, DecisionSource.LLM_FALLBACK, fallbackReason);
    }

    public boolean hasMessage() {
        return messageText != null && !messageText.isBlank();
    }
}
