package com.swipesentinel.decision;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.swipesentinel.api.ModelApiGateway;
import com.swipesentinel.api.ModelCallException;
import com.swipesentinel.api.ModelClient;
import com.swipesentinel.api.ModelErrorKind;
import com.swipesentinel.api.ModelReply;
import com.swipesentinel.model.ActionPlan;
import com.swipesentinel.model.PacketContext;
import com.swipesentinel.prompt.PromptEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Asks the model for {@code {action, reason, message_text, target_id}} and accepts
 * the answer only if it passes {@link DecisionOutputValidator} unchanged.
 *
 * Never falls back by itself: every failure comes back as an ERROR outcome and
 * {@link DecisionEngine} decides what to do with it.
 */
public class ModelDrivenPolicy implements DecisionPolicy {

    private static final Logger log = LoggerFactory.getLogger(ModelDrivenPolicy.class);

    static final String DEFAULT_REASON = "llm_selected_action";

    private final ModelClient             client;
    private final PromptEngine            promptEngine;
    private final DecisionOutputValidator validator;
    private final PolicyProfile           profile;
    private final DecisionEngineConfig    config;

    public ModelDrivenPolicy(ModelClient client, PolicyProfile profile, DecisionEngineConfig config) {
        this(client, new PromptEngine(), new DecisionOutputValidator(), profile, config);
    }

    public ModelDrivenPolicy(ModelClient client, PromptEngine promptEngine, DecisionOutputValidator validator,
                             PolicyProfile profile, DecisionEngineConfig config) {
        this.client       = client;
        this.promptEngine = promptEngine;
        this.validator    = validator;
        this.profile      = profile;
        this.config       = config;
    }

    @Override
    public DecisionOutcome decide(PacketContext ctx, Directive directive) {
        ObjectNode request = promptEngine.buildDecisionRequest(ctx, profile, directive.query(), config);
        ModelReply reply = client.complete(request);
        if (!reply.isOk()) {
            return DecisionOutcome.error(reply.getErrorKind(), reply.getErrorMessage(), reply.toTrace());
        }

        ActionPlan plan;
        try {
            plan = parsePlan(reply.getContent());
        } catch (ModelCallException e) {
            log.warn("ModelDrivenPolicy: unusable model output: {}", e.getMessage());
            return DecisionOutcome.error(e.getKind(), e.getMessage(), reply.toRejectedTrace(e.getKind(), e.getMessage()));
        }

        DecisionCheck check = validator.validate(plan.actionId(), plan.reason(), plan.messageText(),
            plan.targetId(), ctx, profile.getPersonaSpec());
        if (!check.ok()) {
            String detail = String.join(",", check.issues());
            log.warn("ModelDrivenPolicy: rejected '{}' on {}: {}", plan.actionId(), ctx.getScreenType(), detail);
            return DecisionOutcome.error(ModelErrorKind.INVALID_DECISION, detail,
                reply.toRejectedTrace(ModelErrorKind.INVALID_DECISION, detail), check);
        }

        log.info("ModelDrivenPolicy: {} -> {} ({})", ctx.getScreenType(), plan.actionId(), plan.reason());
        return DecisionOutcome.ok(plan, reply.toTrace(), check);
    }

    static ActionPlan parsePlan(String content) throws ModelCallException {
        JsonNode node = ModelApiGateway.extractJsonObject(content);

        JsonNode action = node.get("action");
        if (action == null || !action.isTextual() || action.asText().isBlank()) {
            throw new ModelCallException(ModelErrorKind.MALFORMED_RESPONSE, "Missing or non-string 'action'");
        }
        JsonNode reason = node.get("reason");
        String reasonText = reason != null && reason.isTextual() && !reason.asText().isBlank()
            ? reason.asText().strip() : DEFAULT_REASON;

        return ActionPlan.llm(action.asText().strip(), optionalText(node, "target_id"), reasonText,
            optionalText(node, "message_text"));
    }

    private static String optionalText(JsonNode node, String field) throws ModelCallException {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) return null;
        if (!value.isTextual()) {
            throw new ModelCallException(ModelErrorKind.MALFORMED_RESPONSE, "'" + field + "' must be a string or null");
        }
        return value.asText();
    }
}
