package com.swipesentinel.prompt;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.swipesentinel.action.ActionCatalog;
import com.swipesentinel.action.ActionCatalogEntry;
import com.swipesentinel.decision.DecisionEngineConfig;
import com.swipesentinel.decision.PolicyProfile;
import com.swipesentinel.model.ActionPlan;
import com.swipesentinel.model.InteractionTarget;
import com.swipesentinel.model.PacketContext;
import com.swipesentinel.util.JsonSupport;

import java.util.Base64;
import java.util.List;
import java.util.TreeSet;

/**
 * Builds the chat-completions request bodies for the decision model and the judge.
 *
 * Prompt architecture (in order):
 *  1. System message - role, output keys and hard rules
 *  2. User message   - one JSON text block (actions, catalog, directive, profile, packet),
 *                      plus the screenshot as an image block when enabled and present
 *
 * Both bodies request {@code response_format: json_object}.
 */
public class PromptEngine {

    // ── System Prompts ────────────────────────────────────────────────────────

    public static final String SYSTEM_PROMPT_DECISION = """
        You are an autonomous action selector and first-message writer for a dating app. \
        Decide the safest next action for the current screen. \
        Return strict JSON with keys: action (string), reason (string), message_text (string|null), \
        target_id (string|null). \
        Action must be exactly one of available_actions. \
        Respect profile persona_spec and hard_boundaries. \
        If action is send_message, provide concise message_text that follows opener_strategy \
        and max_message_chars. If action is not send_message, message_text must be null. \
        target_id, when given, must be one of packet.targets. \
        Do not include any additional keys.""";

    public static final String SYSTEM_PROMPT_JUDGE = """
        You are a strict evaluator for an autonomous dating-app controller. \
        Score the candidate decision for correctness, message quality, and safety. \
        Output ONLY strict JSON with the required_output_schema keys.""";

    static final List<String> JUDGE_RULES = List.of(
        "Candidate action must be one of available_actions.",
        "If action != 'send_message' then message_text must be null/empty.",
        "If action == 'send_message' then message_text must be present and obey persona_spec: tone_traits, hard_boundaries.",
        "Penalize any attempt to move off-app (phone number, email, social handles, URLs).",
        "If persona_spec.require_question is true, candidate should include exactly one question mark when possible.",
        "Prefer referencing something visible in packet.observed_strings or packet.quality_features.prompt_answer.",
        "Return strict JSON only; do not add extra keys.");

    private final ObjectMapper mapper = JsonSupport.compactMapper();

    // ── Decision request ──────────────────────────────────────────────────────

    public ObjectNode buildDecisionRequest(PacketContext ctx, PolicyProfile profile, String commandQuery,
                                           DecisionEngineConfig config) {
        ObjectNode user = mapper.createObjectNode();
        user.set("available_actions", mapper.valueToTree(ctx.getAvailableActions()));
        user.set("action_catalog", catalogJson());
        user.put("command_query", commandQuery);
        user.set("profile", profileJson(profile));
        user.set("packet", packetJson(ctx, config.getMaxObservedStrings()));

        ObjectNode root = mapper.createObjectNode();
        root.put("model", config.getModel());
        root.put("temperature", config.getTemperature());
        root.put("max_tokens", config.getMaxTokens());
        root.putObject("response_format").put("type", "json_object");

        ArrayNode messages = root.putArray("messages");
        messages.addObject().put("role", "system").put("content", SYSTEM_PROMPT_DECISION);

        ObjectNode userMessage = messages.addObject().put("role", "user");
        ArrayNode content = userMessage.putArray("content");
        content.addObject().put("type", "text").put("text", user.toString());
        if (config.isIncludeScreenshot() && ctx.hasScreenshot()) {
            ObjectNode image = content.addObject().put("type", "image_url");
            image.putObject("image_url")
                .put("url", "data:image/png;base64," + Base64.getEncoder().encodeToString(ctx.getScreenshotPng()))
                .put("detail", config.getImageDetail().wireName());
        }
        return root;
    }

    // ── Judge request ─────────────────────────────────────────────────────────

    public ObjectNode buildJudgeRequest(String model, int maxTokens, String rubricVersion,
                                        JsonNode packet, PolicyProfile profile, String nlQuery,
                                        ActionPlan candidate) {
        ObjectNode user = mapper.createObjectNode();
        user.put("rubric_version", rubricVersion);
        user.put("nl_query", nlQuery);
        user.set("available_actions", packet.path("available_actions"));
        user.set("packet", packet);
        user.set("profile", profileJson(profile));
        ObjectNode cand = user.putObject("candidate");
        cand.put("action", candidate.actionId());
        cand.put("reason", candidate.reason());
        cand.put("message_text", candidate.messageText());

        ObjectNode schema = user.putObject("required_output_schema");
        schema.put("ok", "boolean");
        schema.put("overall_score", "int 0..100");
        schema.put("action_alignment_score", "int 0..100");
        schema.put("message_quality_score", "int 0..100");
        schema.put("safety_score", "int 0..100");
        schema.put("reasons", "list[str] (short)");
        schema.put("violations", "list[str] (machine readable tags)");
        user.set("rules", mapper.valueToTree(JUDGE_RULES));

        ObjectNode root = mapper.createObjectNode();
        root.put("model", model);
        root.put("temperature", 0);
        root.put("max_tokens", maxTokens);
        root.putObject("response_format").put("type", "json_object");
        ArrayNode messages = root.putArray("messages");
        messages.addObject().put("role", "system").put("content", SYSTEM_PROMPT_JUDGE);
        messages.addObject().put("role", "user").put("content", user.toString());
        return root;
    }

    // ── Shared JSON views ─────────────────────────────────────────────────────

    /**
     * The packet as the model sees it. Observed strings are cut to {@code maxObservedStrings};
     * the screenshot travels separately.
     */
    public ObjectNode packetJson(PacketContext ctx, int maxObservedStrings) {
        ObjectNode p = mapper.createObjectNode();
        p.put("screen_type", ctx.getScreenType().wireName());
        p.put("quality_score", ctx.getQualityScore());
        p.put("quality_score_version", ctx.getQualityScoreVersion());
        p.set("quality_features", mapper.valueToTree(ctx.getQualityFeatures()));
        p.set("available_actions", mapper.valueToTree(ctx.getAvailableActions()));
        List<String> strings = ctx.getObservedStrings();
        p.set("observed_strings", mapper.valueToTree(strings.subList(0, Math.min(strings.size(), maxObservedStrings))));
        ArrayNode targets = p.putArray("targets");
        for (InteractionTarget t : ctx.getTargets()) {
            ObjectNode node = targets.addObject();
            node.put("target_id", t.targetId());
            node.put("kind", t.kind().wireName());
            node.put("label", t.label());
            node.set("context_text", mapper.valueToTree(t.contextText()));
        }
        p.set("counters", mapper.valueToTree(ctx.getCounters()));
        p.put("last_action", ctx.getLastAction());
        return p;
    }

    public ObjectNode profileJson(PolicyProfile profile) {
        ObjectNode node = mapper.createObjectNode();
        node.put("name", profile.getName());
        node.set("persona_spec", mapper.valueToTree(profile.getPersonaSpec()));

        PolicyProfile.SwipePolicy swipe = profile.getSwipePolicy();
        ObjectNode s = node.putObject("swipe_policy");
        s.put("min_quality_score_like", swipe.minQualityScoreLike());
        s.set("require_flags_all", mapper.valueToTree(new TreeSet<>(swipe.requireFlagsAll())));
        s.set("block_prompt_keywords", mapper.valueToTree(swipe.blockPromptKeywords()));
        s.put("max_likes", swipe.maxLikes());
        s.put("max_passes", swipe.maxPasses());

        node.set("message_policy", mapper.valueToTree(profile.getMessagePolicy()));
        node.set("llm_criteria", mapper.valueToTree(profile.getLlmCriteria()));
        return node;
    }

    private ArrayNode catalogJson() {
        ArrayNode arr = mapper.createArrayNode();
        for (ActionCatalogEntry e : ActionCatalog.entries()) {
            arr.addObject()
                .put("action", e.getActionId())
                .put("human_action", e.getHumanAction())
                .put("description", e.getDescription());
        }
        return arr;
    }
}
