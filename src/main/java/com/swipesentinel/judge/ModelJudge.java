package com.swipesentinel.judge;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.swipesentinel.api.ModelApiGateway;
import com.swipesentinel.api.ModelCallException;
import com.swipesentinel.api.ModelClient;
import com.swipesentinel.api.ModelErrorKind;
import com.swipesentinel.api.ModelReply;
import com.swipesentinel.core.ConfigException;
import com.swipesentinel.decision.PolicyProfile;
import com.swipesentinel.model.ActionPlan;
import com.swipesentinel.prompt.PromptEngine;
import com.swipesentinel.util.Hashing;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Scores candidate decisions with a judge model. Used only by the regression
 * runner, never by the live loop.
 *
 * Order of checks for every call:
 *   1. cache hit      -> CACHED (no budget used)
 *   2. budget spent   -> SKIPPED
 *   3. model call     -> SCORED, or ERROR when the call or its answer fails
 *
 * The budget counts model calls, including failed ones.
 */
public class ModelJudge {

    private static final Logger log = LoggerFactory.getLogger(ModelJudge.class);

    private final ModelClient  client;
    private final JudgeConfig  config;
    private final JudgeCache   cache;
    private final PromptEngine promptEngine = new PromptEngine();

    private int invocations;

    public ModelJudge(ModelClient client, JudgeConfig config, JudgeCache cache) {
        this.client = client;
        this.config = config;
        this.cache  = cache;
    }

    /** Wires a judge against the configured endpoint, with the configured cache file if any. */
    public static ModelJudge create(JudgeConfig config) {
        if (config.getApiKey() == null || config.getApiKey().isBlank()) {
            throw new ConfigException("Missing API key: environment variable '" + config.getApiKeyEnv()
                + "' is required for the judge");
        }
        ModelClient client = new ModelApiGateway(config.getBaseUrl(), config.getApiKey(),
            config.getTimeoutSeconds(), config.getRetryBackoffMs(), false);
        return new ModelJudge(client, config, new JudgeCache(config.getCachePath()));
    }

    // ── Primary API ───────────────────────────────────────────────────────────

    /**
     * @param packet    packet JSON as the decision model saw it
     * @param candidate the decision to score
     */
    public JudgeVerdict score(JsonNode packet, PolicyProfile profile, String nlQuery, ActionPlan candidate) {
        ObjectNode request = promptEngine.buildJudgeRequest(config.getModel(), config.getMaxTokens(),
            config.getRubricVersion(), packet, profile, nlQuery, candidate);

        String key = JudgeCache.key(config.getModel(),
            packetFingerprint(packet, profile, nlQuery),
            responseFingerprint(candidate));

        var cached = cache.get(key);
        if (cached.isPresent()) {
            log.debug("ModelJudge: cache hit {}", key.substring(0, 12));
            return JudgeVerdict.cached(cached.get());
        }
        if (invocations >= config.getMaxInvocations()) {
            return JudgeVerdict.skipped("judge_budget_exhausted (" + config.getMaxInvocations() + ")");
        }

        invocations++;
        ModelReply reply = client.complete(request);
        if (!reply.isOk()) {
            log.warn("ModelJudge: judge call failed ({}): {}", reply.getErrorKind(), reply.getErrorMessage());
            return JudgeVerdict.error(reply.getErrorKind().wireName() + ": " + reply.getErrorMessage());
        }

        JudgeScore score;
        try {
            score = parseScore(reply.getContent());
        } catch (ModelCallException e) {
            log.warn("ModelJudge: unreadable judge answer: {}", e.getMessage());
            return JudgeVerdict.error(e.getKind().wireName() + ": " + e.getMessage());
        }
        cache.put(key, score);
        log.info("ModelJudge: scored '{}' overall={} ({} of {} invocations used)",
            candidate.actionId(), score.overallScore(), invocations, config.getMaxInvocations());
        return JudgeVerdict.scored(score);
    }

    public int getInvocations()  { return invocations; }
    public JudgeConfig getConfig() { return config; }

    // ── Fingerprints ──────────────────────────────────────────────────────────

    String packetFingerprint(JsonNode packet, PolicyProfile profile, String nlQuery) {
        return Hashing.sha256Hex(config.getRubricVersion() + "\n" + nlQuery + "\n"
            + packet.toString() + "\n" + promptEngine.profileJson(profile).toString());
    }

    static String responseFingerprint(ActionPlan candidate) {
        return Hashing.sha256Hex(candidate.actionId() + "\n" + candidate.reason() + "\n" + candidate.messageText());
    }

    // ── Parsing ───────────────────────────────────────────────────────────────

    static JudgeScore parseScore(String content) throws ModelCallException {
        JsonNode node = ModelApiGateway.extractJsonObject(content);
        return new JudgeScore(
            node.path("ok").asBoolean(false),
            clamp(node, "overall_score"),
            clamp(node, "action_alignment_score"),
            clamp(node, "message_quality_score"),
            clamp(node, "safety_score"),
            strings(node, "reasons"),
            strings(node, "violations"));
    }

    private static int clamp(JsonNode node, String field) throws ModelCallException {
        JsonNode v = node.get(field);
        if (v == null || !v.isNumber()) {
            throw new ModelCallException(ModelErrorKind.MALFORMED_RESPONSE,
                "judge field '" + field + "' must be a number");
        }
        return Math.max(0, Math.min(100, v.asInt()));
    }

    private static List<String> strings(JsonNode node, String field) throws ModelCallException {
        JsonNode v = node.get(field);
        List<String> out = new ArrayList<>();
        if (v == null || v.isNull()) return out;
        if (!v.isArray()) {
            throw new ModelCallException(ModelErrorKind.MALFORMED_RESPONSE,
                "judge field '" + field + "' must be a list of strings");
        }
        for (JsonNode item : v) {
            String s = item.asText("").trim();
            if (!s.isEmpty()) out.add(s);
        }
        return out;
    }
}
