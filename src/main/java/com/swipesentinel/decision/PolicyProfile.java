package com.swipesentinel.decision;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.swipesentinel.core.ConfigException;
import com.swipesentinel.util.JsonSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Swipe, message and persona policy for one run, loaded from a profile JSON file.
 *
 * <pre>
 * {
 *   "name": "weekday_profile",
 *   "swipe_policy":   { "min_quality_score_like": 70, "require_flags_all": [], "block_prompt_keywords": [],
 *                       "max_likes": 20, "max_passes": 120 },
 *   "message_policy": { "enabled": false, "min_quality_score_to_message": 85, "max_messages": 5,
 *                       "template": "Hey {{name}}, how's your week going?" },
 *   "persona_spec":   { "archetype": "...", "max_message_chars": 180, "require_question": true, ... },
 *   "llm_criteria":   { }
 * }
 * </pre>
 *
 * {@code swipe_policy} and {@code message_policy} are required; every field inside
 * has a default. Immutable: directive overrides produce a new instance.
 */
public final class PolicyProfile {

    private static final Logger log = LoggerFactory.getLogger(PolicyProfile.class);

    public static final String DEFAULT_NAME              = "swipe_profile";
    public static final int    DEFAULT_LIKE_THRESHOLD    = 70;
    public static final int    DEFAULT_MAX_LIKES         = 20;
    public static final int    DEFAULT_MAX_PASSES        = 120;
    public static final int    DEFAULT_MESSAGE_THRESHOLD = 85;
    public static final int    DEFAULT_MAX_MESSAGES      = 5;
    public static final String DEFAULT_TEMPLATE          = "Hey {{name}}, how's your week going?";
    public static final int    DEFAULT_MAX_MESSAGE_CHARS = 180;
    public static final int    MAX_MESSAGE_CHARS_LIMIT   = 500;

    // ── Policy sections ───────────────────────────────────────────────────────

    public record SwipePolicy(
            @JsonProperty("min_quality_score_like") int minQualityScoreLike,
            @JsonProperty("require_flags_all") Set<String> requireFlagsAll,
            @JsonProperty("block_prompt_keywords") List<String> blockPromptKeywords,
            @JsonProperty("max_likes") int maxLikes,
            @JsonProperty("max_passes") int maxPasses) {

        public SwipePolicy {
            requireFlagsAll = Set.copyOf(requireFlagsAll);
            blockPromptKeywords = List.copyOf(blockPromptKeywords);
        }
    }

    public record MessagePolicy(
            boolean enabled,
            @JsonProperty("min_quality_score_to_message") int minQualityScoreToMessage,
            @JsonProperty("max_messages") int maxMessages,
            String template) {}

    public record PersonaSpec(
            String archetype,
            String intent,
            @JsonProperty("tone_traits") List<String> toneTraits,
            @JsonProperty("hard_boundaries") List<String> hardBoundaries,
            @JsonProperty("preferred_signals") List<String> preferredSignals,
            @JsonProperty("avoid_signals") List<String> avoidSignals,
            @JsonProperty("opener_strategy") String openerStrategy,
            List<String> examples,
            @JsonProperty("max_message_chars") int maxMessageChars,
            @JsonProperty("require_question") boolean requireQuestion) {

        static PersonaSpec defaults() {
            return new PersonaSpec(
                "intentional_warm_connector",
                "Find emotionally available, high-intent matches for meaningful dating.",
                List.of("warm", "curious", "grounded", "playful"),
                List.of("No sexual content in first message",
                        "No manipulative or negging language",
                        "No pressure to move off-app immediately"),
                List.of("Specific prompt answers with personality",
                        "Evidence of emotional maturity",
                        "Signs of an active lifestyle"),
                List.of("Profile hostility", "Heavy cynicism", "Low-effort one-word prompts"),
                "Reference one concrete profile detail and end with one easy-to-answer question.",
                List.of("You mentioned learning salsa. What's been the hardest move to get right so far?",
                        "Your travel prompt made me laugh. What's your most controversial airport opinion?"),
                DEFAULT_MAX_MESSAGE_CHARS,
                true);
        }
    }

    private final String              name;
    private final SwipePolicy         swipePolicy;
    private final MessagePolicy       messagePolicy;
    private final PersonaSpec         personaSpec;
    private final Map<String, Object> llmCriteria;

    public PolicyProfile(String name, SwipePolicy swipePolicy, MessagePolicy messagePolicy,
                         PersonaSpec personaSpec, Map<String, Object> llmCriteria) {
        this.name          = name;
        this.swipePolicy   = swipePolicy;
        this.messagePolicy = messagePolicy;
        this.personaSpec   = personaSpec;
        this.llmCriteria   = llmCriteria != null ? Map.copyOf(llmCriteria) : Map.of();
    }

    /** Built-in defaults; messaging disabled. */
    public static PolicyProfile defaults() {
        return new PolicyProfile(DEFAULT_NAME,
            new SwipePolicy(DEFAULT_LIKE_THRESHOLD, Set.of(), List.of(), DEFAULT_MAX_LIKES, DEFAULT_MAX_PASSES),
            new MessagePolicy(false, DEFAULT_MESSAGE_THRESHOLD, DEFAULT_MAX_MESSAGES, DEFAULT_TEMPLATE),
            PersonaSpec.defaults(),
            Map.of());
    }

    // ── Getters ───────────────────────────────────────────────────────────────

    public String              getName()          { return name; }
    public SwipePolicy         getSwipePolicy()   { return swipePolicy; }
    public MessagePolicy       getMessagePolicy() { return messagePolicy; }
    public PersonaSpec         getPersonaSpec()   { return personaSpec; }
    public Map<String, Object> getLlmCriteria()   { return llmCriteria; }

    // ── Directive overrides ───────────────────────────────────────────────────

    /** Returns a copy with the directive's swipe and message overrides applied. */
    public PolicyProfile withDirective(Directive d) {
        SwipePolicy s = swipePolicy;
        SwipePolicy swipe = new SwipePolicy(
            d.minQualityScoreLike() != null ? d.minQualityScoreLike() : s.minQualityScoreLike(),
            s.requireFlagsAll(),
            s.blockPromptKeywords(),
            d.maxLikes() != null ? d.maxLikes() : s.maxLikes(),
            d.maxPasses() != null ? d.maxPasses() : s.maxPasses());

        MessagePolicy m = messagePolicy;
        MessagePolicy message = new MessagePolicy(
            d.messageEnabled() != null ? d.messageEnabled() : m.enabled(),
            m.minQualityScoreToMessage(),
            d.maxMessages() != null ? d.maxMessages() : m.maxMessages(),
            m.template());

        return new PolicyProfile(name, swipe, message, personaSpec, llmCriteria);
    }

    // ── Loading ───────────────────────────────────────────────────────────────

    /**
     * Loads and validates a profile file.
     *
     * @throws ConfigException if the file is unreadable, a required section is
     *         missing, or any field has the wrong type or range
     */
    public static PolicyProfile load(Path path) {
        ObjectMapper mapper = JsonSupport.compactMapper();
        JsonNode root;
        try {
            root = mapper.readTree(Files.readString(path));
        } catch (IOException e) {
            throw new ConfigException("Cannot read profile " + path + ": " + e.getMessage(), e);
        }
        PolicyProfile profile = fromJson(root, path.toString());
        log.info("PolicyProfile: loaded '{}' from {}", profile.getName(), path);
        return profile;
    }

    static PolicyProfile fromJson(JsonNode root, String ctx) {
        if (root == null || !root.isObject()) throw new ConfigException(ctx + ": profile must be a JSON object");

        JsonNode swipe   = requireObject(root, "swipe_policy", ctx);
        JsonNode message = requireObject(root, "message_policy", ctx);
        JsonNode persona = optionalObject(root, "persona_spec", ctx);
        JsonNode criteria = optionalObject(root, "llm_criteria", ctx);

        SwipePolicy swipePolicy = new SwipePolicy(
            positiveInt(swipe, "min_quality_score_like", DEFAULT_LIKE_THRESHOLD, ctx),
            new TreeSet<>(stringList(swipe, "require_flags_all", List.of(), ctx)),
            stringList(swipe, "block_prompt_keywords", List.of(), ctx).stream()
                .map(k -> k.toLowerCase(Locale.ROOT)).toList(),
            positiveInt(swipe, "max_likes", DEFAULT_MAX_LIKES, ctx),
            positiveInt(swipe, "max_passes", DEFAULT_MAX_PASSES, ctx));

        MessagePolicy messagePolicy = new MessagePolicy(
            message.path("enabled").asBoolean(false),
            positiveInt(message, "min_quality_score_to_message", DEFAULT_MESSAGE_THRESHOLD, ctx),
            positiveInt(message, "max_messages", DEFAULT_MAX_MESSAGES, ctx),
            text(message, "template", DEFAULT_TEMPLATE));

        PersonaSpec d = PersonaSpec.defaults();
        PersonaSpec personaSpec = new PersonaSpec(
            text(persona, "archetype", d.archetype()),
            text(persona, "intent", d.intent()),
            stringList(persona, "tone_traits", d.toneTraits(), ctx),
            stringList(persona, "hard_boundaries", d.hardBoundaries(), ctx),
            stringList(persona, "preferred_signals", d.preferredSignals(), ctx),
            stringList(persona, "avoid_signals", d.avoidSignals(), ctx),
            text(persona, "opener_strategy", d.openerStrategy()),
            stringList(persona, "examples", d.examples(), ctx),
            positiveInt(persona, "max_message_chars", DEFAULT_MAX_MESSAGE_CHARS, ctx),
            persona.path("require_question").asBoolean(true));
        if (personaSpec.maxMessageChars() > MAX_MESSAGE_CHARS_LIMIT) {
            throw new ConfigException(ctx + ": persona_spec.max_message_chars must be <= " + MAX_MESSAGE_CHARS_LIMIT);
        }

        Map<String, Object> llmCriteria = JsonSupport.compactMapper()
            .convertValue(criteria, new TypeReference<LinkedHashMap<String, Object>>() {});

        return new PolicyProfile(text(root, "name", DEFAULT_NAME), swipePolicy, messagePolicy, personaSpec, llmCriteria);
    }

    // ── Field helpers ─────────────────────────────────────────────────────────

    private static JsonNode requireObject(JsonNode root, String field, String ctx) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) throw new ConfigException(ctx + ": '" + field + "' is required");
        if (!node.isObject()) throw new ConfigException(ctx + ": '" + field + "' must be an object");
        return node;
    }

    private static JsonNode optionalObject(JsonNode root, String field, String ctx) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) return JsonSupport.compactMapper().createObjectNode();
        if (!node.isObject()) throw new ConfigException(ctx + ": '" + field + "' must be an object");
        return node;
    }

    private static int positiveInt(JsonNode section, String field, int def, String ctx) {
        JsonNode node = section.get(field);
        if (node == null || node.isNull()) return def;
        if (!node.canConvertToInt() || !node.isIntegralNumber() || node.asInt() <= 0) {
            throw new ConfigException(ctx + ": '" + field + "' must be a positive integer");
        }
        return node.asInt();
    }

    private static String text(JsonNode section, String field, String def) {
        JsonNode node = section.get(field);
        return node != null && node.isTextual() && !node.asText().isBlank() ? node.asText().trim() : def;
    }

    private static List<String> stringList(JsonNode section, String field, List<String> def, String ctx) {
        JsonNode node = section.get(field);
        if (node == null || node.isNull()) return def;
        if (!node.isArray()) throw new ConfigException(ctx + ": '" + field + "' must be a list of strings");
        List<String> out = new ArrayList<>();
        for (Iterator<JsonNode> it = node.elements(); it.hasNext(); ) {
            JsonNode e = it.next();
            if (!e.isTextual() || e.asText().isBlank()) {
                throw new ConfigException(ctx + ": '" + field + "' must contain only non-empty strings");
            }
            out.add(e.asText().trim());
        }
        return out;
    }
}
