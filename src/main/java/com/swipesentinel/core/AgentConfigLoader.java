package com.swipesentinel.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.swipesentinel.capture.appium.AppiumConfig;
import com.swipesentinel.decision.DecisionEngineConfig;
import com.swipesentinel.decision.PolicyProfile;
import com.swipesentinel.judge.JudgeConfig;
import com.swipesentinel.session.SessionConfig;
import com.swipesentinel.util.JsonSupport;
import com.swipesentinel.validation.ChangeDetection;
import com.swipesentinel.validation.ValidationConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Reads the agent config file.
 *
 * <pre>
 * {
 *   "session":         { "name", "target_package", "dry_run", "max_actions", "max_runtime_s",
 *                        "loop_sleep_ms", "artifacts_dir", "recovery": { "max_attempts", "cooldown_ms" } },
 *   "appium":          { "server_url", "device_name", "udid", "app_activity", "no_reset",
 *                        "command_timeout_s", "capture_screenshot" },
 *   "decision_engine": { "type", "llm_failure_mode", "llm": { "model", "temperature", "timeout_s",
 *                        "api_key_env", "base_url", "include_screenshot", "image_detail",
 *                        "max_observed_strings", "max_tokens", "retry_backoff_ms", "log_prompts" } },
 *   "validation":      { "enabled", "settle_ms", "require_screen_change_for", "max_consecutive_failures",
 *                        "change_detection" },
 *   "judge":           { "enabled", "model", "max_tokens", "max_invocations", "rubric_version",
 *                        "cache_path", "base_url", "api_key_env", "timeout_s", "retry_backoff_ms",
 *                        "pass_score" },
 *   "profile_json_path": "profile.json"
 * }
 * </pre>
 *
 * Every section is optional and every field has the default of its config class.
 * Unknown keys are rejected. Relative paths resolve against the config file's
 * directory. API keys are read from the environment variable named by {@code api_key_env}.
 */
public class AgentConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(AgentConfigLoader.class);

    private static final Set<String> ROOT_KEYS       = Set.of("session", "appium", "decision_engine",
                                                              "validation", "judge", "profile_json_path");
    private static final Set<String> SESSION_KEYS    = Set.of("name", "target_package", "dry_run", "max_actions",
                                                              "max_runtime_s", "loop_sleep_ms", "artifacts_dir",
                                                              "recovery");
    private static final Set<String> RECOVERY_KEYS   = Set.of("max_attempts", "cooldown_ms");
    private static final Set<String> APPIUM_KEYS     = Set.of("server_url", "device_name", "udid", "app_activity",
                                                              "no_reset", "command_timeout_s", "capture_screenshot");
    private static final Set<String> ENGINE_KEYS     = Set.of("type", "llm_failure_mode", "llm");
    private static final Set<String> LLM_KEYS        = Set.of("model", "temperature", "timeout_s", "api_key_env",
                                                              "base_url", "include_screenshot", "image_detail",
                                                              "max_observed_strings", "max_tokens",
                                                              "retry_backoff_ms", "log_prompts");
    private static final Set<String> VALIDATION_KEYS = Set.of("enabled", "settle_ms", "require_screen_change_for",
                                                              "max_consecutive_failures", "change_detection");
    private static final Set<String> JUDGE_KEYS      = Set.of("enabled", "model", "max_tokens", "max_invocations",
                                                              "rubric_version", "cache_path", "base_url",
                                                              "api_key_env", "timeout_s", "retry_backoff_ms",
                                                              "pass_score");

    private final UnaryOperator<String> env;

    public AgentConfigLoader() {
        this(System::getenv);
    }

    /** @param env environment lookup, replaceable in tests */
    public AgentConfigLoader(UnaryOperator<String> env) {
        this.env = env;
    }

    /**
     * @throws ConfigException when the file is unreadable, not a JSON object, has an
     *         unknown key, or any section fails its config's validation
     */
    public AgentConfig load(Path path) {
        String text;
        try {
            text = Files.readString(path);
        } catch (IOException e) {
            throw new ConfigException("Cannot read config " + path + ": " + e.getMessage(), e);
        }
        JsonNode root;
        try {
            root = JsonSupport.compactMapper().readTree(text);
        } catch (JsonProcessingException e) {
            throw new ConfigException("Config " + path + " is not valid JSON: " + e.getOriginalMessage(), e);
        }
        Path baseDir = path.toAbsolutePath().getParent();
        AgentConfig config = parse(root, baseDir);
        log.info("AgentConfigLoader: loaded {} (engine={}, profile='{}', dryRun={})", path,
            config.decisionEngine().label(), config.profile().getName(), config.session().isDryRun());
        return config;
    }

    AgentConfig parse(JsonNode root, Path baseDir) {
        if (root == null || !root.isObject()) throw new ConfigException("config must be a JSON object");
        requireKnown(root, ROOT_KEYS, "config");

        PolicyProfile profile = PolicyProfile.defaults();
        String profilePath = text(root, "profile_json_path", null, "config");
        if (profilePath != null) profile = PolicyProfile.load(resolve(baseDir, profilePath));

        return new AgentConfig(
            session(section(root, "session"), baseDir),
            appium(section(root, "appium")),
            decisionEngine(section(root, "decision_engine")),
            validation(section(root, "validation")),
            judge(section(root, "judge"), baseDir),
            profile);
    }

    // ── Sections ──────────────────────────────────────────────────────────────

    private SessionConfig session(JsonNode s, Path baseDir) {
        requireKnown(s, SESSION_KEYS, "session");
        JsonNode recovery = section(s, "recovery");
        requireKnown(recovery, RECOVERY_KEYS, "session.recovery");

        SessionConfig.Builder b = SessionConfig.builder()
            .sessionName(text(s, "name", SessionConfig.DEFAULT_SESSION_NAME, "session"))
            .targetPackage(text(s, "target_package", SessionConfig.DEFAULT_TARGET_PACKAGE, "session"))
            .dryRun(bool(s, "dry_run", true, "session"))
            .maxActions(integer(s, "max_actions", SessionConfig.DEFAULT_MAX_ACTIONS, "session"))
            .maxRuntimeSeconds(integer(s, "max_runtime_s", SessionConfig.DEFAULT_MAX_RUNTIME_SECONDS, "session"))
            .loopSleepMs(integer(s, "loop_sleep_ms", (int) SessionConfig.DEFAULT_LOOP_SLEEP_MS, "session"))
            .recoveryMaxAttempts(integer(recovery, "max_attempts", SessionConfig.DEFAULT_RECOVERY_ATTEMPTS,
                "session.recovery"))
            .recoveryCooldownMs(integer(recovery, "cooldown_ms", (int) SessionConfig.DEFAULT_RECOVERY_COOLDOWN_MS,
                "session.recovery"));
        String artifacts = text(s, "artifacts_dir", null, "session");
        if (artifacts != null) b.artifactsDir(resolve(baseDir, artifacts));
        return b.build();
    }

    private AppiumConfig appium(JsonNode a) {
        requireKnown(a, APPIUM_KEYS, "appium");
        return AppiumConfig.builder()
            .serverUrl(text(a, "server_url", AppiumConfig.DEFAULT_SERVER_URL, "appium"))
            .deviceName(text(a, "device_name", AppiumConfig.DEFAULT_DEVICE_NAME, "appium"))
            .udid(text(a, "udid", null, "appium"))
            .appActivity(text(a, "app_activity", null, "appium"))
            .noReset(bool(a, "no_reset", true, "appium"))
            .commandTimeoutSeconds(integer(a, "command_timeout_s", AppiumConfig.DEFAULT_COMMAND_TIMEOUT_S, "appium"))
            .captureScreenshot(bool(a, "capture_screenshot", true, "appium"))
            .build();
    }

    private DecisionEngineConfig decisionEngine(JsonNode d) {
        requireKnown(d, ENGINE_KEYS, "decision_engine");
        JsonNode llm = section(d, "llm");
        requireKnown(llm, LLM_KEYS, "decision_engine.llm");

        String keyEnv = text(llm, "api_key_env", DecisionEngineConfig.DEFAULT_API_KEY_ENV, "decision_engine.llm");
        return DecisionEngineConfig.builder()
            .engineType(DecisionEngineConfig.parseEngineType(text(d, "type", "deterministic", "decision_engine")))
            .failureMode(DecisionEngineConfig.parseFailureMode(
                text(d, "llm_failure_mode", "fail", "decision_engine")))
            .model(text(llm, "model", DecisionEngineConfig.DEFAULT_MODEL, "decision_engine.llm"))
            .temperature(number(llm, "temperature", DecisionEngineConfig.DEFAULT_TEMPERATURE, "decision_engine.llm"))
            .timeoutSeconds(integer(llm, "timeout_s", DecisionEngineConfig.DEFAULT_TIMEOUT_SECONDS,
                "decision_engine.llm"))
            .baseUrl(text(llm, "base_url", DecisionEngineConfig.DEFAULT_BASE_URL, "decision_engine.llm"))
            .apiKeyEnv(keyEnv)
            .apiKey(env.apply(keyEnv))
            .includeScreenshot(bool(llm, "include_screenshot", true, "decision_engine.llm"))
            .imageDetail(DecisionEngineConfig.parseImageDetail(
                text(llm, "image_detail", "low", "decision_engine.llm")))
            .maxObservedStrings(integer(llm, "max_observed_strings", DecisionEngineConfig.DEFAULT_MAX_OBSERVED,
                "decision_engine.llm"))
            .maxTokens(integer(llm, "max_tokens", DecisionEngineConfig.DEFAULT_MAX_TOKENS, "decision_engine.llm"))
            .retryBackoffMs(integer(llm, "retry_backoff_ms", (int) DecisionEngineConfig.DEFAULT_RETRY_BACKOFF_MS,
                "decision_engine.llm"))
            .logPrompts(bool(llm, "log_prompts", false, "decision_engine.llm"))
            .build();
    }

    private ValidationConfig validation(JsonNode v) {
        requireKnown(v, VALIDATION_KEYS, "validation");
        ValidationConfig.Builder b = ValidationConfig.builder()
            .enabled(bool(v, "enabled", true, "validation"))
            .settleMs(integer(v, "settle_ms", (int) ValidationConfig.DEFAULT_SETTLE_MS, "validation"))
            .maxConsecutiveFailures(integer(v, "max_consecutive_failures",
                ValidationConfig.DEFAULT_MAX_CONSECUTIVE_FAILURES, "validation"))
            .changeDetection(ChangeDetection.parse(text(v, "change_detection",
                ValidationConfig.DEFAULT_CHANGE_DETECTION.name(), "validation")));
        if (v.has("require_screen_change_for")) {
            b.requireScreenChangeFor(stringList(v, "require_screen_change_for", "validation"));
        }
        return b.build();
    }

    private JudgeConfig judge(JsonNode j, Path baseDir) {
        requireKnown(j, JUDGE_KEYS, "judge");
        String keyEnv = text(j, "api_key_env", JudgeConfig.DEFAULT_API_KEY_ENV, "judge");
        String cache = text(j, "cache_path", null, "judge");
        return JudgeConfig.builder()
            .enabled(bool(j, "enabled", false, "judge"))
            .model(text(j, "model", JudgeConfig.DEFAULT_MODEL, "judge"))
            .maxTokens(integer(j, "max_tokens", JudgeConfig.DEFAULT_MAX_TOKENS, "judge"))
            .maxInvocations(integer(j, "max_invocations", JudgeConfig.DEFAULT_MAX_INVOCATIONS, "judge"))
            .rubricVersion(text(j, "rubric_version", JudgeConfig.DEFAULT_RUBRIC_VERSION, "judge"))
            .cachePath(cache != null ? resolve(baseDir, cache) : null)
            .baseUrl(text(j, "base_url", JudgeConfig.DEFAULT_BASE_URL, "judge"))
            .apiKeyEnv(keyEnv)
            .apiKey(env.apply(keyEnv))
            .timeoutSeconds(integer(j, "timeout_s", JudgeConfig.DEFAULT_TIMEOUT_SECONDS, "judge"))
            .retryBackoffMs(integer(j, "retry_backoff_ms", (int) JudgeConfig.DEFAULT_RETRY_BACKOFF_MS, "judge"))
            .passScore(integer(j, "pass_score", 0, "judge"))
            .build();
    }

    // ── Field helpers ─────────────────────────────────────────────────────────

    private static JsonNode section(JsonNode parent, String key) {
        JsonNode n = parent.get(key);
        if (n == null || n.isNull()) return JsonSupport.compactMapper().createObjectNode();
        if (!n.isObject()) throw new ConfigException(key + " must be a JSON object");
        return n;
    }

    private static void requireKnown(JsonNode node, Set<String> allowed, String ctx) {
        List<String> unknown = new ArrayList<>();
        Iterator<String> names = node.fieldNames();
        while (names.hasNext()) {
            String name = names.next();
            if (!allowed.contains(name)) unknown.add(name);
        }
        if (!unknown.isEmpty()) {
            throw new ConfigException(ctx + ": unknown key(s) " + unknown + ", allowed: " + allowed.stream().sorted().toList());
        }
    }

    private static String text(JsonNode node, String key, String def, String ctx) {
        JsonNode n = node.get(key);
        if (n == null || n.isNull()) return def;
        if (!n.isTextual()) throw new ConfigException(ctx + "." + key + " must be a string");
        String v = n.asText().trim();
        return v.isEmpty() ? def : v;
    }

    private static boolean bool(JsonNode node, String key, boolean def, String ctx) {
        JsonNode n = node.get(key);
        if (n == null || n.isNull()) return def;
        if (!n.isBoolean()) throw new ConfigException(ctx + "." + key + " must be a boolean");
        return n.asBoolean();
    }

    private static int integer(JsonNode node, String key, int def, String ctx) {
        JsonNode n = node.get(key);
        if (n == null || n.isNull()) return def;
        if (!n.isIntegralNumber() || !n.canConvertToInt()) {
            throw new ConfigException(ctx + "." + key + " must be an integer");
        }
        return n.asInt();
    }

    private static double number(JsonNode node, String key, double def, String ctx) {
        JsonNode n = node.get(key);
        if (n == null || n.isNull()) return def;
        if (!n.isNumber()) throw new ConfigException(ctx + "." + key + " must be a number");
        return n.asDouble();
    }

    private static List<String> stringList(JsonNode node, String key, String ctx) {
        JsonNode n = node.get(key);
        if (!n.isArray()) throw new ConfigException(ctx + "." + key + " must be an array of strings");
        List<String> out = new ArrayList<>();
        for (JsonNode item : n) {
            if (!item.isTextual()) throw new ConfigException(ctx + "." + key + " must contain only strings");
            out.add(item.asText().trim());
        }
        return out;
    }

    private static Path resolve(Path baseDir, String raw) {
        Path p = Path.of(raw);
        return p.isAbsolute() || baseDir == null ? p : baseDir.resolve(p);
    }
}
