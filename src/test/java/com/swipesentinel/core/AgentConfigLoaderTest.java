package com.swipesentinel.core;

import com.swipesentinel.decision.DecisionEngineConfig;
import com.swipesentinel.judge.JudgeConfig;
import com.swipesentinel.validation.ChangeDetection;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class AgentConfigLoaderTest {

    private static final String PROFILE = """
        {
          "name": "weekday_profile",
          "swipe_policy":   { "min_quality_score_like": 75, "block_prompt_keywords": ["Crypto"] },
          "message_policy": { "enabled": true, "max_messages": 2 }
        }
        """;

    private Path dir;

    @BeforeMethod
    public void createDir() throws IOException {
        dir = Files.createTempDirectory("swipesentinel-config");
    }

    private Path write(String name, String json) throws IOException {
        Path path = dir.resolve(name);
        Files.writeString(path, json);
        return path;
    }

    private static AgentConfigLoader loader(Map<String, String> env) {
        return new AgentConfigLoader(env::get);
    }

    // ════════════════════════════════════════════════════════════════════════
    // Defaults and sections
    // ════════════════════════════════════════════════════════════════════════

    @Test
    public void emptyObject_givesDefaults() throws IOException {
        AgentConfig config = loader(Map.of()).load(write("agent.json", "{}"));

        assertThat(config.session().isDryRun()).isTrue();
        assertThat(config.session().getSessionName()).isEqualTo("live");
        assertThat(config.decisionEngine().isLlm()).isFalse();
        assertThat(config.validation().isEnabled()).isTrue();
        assertThat(config.judge().isEnabled()).isFalse();
        assertThat(config.judge().getRetryBackoffMs()).isEqualTo(JudgeConfig.DEFAULT_RETRY_BACKOFF_MS);
        assertThat(config.profile().getName()).isEqualTo("swipe_profile");
    }

    @Test
    public void fullConfig_isApplied() throws IOException {
        write("profile.json", PROFILE);
        Path path = write("agent.json", """
            {
              "session": { "name": "evening", "dry_run": false, "max_actions": 12,
                           "artifacts_dir": "out", "recovery": { "max_attempts": 1, "cooldown_ms": 50 } },
              "appium": { "device_name": "Pixel 8", "udid": "emulator-5554" },
              "decision_engine": { "type": "llm", "llm_failure_mode": "fallback_deterministic",
                                   "llm": { "model": "gpt-4o", "temperature": 0.3, "api_key_env": "MY_KEY" } },
              "validation": { "settle_ms": 100, "require_screen_change_for": ["like"],
                              "change_detection": "screen_type" },
              "judge": { "enabled": true, "cache_path": "cache/judge.jsonl", "pass_score": 60,
                         "retry_backoff_ms": 250 },
              "profile_json_path": "profile.json"
            }
            """);

        AgentConfig config = loader(Map.of("MY_KEY", "sk-llm", "OPENAI_API_KEY", "sk-judge")).load(path);

        assertThat(config.session().getSessionName()).isEqualTo("evening");
        assertThat(config.session().isDryRun()).isFalse();
        assertThat(config.session().getMaxActions()).isEqualTo(12);
        assertThat(config.session().getArtifactsDir()).isEqualTo(dir.toAbsolutePath().resolve("out"));
        assertThat(config.session().getRecoveryMaxAttempts()).isEqualTo(1);
        assertThat(config.appium().getUdid()).isEqualTo("emulator-5554");
        assertThat(config.decisionEngine().getApiKey()).isEqualTo("sk-llm");
        assertThat(config.decisionEngine().getFailureMode())
            .isEqualTo(DecisionEngineConfig.FailureMode.FALLBACK_DETERMINISTIC);
        assertThat(config.decisionEngine().label()).isEqualTo("llm:gpt-4o@0.3");
        assertThat(config.validation().getRequireScreenChangeFor()).containsExactly("like");
        assertThat(config.validation().getChangeDetection()).isEqualTo(ChangeDetection.SCREEN_TYPE);
        assertThat(config.judge().getApiKey()).isEqualTo("sk-judge");
        assertThat(config.judge().getCachePath()).isEqualTo(dir.toAbsolutePath().resolve("cache/judge.jsonl"));
        assertThat(config.judge().getPassScore()).isEqualTo(60);
        assertThat(config.judge().getRetryBackoffMs()).isEqualTo(250);
        assertThat(config.profile().getName()).isEqualTo("weekday_profile");
        assertThat(config.profile().getSwipePolicy().minQualityScoreLike()).isEqualTo(75);
        assertThat(config.profile().getSwipePolicy().blockPromptKeywords()).containsExactly("crypto");
        assertThat(config.profile().getMessagePolicy().maxMessages()).isEqualTo(2);
    }

    // ════════════════════════════════════════════════════════════════════════
    // Rejections
    // ════════════════════════════════════════════════════════════════════════

    @Test
    public void unknownRootKey_isRejected() throws IOException {
        Path path = write("agent.json", "{\"sesion\": {}}");

        assertThatThrownBy(() -> loader(Map.of()).load(path))
            .isInstanceOf(ConfigException.class)
            .hasMessageContaining("unknown key(s) [sesion]");
    }

    @Test
    public void unknownNestedKey_namesItsSection() throws IOException {
        Path path = write("agent.json", "{\"decision_engine\": {\"llm\": {\"temprature\": 0.2}}}");

        assertThatThrownBy(() -> loader(Map.of()).load(path))
            .isInstanceOf(ConfigException.class)
            .hasMessageContaining("decision_engine.llm: unknown key(s) [temprature]");
    }

    @Test
    public void llmEngine_withoutKeyInEnvironment_isRejected() throws IOException {
        Path path = write("agent.json", "{\"decision_engine\": {\"type\": \"llm\"}}");

        assertThatThrownBy(() -> loader(Map.of()).load(path))
            .isInstanceOf(ConfigException.class)
            .hasMessageContaining("OPENAI_API_KEY");
    }

    @Test
    public void wrongFieldType_isRejected() throws IOException {
        Path path = write("agent.json", "{\"session\": {\"max_actions\": \"ten\"}}");

        assertThatThrownBy(() -> loader(Map.of()).load(path))
            .isInstanceOf(ConfigException.class)
            .hasMessageContaining("session.max_actions must be an integer");
    }

    @Test
    public void outOfRangeValue_isRejectedByItsConfig() throws IOException {
        Path path = write("agent.json", "{\"decision_engine\": {\"llm\": {\"temperature\": 3.5}}}");

        assertThatThrownBy(() -> loader(Map.of()).load(path))
            .isInstanceOf(ConfigException.class)
            .hasMessageContaining("temperature must be within 0..2");
    }

    @Test
    public void negativeJudgeBackoff_isRejected() throws IOException {
        Path path = write("agent.json", "{\"judge\": {\"retry_backoff_ms\": -1}}");

        assertThatThrownBy(() -> loader(Map.of()).load(path))
            .isInstanceOf(ConfigException.class)
            .hasMessageContaining("judge.retry_backoff_ms must be >= 0");
    }

    @Test
    public void invalidJson_isRejected() throws IOException {
        Path path = write("agent.json", "{ not json");

        assertThatThrownBy(() -> loader(Map.of()).load(path))
            .isInstanceOf(ConfigException.class)
            .hasMessageContaining("is not valid JSON");
    }

    @Test
    public void missingFile_isRejected() {
        assertThatThrownBy(() -> loader(Map.of()).load(dir.resolve("absent.json")))
            .isInstanceOf(ConfigException.class)
            .hasMessageContaining("Cannot read config");
    }

    @Test
    public void profileWithoutSwipePolicy_isRejected() throws IOException {
        write("profile.json", "{\"message_policy\": {}}");
        Path path = write("agent.json", "{\"profile_json_path\": \"profile.json\"}");

        assertThatThrownBy(() -> loader(Map.of()).load(path))
            .isInstanceOf(ConfigException.class)
            .hasMessageContaining("'swipe_policy' is required");
    }

    @Test
    public void profileWithNonPositiveLimit_isRejected() throws IOException {
        write("profile.json", "{\"swipe_policy\": {\"max_likes\": 0}, \"message_policy\": {}}");
        Path path = write("agent.json", "{\"profile_json_path\": \"profile.json\"}");

        assertThatThrownBy(() -> loader(Map.of()).load(path))
            .isInstanceOf(ConfigException.class)
            .hasMessageContaining("'max_likes' must be a positive integer");
    }
}
