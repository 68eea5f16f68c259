package com.swipesentinel.judge;

import com.swipesentinel.core.ConfigException;

import java.nio.file.Path;

import static com.swipesentinel.core.EnvDefaults.boolEnvOrDefault;
import static com.swipesentinel.core.EnvDefaults.envOrDefault;
import static com.swipesentinel.core.EnvDefaults.envOrNull;
import static com.swipesentinel.core.EnvDefaults.intEnvOrDefault;
import static com.swipesentinel.core.EnvDefaults.longEnvOrDefault;
import static com.swipesentinel.core.EnvDefaults.pathEnvOrDefault;

/**
 * Configuration for the {@link ModelJudge}.
 *
 * Environment variables read by {@link #fromEnvironment()}:
 *   SWIPESENTINEL_JUDGE_ENABLED          - Score regression outputs (default: false)
 *   SWIPESENTINEL_JUDGE_MODEL            - Judge model id (default: gpt-4.1-mini)
 *   SWIPESENTINEL_JUDGE_MAX_TOKENS       - Completion cap (default: 450)
 *   SWIPESENTINEL_JUDGE_MAX_INVOCATIONS  - Model calls allowed per run (default: 50)
 *   SWIPESENTINEL_JUDGE_RUBRIC           - Rubric version, part of the cache key (default: judge.v1)
 *   SWIPESENTINEL_JUDGE_CACHE            - JSONL cache file; unset keeps the cache in memory
 *   SWIPESENTINEL_JUDGE_BASE_URL         - API base URL (default: https://api.openai.com)
 *   SWIPESENTINEL_JUDGE_API_KEY_ENV      - Name of the variable holding the API key (default: OPENAI_API_KEY)
 *   SWIPESENTINEL_JUDGE_TIMEOUT          - Request timeout in seconds (default: 30)
 *   SWIPESENTINEL_JUDGE_RETRY_BACKOFF_MS - Pause before the single transient retry (default: 2000)
 *   SWIPESENTINEL_JUDGE_PASS_SCORE       - Minimum overall score for a case to pass (default: 0)
 *
 * Temperature is fixed at 0.
 */
public class JudgeConfig {

    public static final String DEFAULT_MODEL           = "gpt-4.1-mini";
    public static final int    DEFAULT_MAX_TOKENS      = 450;
    public static final int    DEFAULT_MAX_INVOCATIONS = 50;
    public static final String DEFAULT_RUBRIC_VERSION  = "judge.v1";
    public static final String DEFAULT_BASE_URL        = "https://api.openai.com";
    public static final String DEFAULT_API_KEY_ENV     = "OPENAI_API_KEY";
    public static final int    DEFAULT_TIMEOUT_SECONDS = 30;
    public static final long   DEFAULT_RETRY_BACKOFF_MS = 2000;

    private final boolean enabled;
    private final String  model;
    private final int     maxTokens;
    private final int     maxInvocations;
    private final String  rubricVersion;
    private final Path    cachePath;
    private final String  baseUrl;
    private final String  apiKeyEnv;
    private final String  apiKey;
    private final int     timeoutSeconds;
    private final long    retryBackoffMs;
    private final int     passScore;

    private JudgeConfig(Builder b) {
        this.enabled        = b.enabled;
        this.model          = b.model;
        this.maxTokens      = b.maxTokens;
        this.maxInvocations = b.maxInvocations;
        this.rubricVersion  = b.rubricVersion;
        this.cachePath      = b.cachePath;
        this.baseUrl        = b.baseUrl;
        this.apiKeyEnv      = b.apiKeyEnv;
        this.apiKey         = b.apiKey;
        this.timeoutSeconds = b.timeoutSeconds;
        this.retryBackoffMs = b.retryBackoffMs;
        this.passScore      = b.passScore;
    }

    public static JudgeConfig disabled() {
        return builder().build();
    }

    public static JudgeConfig fromEnvironment() {
        String keyEnv = envOrDefault("SWIPESENTINEL_JUDGE_API_KEY_ENV", DEFAULT_API_KEY_ENV);
        return builder()
            .enabled(boolEnvOrDefault("SWIPESENTINEL_JUDGE_ENABLED", false))
            .model(envOrDefault("SWIPESENTINEL_JUDGE_MODEL", DEFAULT_MODEL))
            .maxTokens(intEnvOrDefault("SWIPESENTINEL_JUDGE_MAX_TOKENS", DEFAULT_MAX_TOKENS))
            .maxInvocations(intEnvOrDefault("SWIPESENTINEL_JUDGE_MAX_INVOCATIONS", DEFAULT_MAX_INVOCATIONS))
            .rubricVersion(envOrDefault("SWIPESENTINEL_JUDGE_RUBRIC", DEFAULT_RUBRIC_VERSION))
            .cachePath(pathEnvOrDefault("SWIPESENTINEL_JUDGE_CACHE", null))
            .baseUrl(envOrDefault("SWIPESENTINEL_JUDGE_BASE_URL", DEFAULT_BASE_URL))
            .apiKeyEnv(keyEnv)
            .apiKey(envOrNull(keyEnv))
            .timeoutSeconds(intEnvOrDefault("SWIPESENTINEL_JUDGE_TIMEOUT", DEFAULT_TIMEOUT_SECONDS))
            .retryBackoffMs(longEnvOrDefault("SWIPESENTINEL_JUDGE_RETRY_BACKOFF_MS", DEFAULT_RETRY_BACKOFF_MS))
            .passScore(intEnvOrDefault("SWIPESENTINEL_JUDGE_PASS_SCORE", 0))
            .build();
    }

    public boolean isEnabled()         { return enabled; }
    public String  getModel()          { return model; }
    public double  getTemperature()    { return 0.0; }
    public int     getMaxTokens()      { return maxTokens; }
    public int     getMaxInvocations() { return maxInvocations; }
    public String  getRubricVersion()  { return rubricVersion; }
    public Path    getCachePath()      { return cachePath; }
    public String  getBaseUrl()        { return baseUrl; }
    public String  getApiKeyEnv()      { return apiKeyEnv; }
    public String  getApiKey()         { return apiKey; }
    public int     getTimeoutSeconds() { return timeoutSeconds; }
    public long    getRetryBackoffMs() { return retryBackoffMs; }
    public int     getPassScore()      { return passScore; }

    // ── Builder ───────────────────────────────────────────────────────────────

    public static Builder builder() { return new Builder(); }

    public static class Builder {
        private boolean enabled = false;
        private String  model = DEFAULT_MODEL;
        private int     maxTokens = DEFAULT_MAX_TOKENS;
        private int     maxInvocations = DEFAULT_MAX_INVOCATIONS;
        private String  rubricVersion = DEFAULT_RUBRIC_VERSION;
        private Path    cachePath;
        private String  baseUrl = DEFAULT_BASE_URL;
        private String  apiKeyEnv = DEFAULT_API_KEY_ENV;
        private String  apiKey;
        private int     timeoutSeconds = DEFAULT_TIMEOUT_SECONDS;
        private long    retryBackoffMs = DEFAULT_RETRY_BACKOFF_MS;
        private int     passScore = 0;

        public Builder enabled(boolean b)       { this.enabled = b; return this; }
        public Builder model(String m)          { this.model = m; return this; }
        public Builder maxTokens(int n)         { this.maxTokens = n; return this; }
        public Builder maxInvocations(int n)    { this.maxInvocations = n; return this; }
        public Builder rubricVersion(String v)  { this.rubricVersion = v; return this; }
        public Builder cachePath(Path p)        { this.cachePath = p; return this; }
        public Builder baseUrl(String u)        { this.baseUrl = u; return this; }
        public Builder apiKeyEnv(String e)      { this.apiKeyEnv = e; return this; }
        public Builder apiKey(String k)         { this.apiKey = k; return this; }
        public Builder timeoutSeconds(int s)    { this.timeoutSeconds = s; return this; }
        public Builder retryBackoffMs(long ms)  { this.retryBackoffMs = ms; return this; }
        public Builder passScore(int s)         { this.passScore = s; return this; }

        /** @throws ConfigException on out-of-range values, or a missing model when enabled */
        public JudgeConfig build() {
            if (maxTokens <= 0)       throw new ConfigException("judge.max_tokens must be > 0");
            if (maxInvocations < 0)   throw new ConfigException("judge.max_invocations must be >= 0");
            if (timeoutSeconds <= 0)  throw new ConfigException("judge.timeout_s must be > 0");
            if (retryBackoffMs < 0)   throw new ConfigException("judge.retry_backoff_ms must be >= 0");
            if (passScore < 0 || passScore > 100) throw new ConfigException("judge.pass_score must be within 0..100");
            if (rubricVersion == null || rubricVersion.isBlank()) {
                throw new ConfigException("judge.rubric_version is required");
            }
            if (enabled && (model == null || model.isBlank())) {
                throw new ConfigException("judge.model is required when the judge is enabled");
            }
            return new JudgeConfig(this);
        }
    }
}
