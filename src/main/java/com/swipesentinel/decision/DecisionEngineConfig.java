package com.swipesentinel.decision;

import com.swipesentinel.core.ConfigException;

import java.util.Locale;

import static com.swipesentinel.core.EnvDefaults.boolEnvOrDefault;
import static com.swipesentinel.core.EnvDefaults.doubleEnvOrDefault;
import static com.swipesentinel.core.EnvDefaults.envOrDefault;
import static com.swipesentinel.core.EnvDefaults.intEnvOrDefault;
import static com.swipesentinel.core.EnvDefaults.longEnvOrDefault;

/**
 * Configuration for the Decision Engine.
 *
 * Environment variables read by {@link #fromEnvironment()}:
 *   SWIPESENTINEL_DECISION_TYPE        - deterministic | llm (default: deterministic)
 *   SWIPESENTINEL_LLM_MODEL            - Model id (default: gpt-4.1-mini)
 *   SWIPESENTINEL_LLM_TEMPERATURE      - Sampling temperature (default: 0.1)
 *   SWIPESENTINEL_LLM_TIMEOUT          - Request timeout in seconds (default: 30)
 *   SWIPESENTINEL_LLM_BASE_URL         - API base URL (default: https://api.openai.com)
 *   SWIPESENTINEL_LLM_API_KEY_ENV      - Name of the variable holding the API key (default: OPENAI_API_KEY)
 *   SWIPESENTINEL_LLM_SCREENSHOT       - Attach the screenshot to requests (default: true)
 *   SWIPESENTINEL_LLM_IMAGE_DETAIL     - low | high | auto (default: low)
 *   SWIPESENTINEL_LLM_MAX_STRINGS      - Observed strings sent per request (default: 120)
 *   SWIPESENTINEL_LLM_FAILURE_MODE     - fail | fallback_deterministic (default: fail)
 *   SWIPESENTINEL_LLM_RETRY_BACKOFF_MS - Pause before the single transient retry (default: 2000)
 *   SWIPESENTINEL_LOG_PROMPTS          - Log request and response bodies at DEBUG (default: false)
 */
public class DecisionEngineConfig {

    public enum EngineType { DETERMINISTIC, LLM }

    public enum FailureMode { FAIL, FALLBACK_DETERMINISTIC }

    public enum ImageDetail {
        LOW, HIGH, AUTO;
        public String wireName() { return name().toLowerCase(Locale.ROOT); }
    }

    public static final String DEFAULT_MODEL              = "gpt-4.1-mini";
    public static final double DEFAULT_TEMPERATURE        = 0.1;
    public static final int    DEFAULT_TIMEOUT_SECONDS    = 30;
    public static final String DEFAULT_BASE_URL           = "https://api.openai.com";
    public static final String DEFAULT_API_KEY_ENV        = "OPENAI_API_KEY";
    public static final int    DEFAULT_MAX_OBSERVED       = 120;
    public static final int    DEFAULT_MAX_TOKENS         = 600;
    public static final long   DEFAULT_RETRY_BACKOFF_MS   = 2000;

    private final EngineType  engineType;
    private final String      model;
    private final double      temperature;
    private final int         timeoutSeconds;
    private final String      baseUrl;
    private final String      apiKeyEnv;
    private final String      apiKey;
    private final boolean     includeScreenshot;
    private final ImageDetail imageDetail;
    private final int         maxObservedStrings;
    private final int         maxTokens;
    private final FailureMode failureMode;
    private final long        retryBackoffMs;
    private final boolean     logPrompts;

    private DecisionEngineConfig(Builder b) {
        this.engineType         = b.engineType;
        this.model              = b.model;
        this.temperature        = b.temperature;
        this.timeoutSeconds     = b.timeoutSeconds;
        this.baseUrl            = stripTrailingSlash(b.baseUrl);
        this.apiKeyEnv          = b.apiKeyEnv;
        this.apiKey             = b.apiKey;
        this.includeScreenshot  = b.includeScreenshot;
        this.imageDetail        = b.imageDetail;
        this.maxObservedStrings = b.maxObservedStrings;
        this.maxTokens          = b.maxTokens;
        this.failureMode        = b.failureMode;
        this.retryBackoffMs     = b.retryBackoffMs;
        this.logPrompts         = b.logPrompts;
    }

    // ── Static factory: load from environment variables ───────────────────────

    public static DecisionEngineConfig fromEnvironment() {
        String keyEnv = envOrDefault("SWIPESENTINEL_LLM_API_KEY_ENV", DEFAULT_API_KEY_ENV);
        return builder()
            .engineType(parseEngineType(envOrDefault("SWIPESENTINEL_DECISION_TYPE", "deterministic")))
            .model(envOrDefault("SWIPESENTINEL_LLM_MODEL", DEFAULT_MODEL))
            .temperature(doubleEnvOrDefault("SWIPESENTINEL_LLM_TEMPERATURE", DEFAULT_TEMPERATURE))
            .timeoutSeconds(intEnvOrDefault("SWIPESENTINEL_LLM_TIMEOUT", DEFAULT_TIMEOUT_SECONDS))
            .baseUrl(envOrDefault("SWIPESENTINEL_LLM_BASE_URL", DEFAULT_BASE_URL))
            .apiKeyEnv(keyEnv)
            .apiKey(System.getenv(keyEnv))
            .includeScreenshot(boolEnvOrDefault("SWIPESENTINEL_LLM_SCREENSHOT", true))
            .imageDetail(parseImageDetail(envOrDefault("SWIPESENTINEL_LLM_IMAGE_DETAIL", "low")))
            .maxObservedStrings(intEnvOrDefault("SWIPESENTINEL_LLM_MAX_STRINGS", DEFAULT_MAX_OBSERVED))
            .failureMode(parseFailureMode(envOrDefault("SWIPESENTINEL_LLM_FAILURE_MODE", "fail")))
            .retryBackoffMs(longEnvOrDefault("SWIPESENTINEL_LLM_RETRY_BACKOFF_MS", DEFAULT_RETRY_BACKOFF_MS))
            .logPrompts(boolEnvOrDefault("SWIPESENTINEL_LOG_PROMPTS", false))
            .build();
    }

    // ── Getters ───────────────────────────────────────────────────────────────

    public EngineType  getEngineType()         { return engineType; }
    public String      getModel()              { return model; }
    public double      getTemperature()        { return temperature; }
    public int         getTimeoutSeconds()     { return timeoutSeconds; }
    public String      getBaseUrl()            { return baseUrl; }
    public String      getApiKeyEnv()          { return apiKeyEnv; }
    public String      getApiKey()             { return apiKey; }
    public boolean     isIncludeScreenshot()   { return includeScreenshot; }
    public ImageDetail getImageDetail()        { return imageDetail; }
    public int         getMaxObservedStrings() { return maxObservedStrings; }
    public int         getMaxTokens()          { return maxTokens; }
    public FailureMode getFailureMode()        { return failureMode; }
    public long        getRetryBackoffMs()     { return retryBackoffMs; }
    public boolean     isLogPrompts()          { return logPrompts; }
    public boolean     isLlm()                 { return engineType == EngineType.LLM; }

    /**
     * Identifies the engine configuration in baselines and reports:
     * {@code deterministic} or {@code llm:<model>@<temperature>}.
     */
    public String label() {
        return isLlm() ? "llm:" + model + "@" + temperature : "deterministic";
    }

    /** Model id recorded in baselines; {@code deterministic} for the rule engine. */
    public String modelId() {
        return isLlm() ? model : "deterministic";
    }

    // ── Parsing helpers ───────────────────────────────────────────────────────

    public static EngineType parseEngineType(String raw) {
        try {
            return EngineType.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new ConfigException("decision_engine.type must be 'deterministic' or 'llm', got: " + raw);
        }
    }

    public static FailureMode parseFailureMode(String raw) {
        try {
            return FailureMode.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new ConfigException("llm_failure_mode must be 'fail' or 'fallback_deterministic', got: " + raw);
        }
    }

    public static ImageDetail parseImageDetail(String raw) {
        try {
            return ImageDetail.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new ConfigException("image_detail must be low, high or auto, got: " + raw);
        }
    }

    private static String stripTrailingSlash(String url) {
        return url != null && url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    // ── Builder ───────────────────────────────────────────────────────────────

    public static Builder builder() { return new Builder(); }

    public static class Builder {
        private EngineType  engineType = EngineType.DETERMINISTIC;
        private String      model = DEFAULT_MODEL;
        private double      temperature = DEFAULT_TEMPERATURE;
        private int         timeoutSeconds = DEFAULT_TIMEOUT_SECONDS;
        private String      baseUrl = DEFAULT_BASE_URL;
        private String      apiKeyEnv = DEFAULT_API_KEY_ENV;
        private String      apiKey;
        private boolean     includeScreenshot = true;
        private ImageDetail imageDetail = ImageDetail.LOW;
        private int         maxObservedStrings = DEFAULT_MAX_OBSERVED;
        private int         maxTokens = DEFAULT_MAX_TOKENS;
        private FailureMode failureMode = FailureMode.FAIL;
        private long        retryBackoffMs = DEFAULT_RETRY_BACKOFF_MS;
        private boolean     logPrompts = false;

        public Builder engineType(EngineType t)          { this.engineType = t; return this; }
        public Builder model(String m)                   { this.model = m; return this; }
        public Builder temperature(double t)             { this.temperature = t; return this; }
        public Builder timeoutSeconds(int s)             { this.timeoutSeconds = s; return this; }
        public Builder baseUrl(String u)                 { this.baseUrl = u; return this; }
        public Builder apiKeyEnv(String e)               { this.apiKeyEnv = e; return this; }
        public Builder apiKey(String k)                  { this.apiKey = k; return this; }
        public Builder includeScreenshot(boolean b)      { this.includeScreenshot = b; return this; }
        public Builder imageDetail(ImageDetail d)        { this.imageDetail = d; return this; }
        public Builder maxObservedStrings(int n)         { this.maxObservedStrings = n; return this; }
        public Builder maxTokens(int n)                  { this.maxTokens = n; return this; }
        public Builder failureMode(FailureMode m)        { this.failureMode = m; return this; }
        public Builder retryBackoffMs(long ms)           { this.retryBackoffMs = ms; return this; }
        public Builder logPrompts(boolean b)             { this.logPrompts = b; return this; }

        /**
         * @throws ConfigException on out-of-range values, or a missing API key when
         *         the model-driven engine is selected
         */
        public DecisionEngineConfig build() {
            if (engineType == null) throw new ConfigException("decision_engine.type is required");
            if (temperature < 0 || temperature > 2) {
                throw new ConfigException("decision_engine.llm.temperature must be within 0..2, got " + temperature);
            }
            if (timeoutSeconds <= 0)     throw new ConfigException("decision_engine.llm.timeout_s must be > 0");
            if (maxObservedStrings <= 0) throw new ConfigException("decision_engine.llm.max_observed_strings must be > 0");
            if (maxTokens <= 0)          throw new ConfigException("decision_engine.llm.max_tokens must be > 0");
            if (retryBackoffMs < 0)      throw new ConfigException("decision_engine.llm.retry_backoff_ms must be >= 0");
            if (engineType == EngineType.LLM) {
                if (model == null || model.isBlank()) {
                    throw new ConfigException("decision_engine.llm.model is required when type='llm'");
                }
                if (baseUrl == null || baseUrl.isBlank()) {
                    throw new ConfigException("decision_engine.llm.base_url is required when type='llm'");
                }
                if (apiKey == null || apiKey.isBlank()) {
                    throw new ConfigException("Missing API key: environment variable '" + apiKeyEnv
                        + "' is required for the llm decision engine");
                }
            }
            return new DecisionEngineConfig(this);
        }
    }
}
