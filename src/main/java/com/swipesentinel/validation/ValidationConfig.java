package com.swipesentinel.validation;

import com.swipesentinel.action.ActionCatalog;
import com.swipesentinel.core.ConfigException;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

import static com.swipesentinel.core.EnvDefaults.boolEnvOrDefault;
import static com.swipesentinel.core.EnvDefaults.envOrDefault;
import static com.swipesentinel.core.EnvDefaults.envOrNull;
import static com.swipesentinel.core.EnvDefaults.intEnvOrDefault;
import static com.swipesentinel.core.EnvDefaults.longEnvOrDefault;

/**
 * Configuration for the {@link PostActionValidator}.
 *
 * Environment variables read by {@link #fromEnvironment()}:
 *   SWIPESENTINEL_VALIDATION_ENABLED          - Check transitions at all (default: true)
 *   SWIPESENTINEL_VALIDATION_SETTLE_MS        - Pause before re-observing (default: 800)
 *   SWIPESENTINEL_VALIDATION_REQUIRE_CHANGE   - Comma-separated action ids (default: see below)
 *   SWIPESENTINEL_VALIDATION_MAX_FAILURES     - Consecutive failures before abort (default: 4)
 *   SWIPESENTINEL_VALIDATION_CHANGE_DETECTION - screen_type | screen_type_or_content
 */
public class ValidationConfig {

    public static final long            DEFAULT_SETTLE_MS                = 800;
    public static final int             DEFAULT_MAX_CONSECUTIVE_FAILURES = 4;
    public static final ChangeDetection DEFAULT_CHANGE_DETECTION         = ChangeDetection.SCREEN_TYPE_OR_CONTENT;
    public static final Set<String>     DEFAULT_REQUIRE_CHANGE_FOR       = Collections.unmodifiableSet(new LinkedHashSet<>(
        Arrays.asList(ActionCatalog.LIKE, ActionCatalog.PASS, ActionCatalog.OPEN_THREAD,
                      ActionCatalog.SEND_MESSAGE, ActionCatalog.BACK, ActionCatalog.DISMISS_OVERLAY)));

    private final boolean         enabled;
    private final long            settleMs;
    private final Set<String>     requireScreenChangeFor;
    private final int             maxConsecutiveFailures;
    private final ChangeDetection changeDetection;

    private ValidationConfig(Builder b) {
        this.enabled                = b.enabled;
        this.settleMs               = b.settleMs;
        this.requireScreenChangeFor = Collections.unmodifiableSet(new LinkedHashSet<>(b.requireScreenChangeFor));
        this.maxConsecutiveFailures = b.maxConsecutiveFailures;
        this.changeDetection        = b.changeDetection;
    }

    public static ValidationConfig defaults() {
        return builder().build();
    }

    public static ValidationConfig fromEnvironment() {
        Builder b = builder()
            .enabled(boolEnvOrDefault("SWIPESENTINEL_VALIDATION_ENABLED", true))
            .settleMs(longEnvOrDefault("SWIPESENTINEL_VALIDATION_SETTLE_MS", DEFAULT_SETTLE_MS))
            .maxConsecutiveFailures(intEnvOrDefault("SWIPESENTINEL_VALIDATION_MAX_FAILURES",
                DEFAULT_MAX_CONSECUTIVE_FAILURES))
            .changeDetection(ChangeDetection.parse(envOrDefault("SWIPESENTINEL_VALIDATION_CHANGE_DETECTION",
                DEFAULT_CHANGE_DETECTION.name())));
        String requireChange = envOrNull("SWIPESENTINEL_VALIDATION_REQUIRE_CHANGE");
        if (requireChange != null) {
            b.requireScreenChangeFor(Arrays.asList(requireChange.split("\\s*,\\s*")));
        }
        return b.build();
    }

    public boolean         isEnabled()                 { return enabled; }
    public long            getSettleMs()               { return settleMs; }
    public Set<String>     getRequireScreenChangeFor() { return requireScreenChangeFor; }
    public int             getMaxConsecutiveFailures() { return maxConsecutiveFailures; }
    public ChangeDetection getChangeDetection()        { return changeDetection; }

    public boolean requiresChange(String actionId) {
        return requireScreenChangeFor.contains(actionId);
    }

    // ── Builder ───────────────────────────────────────────────────────────────

    public static Builder builder() { return new Builder(); }

    public static class Builder {
        private boolean            enabled = true;
        private long               settleMs = DEFAULT_SETTLE_MS;
        private Collection<String> requireScreenChangeFor = DEFAULT_REQUIRE_CHANGE_FOR;
        private int                maxConsecutiveFailures = DEFAULT_MAX_CONSECUTIVE_FAILURES;
        private ChangeDetection    changeDetection = DEFAULT_CHANGE_DETECTION;

        public Builder enabled(boolean b)                         { this.enabled = b; return this; }
        public Builder settleMs(long ms)                          { this.settleMs = ms; return this; }
        public Builder requireScreenChangeFor(Collection<String> a) { this.requireScreenChangeFor = a; return this; }
        public Builder maxConsecutiveFailures(int n)              { this.maxConsecutiveFailures = n; return this; }
        public Builder changeDetection(ChangeDetection d)         { this.changeDetection = d; return this; }

        /** @throws ConfigException on negative delays, a non-positive threshold or unknown action ids */
        public ValidationConfig build() {
            if (settleMs < 0) throw new ConfigException("validation.post_action_sleep_ms must be >= 0");
            if (maxConsecutiveFailures <= 0) {
                throw new ConfigException("validation.max_consecutive_failures must be > 0");
            }
            if (changeDetection == null) throw new ConfigException("validation.change_detection is required");
            if (requireScreenChangeFor == null) {
                throw new ConfigException("validation.require_screen_change_for must be a list");
            }
            for (String actionId : requireScreenChangeFor) {
                if (actionId == null || actionId.isBlank()) {
                    throw new ConfigException("validation.require_screen_change_for must not contain empty ids");
                }
                if (!ActionCatalog.contains(actionId.trim())) {
                    throw new ConfigException("validation.require_screen_change_for names unknown action '"
                        + actionId + "'. Known: " + ActionCatalog.describeIds());
                }
            }
            requireScreenChangeFor = requireScreenChangeFor.stream().map(String::trim).toList();
            return new ValidationConfig(this);
        }
    }
}
