package com.swipesentinel.session;

import com.swipesentinel.core.ConfigException;

import java.nio.file.Path;
import java.nio.file.Paths;

import static com.swipesentinel.core.EnvDefaults.boolEnvOrDefault;
import static com.swipesentinel.core.EnvDefaults.envOrDefault;
import static com.swipesentinel.core.EnvDefaults.intEnvOrDefault;
import static com.swipesentinel.core.EnvDefaults.longEnvOrDefault;
import static com.swipesentinel.core.EnvDefaults.pathEnvOrDefault;

/**
 * Loop, budget and recovery settings for one {@link LiveSession}.
 *
 * Environment variables read by {@link #fromEnvironment()}:
 *   SWIPESENTINEL_SESSION_NAME           - Session name, used in artifact file names (default: live)
 *   SWIPESENTINEL_TARGET_PACKAGE         - Android package kept in the foreground (default: co.hinge.app)
 *   SWIPESENTINEL_DRY_RUN                - Decide and log without touching the device (default: true)
 *   SWIPESENTINEL_MAX_ACTIONS            - Cycle budget (default: 30)
 *   SWIPESENTINEL_MAX_RUNTIME_S          - Wall-clock budget in seconds (default: 300)
 *   SWIPESENTINEL_LOOP_SLEEP_MS          - Pause between cycles (default: 1000)
 *   SWIPESENTINEL_RECOVERY_ATTEMPTS      - Foreground recovery attempts after a transport error (default: 3)
 *   SWIPESENTINEL_RECOVERY_COOLDOWN_MS   - Pause between recovery attempts (default: 1000)
 *   SWIPESENTINEL_ARTIFACTS_DIR          - Where packet and action logs go (default: artifacts)
 */
public class SessionConfig {

    public static final String DEFAULT_SESSION_NAME        = "live";
    public static final String DEFAULT_TARGET_PACKAGE      = "co.hinge.app";
    public static final int    DEFAULT_MAX_ACTIONS         = 30;
    public static final int    DEFAULT_MAX_RUNTIME_SECONDS = 300;
    public static final long   DEFAULT_LOOP_SLEEP_MS       = 1000;
    public static final int    DEFAULT_RECOVERY_ATTEMPTS   = 3;
    public static final long   DEFAULT_RECOVERY_COOLDOWN_MS = 1000;

    /** System property that overrides the default artifacts directory (set by the test run). */
    public static final String ARTIFACTS_DIR_PROPERTY = "swipesentinel.artifacts.dir";

    private final String  sessionName;
    private final String  targetPackage;
    private final boolean dryRun;
    private final int     maxActions;
    private final int     maxRuntimeSeconds;
    private final long    loopSleepMs;
    private final int     recoveryMaxAttempts;
    private final long    recoveryCooldownMs;
    private final Path    artifactsDir;

    private SessionConfig(Builder b) {
        this.sessionName         = b.sessionName;
        this.targetPackage       = b.targetPackage;
        this.dryRun              = b.dryRun;
        this.maxActions          = b.maxActions;
        this.maxRuntimeSeconds   = b.maxRuntimeSeconds;
        this.loopSleepMs         = b.loopSleepMs;
        this.recoveryMaxAttempts = b.recoveryMaxAttempts;
        this.recoveryCooldownMs  = b.recoveryCooldownMs;
        this.artifactsDir        = b.artifactsDir;
    }

    public static SessionConfig defaults() {
        return builder().build();
    }

    public static SessionConfig fromEnvironment() {
        return builder()
            .sessionName(envOrDefault("SWIPESENTINEL_SESSION_NAME", DEFAULT_SESSION_NAME))
            .targetPackage(envOrDefault("SWIPESENTINEL_TARGET_PACKAGE", DEFAULT_TARGET_PACKAGE))
            .dryRun(boolEnvOrDefault("SWIPESENTINEL_DRY_RUN", true))
            .maxActions(intEnvOrDefault("SWIPESENTINEL_MAX_ACTIONS", DEFAULT_MAX_ACTIONS))
            .maxRuntimeSeconds(intEnvOrDefault("SWIPESENTINEL_MAX_RUNTIME_S", DEFAULT_MAX_RUNTIME_SECONDS))
            .loopSleepMs(longEnvOrDefault("SWIPESENTINEL_LOOP_SLEEP_MS", DEFAULT_LOOP_SLEEP_MS))
            .recoveryMaxAttempts(intEnvOrDefault("SWIPESENTINEL_RECOVERY_ATTEMPTS", DEFAULT_RECOVERY_ATTEMPTS))
            .recoveryCooldownMs(longEnvOrDefault("SWIPESENTINEL_RECOVERY_COOLDOWN_MS", DEFAULT_RECOVERY_COOLDOWN_MS))
            .artifactsDir(pathEnvOrDefault("SWIPESENTINEL_ARTIFACTS_DIR", defaultArtifactsDir()))
            .build();
    }

    static Path defaultArtifactsDir() {
        return Paths.get(System.getProperty(ARTIFACTS_DIR_PROPERTY, "artifacts"));
    }

    // ── Getters ───────────────────────────────────────────────────────────────

    public String  getSessionName()         { return sessionName; }
    public String  getTargetPackage()       { return targetPackage; }
    public boolean isDryRun()               { return dryRun; }
    public int     getMaxActions()          { return maxActions; }
    public int     getMaxRuntimeSeconds()   { return maxRuntimeSeconds; }
    public long    getLoopSleepMs()         { return loopSleepMs; }
    public int     getRecoveryMaxAttempts() { return recoveryMaxAttempts; }
    public long    getRecoveryCooldownMs()  { return recoveryCooldownMs; }
    public Path    getArtifactsDir()        { return artifactsDir; }

    public Path packetLogPath() {
        return artifactsDir.resolve(sessionName + "_packets.jsonl");
    }

    public Path actionLogPath() {
        return artifactsDir.resolve(sessionName + "_action_log.json");
    }

    /** Per-cycle screenshots and accessibility trees. */
    public Path framesDir() {
        return artifactsDir.resolve(sessionName + "_frames");
    }

    public Builder toBuilder() {
        return builder()
            .sessionName(sessionName)
            .targetPackage(targetPackage)
            .dryRun(dryRun)
            .maxActions(maxActions)
            .maxRuntimeSeconds(maxRuntimeSeconds)
            .loopSleepMs(loopSleepMs)
            .recoveryMaxAttempts(recoveryMaxAttempts)
            .recoveryCooldownMs(recoveryCooldownMs)
            .artifactsDir(artifactsDir);
    }

    // ── Builder ───────────────────────────────────────────────────────────────

    public static Builder builder() { return new Builder(); }

    public static class Builder {
        private String  sessionName = DEFAULT_SESSION_NAME;
        private String  targetPackage = DEFAULT_TARGET_PACKAGE;
        private boolean dryRun = true;
        private int     maxActions = DEFAULT_MAX_ACTIONS;
        private int     maxRuntimeSeconds = DEFAULT_MAX_RUNTIME_SECONDS;
        private long    loopSleepMs = DEFAULT_LOOP_SLEEP_MS;
        private int     recoveryMaxAttempts = DEFAULT_RECOVERY_ATTEMPTS;
        private long    recoveryCooldownMs = DEFAULT_RECOVERY_COOLDOWN_MS;
        private Path    artifactsDir = defaultArtifactsDir();

        public Builder sessionName(String n)          { this.sessionName = n; return this; }
        public Builder targetPackage(String p)        { this.targetPackage = p; return this; }
        public Builder dryRun(boolean b)              { this.dryRun = b; return this; }
        public Builder maxActions(int n)              { this.maxActions = n; return this; }
        public Builder maxRuntimeSeconds(int s)       { this.maxRuntimeSeconds = s; return this; }
        public Builder loopSleepMs(long ms)           { this.loopSleepMs = ms; return this; }
        public Builder recoveryMaxAttempts(int n)     { this.recoveryMaxAttempts = n; return this; }
        public Builder recoveryCooldownMs(long ms)    { this.recoveryCooldownMs = ms; return this; }
        public Builder artifactsDir(Path p)           { this.artifactsDir = p; return this; }

        /** @throws ConfigException on blank names or out-of-range budgets */
        public SessionConfig build() {
            if (sessionName == null || !sessionName.matches("[A-Za-z0-9_.-]+")) {
                throw new ConfigException("session.name must match [A-Za-z0-9_.-]+, got: " + sessionName);
            }
            if (targetPackage == null || targetPackage.isBlank()) {
                throw new ConfigException("session.target_package is required");
            }
            if (maxActions <= 0)          throw new ConfigException("session.max_actions must be > 0");
            if (maxRuntimeSeconds <= 0)   throw new ConfigException("session.max_runtime_s must be > 0");
            if (loopSleepMs < 0)          throw new ConfigException("session.loop_sleep_ms must be >= 0");
            if (recoveryMaxAttempts < 0)  throw new ConfigException("session.recovery.max_attempts must be >= 0");
            if (recoveryCooldownMs < 0)   throw new ConfigException("session.recovery.cooldown_ms must be >= 0");
            if (artifactsDir == null)     throw new ConfigException("session.artifacts_dir is required");
            return new SessionConfig(this);
        }
    }
}
