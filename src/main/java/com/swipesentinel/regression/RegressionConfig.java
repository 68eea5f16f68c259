package com.swipesentinel.regression;

import com.swipesentinel.core.ConfigException;

import java.nio.file.Path;

import static com.swipesentinel.core.EnvDefaults.boolEnvOrDefault;
import static com.swipesentinel.core.EnvDefaults.envOrDefault;
import static com.swipesentinel.core.EnvDefaults.intEnvOrDefault;
import static com.swipesentinel.core.EnvDefaults.pathEnvOrDefault;

/**
 * Settings for one regression run.
 *
 * Environment variables read by {@link #fromEnvironment()}:
 *   SWIPESENTINEL_REGRESS_DATASET          - Dataset JSONL (required for a run)
 *   SWIPESENTINEL_REGRESS_BASELINE         - Baseline JSON to compare against or write
 *   SWIPESENTINEL_REGRESS_REPORT           - Where to write the run report
 *   SWIPESENTINEL_REGRESS_MESSAGE_TOLERANCE - exact | judge | ignore (default: exact)
 *   SWIPESENTINEL_REGRESS_JUDGE_DELTA      - Allowed judge score difference under 'judge' (default: 10)
 *   SWIPESENTINEL_REGRESS_FAIL_ON_DRIFT    - Drift makes the run fail (default: false)
 *   SWIPESENTINEL_REGRESS_MAX_CASES        - Only replay the first N cases (default: all)
 */
public class RegressionConfig {

    public static final MessageTolerance DEFAULT_MESSAGE_TOLERANCE = MessageTolerance.EXACT;
    public static final int              DEFAULT_JUDGE_DELTA       = 10;

    private final Path             datasetPath;
    private final Path             baselinePath;
    private final Path             reportPath;
    private final boolean          writeBaseline;
    private final boolean          failOnDrift;
    private final MessageTolerance messageTolerance;
    private final int              maxJudgeScoreDelta;
    private final int              maxCases;

    private RegressionConfig(Builder b) {
        this.datasetPath        = b.datasetPath;
        this.baselinePath       = b.baselinePath;
        this.reportPath         = b.reportPath;
        this.writeBaseline      = b.writeBaseline;
        this.failOnDrift        = b.failOnDrift;
        this.messageTolerance   = b.messageTolerance;
        this.maxJudgeScoreDelta = b.maxJudgeScoreDelta;
        this.maxCases           = b.maxCases;
    }

    public static RegressionConfig fromEnvironment() {
        return builder()
            .datasetPath(pathEnvOrDefault("SWIPESENTINEL_REGRESS_DATASET", null))
            .baselinePath(pathEnvOrDefault("SWIPESENTINEL_REGRESS_BASELINE", null))
            .reportPath(pathEnvOrDefault("SWIPESENTINEL_REGRESS_REPORT", null))
            .messageTolerance(MessageTolerance.parse(envOrDefault("SWIPESENTINEL_REGRESS_MESSAGE_TOLERANCE", "exact")))
            .maxJudgeScoreDelta(intEnvOrDefault("SWIPESENTINEL_REGRESS_JUDGE_DELTA", DEFAULT_JUDGE_DELTA))
            .failOnDrift(boolEnvOrDefault("SWIPESENTINEL_REGRESS_FAIL_ON_DRIFT", false))
            .maxCases(intEnvOrDefault("SWIPESENTINEL_REGRESS_MAX_CASES", 0))
            .build();
    }

    public Path             getDatasetPath()        { return datasetPath; }
    public Path             getBaselinePath()       { return baselinePath; }
    public Path             getReportPath()         { return reportPath; }
    public boolean          isWriteBaseline()       { return writeBaseline; }
    public boolean          isFailOnDrift()         { return failOnDrift; }
    public MessageTolerance getMessageTolerance()   { return messageTolerance; }
    public int              getMaxJudgeScoreDelta() { return maxJudgeScoreDelta; }
    /** 0 means no limit. */
    public int              getMaxCases()           { return maxCases; }

    // ── Builder ───────────────────────────────────────────────────────────────

    public static Builder builder() { return new Builder(); }

    public static class Builder {
        private Path             datasetPath;
        private Path             baselinePath;
        private Path             reportPath;
        private boolean          writeBaseline;
        private boolean          failOnDrift;
        private MessageTolerance messageTolerance = DEFAULT_MESSAGE_TOLERANCE;
        private int              maxJudgeScoreDelta = DEFAULT_JUDGE_DELTA;
        private int              maxCases;

        public Builder datasetPath(Path p)                 { this.datasetPath = p; return this; }
        public Builder baselinePath(Path p)                { this.baselinePath = p; return this; }
        public Builder reportPath(Path p)                  { this.reportPath = p; return this; }
        public Builder writeBaseline(boolean b)            { this.writeBaseline = b; return this; }
        public Builder failOnDrift(boolean b)              { this.failOnDrift = b; return this; }
        public Builder messageTolerance(MessageTolerance t) { this.messageTolerance = t; return this; }
        public Builder maxJudgeScoreDelta(int d)           { this.maxJudgeScoreDelta = d; return this; }
        public Builder maxCases(int n)                     { this.maxCases = n; return this; }

        /** @throws ConfigException on inconsistent options */
        public RegressionConfig build() {
            if (writeBaseline && baselinePath == null) {
                throw new ConfigException("--write-baseline needs a baseline path");
            }
            if (messageTolerance == null)  throw new ConfigException("message tolerance is required");
            if (maxJudgeScoreDelta < 0)    throw new ConfigException("judge score delta must be >= 0");
            if (maxCases < 0)              throw new ConfigException("max cases must be >= 0");
            return new RegressionConfig(this);
        }
    }
}
