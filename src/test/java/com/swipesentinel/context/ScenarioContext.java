package com.swipesentinel.context;

import com.swipesentinel.decision.Directive;
import com.swipesentinel.decision.PolicyProfile;
import com.swipesentinel.regression.RegressionCase;
import com.swipesentinel.regression.RunOutcomeReport;
import com.swipesentinel.session.SessionResult;
import com.swipesentinel.support.FakeCaptureAdapter;

import java.nio.file.Path;
import java.util.List;

/**
 * Shared state for a single Cucumber scenario.
 *
 * Injected by PicoContainer into every step definition class and into
 * {@code Hooks}. One instance per scenario.
 *
 * Holds:
 *   artifactsDir  -- temp directory for packet and action logs, created in @Before
 *   adapter       -- the scripted device the session runs against
 *   directive     -- parsed operator instruction, {@link Directive#none()} until set
 *   lastResult    -- result of the most recent session run
 *   cases         -- loaded regression dataset
 *   lastReport    -- report of the most recent replay
 */
public class ScenarioContext {

    private final PolicyProfile profile = PolicyProfile.defaults();

    private Path               artifactsDir;
    private FakeCaptureAdapter adapter;
    private Directive          directive = Directive.none();
    private SessionResult      lastResult;

    private List<RegressionCase> cases;
    private RunOutcomeReport     lastReport;

    // ── Getters / Setters ─────────────────────────────────────────────────────

    public PolicyProfile getProfile() { return profile; }

    public Path getArtifactsDir()           { return artifactsDir; }
    public void setArtifactsDir(Path dir)   { this.artifactsDir = dir; }

    public FakeCaptureAdapter getAdapter()                  { return adapter; }
    public void               setAdapter(FakeCaptureAdapter a) { this.adapter = a; }

    public Directive getDirective()            { return directive; }
    public void      setDirective(Directive d) { this.directive = d; }

    public SessionResult getLastResult()                { return lastResult; }
    public void          setLastResult(SessionResult r) { this.lastResult = r; }

    public List<RegressionCase> getCases()                        { return cases; }
    public void                 setCases(List<RegressionCase> c)  { this.cases = c; }

    public RunOutcomeReport getLastReport()                   { return lastReport; }
    public void             setLastReport(RunOutcomeReport r) { this.lastReport = r; }

    /** One-line description of whatever the scenario produced, for failure attachments. */
    public String summary() {
        StringBuilder sb = new StringBuilder();
        if (lastResult != null) {
            sb.append("Session    : ").append(lastResult.sessionName()).append("\n");
            sb.append("Ended      : ").append(lastResult.terminationReason())
              .append(" (").append(lastResult.detail()).append(")\n");
            sb.append("Iterations : ").append(lastResult.iterations()).append("\n");
            sb.append("Counters   : ").append(lastResult.counters()).append("\n");
        }
        if (lastReport != null) {
            sb.append("Replay     : ").append(lastReport.passed()).append("/").append(lastReport.total())
              .append(" passed, exit ").append(lastReport.exitStatus()).append("\n");
        }
        return sb.toString();
    }
}
