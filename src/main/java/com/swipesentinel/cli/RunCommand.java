package com.swipesentinel.cli;

import com.swipesentinel.capture.TransportException;
import com.swipesentinel.capture.appium.AppiumCaptureAdapter;
import com.swipesentinel.core.AgentConfig;
import com.swipesentinel.decision.DecisionEngine;
import com.swipesentinel.decision.Directive;
import com.swipesentinel.decision.DirectiveParser;
import com.swipesentinel.decision.PolicyProfile;
import com.swipesentinel.model.TerminationReason;
import com.swipesentinel.session.LiveSession;
import com.swipesentinel.session.SessionConfig;
import com.swipesentinel.session.SessionRegistry;
import com.swipesentinel.session.SessionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.time.Duration;

/**
 * Runs one live session against the device through Appium.
 *
 * Ctrl-C requests a stop; the cycle in flight finishes and the action log is
 * still written.
 */
@Command(name = "run", description = "Run a live observe-decide-act session over Appium")
class RunCommand extends SwipeSentinelCommand {

    private static final Logger log = LoggerFactory.getLogger(RunCommand.class);

    /** Extra time allowed beyond the runtime budget for the last cycle and log writes. */
    private static final Duration AWAIT_MARGIN = Duration.ofSeconds(60);

    @Option(names = {"-q", "--query"}, description = "Natural-language instruction, e.g. \"like 5 profiles, dry run\"")
    private String query;

    @Option(names = "--session-name", description = "Session name used for artifact files")
    private String sessionName;

    @Option(names = "--live", description = "Issue real device actions (overrides dry_run=true)")
    private boolean live;

    @Option(names = "--max-actions", description = "Cycle budget")
    private Integer maxActions;

    @Override
    protected int execute() {
        AgentConfig config = loadConfig();
        Directive directive = new DirectiveParser().parse(query);

        SessionConfig.Builder sb = config.session().toBuilder();
        if (sessionName != null) sb.sessionName(sessionName);
        if (live)                sb.dryRun(false);
        if (maxActions != null)  sb.maxActions(maxActions);
        SessionConfig sessionConfig = sb.build();

        PolicyProfile profile = config.profile().withDirective(directive);
        DecisionEngine engine = DecisionEngine.create(config.decisionEngine(), profile);

        AppiumCaptureAdapter adapter;
        try {
            adapter = AppiumCaptureAdapter.connect(config.appium(), sessionConfig.getTargetPackage());
        } catch (TransportException e) {
            log.error("RunCommand: {}", e.getMessage());
            System.err.println("[TRANSPORT] " + e.getMessage());
            return EXIT_FAILED;
        }

        SessionRegistry registry = new SessionRegistry();
        String name = sessionConfig.getSessionName();
        Thread stopHook = new Thread(() -> registry.stop(name), "stop-" + name);
        try (adapter) {
            registry.create(new LiveSession(sessionConfig, config.validation(), engine, profile, directive, adapter));
            Runtime.getRuntime().addShutdownHook(stopHook);
            registry.start(name);

            int runtime = directive.maxRuntimeSeconds() != null
                ? directive.maxRuntimeSeconds() : sessionConfig.getMaxRuntimeSeconds();
            SessionResult result = registry.await(name, Duration.ofSeconds(runtime).plus(AWAIT_MARGIN));

            System.out.printf("Session %s: %s%s after %d cycle(s), counters=%s%n",
                result.sessionName(), result.terminationReason().wireName(),
                result.detail() != null ? " (" + result.detail() + ")" : "",
                result.iterations(), result.counters());
            System.out.println("  packets:    " + result.packetLog());
            System.out.println("  action log: " + result.actionLog());
            boolean ok = result.isCompleted() || result.terminationReason() == TerminationReason.ABORTED_BUDGET;
            return ok ? EXIT_OK : EXIT_FAILED;
        } finally {
            registry.shutdownAll();
            removeHook(stopHook);
        }
    }

    private static void removeHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            // JVM already shutting down; the hook is running or has run.
            log.debug("RunCommand: shutdown in progress, hook kept");
        } catch (IllegalArgumentException e) {
            log.debug("RunCommand: stop hook was never registered");
        }
    }
}
