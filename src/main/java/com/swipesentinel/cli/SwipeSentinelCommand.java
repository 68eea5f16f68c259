package com.swipesentinel.cli;

import com.swipesentinel.core.AgentConfig;
import com.swipesentinel.core.AgentConfigLoader;
import com.swipesentinel.core.ConfigException;
import com.swipesentinel.decision.PolicyProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Option;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Shared options and error mapping for the subcommands.
 *
 * Configuration comes from {@code --config} when given, otherwise from
 * {@code SWIPESENTINEL_*} environment variables. {@code --profile} replaces the
 * profile named by the config file.
 */
abstract class SwipeSentinelCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(SwipeSentinelCommand.class);

    static final int EXIT_OK      = 0;
    static final int EXIT_FAILED  = 1;
    static final int EXIT_CONFIG  = 2;

    @Option(names = {"-c", "--config"}, description = "Agent config JSON (sections session, appium, decision_engine, validation, judge)")
    protected Path configPath;

    @Option(names = {"-p", "--profile"}, description = "Policy profile JSON, overrides profile_json_path")
    protected Path profilePath;

    @Override
    public final Integer call() {
        try {
            return execute();
        } catch (ConfigException e) {
            log.error("{}: configuration error: {}", getClass().getSimpleName(), e.getMessage());
            System.err.println("[CONFIG] " + e.getMessage());
            return EXIT_CONFIG;
        } catch (UncheckedIOException e) {
            log.error("{}: I/O error: {}", getClass().getSimpleName(), e.getMessage());
            System.err.println("[IO] " + e.getMessage());
            return EXIT_CONFIG;
        } catch (IllegalStateException e) {
            log.error("{}: {}", getClass().getSimpleName(), e.getMessage(), e);
            System.err.println("[FAILED] " + e.getMessage());
            return EXIT_FAILED;
        }
    }

    protected abstract int execute();

    protected AgentConfig loadConfig() {
        AgentConfig config = configPath != null
            ? new AgentConfigLoader().load(configPath)
            : AgentConfig.fromEnvironment();
        if (profilePath == null) return config;
        return new AgentConfig(config.session(), config.appium(), config.decisionEngine(),
            config.validation(), config.judge(), PolicyProfile.load(profilePath));
    }
}
