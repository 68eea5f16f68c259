package com.swipesentinel.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Entry point.
 *
 * <pre>
 *   swipe-sentinel run           [--config FILE] [--profile FILE] [--query TEXT] [--live]
 *   swipe-sentinel regress       --dataset FILE [--baseline FILE [--write-baseline | --fail-on-drift]] [--report FILE]
 *   swipe-sentinel build-dataset --packets FILE --out FILE [--screen-types a,b] [--max-rows N]
 * </pre>
 *
 * Exit status: 0 success, 1 case failures (regress) or an unsuccessful session (run),
 * 2 configuration or input errors.
 */
@Command(
        name = "swipe-sentinel",
        mixinStandardHelpOptions = true,
        version = "swipe-sentinel 1.0.0",
        description = "Observe-decide-act agent for a mobile dating app, with regression replay",
        subcommands = {
            RunCommand.class,
            RegressCommand.class,
            BuildDatasetCommand.class
        })
public class SwipeSentinelCli {

    public static void main(String[] args) {
        System.exit(newCommandLine().execute(args));
    }

    static CommandLine newCommandLine() {
        return new CommandLine(new SwipeSentinelCli());
    }
}
