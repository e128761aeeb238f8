package com.waypoint.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command. Routes to goals, timeline, history and serve.
 */
@Command(
        name = "waypoint",
        mixinStandardHelpOptions = true,
        version = "Waypoint 0.1.0",
        description = "Goal graph engine: hierarchies, roadmaps and timelines",
        subcommands = {
                GoalsCommand.class,
                TimelineCommand.class,
                HistoryCommand.class,
                ServeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class WaypointCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        spec.commandLine().usage(System.out);
    }
}
