package com.waypoint.dispatch.cli;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Bridges picocli with the Spring Boot lifecycle.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private final WaypointCommand waypointCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(WaypointCommand waypointCommand, IFactory factory) {
        this.waypointCommand = waypointCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) throws Exception {
        // serve mode: the embedded web server keeps the JVM alive, picocli would return at once
        for (String arg : args) {
            if ("serve".equals(arg)) {
                return;
            }
        }
        exitCode = new CommandLine(waypointCommand, factory).execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
