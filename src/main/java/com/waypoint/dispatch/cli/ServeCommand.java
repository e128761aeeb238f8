package com.waypoint.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: waypoint serve
 * <p>
 * Runs the REST API and SSE event stream. The web server is enabled by
 * {@link com.waypoint.WaypointApplication#main} when "serve" is among the
 * arguments; {@link CliRunner} then skips picocli and this listener prints the
 * banner once the server is up.
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the Waypoint HTTP server")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:8080}")
    private int port;

    @Override
    public void run() {
        // only reached through picocli, e.g. for --help
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
    }

    private static void printBanner(int port) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Waypoint server running on port " + port);
        System.out.println();
        System.out.println("  Goals API:  http://localhost:" + port + "/api/v1/goals");
        System.out.println("  Events:     http://localhost:" + port + "/api/v1/goals/events");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }

    public int getPort() {
        return port;
    }
}
