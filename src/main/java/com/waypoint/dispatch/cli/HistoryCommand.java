package com.waypoint.dispatch.cli;

import com.waypoint.core.error.GoalNotFoundException;
import com.waypoint.core.model.GoalRevision;
import com.waypoint.core.query.GoalQueryService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.List;
import java.util.UUID;

/**
 * CLI command: waypoint history &lt;goal-id&gt;
 * <p>
 * Shows the goal's revision trail, most recent last.
 */
@Command(name = "history", mixinStandardHelpOptions = true, description = "Show a goal's revision history")
@Component
public class HistoryCommand implements Runnable {

    @Parameters(index = "0", description = "Goal ID")
    private UUID goalId;

    @Option(names = {"--limit", "-n"}, description = "Number of results", defaultValue = "20")
    private int limit;

    private final GoalQueryService queries;

    public HistoryCommand(GoalQueryService queries) {
        this.queries = queries;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        List<GoalRevision> revisions;
        try {
            revisions = queries.revisionHistory(goalId);
        } catch (GoalNotFoundException e) {
            ConsoleOutput.error("No goal found: " + goalId);
            return;
        }
        if (revisions.isEmpty()) {
            ConsoleOutput.info("No revisions recorded for goal " + goalId);
            return;
        }

        List<GoalRevision> display = revisions.size() > limit
                ? revisions.subList(revisions.size() - limit, revisions.size())
                : revisions;

        ConsoleOutput.info("Revisions (" + display.size() + " of " + revisions.size() + "):");
        System.out.println();
        System.out.printf("  %-26s %-28s %s%n", "TIMESTAMP", "SUMMARY", "RATIONALE");
        System.out.println("  " + "-".repeat(76));
        for (GoalRevision r : display) {
            System.out.printf("  %-26s %-28s %s%n", r.timestamp(),
                    ConsoleOutput.truncate(r.summary(), 28), ConsoleOutput.truncate(r.rationale(), 40));
        }
    }
}
