package com.waypoint.dispatch.cli;

import com.waypoint.core.error.GoalNotFoundException;
import com.waypoint.core.query.GoalQueryService;
import com.waypoint.core.timeline.Horizon;
import com.waypoint.core.timeline.TimelineEntry;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.time.Clock;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * CLI command: waypoint timeline [goal-id] [--days N]
 * <p>
 * Lists timeline entries from now over the next N days, for one goal or for
 * every goal that falls in that window.
 */
@Command(name = "timeline", mixinStandardHelpOptions = true, description = "Show upcoming timeline entries")
@Component
public class TimelineCommand implements Runnable {

    private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm", Locale.ROOT);

    @Parameters(index = "0", arity = "0..1", description = "Goal ID")
    private UUID goalId;

    @Option(names = {"--days"}, description = "Horizon length in days", defaultValue = "14")
    private int days;

    private final GoalQueryService queries;
    private final Clock clock;

    public TimelineCommand(GoalQueryService queries, Clock clock) {
        this.queries = queries;
        this.clock = clock;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        Horizon horizon = Horizon.ofDays(clock.instant(), days);

        List<TimelineEntry> entries;
        try {
            entries = goalId != null
                    ? queries.timelineEntries(goalId, horizon)
                    : queries.portfolioTimeline(horizon);
        } catch (GoalNotFoundException e) {
            ConsoleOutput.error("No goal found: " + goalId);
            return;
        }
        if (entries.isEmpty()) {
            ConsoleOutput.info("Nothing scheduled in the next " + days + " days.");
            return;
        }

        ZoneId zone = clock.getZone();
        System.out.printf("  %-16s %-18s %-24s %s%n", "START", "KIND", "GOAL", "ENTRY");
        System.out.println("  " + "-".repeat(76));
        for (TimelineEntry e : entries) {
            System.out.printf("  %-16s %-18s %-24s %s%n",
                    DATE.format(e.start().atZone(zone)),
                    e.kind().name().toLowerCase(Locale.ROOT),
                    ConsoleOutput.truncate(e.goalTitle(), 24),
                    e.title() + (e.metricSummary() != null && !e.metricSummary().equals(e.title())
                            ? " (" + e.metricSummary() + ")" : ""));
        }
        System.out.println();
        ConsoleOutput.info(entries.size() + " entr" + (entries.size() != 1 ? "ies" : "y") + " in horizon.");
    }
}
