package com.waypoint.dispatch.cli;

import com.waypoint.core.error.GoalNotFoundException;
import com.waypoint.core.model.ActivationState;
import com.waypoint.core.model.GoalKind;
import com.waypoint.core.model.GoalRevision;
import com.waypoint.core.model.Priority;
import com.waypoint.core.query.GoalQueryService;
import com.waypoint.core.query.GoalView;
import com.waypoint.core.timeline.Horizon;
import com.waypoint.core.timeline.TimelineEntry;
import com.waypoint.core.timeline.TimelineEntryKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Exercises picocli directly, without a Spring context.
 */
class CliTest {

    private static final Instant NOW = Instant.parse("2026-03-01T09:00:00Z");

    private record CliResult(int exitCode, String output) {}

    private GoalQueryService queries;
    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);

    @BeforeEach
    void setUp() {
        queries = mock(GoalQueryService.class);
        when(queries.topLevelGoals()).thenReturn(List.of());
    }

    private static GoalView view(UUID id, String title, ActivationState state, boolean locked, double progress) {
        return new GoalView(id, null, title, "", "General", Priority.NEXT, GoalKind.HYBRID, state, locked,
                progress, 0, false, false, false, false, null, false, null, null, null,
                List.of(), List.of(), List.of(), List.of(), 0, null, NOW, NOW, null, null);
    }

    private CommandLine.IFactory createFactory() {
        return new CommandLine.IFactory() {
            @Override
            @SuppressWarnings("unchecked")
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == GoalsCommand.class) {
                    return (K) new GoalsCommand(queries);
                }
                if (cls == TimelineCommand.class) {
                    return (K) new TimelineCommand(queries, clock);
                }
                if (cls == HistoryCommand.class) {
                    return (K) new HistoryCommand(queries);
                }
                return CommandLine.defaultFactory().create(cls);
            }
        };
    }

    private CliResult execute(String... args) {
        ByteArrayOutputStream capture = new ByteArrayOutputStream();
        PrintStream capturePrintStream = new PrintStream(capture, true);
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        System.setOut(capturePrintStream);
        System.setErr(capturePrintStream);
        try {
            int exitCode = new CommandLine(new WaypointCommand(), createFactory()).execute(args);
            capturePrintStream.flush();
            return new CliResult(exitCode, capture.toString());
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    @Nested
    @DisplayName("Help output")
    class HelpTests {

        @Test
        @DisplayName("--help lists every subcommand")
        void helpListsSubcommands() {
            CliResult result = execute("--help");
            assertEquals(0, result.exitCode());
            for (String sub : List.of("goals", "timeline", "history", "serve", "help")) {
                assertTrue(result.output().contains(sub), "Help should list '" + sub + "'");
            }
        }

        @Test
        @DisplayName("--version shows the version")
        void version() {
            CliResult result = execute("--version");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Waypoint 0.1.0"));
        }

        @Test
        @DisplayName("no arguments prints banner and usage")
        void noArguments() {
            CliResult result = execute();
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("WAYPOINT v0.1.0"));
            assertTrue(result.output().contains("Usage"));
        }

        @Test
        @DisplayName("an unknown subcommand fails")
        void unknownSubcommand() {
            assertNotEquals(0, execute("frobnicate").exitCode());
        }
    }

    @Nested
    @DisplayName("goals")
    class GoalsTests {

        @Test
        @DisplayName("with no goals prints a hint")
        void empty() {
            CliResult result = execute("goals");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("No goals yet."));
        }

        @Test
        @DisplayName("prints the tree down to the requested depth")
        void tree() {
            UUID rootId = UUID.randomUUID();
            UUID childId = UUID.randomUUID();
            UUID grandchildId = UUID.randomUUID();
            when(queries.topLevelGoals()).thenReturn(List.of(view(rootId, "Get fit", ActivationState.ACTIVE, true, 0.5)));
            when(queries.children(rootId)).thenReturn(List.of(view(childId, "Run 10k", ActivationState.DRAFT, false, 1.0)));
            when(queries.children(childId)).thenReturn(List.of(view(grandchildId, "Buy shoes", ActivationState.DRAFT, false, 0)));

            CliResult result = execute("goals");

            assertTrue(result.output().contains("Get fit"));
            assertTrue(result.output().contains("[locked]"));
            assertTrue(result.output().contains("[#####-----]  50%"));
            assertTrue(result.output().contains("Run 10k"));
            assertFalse(result.output().contains("Buy shoes"));

            assertTrue(execute("goals", "--depth", "2").output().contains("Buy shoes"));
        }

        @Test
        @DisplayName("an unknown goal id is reported")
        void unknownGoal() {
            UUID id = UUID.randomUUID();
            when(queries.goal(id)).thenThrow(new GoalNotFoundException(id));

            CliResult result = execute("goals", id.toString());

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("No goal found: " + id));
        }

        @Test
        @DisplayName("a malformed goal id is a usage error")
        void malformedId() {
            assertNotEquals(0, execute("goals", "not-a-uuid").exitCode());
        }
    }

    @Nested
    @DisplayName("timeline")
    class TimelineTests {

        @Test
        @DisplayName("uses a horizon of --days from now")
        void horizon() {
            when(queries.portfolioTimeline(any())).thenReturn(List.of());

            CliResult result = execute("timeline", "--days", "7");

            verify(queries).portfolioTimeline(Horizon.ofDays(NOW, 7));
            assertTrue(result.output().contains("Nothing scheduled in the next 7 days."));
        }

        @Test
        @DisplayName("prints one row per entry with a count")
        void rows() {
            UUID goalId = UUID.randomUUID();
            var entry = new TimelineEntry(UUID.randomUUID(), goalId, "Get fit", TimelineEntryKind.METRIC_CHECKPOINT,
                    "Δ2.5 % body fat", null, NOW.plus(Duration.ofDays(7)), NOW.plus(Duration.ofDays(7)),
                    "Δ2.5 % body fat", null, null);
            when(queries.timelineEntries(eq(goalId), any())).thenReturn(List.of(entry));

            CliResult result = execute("timeline", goalId.toString());

            assertTrue(result.output().contains("2026-03-08 09:00"));
            assertTrue(result.output().contains("metric_checkpoint"));
            assertTrue(result.output().contains("1 entry in horizon."));
        }
    }

    @Nested
    @DisplayName("history")
    class HistoryTests {

        @Test
        @DisplayName("requires a goal id")
        void requiresId() {
            assertNotEquals(0, execute("history").exitCode());
        }

        @Test
        @DisplayName("shows the most recent revisions up to --limit")
        void limit() {
            UUID goalId = UUID.randomUUID();
            var revisions = new ArrayList<GoalRevision>();
            for (int i = 1; i <= 5; i++) {
                revisions.add(GoalRevision.of("Revision " + i, null, NOW.plus(Duration.ofMinutes(i))));
            }
            when(queries.revisionHistory(goalId)).thenReturn(revisions);

            CliResult result = execute("history", goalId.toString(), "-n", "2");

            assertTrue(result.output().contains("Revisions (2 of 5)"));
            assertTrue(result.output().contains("Revision 5"));
            assertFalse(result.output().contains("Revision 3"));
        }

        @Test
        @DisplayName("reports a goal without revisions")
        void empty() {
            UUID goalId = UUID.randomUUID();
            when(queries.revisionHistory(goalId)).thenReturn(List.of());

            assertTrue(execute("history", goalId.toString()).output()
                    .contains("No revisions recorded for goal " + goalId));
        }
    }

    @Nested
    @DisplayName("ConsoleOutput")
    class ConsoleOutputTests {

        @Test
        @DisplayName("progressBar fills tenths and clamps")
        void progressBar() {
            assertEquals("[----------]   0%", ConsoleOutput.progressBar(0.0));
            assertEquals("[##########] 100%", ConsoleOutput.progressBar(1.0));
            assertEquals("[###-------]  25%", ConsoleOutput.progressBar(0.25));
        }

        @Test
        @DisplayName("truncate shortens long text and marks missing text")
        void truncate() {
            assertEquals("-", ConsoleOutput.truncate(null, 10));
            assertEquals("short", ConsoleOutput.truncate("short", 10));
            assertEquals("abcdefg...", ConsoleOutput.truncate("abcdefghijklmnop", 10));
        }
    }
}
