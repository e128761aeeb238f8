package com.waypoint.dispatch.cli;

import com.waypoint.core.query.GoalView;
import picocli.CommandLine;

import java.util.Locale;

/**
 * ANSI-colored terminal output for the Waypoint CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) WAYPOINT v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [WAYPOINT]|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    /** One goal row, indented by depth, with state, lock marker and progress. */
    public static void goal(GoalView goal, int depth) {
        String state = switch (goal.activationState()) {
            case ACTIVE -> "@|fg(green) ACTIVE|@   ";
            case COMPLETED -> "@|fg(blue) DONE|@     ";
            case ARCHIVED -> "@|faint ARCHIVED|@ ";
            case DRAFT -> "@|fg(white) DRAFT|@    ";
        };
        String lock = goal.locked() ? " @|fg(yellow) [locked]|@" : "";
        String step = goal.sequentialStep() && goal.stepStatus() != null
                ? " @|fg(magenta) [" + goal.stepStatus().name().toLowerCase(Locale.ROOT) + "]|@"
                : "";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  " + "  ".repeat(depth) + state + " " + progressBar(goal.progress()) + " "
                        + goal.title() + lock + step + " @|faint " + goal.id() + "|@"));
    }

    static String progressBar(double progress) {
        int filled = (int) Math.round(Math.max(0.0, Math.min(1.0, progress)) * 10);
        return "[" + "#".repeat(filled) + "-".repeat(10 - filled) + "] "
                + String.format(Locale.ROOT, "%3d%%", Math.round(progress * 100));
    }

    static String truncate(String s, int max) {
        if (s == null || s.isEmpty()) return "-";
        return s.length() <= max ? s : s.substring(0, max - 3) + "...";
    }
}
