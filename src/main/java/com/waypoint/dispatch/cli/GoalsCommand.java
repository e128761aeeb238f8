package com.waypoint.dispatch.cli;

import com.waypoint.core.error.GoalNotFoundException;
import com.waypoint.core.query.GoalQueryService;
import com.waypoint.core.query.GoalView;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.List;
import java.util.UUID;

/**
 * CLI command: waypoint goals [goal-id] [--depth N]
 * <p>
 * Without an id, lists top-level goals; with one, prints that goal and its subtree.
 */
@Command(name = "goals", mixinStandardHelpOptions = true, description = "List goals as a tree")
@Component
public class GoalsCommand implements Runnable {

    @Parameters(index = "0", arity = "0..1", description = "Goal ID whose subtree to show")
    private UUID goalId;

    @Option(names = {"--depth", "-d"}, description = "Levels of subgoals to show", defaultValue = "1")
    private int depth;

    private final GoalQueryService queries;

    public GoalsCommand(GoalQueryService queries) {
        this.queries = queries;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        List<GoalView> roots;
        if (goalId != null) {
            try {
                roots = List.of(queries.goal(goalId));
            } catch (GoalNotFoundException e) {
                ConsoleOutput.error("No goal found: " + goalId);
                return;
            }
        } else {
            roots = queries.topLevelGoals();
        }
        if (roots.isEmpty()) {
            ConsoleOutput.info("No goals yet.");
            return;
        }
        for (GoalView root : roots) {
            print(root, 0);
        }
    }

    private void print(GoalView goal, int level) {
        ConsoleOutput.goal(goal, level);
        if (level >= depth) return;
        for (GoalView child : queries.children(goal.id())) {
            print(child, level + 1);
        }
    }
}
