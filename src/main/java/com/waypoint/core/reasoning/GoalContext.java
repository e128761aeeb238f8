package com.waypoint.core.reasoning;

import com.waypoint.core.query.GoalView;

import java.util.List;

/**
 * What the reasoning collaborator gets to see about a goal.
 *
 * @param goal      the goal itself
 * @param parent    its parent, or {@code null} for a top-level goal
 * @param subgoals  direct children that are not roadmap steps
 * @param steps     roadmap steps in order
 * @param portfolio every top-level goal, for conflict avoidance and tone
 */
public record GoalContext(
    GoalView goal,
    GoalView parent,
    List<GoalView> subgoals,
    List<GoalView> steps,
    List<GoalView> portfolio
) {

    public GoalContext {
        subgoals = List.copyOf(subgoals);
        steps = List.copyOf(steps);
        portfolio = List.copyOf(portfolio);
    }
}
