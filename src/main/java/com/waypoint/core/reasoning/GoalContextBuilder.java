package com.waypoint.core.reasoning;

import com.waypoint.core.graph.GoalGraph;
import com.waypoint.core.model.Goal;
import com.waypoint.core.query.GoalView;
import com.waypoint.core.query.GoalViewFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.UUID;

/**
 * Captures a {@link GoalContext} in one read-locked pass so an external call
 * works on a consistent snapshot.
 */
@Component
public class GoalContextBuilder {

    private final GoalGraph graph;
    private final GoalViewFactory views;

    public GoalContextBuilder(GoalGraph graph, GoalViewFactory views) {
        this.graph = graph;
        this.views = views;
    }

    public GoalContext build(UUID goalId) {
        return graph.read(() -> {
            GoalView goal = views.view(goalId);
            GoalView parent = goal.parentId() != null ? views.view(goal.parentId()) : null;
            List<Goal> children = graph.children(goalId);
            List<GoalView> subgoals = views.views(children.stream().filter(g -> !g.isSequentialStep()).toList());
            List<GoalView> steps = views.views(children.stream().filter(Goal::isSequentialStep).toList());
            List<GoalView> portfolio = views.views(graph.topLevelGoals());
            return new GoalContext(goal, parent, subgoals, steps, portfolio);
        });
    }
}
