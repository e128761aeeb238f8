package com.waypoint.core.query;

import com.waypoint.core.graph.GoalGraph;
import com.waypoint.core.model.Goal;
import com.waypoint.core.progress.ProgressAggregator;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.UUID;

/**
 * Builds {@link GoalView}s under the graph read lock.
 */
@Component
public class GoalViewFactory {

    private final GoalGraph graph;
    private final ProgressAggregator progressAggregator;

    public GoalViewFactory(GoalGraph graph, ProgressAggregator progressAggregator) {
        this.graph = graph;
        this.progressAggregator = progressAggregator;
    }

    public GoalView view(UUID goalId) {
        return graph.read(() -> toView(graph.get(goalId)));
    }

    public List<GoalView> views(List<Goal> goals) {
        return graph.read(() -> goals.stream().map(this::toView).toList());
    }

    private GoalView toView(Goal g) {
        UUID id = g.getId();
        return new GoalView(
                id,
                graph.parent(id).orElse(null),
                g.getTitle(),
                g.getBody(),
                g.getCategory(),
                g.getPriority(),
                g.getKind(),
                g.getActivationState(),
                g.isLocked(),
                progressAggregator.progress(id),
                g.getSortIndex(),
                g.isBrokenDown(),
                g.isAtomic(),
                g.hasSequentialSteps(),
                g.isSequentialStep(),
                g.getStepStatus(),
                g.isFinalStep(),
                g.getStepOutcome(),
                g.getEmoji(),
                g.getTargetMetric(),
                g.getProjections(),
                g.getPhases(),
                g.getScheduledEvents(),
                graph.children(id).stream().map(Goal::getId).toList(),
                g.getRevisionHistory().size(),
                g.getTargetDate(),
                g.getCreatedAt(),
                g.getUpdatedAt(),
                g.getActivatedAt(),
                g.getCompletedAt());
    }
}
