package com.waypoint.core.progress;

import com.waypoint.core.graph.GoalGraph;
import com.waypoint.core.model.ActivationState;
import com.waypoint.core.model.Goal;
import com.waypoint.core.model.StepStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;

/**
 * Computes a goal's effective completion fraction from the current graph.
 * <p>
 * Nothing is cached: every call reads the graph, so a parent's progress reflects
 * a leaf change as soon as the leaf is written.
 * <ul>
 *   <li>no subgoals: the stored scalar</li>
 *   <li>sequential roadmap: completed steps / total steps, 1.0 once the roadmap is completed</li>
 *   <li>otherwise: mean of all leaf descendants, each leaf weighted equally whatever its depth</li>
 * </ul>
 * A completed goal with subgoals reports 1.0 whatever its leaves say.
 */
@Service
public class ProgressAggregator {

    private static final Logger log = LoggerFactory.getLogger(ProgressAggregator.class);

    private final GoalGraph graph;

    public ProgressAggregator(GoalGraph graph) {
        this.graph = graph;
    }

    public double progress(UUID goalId) {
        return graph.read(() -> {
            Goal goal = graph.get(goalId);
            if (goal.hasSequentialSteps()) {
                List<Goal> steps = graph.sequentialSteps(goalId);
                if (!steps.isEmpty()) {
                    return goal.getActivationState() == ActivationState.COMPLETED ? 1.0 : stepRatio(steps);
                }
            }
            if (!graph.hasChildren(goalId)) {
                return goal.getProgress();
            }
            if (goal.getActivationState() == ActivationState.COMPLETED) {
                return 1.0;
            }
            List<Goal> leaves = graph.leaves(goalId);
            double mean = leaves.stream().mapToDouble(Goal::getProgress).average().orElse(goal.getProgress());
            log.debug("Progress of {} = {} over {} leaves", goalId, mean, leaves.size());
            return mean;
        });
    }

    /** Completed steps over total steps; 0 for an empty roadmap. */
    public static double stepRatio(List<Goal> steps) {
        if (steps.isEmpty()) return 0.0;
        long completed = steps.stream().filter(s -> s.getStepStatus() == StepStatus.COMPLETED).count();
        return (double) completed / steps.size();
    }
}
