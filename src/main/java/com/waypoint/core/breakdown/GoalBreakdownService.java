package com.waypoint.core.breakdown;

import com.waypoint.core.error.GoalStateException;
import com.waypoint.core.events.EventBus;
import com.waypoint.core.events.GoalEvent;
import com.waypoint.core.external.ExternalCallExecutor;
import com.waypoint.core.graph.GoalGraph;
import com.waypoint.core.lifecycle.InFlightOperations;
import com.waypoint.core.logging.MdcContext;
import com.waypoint.core.model.Goal;
import com.waypoint.core.persistence.GraphPersistence;
import com.waypoint.core.reasoning.GoalContext;
import com.waypoint.core.reasoning.GoalContextBuilder;
import com.waypoint.core.reasoning.ReasoningService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.UUID;

/**
 * Breaks a goal down into subgoals proposed by the reasoning collaborator.
 */
@Service
public class GoalBreakdownService {

    private static final Logger log = LoggerFactory.getLogger(GoalBreakdownService.class);

    private final GoalGraph graph;
    private final GoalContextBuilder contextBuilder;
    private final ReasoningService reasoning;
    private final ExternalCallExecutor external;
    private final GoalBreakdownBuilder builder;
    private final GraphPersistence persistence;
    private final EventBus eventBus;
    private final InFlightOperations inFlight;

    public GoalBreakdownService(GoalGraph graph,
                                GoalContextBuilder contextBuilder,
                                ReasoningService reasoning,
                                ExternalCallExecutor external,
                                GoalBreakdownBuilder builder,
                                GraphPersistence persistence,
                                EventBus eventBus,
                                InFlightOperations inFlight) {
        this.graph = graph;
        this.contextBuilder = contextBuilder;
        this.reasoning = reasoning;
        this.external = external;
        this.builder = builder;
        this.persistence = persistence;
        this.eventBus = eventBus;
        this.inFlight = inFlight;
    }

    /**
     * @throws GoalStateException if the goal was already broken down, has subgoals or is a roadmap
     */
    public BreakdownResult breakdown(UUID goalId) {
        try (var mdc = MdcContext.operation("breakdown", goalId);
             var busy = inFlight.begin(goalId)) {
            requireBreakable(goalId);
            GoalContext context = contextBuilder.build(goalId);
            DecompositionTree tree = external.call("reasoning", "breakdown",
                    () -> reasoning.requestBreakdown(context));
            if (tree == null || tree.nodes().isEmpty()) {
                throw new GoalStateException("No subtasks were proposed for goal " + goalId);
            }

            BreakdownResult result = graph.write(() -> {
                requireBreakable(goalId);
                return builder.apply(tree, goalId);
            });
            persistence.flush();
            eventBus.publish(new GoalEvent(GoalEvent.BROKEN_DOWN, goalId, Map.of(
                    "goals", result.createdGoals().size(),
                    "atomic", result.atomicTaskCount(),
                    "dependencies", result.dependencyCount()), graph.clock().instant()));
            log.info("Goal {} broken down into {} goal(s)", goalId, result.createdGoals().size());
            return result;
        }
    }

    private void requireBreakable(UUID goalId) {
        graph.read(() -> {
            Goal goal = graph.get(goalId);
            if (goal.isBrokenDown()) {
                throw new GoalStateException("Goal " + goalId + " has already been broken down");
            }
            if (graph.hasChildren(goalId) || goal.hasSequentialSteps()) {
                throw new GoalStateException("Goal " + goalId + " already has subgoals");
            }
            return null;
        });
    }
}
