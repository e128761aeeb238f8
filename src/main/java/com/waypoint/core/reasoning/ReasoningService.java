package com.waypoint.core.reasoning;

import com.waypoint.core.breakdown.DecompositionTree;
import com.waypoint.core.query.GoalView;
import com.waypoint.core.timeline.Horizon;
import com.waypoint.core.timeline.TimelineEntry;

import java.util.List;

/**
 * The external reasoning collaborator.
 * <p>
 * Calls are plain request/response and may fail or block; callers run them
 * through {@code ExternalCallExecutor}, outside the graph write lock, on
 * immutable {@link GoalContext} snapshots.
 */
public interface ReasoningService {

    DecompositionTree requestBreakdown(GoalContext context);

    RegenerationProposal requestRegeneration(GoalContext context);

    ActivationPlan requestActivationPlan(GoalContext context, List<GoalView> allGoals);

    NextStepProposal requestNextStep(GoalContext context, GoalView completedStep);

    /** One-paragraph rationale recorded when a goal is locked. */
    String summarizeForLock(GoalContext context);

    TimelineInsights requestTimelineInsights(GoalContext context, List<TimelineEntry> entries, Horizon horizon);
}
