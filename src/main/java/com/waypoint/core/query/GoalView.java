package com.waypoint.core.query;

import com.waypoint.core.model.ActivationState;
import com.waypoint.core.model.GoalKind;
import com.waypoint.core.model.GoalPhase;
import com.waypoint.core.model.GoalProjection;
import com.waypoint.core.model.Priority;
import com.waypoint.core.model.ScheduledEventLink;
import com.waypoint.core.model.StepStatus;
import com.waypoint.core.model.TargetMetric;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Immutable copy of a goal taken under the graph read lock.
 * <p>
 * Handed to external collaborators and to the REST/CLI surfaces so that nothing
 * outside the graph holds a reference to a live, mutable goal.
 *
 * @param progress effective progress from the aggregator (not the stored scalar)
 */
public record GoalView(
    UUID id,
    UUID parentId,
    String title,
    String body,
    String category,
    Priority priority,
    GoalKind kind,
    ActivationState activationState,
    boolean locked,
    double progress,
    int sortIndex,
    boolean brokenDown,
    boolean atomic,
    boolean hasSequentialSteps,
    boolean sequentialStep,
    StepStatus stepStatus,
    boolean finalStep,
    String stepOutcome,
    String emoji,
    TargetMetric targetMetric,
    List<GoalProjection> projections,
    List<GoalPhase> phases,
    List<ScheduledEventLink> scheduledEvents,
    List<UUID> childIds,
    int revisionCount,
    Instant targetDate,
    Instant createdAt,
    Instant updatedAt,
    Instant activatedAt,
    Instant completedAt
) {

    public GoalView {
        projections = List.copyOf(projections);
        phases = List.copyOf(phases);
        scheduledEvents = List.copyOf(scheduledEvents);
        childIds = List.copyOf(childIds);
    }

    public boolean isLeaf() {
        return childIds.isEmpty();
    }
}
