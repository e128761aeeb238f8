package com.waypoint.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.UUID;

/**
 * A typed dependency edge: {@code dependent} waits on {@code prerequisite}.
 * Independent of the parent/child hierarchy.
 */
public record GoalDependency(
    UUID id,
    UUID prerequisiteId,
    UUID dependentId,
    DependencyKind kind,
    String note,
    Instant createdAt
) implements Serializable {

    public boolean touches(UUID goalId) {
        return prerequisiteId.equals(goalId) || dependentId.equals(goalId);
    }
}
