package com.waypoint.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.UUID;

/**
 * A named stage of a goal's plan, ordered by {@code order}.
 */
public record GoalPhase(
    UUID id,
    String title,
    String summary,
    int order,
    PhaseStatus status,
    Instant startedAt,
    Instant completedAt
) implements Serializable {

    public GoalPhase {
        if (status == null) status = PhaseStatus.PLANNED;
    }
}
