package com.waypoint.core.error;

import java.util.UUID;

/**
 * Thrown when a roadmap already holds the maximum number of steps.
 * The caller must complete or split the goal.
 */
public class StepLimitExceededException extends GoalGraphException {

    private final int limit;

    public StepLimitExceededException(UUID goalId, int limit) {
        super("Goal " + goalId + " already has " + limit + " sequential steps; complete or split it");
        this.limit = limit;
    }

    public int limit() {
        return limit;
    }
}
