package com.waypoint.core.error;

import java.util.UUID;

/**
 * Thrown on an attempt to change a locked goal's content.
 */
public class GoalLockedException extends GoalGraphException {

    private final UUID goalId;

    public GoalLockedException(UUID goalId) {
        super("Goal " + goalId + " is locked and cannot be modified");
        this.goalId = goalId;
    }

    public UUID goalId() {
        return goalId;
    }
}
