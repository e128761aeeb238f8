package com.waypoint.core.error;

import java.util.UUID;

public class GoalNotFoundException extends GoalGraphException {

    public GoalNotFoundException(UUID goalId) {
        super("Goal not found: " + goalId);
    }
}
