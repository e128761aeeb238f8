package com.waypoint.core.error;

import java.util.UUID;

public class SelfDependencyException extends GoalGraphException {

    public SelfDependencyException(UUID goalId) {
        super("Goal " + goalId + " cannot depend on itself");
    }
}
