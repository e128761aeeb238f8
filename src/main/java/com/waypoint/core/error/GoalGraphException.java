package com.waypoint.core.error;

/**
 * Base type for every error the goal engine surfaces to callers.
 */
public class GoalGraphException extends RuntimeException {

    public GoalGraphException(String message) {
        super(message);
    }

    public GoalGraphException(String message, Throwable cause) {
        super(message, cause);
    }
}
