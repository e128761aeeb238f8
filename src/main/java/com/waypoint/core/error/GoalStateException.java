package com.waypoint.core.error;

/**
 * Thrown when an operation is not valid for the goal's current state,
 * e.g. activating a completed goal or breaking down a goal that already has subgoals.
 */
public class GoalStateException extends GoalGraphException {

    public GoalStateException(String message) {
        super(message);
    }
}
