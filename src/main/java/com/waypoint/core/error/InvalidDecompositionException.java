package com.waypoint.core.error;

/**
 * Thrown when a proposed decomposition tree is malformed (duplicate ids or
 * dependencies on unknown ids). Nothing is materialized.
 */
public class InvalidDecompositionException extends GoalGraphException {

    public InvalidDecompositionException(String message) {
        super(message);
    }
}
