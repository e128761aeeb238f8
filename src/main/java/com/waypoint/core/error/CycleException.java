package com.waypoint.core.error;

import java.util.UUID;

/**
 * Thrown when an edge would make the parent/child tree or the dependency graph cyclic.
 * Always raised before anything is written.
 */
public class CycleException extends GoalGraphException {

    private final UUID from;
    private final UUID to;

    public CycleException(String message, UUID from, UUID to) {
        super(message);
        this.from = from;
        this.to = to;
    }

    public UUID from() {
        return from;
    }

    public UUID to() {
        return to;
    }
}
