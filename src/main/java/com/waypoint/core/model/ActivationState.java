package com.waypoint.core.model;

/**
 * Lifecycle state of a goal.
 * <p>
 * {@code DRAFT -> ACTIVE}, {@code ACTIVE -> DRAFT}, and both {@code DRAFT} and
 * {@code ACTIVE} may move to {@code COMPLETED} or {@code ARCHIVED}, which are terminal.
 */
public enum ActivationState {
    DRAFT,
    ACTIVE,
    COMPLETED,
    ARCHIVED;

    public boolean isTerminal() {
        return this == COMPLETED || this == ARCHIVED;
    }

    public boolean canTransitionTo(ActivationState target) {
        return switch (this) {
            case DRAFT -> target == ACTIVE || target == COMPLETED || target == ARCHIVED;
            case ACTIVE -> target == DRAFT || target == COMPLETED || target == ARCHIVED;
            case COMPLETED, ARCHIVED -> false;
        };
    }
}
