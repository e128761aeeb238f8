package com.waypoint.core.model;

/**
 * Temporal relation carried by a dependency edge.
 */
public enum DependencyKind {
    FINISH_TO_START,
    START_TO_START,
    FINISH_TO_FINISH
}
