package com.waypoint.core.model;

public enum PhaseStatus {
    PLANNED,
    ACTIVE,
    COMPLETE
}
