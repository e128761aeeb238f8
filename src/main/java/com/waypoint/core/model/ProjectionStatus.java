package com.waypoint.core.model;

public enum ProjectionStatus {
    UPCOMING,
    IN_PROGRESS,
    COMPLETE,
    SKIPPED;

    /** Completed and skipped projections no longer appear on timelines. */
    public boolean isOpen() {
        return this == UPCOMING || this == IN_PROGRESS;
    }
}
