package com.waypoint.core.model;

/**
 * Status of a step on a sequential roadmap.
 * <p>
 * {@code UNKNOWN} marks a step whose status could not be determined; it never
 * blocks advancement and sorts after {@code PENDING}.
 */
public enum StepStatus {
    COMPLETED(0),
    CURRENT(1),
    PENDING(2),
    UNKNOWN(3);

    private final int sortRank;

    StepStatus(int sortRank) {
        this.sortRank = sortRank;
    }

    public int sortRank() {
        return sortRank;
    }
}
