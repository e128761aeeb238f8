package com.waypoint.core.timeline;

/**
 * Declaration order is the tie-break order for entries starting at the same instant.
 */
public enum TimelineEntryKind {
    EVENT,
    PROJECTION,
    PHASE,
    METRIC_CHECKPOINT
}
