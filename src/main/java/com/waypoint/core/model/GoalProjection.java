package com.waypoint.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.UUID;

/**
 * Externally supplied forecast slice for a campaign goal.
 */
public record GoalProjection(
    UUID id,
    String title,
    String detail,
    Instant start,
    Instant end,
    Double expectedMetricDelta,
    String metricUnit,
    Double confidence,
    ProjectionStatus status
) implements Serializable {

    public GoalProjection {
        if (status == null) status = ProjectionStatus.UPCOMING;
    }
}
