package com.waypoint.core.model;

import java.io.Serializable;

/**
 * Measurable target of a metric-driven goal.
 *
 * @param label                 what is measured ("Body fat")
 * @param baselineValue         starting value, if known
 * @param targetValue           value to reach
 * @param unit                  unit label ("kg")
 * @param measurementWindowDays length of the measurement window in days
 * @param notes                 free text shown with checkpoints
 */
public record TargetMetric(
    String label,
    Double baselineValue,
    Double targetValue,
    String unit,
    Integer measurementWindowDays,
    String notes
) implements Serializable {

    /** Absolute distance between baseline and target, or the target alone without a baseline. */
    public Double delta() {
        if (targetValue == null) return null;
        if (baselineValue == null) return targetValue;
        return Math.abs(targetValue - baselineValue);
    }
}
