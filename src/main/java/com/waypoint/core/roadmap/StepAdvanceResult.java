package com.waypoint.core.roadmap;

import com.waypoint.core.query.GoalView;

/**
 * What happened when the current roadmap step was completed.
 *
 * @param outcome       which path the advance took
 * @param completedStep the step that was just completed
 * @param newStep       the step that became current, or {@code null}
 * @param progress      the roadmap owner's progress after the advance
 * @param warning       message for the caller to show (duplicate skipped, roadmap getting long), or {@code null}
 */
public record StepAdvanceResult(
    Outcome outcome,
    GoalView completedStep,
    GoalView newStep,
    double progress,
    String warning
) {

    public enum Outcome {
        ADVANCED,
        DUPLICATE_SKIPPED,
        ROADMAP_COMPLETED
    }

    public boolean hasWarning() {
        return warning != null;
    }
}
