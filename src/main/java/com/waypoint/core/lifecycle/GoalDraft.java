package com.waypoint.core.lifecycle;

import com.waypoint.core.model.GoalKind;
import com.waypoint.core.model.Priority;
import com.waypoint.core.model.TargetMetric;

import java.time.Instant;
import java.util.UUID;

/**
 * Input for creating a goal. Everything except the title is optional.
 *
 * @param parentId parent goal, or {@code null} for a top-level goal
 */
public record GoalDraft(
    String title,
    String body,
    String category,
    Priority priority,
    GoalKind kind,
    String emoji,
    Instant targetDate,
    TargetMetric targetMetric,
    UUID parentId
) {

    public static GoalDraft of(String title, String body) {
        return new GoalDraft(title, body, null, null, null, null, null, null, null);
    }

    public GoalDraft under(UUID parent) {
        return new GoalDraft(title, body, category, priority, kind, emoji, targetDate, targetMetric, parent);
    }
}
