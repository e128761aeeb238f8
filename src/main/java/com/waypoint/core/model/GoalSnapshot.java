package com.waypoint.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * Content of a goal captured at a point in time, used for locks and for
 * before/after pairs on audited revisions.
 *
 * @param title      goal title at capture time
 * @param body       goal body at capture time
 * @param progress   stored progress at capture time
 * @param rationale  why the snapshot was taken (may be null for revision pairs)
 * @param capturedAt capture time
 */
public record GoalSnapshot(
    String title,
    String body,
    double progress,
    String rationale,
    Instant capturedAt
) implements Serializable {

    public static GoalSnapshot of(Goal goal, String rationale, Instant capturedAt) {
        return new GoalSnapshot(goal.getTitle(), goal.getBody(), goal.getProgress(), rationale, capturedAt);
    }
}
