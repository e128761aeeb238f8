package com.waypoint.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.UUID;

/**
 * One entry of a goal's append-only audit trail.
 *
 * @param id        unique revision id
 * @param summary   short description ("Locked", "Regenerated", ...)
 * @param rationale optional explanation
 * @param before    content before the change, when the change replaced content
 * @param after     content after the change, when the change replaced content
 * @param timestamp when the change was recorded
 */
public record GoalRevision(
    UUID id,
    String summary,
    String rationale,
    GoalSnapshot before,
    GoalSnapshot after,
    Instant timestamp
) implements Serializable {

    public static GoalRevision of(String summary, String rationale, Instant timestamp) {
        return new GoalRevision(UUID.randomUUID(), summary, rationale, null, null, timestamp);
    }

    public static GoalRevision audited(String summary, String rationale,
                                       GoalSnapshot before, GoalSnapshot after, Instant timestamp) {
        return new GoalRevision(UUID.randomUUID(), summary, rationale, before, after, timestamp);
    }

    GoalRevision at(Instant newTimestamp) {
        return new GoalRevision(id, summary, rationale, before, after, newTimestamp);
    }
}
