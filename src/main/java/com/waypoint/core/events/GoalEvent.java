package com.waypoint.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * A goal lifecycle event, streamed over SSE and printed by the CLI.
 *
 * @param eventType dotted event name, e.g. "goal.locked", "goal.step_advanced"
 * @param goalId    the goal the event concerns
 * @param payload   event-specific data
 * @param timestamp when the event occurred
 */
public record GoalEvent(
    String eventType,
    UUID goalId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static final String CREATED = "goal.created";
    public static final String UPDATED = "goal.updated";
    public static final String LOCKED = "goal.locked";
    public static final String UNLOCKED = "goal.unlocked";
    public static final String REGENERATED = "goal.regenerated";
    public static final String ACTIVATED = "goal.activated";
    public static final String DEACTIVATED = "goal.deactivated";
    public static final String COMPLETED = "goal.completed";
    public static final String DELETED = "goal.deleted";
    public static final String BROKEN_DOWN = "goal.broken_down";
    public static final String STEP_ADVANCED = "goal.step_advanced";
    public static final String PROGRESS = "goal.progress";

    public GoalEvent {
        payload = payload == null ? Map.of() : Map.copyOf(payload);
    }
}
