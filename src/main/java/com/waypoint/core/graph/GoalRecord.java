package com.waypoint.core.graph;

import com.waypoint.core.model.Goal;

import java.util.UUID;

/**
 * A goal together with its position in the hierarchy, as exchanged with storage.
 *
 * @param goal     the goal
 * @param parentId owning parent, or {@code null} for a top-level goal
 */
public record GoalRecord(Goal goal, UUID parentId) {}
