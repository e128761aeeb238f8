package com.waypoint.core.graph;

import com.waypoint.core.model.GoalDependency;

import java.util.List;

/**
 * Full content of a goal graph: every goal with its parent, plus every dependency edge.
 * Used for bulk load at startup.
 */
public record GraphSnapshot(List<GoalRecord> goals, List<GoalDependency> dependencies) {

    public GraphSnapshot {
        goals = goals == null ? List.of() : List.copyOf(goals);
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
    }

    public static GraphSnapshot empty() {
        return new GraphSnapshot(List.of(), List.of());
    }
}
