package com.waypoint.core.graph;

import com.waypoint.core.model.GoalDependency;

import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Mutations accumulated since the last {@link GoalGraph#drainChanges()}.
 *
 * @param upserts              goals created or modified, with their current parent
 * @param deletedGoalIds       goals removed from the graph
 * @param addedDependencies    dependency edges created
 * @param removedDependencyIds dependency edges removed
 */
public record GraphChangeSet(
    List<GoalRecord> upserts,
    Set<UUID> deletedGoalIds,
    List<GoalDependency> addedDependencies,
    Set<UUID> removedDependencyIds
) {

    public GraphChangeSet {
        upserts = List.copyOf(upserts);
        deletedGoalIds = Set.copyOf(deletedGoalIds);
        addedDependencies = List.copyOf(addedDependencies);
        removedDependencyIds = Set.copyOf(removedDependencyIds);
    }

    public boolean isEmpty() {
        return upserts.isEmpty() && deletedGoalIds.isEmpty()
                && addedDependencies.isEmpty() && removedDependencyIds.isEmpty();
    }

    public int size() {
        return upserts.size() + deletedGoalIds.size() + addedDependencies.size() + removedDependencyIds.size();
    }
}
