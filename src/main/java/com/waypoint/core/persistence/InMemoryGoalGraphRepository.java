package com.waypoint.core.persistence;

import com.waypoint.core.graph.GoalRecord;
import com.waypoint.core.graph.GraphChangeSet;
import com.waypoint.core.graph.GraphSnapshot;
import com.waypoint.core.model.GoalDependency;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Keeps saved state in process memory; nothing survives a restart.
 */
public class InMemoryGoalGraphRepository implements GoalGraphRepository {

    private final Map<UUID, GoalRecord> goals = new LinkedHashMap<>();
    private final Map<UUID, GoalDependency> dependencies = new LinkedHashMap<>();

    @Override
    public synchronized GraphSnapshot loadAll() {
        return new GraphSnapshot(new ArrayList<>(goals.values()), new ArrayList<>(dependencies.values()));
    }

    @Override
    public synchronized void save(GraphChangeSet changes) {
        changes.removedDependencyIds().forEach(dependencies::remove);
        changes.deletedGoalIds().forEach(goals::remove);
        changes.upserts().forEach(r -> goals.put(r.goal().getId(), r));
        changes.addedDependencies().forEach(d -> dependencies.put(d.id(), d));
    }

    public synchronized int goalCount() {
        return goals.size();
    }
}
