package com.waypoint.core.persistence;

import com.waypoint.core.graph.GraphChangeSet;
import com.waypoint.core.graph.GraphSnapshot;

/**
 * Storage boundary of the goal graph: bulk load at startup, incremental save after mutations.
 */
public interface GoalGraphRepository {

    GraphSnapshot loadAll();

    /** Applies the change set atomically. */
    void save(GraphChangeSet changes);
}
