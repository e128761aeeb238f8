package com.waypoint.core.persistence;

import com.waypoint.core.graph.GoalGraph;
import com.waypoint.core.graph.GraphChangeSet;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Connects the in-memory graph to its repository: loads everything at startup
 * and writes pending changes after each mutating operation.
 */
@Component
public class GraphPersistence {

    private static final Logger log = LoggerFactory.getLogger(GraphPersistence.class);

    private final GoalGraph graph;
    private final GoalGraphRepository repository;

    public GraphPersistence(GoalGraph graph, GoalGraphRepository repository) {
        this.graph = graph;
        this.repository = repository;
    }

    @PostConstruct
    public void load() {
        graph.load(repository.loadAll());
    }

    /**
     * Saves the changes recorded since the last flush. Runs under the graph write
     * lock so the serialized goals cannot change mid-save. A failed save leaves
     * its changes pending for the next flush.
     *
     * @return number of changes written
     */
    public int flush() {
        return graph.write(() -> {
            GraphChangeSet changes = graph.drainChanges();
            if (changes.isEmpty()) {
                return 0;
            }
            try {
                repository.save(changes);
            } catch (RuntimeException e) {
                graph.restoreChanges(changes);
                log.warn("Save of {} change(s) failed; kept pending for the next flush", changes.size());
                throw e;
            }
            log.debug("Flushed {} change(s)", changes.size());
            return changes.size();
        });
    }
}
