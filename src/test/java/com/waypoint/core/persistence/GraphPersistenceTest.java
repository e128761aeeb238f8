package com.waypoint.core.persistence;

import com.waypoint.core.graph.GoalGraph;
import com.waypoint.core.graph.GraphChangeSet;
import com.waypoint.core.model.Goal;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class GraphPersistenceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T09:00:00Z");

    private final GoalGraph graph = new GoalGraph(Clock.fixed(NOW, ZoneOffset.UTC));

    @Test
    @DisplayName("load replaces the graph with the repository content")
    void load() {
        var source = new InMemoryGoalGraphRepository();
        var other = new GoalGraph(Clock.fixed(NOW, ZoneOffset.UTC));
        other.insert(new Goal("Persisted", "", null, null, null, NOW), null);
        source.save(other.drainChanges());

        new GraphPersistence(graph, source).load();

        assertEquals(1, graph.size());
        assertEquals("Persisted", graph.topLevelGoals().get(0).getTitle());
    }

    @Test
    @DisplayName("flush skips the repository when nothing changed")
    void flushNothing() {
        GoalGraphRepository repository = mock(GoalGraphRepository.class);

        assertEquals(0, new GraphPersistence(graph, repository).flush());
        verify(repository, never()).save(any());
    }

    @Test
    @DisplayName("a failed save propagates to the caller")
    void saveFailure() {
        GoalGraphRepository repository = mock(GoalGraphRepository.class);
        doThrow(new PersistenceException("disk full", null)).when(repository).save(any(GraphChangeSet.class));
        graph.insert(new Goal("Doomed", "", null, null, null, NOW), null);

        assertThrows(PersistenceException.class, () -> new GraphPersistence(graph, repository).flush());
        assertTrue(graph.hasPendingChanges());
    }

    @Test
    @DisplayName("changes from a failed save are written by the next successful flush")
    void saveRetriedAfterFailure() {
        var repository = spy(new InMemoryGoalGraphRepository());
        doThrow(new PersistenceException("connection reset", null))
                .doCallRealMethod()
                .when(repository).save(any(GraphChangeSet.class));
        var persistence = new GraphPersistence(graph, repository);

        graph.insert(new Goal("First", "", null, null, null, NOW), null);
        assertThrows(PersistenceException.class, persistence::flush);

        Goal second = graph.insert(new Goal("Second", "", null, null, null, NOW), null);
        assertEquals(2, persistence.flush());

        assertEquals(2, repository.goalCount());
        assertFalse(graph.hasPendingChanges());
        assertTrue(repository.loadAll().goals().stream().anyMatch(r -> r.goal().getId().equals(second.getId())));
    }

    @Test
    @DisplayName("a goal deleted after a failed save is not written back")
    void restoreSkipsDeletedGoals() {
        var repository = spy(new InMemoryGoalGraphRepository());
        doThrow(new PersistenceException("connection reset", null))
                .doCallRealMethod()
                .when(repository).save(any(GraphChangeSet.class));
        var persistence = new GraphPersistence(graph, repository);

        Goal goal = graph.insert(new Goal("Short-lived", "", null, null, null, NOW), null);
        assertThrows(PersistenceException.class, persistence::flush);
        graph.delete(goal.getId());
        persistence.flush();

        assertEquals(0, repository.goalCount());
    }
}
