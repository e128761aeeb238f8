package com.waypoint.core.persistence;

import com.waypoint.core.graph.GoalGraph;
import com.waypoint.core.graph.GraphSnapshot;
import com.waypoint.core.model.DependencyKind;
import com.waypoint.core.model.Goal;
import com.waypoint.core.model.GoalRevision;
import com.waypoint.core.model.GoalSnapshot;
import com.waypoint.core.model.ScheduledEventLink;
import com.waypoint.core.model.StepStatus;
import com.waypoint.core.model.TargetMetric;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the repository against an in-memory H2 database.
 */
class JdbcGoalGraphRepositoryTest {

    private static final Instant NOW = Instant.parse("2026-03-01T09:00:00Z");

    private JdbcGoalGraphRepository repository;
    private GoalGraph graph;
    private GraphPersistence persistence;

    @BeforeEach
    void setUp() throws Exception {
        var dataSource = new DriverManagerDataSource(
                "jdbc:h2:mem:waypoint-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1", "sa", "");
        repository = new JdbcGoalGraphRepository(dataSource);
        repository.createTables();
        graph = new GoalGraph(Clock.fixed(NOW, ZoneOffset.UTC));
        persistence = new GraphPersistence(graph, repository);
    }

    @Test
    @DisplayName("a fresh database loads as an empty graph")
    void emptyLoad() {
        GraphSnapshot snapshot = repository.loadAll();
        assertTrue(snapshot.goals().isEmpty());
        assertTrue(snapshot.dependencies().isEmpty());
    }

    @Test
    @DisplayName("flushed goals, edges and goal state survive a reload")
    void roundTripThroughFlush() {
        Goal root = graph.insert(new Goal("Run a marathon", "Sub 4h", "Health", null, null, NOW), null);
        root.setTargetMetric(new TargetMetric("Distance", 5.0, 42.2, "km", 30, null));
        root.addScheduledEvent(ScheduledEventLink.proposed("cal-1", NOW, NOW.plusSeconds(3600)));
        root.appendRevision(GoalRevision.of("Locked", "Ready", NOW));
        root.lock(GoalSnapshot.of(root, "Ready", NOW), 10);
        Goal step = new Goal("Run 10k", "", null, null, null, NOW);
        step.markAsStep(StepStatus.CURRENT);
        graph.insert(step, root.getId());
        Goal other = graph.insert(new Goal("Buy shoes", "", null, null, null, NOW), null);
        graph.addDependency(other.getId(), step.getId(), DependencyKind.FINISH_TO_START, "gear first");

        assertEquals(4, persistence.flush());
        assertEquals(0, persistence.flush());

        var reloaded = new GoalGraph(Clock.fixed(NOW, ZoneOffset.UTC));
        reloaded.load(repository.loadAll());

        assertEquals(3, reloaded.size());
        Goal loadedRoot = reloaded.get(root.getId());
        assertTrue(loadedRoot.isLocked());
        assertEquals("Ready", loadedRoot.getLockedSnapshot().rationale());
        assertEquals(42.2, loadedRoot.getTargetMetric().targetValue());
        assertEquals("cal-1", loadedRoot.getScheduledEvents().get(0).externalEventId());
        assertEquals(1, loadedRoot.getRevisionHistory().size());
        assertEquals(StepStatus.CURRENT, reloaded.get(step.getId()).getStepStatus());
        assertEquals(root.getId(), reloaded.parent(step.getId()).orElseThrow());
        assertEquals("gear first", reloaded.incomingDependencies(step.getId()).get(0).note());
    }

    @Test
    @DisplayName("deletes and edge removals reach the database")
    void deletes() {
        Goal a = graph.insert(new Goal("A", "", null, null, null, NOW), null);
        Goal b = graph.insert(new Goal("B", "", null, null, null, NOW), null);
        var edge = graph.addDependency(a.getId(), b.getId(), DependencyKind.FINISH_TO_START, null);
        persistence.flush();

        graph.removeDependency(edge.id());
        graph.delete(a.getId());
        persistence.flush();

        GraphSnapshot snapshot = repository.loadAll();
        assertEquals(1, snapshot.goals().size());
        assertEquals(b.getId(), snapshot.goals().get(0).goal().getId());
        assertTrue(snapshot.dependencies().isEmpty());
    }

    @Test
    @DisplayName("an updated goal is stored once with its latest content")
    void upsert() {
        Goal a = graph.insert(new Goal("Draft", "", null, null, null, NOW), null);
        persistence.flush();
        a.setTitle("Final");
        graph.touch(a.getId());
        persistence.flush();

        GraphSnapshot snapshot = repository.loadAll();
        assertEquals(1, snapshot.goals().size());
        assertEquals("Final", snapshot.goals().get(0).goal().getTitle());
    }
}
