package com.waypoint.core.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class WaypointMetricsTest {

    private SimpleMeterRegistry registry;
    private WaypointMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new WaypointMetrics(registry);
    }

    @Test
    @DisplayName("recordTransition counts by transition tag")
    void recordTransition() {
        metrics.recordTransition("locked");
        metrics.recordTransition("locked");
        metrics.recordTransition("activated");

        assertEquals(2.0, registry.find("waypoint.lifecycle.transitions").tag("transition", "locked").counter().count());
        assertEquals(1.0, registry.find("waypoint.lifecycle.transitions").tag("transition", "activated").counter().count());
    }

    @Test
    @DisplayName("recordBreakdown records both distributions")
    void recordBreakdown() {
        metrics.recordBreakdown(6, 2);

        var goals = registry.find("waypoint.breakdown.goals_created").summary();
        var deps = registry.find("waypoint.breakdown.dependencies_added").summary();
        assertNotNull(goals);
        assertNotNull(deps);
        assertEquals(6.0, goals.totalAmount());
        assertEquals(2.0, deps.totalAmount());
    }

    @Test
    @DisplayName("recordExternalCall creates a timer per service and outcome")
    void recordExternalCall() {
        metrics.recordExternalCall("reasoning", "success", 120);
        metrics.recordExternalCall("calendar", "timeout", 30000);

        var reasoning = registry.find("waypoint.external.duration")
                .tag("service", "reasoning").tag("outcome", "success").timer();
        var calendar = registry.find("waypoint.external.duration")
                .tag("service", "calendar").tag("outcome", "timeout").timer();
        assertNotNull(reasoning);
        assertNotNull(calendar);
        assertEquals(1, reasoning.count());
    }

    @Test
    @DisplayName("recordStepAdvance counts by outcome")
    void recordStepAdvance() {
        metrics.recordStepAdvance("advanced");
        metrics.recordStepAdvance("limit_exceeded");

        assertEquals(1.0, registry.find("waypoint.roadmap.step_advances").tag("outcome", "advanced").counter().count());
        assertEquals(1.0, registry.find("waypoint.roadmap.step_advances").tag("outcome", "limit_exceeded").counter().count());
    }
}
