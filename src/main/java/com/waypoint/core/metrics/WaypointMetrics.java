package com.waypoint.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Micrometer metrics for goal lifecycle, breakdown and roadmap operations.
 */
@Service
public class WaypointMetrics {

    private final MeterRegistry registry;

    public WaypointMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * @param transition "locked", "unlocked", "activated", "deactivated", "completed", ...
     */
    public void recordTransition(String transition) {
        Counter.builder("waypoint.lifecycle.transitions")
                .tag("transition", transition)
                .register(registry)
                .increment();
    }

    public void recordLockFallback() {
        Counter.builder("waypoint.lifecycle.lock_fallbacks")
                .description("Locks that used the default rationale after a reasoning failure")
                .register(registry)
                .increment();
    }

    public void recordBreakdown(int goalsCreated, int dependenciesAdded) {
        DistributionSummary.builder("waypoint.breakdown.goals_created")
                .register(registry)
                .record(goalsCreated);
        DistributionSummary.builder("waypoint.breakdown.dependencies_added")
                .register(registry)
                .record(dependenciesAdded);
    }

    public void recordDroppedDependency(String reason) {
        Counter.builder("waypoint.breakdown.dropped_dependencies")
                .description("Declared dependencies skipped during breakdown")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    /**
     * @param outcome "advanced", "duplicate_skipped", "roadmap_completed" or "limit_exceeded"
     */
    public void recordStepAdvance(String outcome) {
        Counter.builder("waypoint.roadmap.step_advances")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordExternalCall(String service, String outcome, long ms) {
        Timer.builder("waypoint.external.duration")
                .tag("service", service)
                .tag("outcome", outcome)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordCalendarCancelFailure() {
        Counter.builder("waypoint.calendar.cancel_failures")
                .register(registry)
                .increment();
    }
}
