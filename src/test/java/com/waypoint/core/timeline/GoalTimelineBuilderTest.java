package com.waypoint.core.timeline;

import com.waypoint.core.model.ActivationState;
import com.waypoint.core.model.EventLinkStatus;
import com.waypoint.core.model.GoalKind;
import com.waypoint.core.model.GoalPhase;
import com.waypoint.core.model.GoalProjection;
import com.waypoint.core.model.PhaseStatus;
import com.waypoint.core.model.Priority;
import com.waypoint.core.model.ProjectionStatus;
import com.waypoint.core.model.ScheduledEventLink;
import com.waypoint.core.model.TargetMetric;
import com.waypoint.core.query.GoalView;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class GoalTimelineBuilderTest {

    private static final Instant START = Instant.parse("2026-03-01T00:00:00Z");

    private final GoalTimelineBuilder builder = new GoalTimelineBuilder(14);

    private static GoalView goal(GoalKind kind, TargetMetric metric, List<GoalProjection> projections,
                                 List<GoalPhase> phases, List<ScheduledEventLink> events,
                                 Instant createdAt, Instant targetDate) {
        return new GoalView(UUID.randomUUID(), null, "Lose weight", "", "Health", Priority.NOW, kind,
                ActivationState.DRAFT, false, 0.0, 0, false, false, false, false, null, false, null, null,
                metric, projections, phases, events, List.of(), 0, targetDate, createdAt, createdAt, null, null);
    }

    private static Instant day(int n) {
        return START.plus(Duration.ofDays(n));
    }

    @Test
    @DisplayName("entries are sorted by start with kind order breaking ties")
    void ordering() {
        var event = new ScheduledEventLink(UUID.randomUUID(), "cal-1", day(3), day(3).plusSeconds(3600), EventLinkStatus.CONFIRMED);
        var projection = new GoalProjection(UUID.randomUUID(), "Week 1", "First week", day(3), day(9),
                1.5, "kg", 0.7, ProjectionStatus.UPCOMING);
        var phase = new GoalPhase(UUID.randomUUID(), "Prepare", "Plan meals", 0, PhaseStatus.COMPLETE, day(1), day(2));
        var view = goal(GoalKind.CAMPAIGN, null, List.of(projection), List.of(phase), List.of(event), day(0), null);

        List<TimelineEntry> entries = builder.entries(view, Horizon.ofDays(START, 14));

        assertEquals(List.of(TimelineEntryKind.PHASE, TimelineEntryKind.EVENT, TimelineEntryKind.PROJECTION),
                entries.stream().map(TimelineEntry::kind).toList());
        assertEquals("Confirmed session", entries.get(1).title());
        assertEquals(0.95, entries.get(1).confidence());
        assertEquals("Δ1.5 kg", entries.get(2).metricSummary());
    }

    @Test
    @DisplayName("items outside the horizon and closed projections are skipped")
    void clipping() {
        var late = new ScheduledEventLink(UUID.randomUUID(), "cal-2", day(30), day(30).plusSeconds(600), EventLinkStatus.PROPOSED);
        var skipped = new GoalProjection(UUID.randomUUID(), "Skipped", null, day(1), day(2), null, null, null,
                ProjectionStatus.SKIPPED);
        var view = goal(GoalKind.EVENT, null, List.of(skipped), List.of(), List.of(late), day(0), null);

        assertTrue(builder.entries(view, Horizon.ofDays(START, 14)).isEmpty());
    }

    @Test
    @DisplayName("metric-driven goals get one checkpoint at the end of the measurement window")
    void metricCheckpoint() {
        var metric = new TargetMetric("Body fat", 24.0, 21.5, "%", 7, "Weekly weigh-in");
        var view = goal(GoalKind.HYBRID, metric, List.of(), List.of(), List.of(), day(0), null);

        List<TimelineEntry> entries = builder.entries(view, Horizon.ofDays(START, 14));

        assertEquals(1, entries.size());
        TimelineEntry checkpoint = entries.get(0);
        assertEquals(TimelineEntryKind.METRIC_CHECKPOINT, checkpoint.kind());
        assertEquals(day(7), checkpoint.start());
        assertEquals("Δ2.5 % body fat", checkpoint.metricSummary());
        assertEquals(GoalTimelineBuilder.checkpointId(view.id()), checkpoint.id());
    }

    @Test
    @DisplayName("event goals never get a metric checkpoint")
    void eventKindIgnoresMetric() {
        var metric = new TargetMetric("Distance", null, 42.2, "km", 7, null);
        var view = goal(GoalKind.EVENT, metric, List.of(), List.of(), List.of(), day(0), null);

        assertTrue(builder.entries(view, Horizon.ofDays(START, 14)).isEmpty());
    }

    @Test
    @DisplayName("a planned phase spans three days from the goal anchor")
    void plannedPhase() {
        var phase = new GoalPhase(UUID.randomUUID(), "Build habit", null, 1, PhaseStatus.PLANNED, null, null);
        var view = goal(GoalKind.CAMPAIGN, null, List.of(), List.of(phase), List.of(), day(2), null);

        TimelineEntry entry = builder.entries(view, Horizon.ofDays(START, 14)).get(0);

        assertEquals(day(2), entry.start());
        assertEquals(day(5), entry.end());
    }

    @Test
    @DisplayName("isInHorizon uses the target date, else the default span")
    void inHorizon() {
        var withTarget = goal(GoalKind.EVENT, null, List.of(), List.of(), List.of(), day(-40), day(-10));
        var withoutTarget = goal(GoalKind.EVENT, null, List.of(), List.of(), List.of(), day(-10), null);

        assertFalse(builder.isInHorizon(withTarget, Horizon.ofDays(START, 14)));
        assertTrue(builder.isInHorizon(withoutTarget, Horizon.ofDays(START, 14)));
    }

    @Test
    @DisplayName("formatMetric keeps at most one fraction digit")
    void formatMetric() {
        assertEquals("Δ3", GoalTimelineBuilder.formatMetric(3.0, null, null));
        assertEquals("Δ0.3 kg", GoalTimelineBuilder.formatMetric(0.26, " kg ", ""));
        assertNull(GoalTimelineBuilder.formatMetric(null, "kg", "Weight"));
    }
}
