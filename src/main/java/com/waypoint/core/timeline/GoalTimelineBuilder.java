package com.waypoint.core.timeline;

import com.waypoint.core.config.WaypointProperties;
import com.waypoint.core.model.EventLinkStatus;
import com.waypoint.core.model.GoalPhase;
import com.waypoint.core.model.GoalProjection;
import com.waypoint.core.model.PhaseStatus;
import com.waypoint.core.model.ScheduledEventLink;
import com.waypoint.core.model.TargetMetric;
import com.waypoint.core.query.GoalView;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * Projects a goal onto a date horizon as an ordered list of timeline entries.
 * <p>
 * Works on a {@link GoalView} so it never touches the live graph. Entries are
 * sorted by start, ties broken by {@link TimelineEntryKind} order.
 */
@Component
public class GoalTimelineBuilder {

    private static final Logger log = LoggerFactory.getLogger(GoalTimelineBuilder.class);

    static final Duration DEFAULT_EVENT_LENGTH = Duration.ofHours(1);
    static final Duration PLANNED_PHASE_LENGTH = Duration.ofDays(3);

    private static final Comparator<TimelineEntry> ORDER =
            Comparator.comparing(TimelineEntry::start).thenComparing(e -> e.kind().ordinal());

    private final int defaultSpanDays;

    public GoalTimelineBuilder(WaypointProperties properties) {
        this(properties.getTimeline().getDefaultSpanDays());
    }

    GoalTimelineBuilder(int defaultSpanDays) {
        this.defaultSpanDays = defaultSpanDays;
    }

    public List<TimelineEntry> entries(GoalView goal, Horizon horizon) {
        var results = new ArrayList<TimelineEntry>();
        goal.scheduledEvents().forEach(link -> eventEntry(goal, link, horizon, results));
        goal.projections().forEach(projection -> projectionEntry(goal, projection, horizon, results));
        goal.phases().forEach(phase -> phaseEntry(goal, phase, horizon, results));
        metricCheckpoint(goal, horizon, results);
        results.sort(ORDER);
        log.debug("Timeline for goal {}: {} entries in [{}, {}]", goal.id(), results.size(),
                horizon.start(), horizon.end());
        return results;
    }

    /**
     * Whether the goal belongs on a timeline for {@code horizon}: it has entries there,
     * or its span (activation, else creation, to target date or the default span)
     * overlaps the horizon.
     */
    public boolean isInHorizon(GoalView goal, Horizon horizon) {
        Instant anchor = goal.activatedAt() != null ? goal.activatedAt() : goal.createdAt();
        Instant end = goal.targetDate() != null
                ? goal.targetDate()
                : anchor.plus(Duration.ofDays(defaultSpanDays));
        if (end.isBefore(anchor)) {
            end = anchor;
        }
        return horizon.intersects(anchor, end) || !entries(goal, horizon).isEmpty();
    }

    private void eventEntry(GoalView goal, ScheduledEventLink link, Horizon horizon, List<TimelineEntry> out) {
        Instant start = link.start() != null ? link.start() : link.end();
        if (start == null) return;
        Instant end = link.end() != null ? link.end() : start.plus(DEFAULT_EVENT_LENGTH);
        if (!horizon.intersects(start, end)) return;

        out.add(new TimelineEntry(link.id(), goal.id(), goal.title(), TimelineEntryKind.EVENT,
                eventHeadline(link.status()), eventDetail(link.status()), start, end,
                null, eventConfidence(link.status()), null));
    }

    private void projectionEntry(GoalView goal, GoalProjection projection, Horizon horizon, List<TimelineEntry> out) {
        if (!projection.status().isOpen()) return;
        if (projection.start() == null || projection.end() == null) return;
        if (!horizon.intersects(projection.start(), projection.end())) return;

        String label = goal.targetMetric() != null ? goal.targetMetric().label() : null;
        out.add(new TimelineEntry(projection.id(), goal.id(), goal.title(), TimelineEntryKind.PROJECTION,
                projection.title(), projection.detail(), projection.start(), projection.end(),
                formatMetric(projection.expectedMetricDelta(), projection.metricUnit(), label),
                projection.confidence(), null));
    }

    private void phaseEntry(GoalView goal, GoalPhase phase, Horizon horizon, List<TimelineEntry> out) {
        Instant anchor = phase.startedAt() != null ? phase.startedAt()
                : goal.activatedAt() != null ? goal.activatedAt()
                : goal.createdAt();
        Instant end = phase.completedAt() != null ? phase.completedAt()
                : phase.status() == PhaseStatus.PLANNED ? anchor.plus(PLANNED_PHASE_LENGTH)
                : anchor;
        if (end.isBefore(anchor)) {
            end = anchor;
        }
        if (!horizon.intersects(anchor, end)) return;

        out.add(new TimelineEntry(phase.id(), goal.id(), goal.title(), TimelineEntryKind.PHASE,
                phase.title(), phase.summary(), anchor, end, null, null, null));
    }

    private void metricCheckpoint(GoalView goal, Horizon horizon, List<TimelineEntry> out) {
        TargetMetric metric = goal.targetMetric();
        if (metric == null || !goal.kind().tracksMetric()) return;

        Instant anchor = goal.activatedAt() != null ? goal.activatedAt() : goal.createdAt();
        long windowDays = metric.measurementWindowDays() != null
                ? metric.measurementWindowDays()
                : horizon.lengthDays();
        Instant checkpoint = anchor.plus(Duration.ofDays(Math.max(windowDays, 1)));
        if (!horizon.contains(checkpoint)) return;

        String summary = formatMetric(metric.delta(), metric.unit(), metric.label());
        out.add(new TimelineEntry(checkpointId(goal.id()), goal.id(), goal.title(),
                TimelineEntryKind.METRIC_CHECKPOINT, summary != null ? summary : metric.label(),
                metric.notes(), checkpoint, checkpoint, summary, null, null));
    }

    /** Stable per goal so enrichment can address the checkpoint across rebuilds. */
    static UUID checkpointId(UUID goalId) {
        return UUID.nameUUIDFromBytes(("metric-checkpoint:" + goalId).getBytes(StandardCharsets.UTF_8));
    }

    /**
     * "Δ{delta}[ unit][ label in lower case]" with at most one fraction digit,
     * or {@code null} when there is no delta.
     */
    static String formatMetric(Double delta, String unit, String label) {
        if (delta == null) return null;
        var format = new DecimalFormat("0.#", DecimalFormatSymbols.getInstance(Locale.ROOT));
        var sb = new StringBuilder("Δ").append(format.format(delta));
        if (unit != null && !unit.isBlank()) {
            sb.append(' ').append(unit.trim());
        }
        if (label != null && !label.isBlank()) {
            sb.append(' ').append(label.trim().toLowerCase(Locale.ROOT));
        }
        return sb.toString();
    }

    private static String eventHeadline(EventLinkStatus status) {
        return switch (status) {
            case CONFIRMED -> "Confirmed session";
            case PROPOSED -> "Proposed slot";
            case CANCELLED -> "Cancelled session";
        };
    }

    private static String eventDetail(EventLinkStatus status) {
        return switch (status) {
            case CONFIRMED -> "Confirmed focus block";
            case PROPOSED -> "Awaiting confirmation";
            case CANCELLED -> "Session cancelled";
        };
    }

    private static double eventConfidence(EventLinkStatus status) {
        return switch (status) {
            case CONFIRMED -> 0.95;
            case PROPOSED -> 0.6;
            case CANCELLED -> 0.2;
        };
    }
}
