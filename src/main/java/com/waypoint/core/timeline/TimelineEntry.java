package com.waypoint.core.timeline;

import java.time.Instant;
import java.util.UUID;

/**
 * One displayable row of a goal timeline.
 *
 * @param id            id of the source item (event link, projection, phase) or a stable id for checkpoints
 * @param metricSummary formatted metric delta, e.g. "Δ2.5 kg body fat"
 * @param intelligence  enrichment, absent unless the enrichment pass ran
 */
public record TimelineEntry(
    UUID id,
    UUID goalId,
    String goalTitle,
    TimelineEntryKind kind,
    String title,
    String detail,
    Instant start,
    Instant end,
    String metricSummary,
    Double confidence,
    TimelineIntelligence intelligence
) {

    public TimelineEntry withIntelligence(TimelineIntelligence newIntelligence) {
        return new TimelineEntry(id, goalId, goalTitle, kind, title, detail, start, end,
                metricSummary, confidence, newIntelligence);
    }
}
