package com.waypoint.core.timeline;

import java.util.List;

public record TimelineInsightsResult(List<TimelineEntry> entries, String portfolioHeadline) {

    public TimelineInsightsResult {
        entries = List.copyOf(entries);
    }
}
