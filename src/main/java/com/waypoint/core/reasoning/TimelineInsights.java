package com.waypoint.core.reasoning;

import java.util.List;

public record TimelineInsights(List<TimelineInsight> insights, String portfolioHeadline) {

    public TimelineInsights {
        insights = insights == null ? List.of() : List.copyOf(insights);
    }
}
