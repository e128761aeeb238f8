package com.waypoint.core.timeline;

import java.util.List;

/**
 * Optional annotation attached to a timeline entry by the enrichment pass.
 */
public record TimelineIntelligence(
    String outcomeSummary,
    List<String> highlights,
    String recommendedAction,
    Double completionLikelihood,
    boolean readyToMarkGoalComplete
) {

    public TimelineIntelligence {
        highlights = highlights == null ? List.of() : List.copyOf(highlights);
    }
}
