package com.waypoint.core.reasoning;

import java.util.List;

/**
 * Enrichment for one timeline entry, addressed by the entry id.
 */
public record TimelineInsight(
    String entryId,
    String outcomeSummary,
    List<String> highlights,
    String recommendedAction,
    Double completionLikelihood,
    Boolean readyToMarkGoalComplete
) {}
