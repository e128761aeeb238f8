package com.waypoint.core.timeline;

import com.waypoint.core.external.ExternalCallExecutor;
import com.waypoint.core.logging.MdcContext;
import com.waypoint.core.query.GoalView;
import com.waypoint.core.reasoning.GoalContextBuilder;
import com.waypoint.core.reasoning.ReasoningService;
import com.waypoint.core.reasoning.TimelineInsight;
import com.waypoint.core.reasoning.TimelineInsights;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Optional enrichment pass over timeline entries. The reasoning collaborator
 * annotates entries by id; entries it does not mention come back unchanged.
 */
@Service
public class TimelineIntelligenceService {

    private static final Logger log = LoggerFactory.getLogger(TimelineIntelligenceService.class);

    static final int HIGHLIGHT_LIMIT = 4;

    private final GoalContextBuilder contextBuilder;
    private final ReasoningService reasoning;
    private final ExternalCallExecutor external;

    public TimelineIntelligenceService(GoalContextBuilder contextBuilder,
                                       ReasoningService reasoning,
                                       ExternalCallExecutor external) {
        this.contextBuilder = contextBuilder;
        this.reasoning = reasoning;
        this.external = external;
    }

    /**
     * @throws com.waypoint.core.error.ExternalServiceException if the reasoning call fails
     */
    public TimelineInsightsResult enrich(List<TimelineEntry> entries, GoalView goal, Horizon horizon) {
        if (entries.isEmpty()) {
            return new TimelineInsightsResult(List.of(), null);
        }
        try (var mdc = MdcContext.operation("timeline-insights", goal.id())) {
            var context = contextBuilder.build(goal.id());
            TimelineInsights insights = external.call("reasoning", "timeline insights",
                    () -> reasoning.requestTimelineInsights(context, entries, horizon));

            Map<String, TimelineInsight> byEntry = new HashMap<>();
            for (TimelineInsight insight : insights.insights()) {
                if (insight.entryId() != null) {
                    byEntry.put(insight.entryId().trim().toLowerCase(Locale.ROOT), insight);
                }
            }

            List<TimelineEntry> enriched = entries.stream().map(entry -> {
                TimelineInsight insight = byEntry.get(entry.id().toString());
                return insight == null ? entry : entry.withIntelligence(toIntelligence(insight));
            }).toList();
            log.debug("Enriched {} of {} timeline entries for goal {}", byEntry.size(), entries.size(), goal.id());
            return new TimelineInsightsResult(enriched, insights.portfolioHeadline());
        }
    }

    private static TimelineIntelligence toIntelligence(TimelineInsight insight) {
        List<String> highlights = insight.highlights() == null ? List.of()
                : insight.highlights().stream().limit(HIGHLIGHT_LIMIT).toList();
        return new TimelineIntelligence(insight.outcomeSummary(), highlights, insight.recommendedAction(),
                insight.completionLikelihood(), Boolean.TRUE.equals(insight.readyToMarkGoalComplete()));
    }
}
