package com.waypoint.core.query;

import com.waypoint.core.graph.GoalGraph;
import com.waypoint.core.model.GoalDependency;
import com.waypoint.core.model.GoalRevision;
import com.waypoint.core.progress.ProgressAggregator;
import com.waypoint.core.timeline.GoalTimelineBuilder;
import com.waypoint.core.timeline.Horizon;
import com.waypoint.core.timeline.TimelineEntry;
import com.waypoint.core.timeline.TimelineInsightsResult;
import com.waypoint.core.timeline.TimelineIntelligenceService;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;

/**
 * Read side used by the REST and CLI surfaces. Every result is a copy; nothing
 * returned here references live goals.
 */
@Service
public class GoalQueryService {

    private final GoalGraph graph;
    private final GoalViewFactory views;
    private final ProgressAggregator progressAggregator;
    private final GoalTimelineBuilder timelineBuilder;
    private final TimelineIntelligenceService timelineIntelligence;

    public GoalQueryService(GoalGraph graph,
                            GoalViewFactory views,
                            ProgressAggregator progressAggregator,
                            GoalTimelineBuilder timelineBuilder,
                            TimelineIntelligenceService timelineIntelligence) {
        this.graph = graph;
        this.views = views;
        this.progressAggregator = progressAggregator;
        this.timelineBuilder = timelineBuilder;
        this.timelineIntelligence = timelineIntelligence;
    }

    public List<GoalView> topLevelGoals() {
        return graph.read(() -> views.views(graph.topLevelGoals()));
    }

    public GoalView goal(UUID goalId) {
        return views.view(goalId);
    }

    public List<GoalView> children(UUID goalId) {
        return graph.read(() -> views.views(graph.children(goalId)));
    }

    public List<GoalView> descendants(UUID goalId) {
        return graph.read(() -> views.views(graph.descendants(goalId, false)));
    }

    public double progress(UUID goalId) {
        return progressAggregator.progress(goalId);
    }

    public List<GoalRevision> revisionHistory(UUID goalId) {
        return graph.read(() -> List.copyOf(graph.get(goalId).getRevisionHistory()));
    }

    /** Edges where the goal is the prerequisite or the dependent. */
    public List<GoalDependency> dependencies(UUID goalId) {
        return graph.read(() -> {
            graph.get(goalId);
            var edges = new ArrayList<GoalDependency>(graph.incomingDependencies(goalId));
            edges.addAll(graph.outgoingDependencies(goalId));
            return edges;
        });
    }

    public List<TimelineEntry> timelineEntries(UUID goalId, Horizon horizon) {
        return timelineBuilder.entries(views.view(goalId), horizon);
    }

    /** Entries of every top-level goal that falls in the horizon, in timeline order. */
    public List<TimelineEntry> portfolioTimeline(Horizon horizon) {
        var entries = new ArrayList<TimelineEntry>();
        for (GoalView goal : topLevelGoals()) {
            if (timelineBuilder.isInHorizon(goal, horizon)) {
                entries.addAll(timelineBuilder.entries(goal, horizon));
            }
        }
        entries.sort(Comparator.comparing(TimelineEntry::start).thenComparing(e -> e.kind().ordinal()));
        return entries;
    }

    public TimelineInsightsResult enrichedTimeline(UUID goalId, Horizon horizon) {
        GoalView goal = views.view(goalId);
        return timelineIntelligence.enrich(timelineBuilder.entries(goal, horizon), goal, horizon);
    }
}
