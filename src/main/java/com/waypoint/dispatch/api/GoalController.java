package com.waypoint.dispatch.api;

import com.waypoint.core.breakdown.BreakdownResult;
import com.waypoint.core.breakdown.GoalBreakdownService;
import com.waypoint.core.lifecycle.GoalDraft;
import com.waypoint.core.lifecycle.GoalLifecycleService;
import com.waypoint.core.model.ActivationState;
import com.waypoint.core.model.DependencyKind;
import com.waypoint.core.model.GoalDependency;
import com.waypoint.core.model.GoalKind;
import com.waypoint.core.model.GoalRevision;
import com.waypoint.core.model.GoalSnapshot;
import com.waypoint.core.model.Priority;
import com.waypoint.core.query.GoalQueryService;
import com.waypoint.core.query.GoalView;
import com.waypoint.core.reasoning.ActivationPlan;
import com.waypoint.core.roadmap.RoadmapEngine;
import com.waypoint.core.roadmap.StepAdvanceResult;
import com.waypoint.core.timeline.Horizon;
import com.waypoint.core.timeline.TimelineEntry;
import com.waypoint.core.timeline.TimelineInsightsResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * REST controller for goals: queries, lifecycle operations, breakdown and roadmaps.
 * Errors are mapped to HTTP statuses by {@link ApiExceptionAdvice}.
 */
@RestController
@RequestMapping("/api/v1/goals")
public class GoalController {

    private static final Logger log = LoggerFactory.getLogger(GoalController.class);

    private final GoalQueryService queries;
    private final GoalLifecycleService lifecycle;
    private final GoalBreakdownService breakdownService;
    private final RoadmapEngine roadmapEngine;
    private final SseStreamingService sseStreamingService;
    private final Clock clock;

    public GoalController(GoalQueryService queries,
                          GoalLifecycleService lifecycle,
                          GoalBreakdownService breakdownService,
                          RoadmapEngine roadmapEngine,
                          SseStreamingService sseStreamingService,
                          Clock clock) {
        this.queries = queries;
        this.lifecycle = lifecycle;
        this.breakdownService = breakdownService;
        this.roadmapEngine = roadmapEngine;
        this.sseStreamingService = sseStreamingService;
        this.clock = clock;
    }

    // ── Queries ─────────────────────────────────────────────────────

    /**
     * GET /api/v1/goals: top-level goals in display order.
     */
    @GetMapping
    public List<GoalView> listGoals() {
        return queries.topLevelGoals();
    }

    @GetMapping("/{id}")
    public GoalView getGoal(@PathVariable UUID id) {
        return queries.goal(id);
    }

    @GetMapping("/{id}/children")
    public List<GoalView> children(@PathVariable UUID id) {
        return queries.children(id);
    }

    @GetMapping("/{id}/descendants")
    public List<GoalView> descendants(@PathVariable UUID id) {
        return queries.descendants(id);
    }

    @GetMapping("/{id}/progress")
    public Map<String, Object> progress(@PathVariable UUID id) {
        return Map.of("goal_id", id, "progress", queries.progress(id), "processing", lifecycle.isProcessing(id));
    }

    @GetMapping("/{id}/revisions")
    public List<GoalRevision> revisions(@PathVariable UUID id) {
        return queries.revisionHistory(id);
    }

    @GetMapping("/{id}/dependencies")
    public List<GoalDependency> dependencies(@PathVariable UUID id) {
        return queries.dependencies(id);
    }

    /**
     * GET /api/v1/goals/{id}/timeline: entries within [from, from + days).
     * With {@code insights=true} the entries are enriched by the reasoning collaborator.
     */
    @GetMapping("/{id}/timeline")
    public TimelineInsightsResult timeline(@PathVariable UUID id,
                                           @RequestParam(required = false)
                                           @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
                                           @RequestParam(defaultValue = "14") int days,
                                           @RequestParam(defaultValue = "false") boolean insights) {
        Horizon horizon = Horizon.ofDays(from != null ? from : clock.instant(), days);
        if (insights) {
            return queries.enrichedTimeline(id, horizon);
        }
        return new TimelineInsightsResult(queries.timelineEntries(id, horizon), null);
    }

    /**
     * GET /api/v1/goals/timeline: entries of every goal that falls in the horizon.
     */
    @GetMapping("/timeline")
    public List<TimelineEntry> portfolioTimeline(@RequestParam(required = false)
                                                 @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
                                                 @RequestParam(defaultValue = "14") int days) {
        return queries.portfolioTimeline(Horizon.ofDays(from != null ? from : clock.instant(), days));
    }

    // ── Creation and edits ──────────────────────────────────────────

    @PostMapping
    public ResponseEntity<GoalView> createGoal(@RequestBody GoalRequests.CreateGoal request) {
        if (request.title() == null || request.title().isBlank()) {
            throw new IllegalArgumentException("Title is required");
        }
        var draft = new GoalDraft(request.title(), request.body(), request.category(),
                Priority.parse(request.priority(), null), GoalKind.parse(request.kind(), null),
                request.emoji(), request.targetDate(), request.targetMetric(), request.parentId());
        GoalView created = lifecycle.createGoal(draft);
        log.info("Created goal {} via API", created.id());
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @PatchMapping("/{id}")
    public GoalView updateGoal(@PathVariable UUID id, @RequestBody GoalRequests.UpdateGoal request) {
        return lifecycle.update(id, request.title(), request.body(), request.category(),
                Priority.parse(request.priority(), null));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Map<String, Object>> deleteGoal(@PathVariable UUID id) {
        int removed = lifecycle.delete(id);
        if (removed == 0) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(Map.of("removed", removed));
    }

    @PostMapping("/{id}/progress")
    public GoalView setProgress(@PathVariable UUID id, @RequestBody GoalRequests.SetProgress request) {
        if (request.value() == null) {
            throw new IllegalArgumentException("Progress value is required");
        }
        return lifecycle.setProgress(id, request.value());
    }

    // ── Lifecycle ───────────────────────────────────────────────────

    @PostMapping("/{id}/lock")
    public GoalSnapshot lock(@PathVariable UUID id) {
        return lifecycle.lock(id);
    }

    @PostMapping("/{id}/unlock")
    public GoalView unlock(@PathVariable UUID id, @RequestBody(required = false) GoalRequests.Unlock request) {
        return lifecycle.unlock(id, request != null ? request.reason() : null);
    }

    @PostMapping("/{id}/regenerate")
    public GoalView regenerate(@PathVariable UUID id) {
        return lifecycle.regenerate(id);
    }

    /**
     * POST /api/v1/goals/{id}/activation-plan: first activation phase; nothing is committed.
     */
    @PostMapping("/{id}/activation-plan")
    public ActivationPlan activationPlan(@PathVariable UUID id) {
        return lifecycle.generatePlan(id);
    }

    /**
     * POST /api/v1/goals/{id}/activation: confirms a previously generated plan.
     */
    @PostMapping("/{id}/activation")
    public GoalView confirmActivation(@PathVariable UUID id, @RequestBody GoalRequests.ConfirmActivation request) {
        return lifecycle.confirmActivation(id, request.plan());
    }

    @PostMapping("/{id}/activate")
    public GoalView activate(@PathVariable UUID id) {
        return lifecycle.activate(id);
    }

    @PostMapping("/{id}/deactivate")
    public GoalView deactivate(@PathVariable UUID id, @RequestBody GoalRequests.Deactivate request) {
        ActivationState target = request.state() != null
                ? ActivationState.valueOf(request.state().trim().toUpperCase(Locale.ROOT))
                : ActivationState.DRAFT;
        return lifecycle.deactivate(id, target, request.rationale());
    }

    @PostMapping("/{id}/complete")
    public GoalView complete(@PathVariable UUID id) {
        return lifecycle.complete(id);
    }

    // ── Breakdown and roadmap ───────────────────────────────────────

    @PostMapping("/{id}/breakdown")
    public Map<String, Object> breakdown(@PathVariable UUID id) {
        BreakdownResult result = breakdownService.breakdown(id);
        return Map.of(
                "created_goal_ids", result.createdGoals().stream().map(g -> g.getId()).toList(),
                "atomic_task_count", result.atomicTaskCount(),
                "dependency_count", result.dependencyCount(),
                "dropped_dependencies", result.droppedDependencies(),
                "assigned_identifiers", result.assignedIdentifiers(),
                "total_estimated_hours", result.totalEstimatedHours());
    }

    @PostMapping("/{id}/roadmap")
    public ResponseEntity<GoalView> startRoadmap(@PathVariable UUID id) {
        return ResponseEntity.status(HttpStatus.CREATED).body(roadmapEngine.startRoadmap(id));
    }

    @PostMapping("/{id}/roadmap/advance")
    public StepAdvanceResult completeCurrentStep(@PathVariable UUID id) {
        return roadmapEngine.completeCurrentStep(id);
    }

    // ── Dependencies and ordering ───────────────────────────────────

    @PostMapping("/dependencies")
    public ResponseEntity<GoalDependency> addDependency(@RequestBody GoalRequests.AddDependency request) {
        if (request.prerequisiteId() == null || request.dependentId() == null) {
            throw new IllegalArgumentException("Both prerequisite_id and dependent_id are required");
        }
        DependencyKind kind = request.kind() != null
                ? DependencyKind.valueOf(request.kind().trim().toUpperCase(Locale.ROOT))
                : DependencyKind.FINISH_TO_START;
        GoalDependency edge = lifecycle.addDependency(request.prerequisiteId(), request.dependentId(),
                kind, request.note());
        return ResponseEntity.status(HttpStatus.CREATED).body(edge);
    }

    @DeleteMapping("/dependencies/{dependencyId}")
    public ResponseEntity<Void> removeDependency(@PathVariable UUID dependencyId) {
        return lifecycle.removeDependency(dependencyId)
                ? ResponseEntity.noContent().build()
                : ResponseEntity.notFound().build();
    }

    @PostMapping("/reorder")
    public ResponseEntity<Void> reorder(@RequestBody GoalRequests.Reorder request) {
        lifecycle.reorder(request.parentId(), request.orderedIds() != null ? request.orderedIds() : List.of());
        return ResponseEntity.noContent().build();
    }

    // ── Events ──────────────────────────────────────────────────────

    @GetMapping(value = "/{id}/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter goalEvents(@PathVariable UUID id) {
        queries.goal(id);
        return sseStreamingService.createEmitter(id);
    }

    @GetMapping(value = "/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter allEvents() {
        return sseStreamingService.createEmitter(null);
    }
}
