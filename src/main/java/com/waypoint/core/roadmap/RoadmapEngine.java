package com.waypoint.core.roadmap;

import com.waypoint.core.config.WaypointProperties;
import com.waypoint.core.error.DuplicateStepTitleException;
import com.waypoint.core.error.ExternalServiceException;
import com.waypoint.core.error.GoalStateException;
import com.waypoint.core.error.StepLimitExceededException;
import com.waypoint.core.events.EventBus;
import com.waypoint.core.events.GoalEvent;
import com.waypoint.core.external.ExternalCallExecutor;
import com.waypoint.core.graph.GoalGraph;
import com.waypoint.core.lifecycle.InFlightOperations;
import com.waypoint.core.lifecycle.ScheduledEventCanceller;
import com.waypoint.core.logging.MdcContext;
import com.waypoint.core.metrics.WaypointMetrics;
import com.waypoint.core.model.ActivationState;
import com.waypoint.core.model.Goal;
import com.waypoint.core.model.GoalRevision;
import com.waypoint.core.model.GoalSnapshot;
import com.waypoint.core.model.ScheduledEventLink;
import com.waypoint.core.model.StepStatus;
import com.waypoint.core.persistence.GraphPersistence;
import com.waypoint.core.progress.ProgressAggregator;
import com.waypoint.core.query.GoalView;
import com.waypoint.core.query.GoalViewFactory;
import com.waypoint.core.reasoning.GoalContext;
import com.waypoint.core.reasoning.GoalContextBuilder;
import com.waypoint.core.reasoning.NextStepProposal;
import com.waypoint.core.reasoning.ReasoningService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * Drives a sequential roadmap: one current step at a time, the next one proposed
 * by the reasoning collaborator when the current step is completed.
 * <p>
 * A roadmap holds at most {@link #HARD_LIMIT} steps; from {@link #SOFT_WARNING}
 * on, each advance carries a warning. A proposed step whose title repeats an
 * existing one (ignoring case and surrounding blanks) is skipped, but the
 * current step is still completed. That leaves the roadmap without a current
 * step until the next {@link #startRoadmap} or manual step.
 */
@Service
public class RoadmapEngine {

    private static final Logger log = LoggerFactory.getLogger(RoadmapEngine.class);

    public static final int HARD_LIMIT = 15;
    public static final int SOFT_WARNING = 12;

    static final int DEFAULT_DAYS_TO_TARGET = 7;
    static final String FINAL_STEP_BANNER = "Final step: complete this to finish the goal.";
    static final String ROADMAP_COMPLETED_RATIONALE = "All sequential steps completed";

    private final GoalGraph graph;
    private final GoalContextBuilder contextBuilder;
    private final GoalViewFactory views;
    private final ReasoningService reasoning;
    private final ExternalCallExecutor external;
    private final GraphPersistence persistence;
    private final EventBus eventBus;
    private final WaypointMetrics metrics;
    private final WaypointProperties properties;
    private final InFlightOperations inFlight;
    private final ScheduledEventCanceller canceller;

    public RoadmapEngine(GoalGraph graph,
                         GoalContextBuilder contextBuilder,
                         GoalViewFactory views,
                         ReasoningService reasoning,
                         ExternalCallExecutor external,
                         GraphPersistence persistence,
                         EventBus eventBus,
                         WaypointMetrics metrics,
                         WaypointProperties properties,
                         InFlightOperations inFlight,
                         ScheduledEventCanceller canceller) {
        this.graph = graph;
        this.contextBuilder = contextBuilder;
        this.views = views;
        this.reasoning = reasoning;
        this.external = external;
        this.persistence = persistence;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.properties = properties;
        this.inFlight = inFlight;
        this.canceller = canceller;
    }

    /**
     * Turns a goal into a roadmap by asking for its first step, which becomes current.
     *
     * @return the first step
     * @throws GoalStateException if the goal already has subgoals or steps
     */
    public GoalView startRoadmap(UUID ownerId) {
        try (var mdc = MdcContext.operation("start-roadmap", ownerId);
             var busy = inFlight.begin(ownerId)) {
            requireNoChildren(ownerId);
            GoalContext context = contextBuilder.build(ownerId);
            NextStepProposal proposal = external.call("reasoning", "first step",
                    () -> reasoning.requestNextStep(context, context.goal()));
            requireUsable(proposal);

            Goal step = graph.write(() -> {
                requireNoChildren(ownerId);
                Goal owner = graph.get(ownerId);
                Instant now = graph.clock().instant();
                Goal first = newStep(owner, proposal, owner.getCreatedAt(), now);
                graph.insert(first, ownerId);
                owner.setHasSequentialSteps(true);
                graph.touch(ownerId);
                return first;
            });
            persistence.flush();
            log.info("Started roadmap for goal {} with step '{}'", ownerId, step.getTitle());
            publish(ownerId, Map.of("newStep", step.getId(), "outcome", "started"));
            return views.view(step.getId());
        }
    }

    /**
     * Completes the current step and, unless it was the final one, adds the next.
     *
     * @throws GoalStateException         if the goal has no roadmap or no current step, or the
     *                                    current step changed while the next one was requested
     * @throws StepLimitExceededException if the roadmap already holds {@link #HARD_LIMIT} steps
     * @throws ExternalServiceException   if the next step cannot be obtained; nothing changes then
     */
    public StepAdvanceResult completeCurrentStep(UUID ownerId) {
        try (var mdc = MdcContext.operation("advance-step", ownerId);
             var busy = inFlight.begin(ownerId)) {
            Goal current = graph.read(() -> currentStep(ownerId));

            if (graph.read(current::isFinalStep)) {
                return completeRoadmap(ownerId, current.getId());
            }

            int count = graph.read(() -> graph.sequentialSteps(ownerId).size());
            if (count >= HARD_LIMIT) {
                metrics.recordStepAdvance("limit_exceeded");
                throw new StepLimitExceededException(ownerId, HARD_LIMIT);
            }

            GoalContext context = contextBuilder.build(ownerId);
            GoalView completedView = views.view(current.getId());
            NextStepProposal proposal = external.call("reasoning", "next step",
                    () -> reasoning.requestNextStep(context, completedView));
            requireUsable(proposal);

            StepAdvanceResult result = graph.write(() -> advance(ownerId, current.getId(), proposal));
            persistence.flush();
            metrics.recordStepAdvance(result.outcome().name().toLowerCase(Locale.ROOT));
            publish(ownerId, Map.of("completedStep", current.getId(), "outcome", result.outcome().name()));
            return result;
        }
    }

    /** Completes the final step and the owner; the owner's proposed calendar items are cancelled. */
    private StepAdvanceResult completeRoadmap(UUID ownerId, UUID stepId) {
        var pending = new ArrayList<ScheduledEventLink>();
        StepAdvanceResult result = graph.write(() -> {
            Goal step = requireStillCurrent(ownerId, stepId);
            Goal owner = graph.get(ownerId);
            Instant now = graph.clock().instant();
            finishStep(step, now);
            if (!owner.isLocked()) {
                owner.setProgress(1.0);
            }
            if (owner.getActivationState().canTransitionTo(ActivationState.COMPLETED)) {
                owner.transitionTo(ActivationState.COMPLETED, now);
                pending.addAll(canceller.markPendingCancelled(owner));
                owner.appendRevision(GoalRevision.of("Completed", ROADMAP_COMPLETED_RATIONALE, now));
            }
            graph.touch(ownerId);
            return new StepAdvanceResult(StepAdvanceResult.Outcome.ROADMAP_COMPLETED,
                    views.view(stepId), null, 1.0, null);
        });
        persistence.flush();
        canceller.cancel(ownerId, pending);
        log.info("Final step {} completed; goal {} is done", stepId, ownerId);
        metrics.recordStepAdvance("roadmap_completed");
        metrics.recordTransition("completed");
        publish(ownerId, Map.of("completedStep", stepId, "outcome", result.outcome().name()));
        eventBus.publish(new GoalEvent(GoalEvent.COMPLETED, ownerId, Map.of("rationale", ROADMAP_COMPLETED_RATIONALE),
                graph.clock().instant()));
        return result;
    }

    /** Runs under the write lock. */
    private StepAdvanceResult advance(UUID ownerId, UUID stepId, NextStepProposal proposal) {
        Goal step = requireStillCurrent(ownerId, stepId);
        Goal owner = graph.get(ownerId);
        Instant now = graph.clock().instant();
        List<Goal> steps = graph.sequentialSteps(ownerId);

        if (steps.size() >= HARD_LIMIT) {
            throw new StepLimitExceededException(ownerId, HARD_LIMIT);
        }

        String candidate = normalizeTitle(proposal.title());
        boolean duplicate = steps.stream().anyMatch(s -> normalizeTitle(s.getTitle()).equals(candidate));
        if (duplicate) {
            var skipped = new DuplicateStepTitleException(proposal.title().trim());
            log.warn("Skipping proposed step for goal {}: {}", ownerId, skipped.getMessage());
            finishStep(step, now);
            double progress = syncOwnerProgress(owner, ownerId);
            graph.touch(ownerId);
            String warning = sizeWarning(steps.size());
            String message = warning != null ? skipped.getMessage() + "; " + warning : skipped.getMessage();
            return new StepAdvanceResult(StepAdvanceResult.Outcome.DUPLICATE_SKIPPED, views.view(stepId), null,
                    progress, message);
        }

        finishStep(step, now);
        Goal next = newStep(owner, proposal, now, now);
        graph.insert(next, ownerId);
        double progress = syncOwnerProgress(owner, ownerId);
        graph.touch(ownerId);

        int total = steps.size() + 1;
        String warning = sizeWarning(total);
        log.info("Goal {} advanced to step {} '{}' ({} steps)", ownerId, next.getId(), next.getTitle(), total);
        return new StepAdvanceResult(StepAdvanceResult.Outcome.ADVANCED, views.view(stepId), views.view(next.getId()),
                progress, warning);
    }

    /** Warning for a roadmap holding {@code total} steps after the update, or null below the threshold. */
    static String sizeWarning(int total) {
        return total >= SOFT_WARNING
                ? "Roadmap has " + total + " of at most " + HARD_LIMIT + " steps; consider completing or splitting the goal"
                : null;
    }

    private Goal newStep(Goal owner, NextStepProposal proposal, Instant targetBase, Instant now) {
        String guidance = proposal.guidance() != null ? proposal.guidance()
                : proposal.outcome() != null ? proposal.outcome() : "";
        String body = proposal.finalStep() ? FINAL_STEP_BANNER + "\n\n" + guidance : guidance;
        var step = new Goal(proposal.title().trim(), body, owner.getCategory(), owner.getPriority(),
                owner.getKind(), now);
        step.markAsStep(StepStatus.CURRENT);
        step.setFinalStep(proposal.finalStep());
        step.setStepOutcome(proposal.outcome());
        int days = proposal.daysFromNow() != null && proposal.daysFromNow() >= 0
                ? proposal.daysFromNow()
                : DEFAULT_DAYS_TO_TARGET;
        step.setTargetDate(targetBase.plus(Duration.ofDays(days)));
        return step;
    }

    /** Completed, stamped and locked with a snapshot of its final content. */
    private void finishStep(Goal step, Instant now) {
        if (!step.isLocked()) {
            step.setProgress(1.0);
        }
        step.setStepStatus(StepStatus.COMPLETED);
        if (step.getActivationState().canTransitionTo(ActivationState.COMPLETED)) {
            step.transitionTo(ActivationState.COMPLETED, now);
        }
        if (!step.isLocked()) {
            step.lock(GoalSnapshot.of(step, "Step completed", now), properties.getGraph().getSnapshotRetention());
            step.appendRevision(GoalRevision.of("Locked", "Step completed", now));
        }
        graph.touch(step.getId());
    }

    private double syncOwnerProgress(Goal owner, UUID ownerId) {
        double ratio = ProgressAggregator.stepRatio(graph.sequentialSteps(ownerId));
        if (!owner.isLocked()) {
            owner.setProgress(ratio);
        }
        return ratio;
    }

    private Goal currentStep(UUID ownerId) {
        Goal owner = graph.get(ownerId);
        if (!owner.hasSequentialSteps()) {
            throw new GoalStateException("Goal " + ownerId + " has no sequential roadmap");
        }
        return graph.sequentialSteps(ownerId).stream()
                .filter(s -> s.getStepStatus() == StepStatus.CURRENT)
                .findFirst()
                .orElseThrow(() -> new GoalStateException("Goal " + ownerId + " has no current step"));
    }

    private Goal requireStillCurrent(UUID ownerId, UUID stepId) {
        Goal current = currentStep(ownerId);
        if (!current.getId().equals(stepId)) {
            throw new GoalStateException("Current step of goal " + ownerId + " changed while advancing");
        }
        return current;
    }

    private void requireNoChildren(UUID ownerId) {
        graph.read(() -> {
            graph.get(ownerId);
            if (graph.hasChildren(ownerId)) {
                throw new GoalStateException("Goal " + ownerId + " already has subgoals or steps");
            }
            return null;
        });
    }

    private static void requireUsable(NextStepProposal proposal) {
        if (proposal == null || proposal.title() == null || proposal.title().isBlank()) {
            throw new ExternalServiceException("reasoning", "Next step proposal has no title", true, null);
        }
    }

    static String normalizeTitle(String title) {
        return title == null ? "" : title.trim().toLowerCase(Locale.ROOT);
    }

    private void publish(UUID ownerId, Map<String, Object> payload) {
        eventBus.publish(new GoalEvent(GoalEvent.STEP_ADVANCED, ownerId, payload, graph.clock().instant()));
    }
}
