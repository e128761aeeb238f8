package com.waypoint.core.lifecycle;

import com.waypoint.core.calendar.CalendarGateway;
import com.waypoint.core.config.WaypointProperties;
import com.waypoint.core.error.ExternalServiceException;
import com.waypoint.core.error.GoalLockedException;
import com.waypoint.core.error.GoalStateException;
import com.waypoint.core.error.PartialActivationException;
import com.waypoint.core.events.EventBus;
import com.waypoint.core.events.GoalEvent;
import com.waypoint.core.external.ExternalCallExecutor;
import com.waypoint.core.graph.GoalGraph;
import com.waypoint.core.logging.MdcContext;
import com.waypoint.core.metrics.WaypointMetrics;
import com.waypoint.core.model.ActivationState;
import com.waypoint.core.model.DependencyKind;
import com.waypoint.core.model.EventLinkStatus;
import com.waypoint.core.model.Goal;
import com.waypoint.core.model.GoalDependency;
import com.waypoint.core.model.GoalRevision;
import com.waypoint.core.model.GoalSnapshot;
import com.waypoint.core.model.Priority;
import com.waypoint.core.model.ScheduledEventLink;
import com.waypoint.core.persistence.GraphPersistence;
import com.waypoint.core.progress.ProgressAggregator;
import com.waypoint.core.query.GoalView;
import com.waypoint.core.query.GoalViewFactory;
import com.waypoint.core.reasoning.ActivationPlan;
import com.waypoint.core.reasoning.GoalContext;
import com.waypoint.core.reasoning.GoalContextBuilder;
import com.waypoint.core.reasoning.ProposedSession;
import com.waypoint.core.reasoning.ReasoningService;
import com.waypoint.core.reasoning.RegenerationProposal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * Mutating goal operations: creation and edits, the lock overlay, regeneration,
 * two-phase activation, deactivation and completion.
 * <p>
 * External calls (reasoning, calendar) run outside the graph write lock on a
 * snapshot of the goal. Before committing their result the service re-checks
 * the state it relied on, so a lock or transition that happened meanwhile wins.
 * Every successful operation is persisted, published on the {@link EventBus}
 * and counted in {@link WaypointMetrics}.
 */
@Service
public class GoalLifecycleService {

    private static final Logger log = LoggerFactory.getLogger(GoalLifecycleService.class);

    static final String DEFAULT_LOCK_RATIONALE = "locked by user";

    private final GoalGraph graph;
    private final GoalContextBuilder contextBuilder;
    private final GoalViewFactory views;
    private final ProgressAggregator progressAggregator;
    private final ReasoningService reasoning;
    private final CalendarGateway calendar;
    private final ExternalCallExecutor external;
    private final GraphPersistence persistence;
    private final EventBus eventBus;
    private final WaypointMetrics metrics;
    private final WaypointProperties properties;
    private final InFlightOperations inFlight;
    private final ScheduledEventCanceller canceller;

    public GoalLifecycleService(GoalGraph graph,
                                GoalContextBuilder contextBuilder,
                                GoalViewFactory views,
                                ProgressAggregator progressAggregator,
                                ReasoningService reasoning,
                                CalendarGateway calendar,
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
        this.progressAggregator = progressAggregator;
        this.reasoning = reasoning;
        this.calendar = calendar;
        this.external = external;
        this.persistence = persistence;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.properties = properties;
        this.inFlight = inFlight;
        this.canceller = canceller;
    }

    // ── Creation and edits ──────────────────────────────────────────

    public GoalView createGoal(GoalDraft draft) {
        if (draft.title() == null || draft.title().isBlank()) {
            throw new IllegalArgumentException("Goal title must not be blank");
        }
        try (var mdc = MdcContext.operation("create", draft.parentId())) {
            Goal goal = graph.write(() -> {
                var created = new Goal(draft.title().trim(), draft.body(), draft.category(), draft.priority(),
                        draft.kind(), graph.clock().instant());
                created.setEmoji(draft.emoji());
                created.setTargetDate(draft.targetDate());
                created.setTargetMetric(draft.targetMetric());
                return graph.insert(created, draft.parentId());
            });
            persistence.flush();
            log.info("Created goal {} '{}'", goal.getId(), goal.getTitle());
            publish(GoalEvent.CREATED, goal.getId(), Map.of("title", goal.getTitle()));
            return views.view(goal.getId());
        }
    }

    /**
     * Applies the non-null fields. Title and body are frozen while the goal is locked;
     * category and priority are not part of the locked content.
     *
     * @throws GoalLockedException if title or body is given for a locked goal
     */
    public GoalView update(UUID goalId, String title, String body, String category, Priority priority) {
        try (var mdc = MdcContext.operation("update", goalId)) {
            graph.write(() -> {
                Goal goal = graph.get(goalId);
                boolean contentChange = (title != null && !title.isBlank()) || body != null;
                if (contentChange && goal.isLocked()) {
                    throw new GoalLockedException(goalId);
                }
                Instant now = graph.clock().instant();
                GoalSnapshot before = GoalSnapshot.of(goal, null, now);
                if (title != null && !title.isBlank()) {
                    goal.setTitle(title.trim());
                }
                if (body != null) {
                    goal.setBody(body);
                }
                goal.setCategory(category);
                if (priority != null) {
                    goal.setPriority(priority);
                }
                goal.appendRevision(GoalRevision.audited("Goal updated", "Manual edit",
                        before, GoalSnapshot.of(goal, null, now), now));
                graph.touch(goalId);
            });
            persistence.flush();
            publish(GoalEvent.UPDATED, goalId, Map.of());
            return views.view(goalId);
        }
    }

    /**
     * Sets the stored progress of a leaf goal. Goals with subgoals or a roadmap
     * derive their progress and reject this.
     */
    public GoalView setProgress(UUID goalId, double value) {
        try (var mdc = MdcContext.operation("progress", goalId)) {
            graph.write(() -> {
                Goal goal = graph.get(goalId);
                if (graph.hasChildren(goalId) || goal.hasSequentialSteps()) {
                    throw new GoalStateException("Progress of goal " + goalId + " is derived from its subgoals");
                }
                goal.setProgress(value);
                graph.touch(goalId);
            });
            persistence.flush();
            publishProgress(goalId);
            return views.view(goalId);
        }
    }

    /**
     * Removes the goal with its subtree and cancels their calendar items.
     * Cancellation is best effort; the goals are gone either way.
     *
     * @return number of goals removed
     */
    public int delete(UUID goalId) {
        try (var mdc = MdcContext.operation("delete", goalId)) {
            if (!graph.contains(goalId)) {
                return 0;
            }
            UUID parentId = graph.parent(goalId).orElse(null);
            List<Goal> removed = graph.write(() -> graph.delete(goalId));
            if (removed.isEmpty()) {
                return 0;
            }
            persistence.flush();
            for (Goal goal : removed) {
                for (ScheduledEventLink link : goal.getScheduledEvents()) {
                    if (link.status() != EventLinkStatus.CANCELLED) {
                        canceller.cancel(goal.getId(), link);
                    }
                }
            }
            publish(GoalEvent.DELETED, goalId, Map.of("removed", removed.size()));
            if (parentId != null && graph.contains(parentId)) {
                publishProgress(parentId);
            }
            return removed.size();
        }
    }

    public GoalDependency addDependency(UUID prerequisiteId, UUID dependentId, DependencyKind kind, String note) {
        try (var mdc = MdcContext.operation("add-dependency", dependentId)) {
            GoalDependency edge = graph.addDependency(prerequisiteId, dependentId,
                    kind != null ? kind : DependencyKind.FINISH_TO_START, note);
            persistence.flush();
            return edge;
        }
    }

    public boolean removeDependency(UUID dependencyId) {
        try (var mdc = MdcContext.operation("remove-dependency", null)) {
            boolean removed = graph.removeDependency(dependencyId);
            if (removed) {
                persistence.flush();
            }
            return removed;
        }
    }

    /** Listed children first in the given order, the rest after in their current order. */
    public void reorder(UUID parentId, List<UUID> orderedIds) {
        try (var mdc = MdcContext.operation("reorder", parentId)) {
            graph.reorderChildren(parentId, orderedIds);
            persistence.flush();
        }
    }

    public boolean isProcessing(UUID goalId) {
        return inFlight.isProcessing(goalId);
    }

    // ── Lock overlay ────────────────────────────────────────────────

    /**
     * Freezes the goal's content. The rationale comes from the reasoning
     * collaborator; when that fails the goal is locked anyway with a default rationale.
     *
     * @return the lock snapshot (the existing one when already locked)
     * @throws GoalStateException if the goal has neither title nor body
     */
    public GoalSnapshot lock(UUID goalId) {
        try (var mdc = MdcContext.operation("lock", goalId);
             var busy = inFlight.begin(goalId)) {
            Goal current = graph.get(goalId);
            GoalSnapshot existing = graph.read(() -> current.isLocked() ? current.getLockedSnapshot() : null);
            if (existing != null) {
                log.debug("Goal {} already locked", goalId);
                return existing;
            }
            if (!graph.read(current::hasContent)) {
                throw new GoalStateException("Goal " + goalId + " has no content to lock");
            }

            String rationale;
            try {
                GoalContext context = contextBuilder.build(goalId);
                rationale = external.call("reasoning", "lock summary", () -> reasoning.summarizeForLock(context));
                if (rationale == null || rationale.isBlank()) {
                    rationale = DEFAULT_LOCK_RATIONALE;
                }
            } catch (ExternalServiceException e) {
                log.warn("Lock rationale unavailable for goal {}, locking with default: {}", goalId, e.getMessage());
                metrics.recordLockFallback();
                rationale = DEFAULT_LOCK_RATIONALE;
            }

            String finalRationale = rationale;
            GoalSnapshot snapshot = graph.write(() -> {
                Goal goal = graph.get(goalId);
                if (goal.isLocked()) {
                    return goal.getLockedSnapshot();
                }
                Instant now = graph.clock().instant();
                GoalSnapshot captured = GoalSnapshot.of(goal, finalRationale, now);
                goal.lock(captured, properties.getGraph().getSnapshotRetention());
                goal.appendRevision(GoalRevision.of("Locked", finalRationale, now));
                graph.touch(goalId);
                return captured;
            });
            persistence.flush();
            log.info("Locked goal {}", goalId);
            metrics.recordTransition("locked");
            publish(GoalEvent.LOCKED, goalId, Map.of("rationale", finalRationale));
            return snapshot;
        }
    }

    /** No-op when the goal is not locked. */
    public GoalView unlock(UUID goalId, String reason) {
        try (var mdc = MdcContext.operation("unlock", goalId)) {
            boolean changed = graph.write(() -> {
                Goal goal = graph.get(goalId);
                if (!goal.isLocked()) {
                    return false;
                }
                goal.unlock();
                String why = reason != null && !reason.isBlank() ? reason.trim() : "no reason given";
                goal.appendRevision(GoalRevision.of("Unlocked: " + why, reason, graph.clock().instant()));
                graph.touch(goalId);
                return true;
            });
            if (changed) {
                persistence.flush();
                log.info("Unlocked goal {}", goalId);
                metrics.recordTransition("unlocked");
                publish(GoalEvent.UNLOCKED, goalId, Map.of());
            }
            return views.view(goalId);
        }
    }

    // ── Regeneration ────────────────────────────────────────────────

    /**
     * Replaces title and body with the reasoning collaborator's reframing.
     * Nothing changes when the call fails.
     *
     * @throws GoalLockedException      if the goal is locked, before the call or by the time it returns
     * @throws ExternalServiceException if the reasoning call fails
     */
    public GoalView regenerate(UUID goalId) {
        try (var mdc = MdcContext.operation("regenerate", goalId);
             var busy = inFlight.begin(goalId)) {
            requireUnlocked(goalId);
            GoalContext context = contextBuilder.build(goalId);
            RegenerationProposal proposal = external.call("reasoning", "regeneration",
                    () -> reasoning.requestRegeneration(context));
            if (proposal == null || proposal.title() == null || proposal.title().isBlank()) {
                throw new ExternalServiceException("reasoning", "Regeneration returned no title", true, null);
            }

            graph.write(() -> {
                Goal goal = graph.get(goalId);
                if (goal.isLocked()) {
                    throw new GoalLockedException(goalId);
                }
                Instant now = graph.clock().instant();
                GoalSnapshot before = GoalSnapshot.of(goal, null, now);
                goal.setTitle(proposal.title().trim());
                if (proposal.body() != null) {
                    goal.setBody(proposal.body());
                }
                goal.setCategory(proposal.category());
                if (proposal.priority() != null) {
                    goal.setPriority(proposal.priority());
                }
                goal.setLastRegeneratedAt(now);
                goal.appendRevision(GoalRevision.audited("Regenerated", null,
                        before, GoalSnapshot.of(goal, null, now), now));
                graph.touch(goalId);
            });
            persistence.flush();
            log.info("Regenerated goal {}", goalId);
            metrics.recordTransition("regenerated");
            publish(GoalEvent.REGENERATED, goalId, Map.of("title", proposal.title().trim()));
            return views.view(goalId);
        }
    }

    // ── Activation ──────────────────────────────────────────────────

    /**
     * First phase of activation: asks for a session plan. Nothing is committed.
     *
     * @throws GoalLockedException if the goal is locked
     * @throws GoalStateException  if the goal is not a draft
     */
    public ActivationPlan generatePlan(UUID goalId) {
        try (var mdc = MdcContext.operation("plan", goalId);
             var busy = inFlight.begin(goalId)) {
            requireActivatable(goalId);
            GoalContext context = contextBuilder.build(goalId);
            List<GoalView> allGoals = views.views(graph.allGoals());
            ActivationPlan plan = external.call("reasoning", "activation plan",
                    () -> reasoning.requestActivationPlan(context, allGoals));
            log.info("Activation plan for goal {}: {} session(s)", goalId, plan.sessions().size());
            return plan;
        }
    }

    /**
     * Second phase: creates one calendar item per session, recording each link as
     * proposed, then confirms all links and activates the goal.
     * <p>
     * The goal must stay an unlocked draft throughout. If it is locked or leaves
     * the draft state while the items are being created (another confirmation won),
     * the items created by this call are cancelled and the lock or state error is
     * rethrown.
     *
     * @throws PartialActivationException if a calendar call fails after some items were created;
     *                                    the goal stays a draft and keeps the created links
     */
    public GoalView confirmActivation(UUID goalId, ActivationPlan plan) {
        try (var mdc = MdcContext.operation("activate", goalId);
             var busy = inFlight.begin(goalId)) {
            if (plan == null || plan.isEmpty()) {
                throw new GoalStateException("No sessions selected for activation of goal " + goalId);
            }
            requireActivatable(goalId);
            String title = graph.read(() -> graph.get(goalId).getTitle());

            var created = new ArrayList<ScheduledEventLink>();
            try {
                for (ProposedSession session : plan.sessions()) {
                    requireActivatable(goalId);
                    String notes = composeNotes(session.notes(), title);
                    String externalId;
                    try {
                        externalId = external.call("calendar", "create event",
                                () -> calendar.createEvent(session.title(), session.start(), session.duration(), notes));
                    } catch (ExternalServiceException e) {
                        persistence.flush();
                        log.error("Activation of goal {} failed after {} calendar item(s)", goalId, created.size(), e);
                        metrics.recordTransition("activation_failed");
                        throw new PartialActivationException(goalId, created, e);
                    }
                    ScheduledEventLink link = ScheduledEventLink.proposed(externalId, session.start(), session.end());
                    graph.write(() -> {
                        graph.get(goalId).addScheduledEvent(link);
                        graph.touch(goalId);
                    });
                    created.add(link);
                }

                graph.write(() -> {
                    requireActivatable(goalId);
                    Goal goal = graph.get(goalId);
                    Instant now = graph.clock().instant();
                    goal.transitionTo(ActivationState.ACTIVE, now);
                    for (ScheduledEventLink link : created) {
                        goal.replaceScheduledEvent(link.withStatus(EventLinkStatus.CONFIRMED));
                    }
                    goal.appendRevision(GoalRevision.of("Activated",
                            "Scheduled " + created.size() + " focus sessions", now));
                    graph.touch(goalId);
                });
            } catch (GoalLockedException | GoalStateException e) {
                withdraw(goalId, created);
                throw e;
            }
            persistence.flush();
            log.info("Activated goal {} with {} session(s)", goalId, created.size());
            metrics.recordTransition("activated");
            publish(GoalEvent.ACTIVATED, goalId, Map.of("sessions", created.size()));
            return views.view(goalId);
        }
    }

    /** Cancels the links an interrupted confirmation created, on the goal and in the calendar. */
    private void withdraw(UUID goalId, List<ScheduledEventLink> created) {
        if (created.isEmpty()) {
            return;
        }
        graph.write(() -> {
            if (graph.contains(goalId)) {
                canceller.markCancelled(graph.get(goalId), created);
                graph.touch(goalId);
            }
        });
        persistence.flush();
        log.warn("Activation of goal {} was overtaken; withdrawing {} calendar item(s)", goalId, created.size());
        metrics.recordTransition("activation_failed");
        canceller.cancel(goalId, created);
    }

    /** Both activation phases in one call. */
    public GoalView activate(UUID goalId) {
        ActivationPlan plan = generatePlan(goalId);
        if (plan.isEmpty()) {
            throw new GoalStateException("No suitable schedule was generated for goal " + goalId);
        }
        return confirmActivation(goalId, plan);
    }

    String composeNotes(String detail, String goalTitle) {
        String suffix = properties.getCalendar().getNotesSuffix();
        if (detail != null && !detail.isBlank()) {
            return detail + "\n\n" + suffix;
        }
        return suffix + ": " + goalTitle;
    }

    // ── Deactivation and completion ─────────────────────────────────

    /**
     * Moves the goal to {@code target} regardless of its lock and cancels its
     * proposed calendar links. Cancellation failures are logged, never thrown.
     * Only {@code DRAFT}, {@code COMPLETED} and {@code ARCHIVED} are accepted:
     * the way into {@code ACTIVE} is {@link #activate}.
     *
     * @throws GoalStateException if the target is {@code ACTIVE} or the transition is not allowed
     */
    public GoalView deactivate(UUID goalId, ActivationState target, String rationale) {
        if (target == null || target == ActivationState.ACTIVE) {
            throw new GoalStateException("Goal " + goalId + " cannot be deactivated to " + target
                    + "; use activation instead");
        }
        try (var mdc = MdcContext.operation("deactivate", goalId);
             var busy = inFlight.begin(goalId)) {
            List<ScheduledEventLink> pending = graph.write(() -> {
                Goal goal = graph.get(goalId);
                Instant now = graph.clock().instant();
                goal.transitionTo(target, now);
                List<ScheduledEventLink> toCancel = canceller.markPendingCancelled(goal);
                goal.appendRevision(GoalRevision.of("Moved to " + target.name().toLowerCase(Locale.ROOT), rationale, now));
                graph.touch(goalId);
                return toCancel;
            });
            persistence.flush();
            canceller.cancel(goalId, pending);
            log.info("Goal {} moved to {}", goalId, target);
            metrics.recordTransition("deactivated");
            publish(GoalEvent.DEACTIVATED, goalId, Map.of("state", target.name()));
            return views.view(goalId);
        }
    }

    /**
     * Marks the goal done with progress 1.0, cancels its proposed calendar links,
     * then publishes the re-aggregated progress of every ancestor.
     *
     * @throws GoalLockedException if the goal is locked
     */
    public GoalView complete(UUID goalId) {
        try (var mdc = MdcContext.operation("complete", goalId)) {
            List<ScheduledEventLink> pending = graph.write(() -> {
                Goal goal = graph.get(goalId);
                if (goal.isLocked()) {
                    throw new GoalLockedException(goalId);
                }
                if (!goal.getActivationState().canTransitionTo(ActivationState.COMPLETED)) {
                    throw new GoalStateException("Goal " + goalId + " cannot be completed from "
                            + goal.getActivationState());
                }
                Instant now = graph.clock().instant();
                goal.setProgress(1.0);
                goal.transitionTo(ActivationState.COMPLETED, now);
                List<ScheduledEventLink> toCancel = canceller.markPendingCancelled(goal);
                goal.appendRevision(GoalRevision.of("Completed", null, now));
                graph.touch(goalId);
                return toCancel;
            });
            persistence.flush();
            canceller.cancel(goalId, pending);
            log.info("Completed goal {}", goalId);
            metrics.recordTransition("completed");
            publish(GoalEvent.COMPLETED, goalId, Map.of());
            publishProgress(goalId);
            return views.view(goalId);
        }
    }

    // ── Helpers ─────────────────────────────────────────────────────

    private void requireUnlocked(UUID goalId) {
        if (graph.read(() -> graph.get(goalId).isLocked())) {
            throw new GoalLockedException(goalId);
        }
    }

    private void requireActivatable(UUID goalId) {
        graph.read(() -> {
            Goal goal = graph.get(goalId);
            if (goal.isLocked()) {
                throw new GoalLockedException(goalId);
            }
            if (goal.getActivationState() != ActivationState.DRAFT) {
                throw new GoalStateException("Goal " + goalId + " is " + goal.getActivationState()
                        + "; only drafts can be activated");
            }
            return null;
        });
    }

    /** Publishes the derived progress of the goal and each of its ancestors, nearest first. */
    void publishProgress(UUID goalId) {
        List<Map.Entry<UUID, Double>> values = graph.read(() -> {
            var out = new ArrayList<Map.Entry<UUID, Double>>();
            if (graph.contains(goalId)) {
                out.add(Map.entry(goalId, progressAggregator.progress(goalId)));
                for (Goal ancestor : graph.ancestors(goalId)) {
                    out.add(Map.entry(ancestor.getId(), progressAggregator.progress(ancestor.getId())));
                }
            }
            return out;
        });
        for (Map.Entry<UUID, Double> entry : values) {
            publish(GoalEvent.PROGRESS, entry.getKey(), Map.of("progress", entry.getValue()));
        }
    }

    void publish(String type, UUID goalId, Map<String, Object> payload) {
        eventBus.publish(new GoalEvent(type, goalId, payload, graph.clock().instant()));
    }
}
