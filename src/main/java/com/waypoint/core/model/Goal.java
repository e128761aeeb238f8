package com.waypoint.core.model;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.waypoint.core.error.GoalLockedException;
import com.waypoint.core.error.GoalStateException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * A node of the goal graph: a top-level objective, a subgoal, or a roadmap step.
 * <p>
 * Hierarchy and dependency edges are not held here; the {@code GoalGraph} keeps
 * them in its own adjacency tables and addresses goals by {@link #getId()}.
 * <p>
 * Title, body and progress are frozen while the goal is locked. The revision
 * history only grows and its timestamps never go backwards.
 */
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY,
        getterVisibility = JsonAutoDetect.Visibility.NONE,
        isGetterVisibility = JsonAutoDetect.Visibility.NONE,
        setterVisibility = JsonAutoDetect.Visibility.NONE)
@JsonIgnoreProperties(ignoreUnknown = true)
public class Goal {

    public static final String DEFAULT_CATEGORY = "General";

    private UUID id;
    private Instant createdAt;
    private Instant updatedAt;

    private String title = "";
    private String body = "";
    private String category = DEFAULT_CATEGORY;
    private Priority priority = Priority.NEXT;
    private double progress;
    private GoalKind kind = GoalKind.CAMPAIGN;
    private int sortIndex;

    private ActivationState activationState = ActivationState.DRAFT;
    private boolean locked;
    private GoalSnapshot lockedSnapshot;
    private Instant activatedAt;
    private Instant completedAt;
    private Instant lastRegeneratedAt;

    private boolean brokenDown;
    private boolean atomic;

    // roadmap owner fields
    private boolean hasSequentialSteps;
    private List<RoadmapSection> roadmapSections = new ArrayList<>();
    private Instant targetDate;

    // roadmap step fields
    private boolean sequentialStep;
    private StepStatus stepStatus;
    private boolean finalStep;
    private String stepOutcome;

    private String emoji;
    private TargetMetric targetMetric;
    private List<GoalProjection> projections = new ArrayList<>();
    private List<GoalPhase> phases = new ArrayList<>();
    private List<ScheduledEventLink> scheduledEvents = new ArrayList<>();
    private List<GoalRevision> revisionHistory = new ArrayList<>();
    private List<GoalSnapshot> snapshotHistory = new ArrayList<>();

    protected Goal() {
        // for Jackson
    }

    public Goal(String title, String body, String category, Priority priority, GoalKind kind, Instant createdAt) {
        this(UUID.randomUUID(), title, body, category, priority, kind, createdAt);
    }

    public Goal(UUID id, String title, String body, String category, Priority priority, GoalKind kind, Instant createdAt) {
        this.id = Objects.requireNonNull(id, "id");
        this.title = title != null ? title : "";
        this.body = body != null ? body : "";
        this.category = category != null && !category.isBlank() ? category : DEFAULT_CATEGORY;
        this.priority = priority != null ? priority : Priority.NEXT;
        this.kind = kind != null ? kind : GoalKind.CAMPAIGN;
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
        this.updatedAt = createdAt;
    }

    // ── Identity ────────────────────────────────────────────────────

    public UUID getId() {
        return id;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }

    // ── Content (frozen while locked) ───────────────────────────────

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        requireUnlocked();
        this.title = title != null ? title : "";
    }

    public String getBody() {
        return body;
    }

    public void setBody(String body) {
        requireUnlocked();
        this.body = body != null ? body : "";
    }

    public double getProgress() {
        return progress;
    }

    public void setProgress(double progress) {
        requireUnlocked();
        if (Double.isNaN(progress) || progress < 0.0 || progress > 1.0) {
            throw new IllegalArgumentException("Progress must be within [0, 1], got " + progress);
        }
        this.progress = progress;
    }

    public boolean hasContent() {
        return !title.isBlank() || !body.isBlank();
    }

    private void requireUnlocked() {
        if (locked) {
            throw new GoalLockedException(id);
        }
    }

    // ── Descriptive fields ──────────────────────────────────────────

    public String getCategory() {
        return category;
    }

    public void setCategory(String category) {
        if (category != null && !category.isBlank()) {
            this.category = category;
        }
    }

    public Priority getPriority() {
        return priority;
    }

    public void setPriority(Priority priority) {
        this.priority = Objects.requireNonNull(priority, "priority");
    }

    public GoalKind getKind() {
        return kind;
    }

    public void setKind(GoalKind kind) {
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public int getSortIndex() {
        return sortIndex;
    }

    public void setSortIndex(int sortIndex) {
        this.sortIndex = sortIndex;
    }

    public String getEmoji() {
        return emoji;
    }

    /** Set by external enrichment; opaque to the engine. */
    public void setEmoji(String emoji) {
        this.emoji = emoji;
    }

    // ── Lifecycle ───────────────────────────────────────────────────

    public ActivationState getActivationState() {
        return activationState;
    }

    /**
     * Moves to {@code target}, stamping activation or completion time.
     *
     * @throws GoalStateException if the transition is not allowed from the current state
     */
    public void transitionTo(ActivationState target, Instant at) {
        if (!activationState.canTransitionTo(target)) {
            throw new GoalStateException("Goal " + id + " cannot move from " + activationState + " to " + target);
        }
        activationState = target;
        switch (target) {
            case ACTIVE -> activatedAt = at;
            case COMPLETED -> completedAt = at;
            case DRAFT, ARCHIVED -> { }
        }
    }

    public Instant getActivatedAt() {
        return activatedAt;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    public Instant getLastRegeneratedAt() {
        return lastRegeneratedAt;
    }

    public void setLastRegeneratedAt(Instant lastRegeneratedAt) {
        this.lastRegeneratedAt = lastRegeneratedAt;
    }

    public boolean isLocked() {
        return locked;
    }

    public GoalSnapshot getLockedSnapshot() {
        return lockedSnapshot;
    }

    /**
     * Freezes content and keeps {@code snapshot}; older lock snapshots beyond
     * {@code retention} are trimmed from the snapshot history.
     */
    public void lock(GoalSnapshot snapshot, int retention) {
        this.locked = true;
        this.lockedSnapshot = Objects.requireNonNull(snapshot, "snapshot");
        snapshotHistory.add(snapshot);
        int keep = Math.max(1, retention);
        while (snapshotHistory.size() > keep) {
            snapshotHistory.remove(0);
        }
    }

    public void unlock() {
        this.locked = false;
        this.lockedSnapshot = null;
    }

    public List<GoalSnapshot> getSnapshotHistory() {
        return Collections.unmodifiableList(snapshotHistory);
    }

    // ── Breakdown ───────────────────────────────────────────────────

    public boolean isBrokenDown() {
        return brokenDown;
    }

    public void markBrokenDown() {
        this.brokenDown = true;
    }

    public boolean isAtomic() {
        return atomic;
    }

    public void setAtomic(boolean atomic) {
        this.atomic = atomic;
    }

    // ── Roadmap ─────────────────────────────────────────────────────

    public boolean hasSequentialSteps() {
        return hasSequentialSteps;
    }

    public void setHasSequentialSteps(boolean hasSequentialSteps) {
        this.hasSequentialSteps = hasSequentialSteps;
    }

    public List<RoadmapSection> getRoadmapSections() {
        return Collections.unmodifiableList(roadmapSections);
    }

    public void setRoadmapSections(List<RoadmapSection> sections) {
        this.roadmapSections = new ArrayList<>(sections != null ? sections : List.of());
    }

    public Instant getTargetDate() {
        return targetDate;
    }

    public void setTargetDate(Instant targetDate) {
        this.targetDate = targetDate;
    }

    public boolean isSequentialStep() {
        return sequentialStep;
    }

    public StepStatus getStepStatus() {
        return stepStatus;
    }

    /** Turns this goal into a roadmap step with the given status. */
    public void markAsStep(StepStatus status) {
        this.sequentialStep = true;
        this.stepStatus = Objects.requireNonNull(status, "status");
    }

    public void setStepStatus(StepStatus stepStatus) {
        if (!sequentialStep) {
            throw new GoalStateException("Goal " + id + " is not a roadmap step");
        }
        this.stepStatus = Objects.requireNonNull(stepStatus, "stepStatus");
    }

    public boolean isFinalStep() {
        return finalStep;
    }

    public void setFinalStep(boolean finalStep) {
        this.finalStep = finalStep;
    }

    public String getStepOutcome() {
        return stepOutcome;
    }

    public void setStepOutcome(String stepOutcome) {
        this.stepOutcome = stepOutcome;
    }

    // ── Metric, projections, phases ─────────────────────────────────

    public TargetMetric getTargetMetric() {
        return targetMetric;
    }

    public void setTargetMetric(TargetMetric targetMetric) {
        this.targetMetric = targetMetric;
    }

    public List<GoalProjection> getProjections() {
        return Collections.unmodifiableList(projections);
    }

    public void setProjections(List<GoalProjection> projections) {
        this.projections = new ArrayList<>(projections != null ? projections : List.of());
    }

    public List<GoalPhase> getPhases() {
        return Collections.unmodifiableList(phases);
    }

    public void setPhases(List<GoalPhase> phases) {
        var sorted = new ArrayList<>(phases != null ? phases : List.<GoalPhase>of());
        sorted.sort((a, b) -> Integer.compare(a.order(), b.order()));
        this.phases = sorted;
    }

    // ── Scheduled events ────────────────────────────────────────────

    public List<ScheduledEventLink> getScheduledEvents() {
        return Collections.unmodifiableList(scheduledEvents);
    }

    public void addScheduledEvent(ScheduledEventLink link) {
        scheduledEvents.add(Objects.requireNonNull(link, "link"));
    }

    /** Replaces the link with the same id; no-op when absent. */
    public void replaceScheduledEvent(ScheduledEventLink link) {
        for (int i = 0; i < scheduledEvents.size(); i++) {
            if (scheduledEvents.get(i).id().equals(link.id())) {
                scheduledEvents.set(i, link);
                return;
            }
        }
    }

    // ── Revision history ────────────────────────────────────────────

    public List<GoalRevision> getRevisionHistory() {
        return Collections.unmodifiableList(revisionHistory);
    }

    public void appendRevision(GoalRevision revision) {
        Objects.requireNonNull(revision, "revision");
        if (!revisionHistory.isEmpty()) {
            Instant last = revisionHistory.get(revisionHistory.size() - 1).timestamp();
            if (revision.timestamp().isBefore(last)) {
                revision = revision.at(last);
            }
        }
        revisionHistory.add(revision);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Goal other)) return false;
        return id.equals(other.id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "Goal{" + id + ", '" + title + "', " + activationState + (locked ? ", locked" : "") + "}";
    }
}
