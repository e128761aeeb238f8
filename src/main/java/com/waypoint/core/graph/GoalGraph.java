package com.waypoint.core.graph;

import com.waypoint.core.error.CycleException;
import com.waypoint.core.error.GoalNotFoundException;
import com.waypoint.core.error.GoalStateException;
import com.waypoint.core.error.SelfDependencyException;
import com.waypoint.core.model.DependencyKind;
import com.waypoint.core.model.Goal;
import com.waypoint.core.model.GoalDependency;
import com.waypoint.core.model.StepStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * In-memory goal graph: an arena of goals keyed by id, a parent/child table and
 * an independent table of typed dependency edges.
 * <p>
 * Both edge sets stay acyclic. Every edge insertion runs a visited-set DFS before
 * anything is written, and traversals carry their own visited set so they return
 * partial results instead of looping if a corrupt graph ever gets loaded.
 * <p>
 * Access is guarded by one {@link ReentrantReadWriteLock}. Public queries take the
 * read lock and mutators the write lock; services that need several steps to be
 * atomic wrap them in {@link #write(Supplier)}. The read lock cannot be upgraded,
 * so never call a mutator from inside {@link #read(Supplier)}.
 */
@Component
public class GoalGraph {

    private static final Logger log = LoggerFactory.getLogger(GoalGraph.class);

    private static final Comparator<Goal> SIBLING_ORDER =
            Comparator.comparingInt(Goal::getSortIndex).thenComparing(Goal::getCreatedAt);

    private final Clock clock;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private final Map<UUID, Goal> goals = new LinkedHashMap<>();
    private final Map<UUID, UUID> parentOf = new HashMap<>();
    private final Map<UUID, List<UUID>> childrenOf = new HashMap<>();
    private final Map<UUID, GoalDependency> dependencies = new LinkedHashMap<>();
    private final Map<UUID, Set<UUID>> outgoing = new HashMap<>();
    private final Map<UUID, Set<UUID>> incoming = new HashMap<>();

    // change tracking for incremental save
    private final Set<UUID> dirtyGoals = new LinkedHashSet<>();
    private final Set<UUID> deletedGoals = new LinkedHashSet<>();
    private final Map<UUID, GoalDependency> addedDependencies = new LinkedHashMap<>();
    private final Set<UUID> removedDependencies = new LinkedHashSet<>();

    public GoalGraph(Clock clock) {
        this.clock = clock;
    }

    public Clock clock() {
        return clock;
    }

    // ── Exclusion helpers ───────────────────────────────────────────

    public <T> T read(Supplier<T> action) {
        lock.readLock().lock();
        try {
            return action.get();
        } finally {
            lock.readLock().unlock();
        }
    }

    public <T> T write(Supplier<T> action) {
        lock.writeLock().lock();
        try {
            return action.get();
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void write(Runnable action) {
        write(() -> {
            action.run();
            return null;
        });
    }

    // ── Goals ───────────────────────────────────────────────────────

    /**
     * Adds {@code goal} to the graph, appended after the parent's existing children
     * (or after the existing top-level goals).
     *
     * @throws CycleException        if {@code parentId} is the goal itself or one of its descendants
     * @throws GoalNotFoundException if the parent does not exist
     */
    public Goal insert(Goal goal, UUID parentId) {
        return write(() -> {
            if (goals.containsKey(goal.getId())) {
                throw new IllegalArgumentException("Goal " + goal.getId() + " is already in the graph");
            }
            if (parentId != null) {
                requireGoal(parentId);
                if (parentId.equals(goal.getId())) {
                    throw new CycleException("Goal cannot be its own parent", goal.getId(), parentId);
                }
            }
            goal.setSortIndex(nextSortIndex(parentId));
            goals.put(goal.getId(), goal);
            attach(goal.getId(), parentId);
            dirtyGoals.add(goal.getId());
            log.debug("Inserted goal {} under {}", goal.getId(), parentId);
            return goal;
        });
    }

    /**
     * Moves a goal under {@code newParentId} ({@code null} makes it top-level).
     *
     * @throws CycleException if the new parent is the goal or one of its descendants
     */
    public void reparent(UUID goalId, UUID newParentId) {
        write(() -> {
            Goal goal = requireGoal(goalId);
            if (newParentId != null) {
                requireGoal(newParentId);
                if (collectDescendants(goalId, true).contains(newParentId)) {
                    throw new CycleException("Goal " + newParentId + " is a descendant of " + goalId,
                            goalId, newParentId);
                }
            }
            detach(goalId);
            goal.setSortIndex(nextSortIndex(newParentId));
            attach(goalId, newParentId);
            touchInternal(goal);
        });
    }

    /**
     * Removes the goal and its whole subtree (pre-order) together with every
     * dependency edge touching a removed goal. Idempotent: an unknown id yields
     * an empty list.
     *
     * @return the removed goals, root first
     */
    public List<Goal> delete(UUID goalId) {
        return write(() -> {
            if (!goals.containsKey(goalId)) {
                return List.of();
            }
            List<UUID> subtree = collectDescendants(goalId, true);
            detach(goalId);
            var removed = new ArrayList<Goal>(subtree.size());
            for (UUID id : subtree) {
                for (UUID depId : new ArrayList<>(edgesTouching(id))) {
                    removeDependencyInternal(depId);
                }
                childrenOf.remove(id);
                parentOf.remove(id);
                removed.add(goals.remove(id));
                dirtyGoals.remove(id);
                deletedGoals.add(id);
            }
            log.info("Deleted goal {} with {} descendant(s)", goalId, removed.size() - 1);
            return removed;
        });
    }

    public Optional<Goal> find(UUID goalId) {
        return read(() -> Optional.ofNullable(goals.get(goalId)));
    }

    /**
     * @throws GoalNotFoundException if no goal has this id
     */
    public Goal get(UUID goalId) {
        return read(() -> requireGoal(goalId));
    }

    public boolean contains(UUID goalId) {
        return read(() -> goals.containsKey(goalId));
    }

    public int size() {
        return read(goals::size);
    }

    public List<Goal> allGoals() {
        return read(() -> List.copyOf(goals.values()));
    }

    /** Stamps {@code updatedAt} and marks the goal for the next save. */
    public void touch(UUID goalId) {
        write(() -> touchInternal(requireGoal(goalId)));
    }

    // ── Hierarchy queries ───────────────────────────────────────────

    public Optional<UUID> parent(UUID goalId) {
        return read(() -> {
            requireGoal(goalId);
            return Optional.ofNullable(parentOf.get(goalId));
        });
    }

    /** Direct children in sort order. */
    public List<Goal> children(UUID goalId) {
        return read(() -> {
            requireGoal(goalId);
            return sortedChildren(goalId);
        });
    }

    public boolean hasChildren(UUID goalId) {
        return read(() -> !childrenOf.getOrDefault(goalId, List.of()).isEmpty());
    }

    public List<Goal> topLevelGoals() {
        return read(() -> goals.values().stream()
                .filter(g -> !parentOf.containsKey(g.getId()))
                .sorted(SIBLING_ORDER)
                .toList());
    }

    /** Parent first, root last. */
    public List<Goal> ancestors(UUID goalId) {
        return read(() -> {
            requireGoal(goalId);
            var result = new ArrayList<Goal>();
            var seen = new HashSet<UUID>();
            seen.add(goalId);
            UUID current = parentOf.get(goalId);
            while (current != null && seen.add(current)) {
                result.add(goals.get(current));
                current = parentOf.get(current);
            }
            return result;
        });
    }

    /** Pre-order, children in sort order. */
    public List<Goal> descendants(UUID goalId, boolean includeSelf) {
        return read(() -> {
            requireGoal(goalId);
            return collectDescendants(goalId, includeSelf).stream().map(goals::get).toList();
        });
    }

    /**
     * Descendants with no children. A goal without children is its own single leaf.
     */
    public List<Goal> leaves(UUID goalId) {
        return read(() -> {
            requireGoal(goalId);
            return collectDescendants(goalId, true).stream()
                    .filter(id -> childrenOf.getOrDefault(id, List.of()).isEmpty())
                    .map(goals::get)
                    .toList();
        });
    }

    /** Roadmap steps of a goal in roadmap order. */
    public List<Goal> sequentialSteps(UUID goalId) {
        return read(() -> {
            requireGoal(goalId);
            return sortedChildren(goalId).stream().filter(Goal::isSequentialStep).toList();
        });
    }

    /**
     * Rewrites sibling order: the listed ids first in the given order, the remaining
     * siblings after them in their existing order. Ids that are not siblings are ignored.
     */
    public void reorderChildren(UUID parentId, List<UUID> orderedIds) {
        write(() -> {
            List<Goal> siblings = parentId == null ? topLevelGoals() : children(parentId);
            var bySibling = new LinkedHashMap<UUID, Goal>();
            siblings.forEach(g -> bySibling.put(g.getId(), g));

            var ordered = new ArrayList<Goal>();
            for (UUID id : orderedIds) {
                Goal g = bySibling.remove(id);
                if (g != null) {
                    ordered.add(g);
                }
            }
            ordered.addAll(bySibling.values());
            for (int i = 0; i < ordered.size(); i++) {
                Goal g = ordered.get(i);
                if (g.getSortIndex() != i) {
                    g.setSortIndex(i);
                    touchInternal(g);
                }
            }
        });
    }

    // ── Dependencies ────────────────────────────────────────────────

    /**
     * Adds an edge saying {@code dependentId} waits on {@code prerequisiteId}.
     * Adding an edge that already exists returns the existing one unchanged.
     *
     * @throws SelfDependencyException if both ids are the same
     * @throws CycleException          if the dependent already reaches the prerequisite
     */
    public GoalDependency addDependency(UUID prerequisiteId, UUID dependentId, DependencyKind kind, String note) {
        return write(() -> {
            if (prerequisiteId.equals(dependentId)) {
                throw new SelfDependencyException(prerequisiteId);
            }
            requireGoal(prerequisiteId);
            requireGoal(dependentId);
            Optional<GoalDependency> existing = findEdge(prerequisiteId, dependentId);
            if (existing.isPresent()) {
                return existing.get();
            }
            if (reaches(dependentId, prerequisiteId)) {
                throw new CycleException("Dependency " + prerequisiteId + " -> " + dependentId
                        + " would close a cycle", prerequisiteId, dependentId);
            }
            var edge = new GoalDependency(UUID.randomUUID(), prerequisiteId, dependentId,
                    kind != null ? kind : DependencyKind.FINISH_TO_START, note, clock.instant());
            putDependency(edge);
            addedDependencies.put(edge.id(), edge);
            return edge;
        });
    }

    /** @return whether an edge was removed */
    public boolean removeDependency(UUID dependencyId) {
        return write(() -> removeDependencyInternal(dependencyId));
    }

    public boolean hasDependency(UUID prerequisiteId, UUID dependentId) {
        return read(() -> findEdge(prerequisiteId, dependentId).isPresent());
    }

    /** Edges where the goal is the dependent. */
    public List<GoalDependency> incomingDependencies(UUID goalId) {
        return read(() -> incoming.getOrDefault(goalId, Set.of()).stream().map(dependencies::get).toList());
    }

    /** Edges where the goal is the prerequisite. */
    public List<GoalDependency> outgoingDependencies(UUID goalId) {
        return read(() -> outgoing.getOrDefault(goalId, Set.of()).stream().map(dependencies::get).toList());
    }

    public List<GoalDependency> allDependencies() {
        return read(() -> List.copyOf(dependencies.values()));
    }

    // ── Persistence ─────────────────────────────────────────────────

    /**
     * Returns and clears the mutations recorded since the previous call.
     */
    public GraphChangeSet drainChanges() {
        return write(() -> {
            var upserts = dirtyGoals.stream()
                    .filter(goals::containsKey)
                    .map(id -> new GoalRecord(goals.get(id), parentOf.get(id)))
                    .toList();
            var changes = new GraphChangeSet(upserts, deletedGoals,
                    new ArrayList<>(addedDependencies.values()), removedDependencies);
            dirtyGoals.clear();
            deletedGoals.clear();
            addedDependencies.clear();
            removedDependencies.clear();
            return changes;
        });
    }

    /**
     * Puts back a change set that could not be saved, so the next drain includes
     * it again. Entries overtaken by later mutations are not restored: a goal
     * deleted since is not re-upserted, an edge removed since is not re-added.
     */
    public void restoreChanges(GraphChangeSet changes) {
        write(() -> {
            for (GoalRecord record : changes.upserts()) {
                UUID id = record.goal().getId();
                if (goals.containsKey(id)) {
                    dirtyGoals.add(id);
                }
            }
            for (UUID id : changes.deletedGoalIds()) {
                if (!goals.containsKey(id)) {
                    deletedGoals.add(id);
                }
            }
            for (GoalDependency edge : changes.addedDependencies()) {
                if (dependencies.containsKey(edge.id())) {
                    addedDependencies.putIfAbsent(edge.id(), edge);
                }
            }
            for (UUID id : changes.removedDependencyIds()) {
                if (!dependencies.containsKey(id)) {
                    removedDependencies.add(id);
                }
            }
        });
    }

    /** Whether mutations are waiting for {@link #drainChanges()}. */
    public boolean hasPendingChanges() {
        return read(() -> !dirtyGoals.isEmpty() || !deletedGoals.isEmpty()
                || !addedDependencies.isEmpty() || !removedDependencies.isEmpty());
    }

    public GraphSnapshot snapshot() {
        return read(() -> new GraphSnapshot(
                goals.values().stream().map(g -> new GoalRecord(g, parentOf.get(g.getId()))).toList(),
                List.copyOf(dependencies.values())));
    }

    /**
     * Replaces the whole graph with {@code snapshot}. The snapshot is validated
     * against every graph invariant first; on failure the current content is kept.
     * Pending change tracking is reset.
     *
     * @throws GoalStateException if the snapshot breaks an invariant
     */
    public void load(GraphSnapshot snapshot) {
        write(() -> {
            var staging = new GoalGraph(clock);
            for (GoalRecord record : snapshot.goals()) {
                staging.goals.put(record.goal().getId(), record.goal());
            }
            for (GoalRecord record : snapshot.goals()) {
                UUID parentId = record.parentId();
                if (parentId == null) continue;
                if (!staging.goals.containsKey(parentId)) {
                    throw new GoalStateException("Goal " + record.goal().getId() + " references missing parent " + parentId);
                }
                staging.attach(record.goal().getId(), parentId);
            }
            for (GoalRecord record : snapshot.goals()) {
                if (staging.hasParentCycle(record.goal().getId())) {
                    throw new GoalStateException("Parent chain of goal " + record.goal().getId() + " is cyclic");
                }
            }
            for (GoalDependency edge : snapshot.dependencies()) {
                if (!staging.goals.containsKey(edge.prerequisiteId()) || !staging.goals.containsKey(edge.dependentId())) {
                    throw new GoalStateException("Dependency " + edge.id() + " references a missing goal");
                }
                if (edge.prerequisiteId().equals(edge.dependentId())
                        || staging.reaches(edge.dependentId(), edge.prerequisiteId())) {
                    throw new GoalStateException("Dependency " + edge.id() + " is cyclic");
                }
                staging.putDependency(edge);
            }
            for (UUID id : staging.goals.keySet()) {
                long current = staging.sortedChildren(id).stream()
                        .filter(g -> g.isSequentialStep() && g.getStepStatus() == StepStatus.CURRENT)
                        .count();
                if (current > 1) {
                    throw new GoalStateException("Goal " + id + " has " + current + " current steps");
                }
            }

            clearAll();
            goals.putAll(staging.goals);
            parentOf.putAll(staging.parentOf);
            childrenOf.putAll(staging.childrenOf);
            dependencies.putAll(staging.dependencies);
            outgoing.putAll(staging.outgoing);
            incoming.putAll(staging.incoming);
            log.info("Loaded goal graph: {} goals, {} dependencies", goals.size(), dependencies.size());
        });
    }

    // ── Internals (callers hold the appropriate lock) ──────────────

    private Goal requireGoal(UUID goalId) {
        Goal goal = goals.get(goalId);
        if (goal == null) {
            throw new GoalNotFoundException(goalId);
        }
        return goal;
    }

    private void touchInternal(Goal goal) {
        goal.setUpdatedAt(clock.instant());
        dirtyGoals.add(goal.getId());
    }

    private int nextSortIndex(UUID parentId) {
        var siblings = parentId == null
                ? goals.values().stream().filter(g -> !parentOf.containsKey(g.getId())).toList()
                : childrenOf.getOrDefault(parentId, List.of()).stream().map(goals::get).toList();
        return siblings.stream().mapToInt(Goal::getSortIndex).max().orElse(-1) + 1;
    }

    private void attach(UUID goalId, UUID parentId) {
        if (parentId == null) return;
        parentOf.put(goalId, parentId);
        childrenOf.computeIfAbsent(parentId, k -> new ArrayList<>()).add(goalId);
    }

    private void detach(UUID goalId) {
        UUID parentId = parentOf.remove(goalId);
        if (parentId != null) {
            List<UUID> siblings = childrenOf.get(parentId);
            if (siblings != null) {
                siblings.remove(goalId);
            }
        }
    }

    private List<Goal> sortedChildren(UUID goalId) {
        return childrenOf.getOrDefault(goalId, List.of()).stream()
                .map(goals::get)
                .sorted(SIBLING_ORDER)
                .toList();
    }

    private List<UUID> collectDescendants(UUID rootId, boolean includeSelf) {
        var result = new ArrayList<UUID>();
        var visited = new HashSet<UUID>();
        Deque<UUID> stack = new ArrayDeque<>();
        stack.push(rootId);
        while (!stack.isEmpty()) {
            UUID id = stack.pop();
            if (!visited.add(id)) {
                log.warn("Hierarchy cycle detected at goal {}; returning partial traversal", id);
                continue;
            }
            if (includeSelf || !id.equals(rootId)) {
                result.add(id);
            }
            List<Goal> kids = sortedChildren(id);
            for (int i = kids.size() - 1; i >= 0; i--) {
                stack.push(kids.get(i).getId());
            }
        }
        return result;
    }

    private boolean hasParentCycle(UUID goalId) {
        var seen = new HashSet<UUID>();
        UUID current = goalId;
        while (current != null) {
            if (!seen.add(current)) return true;
            current = parentOf.get(current);
        }
        return false;
    }

    /** DFS along dependency edges from {@code fromId}, following prerequisite to dependent. */
    private boolean reaches(UUID fromId, UUID targetId) {
        var visited = new HashSet<UUID>();
        Deque<UUID> stack = new ArrayDeque<>();
        stack.push(fromId);
        while (!stack.isEmpty()) {
            UUID id = stack.pop();
            if (id.equals(targetId)) return true;
            if (!visited.add(id)) continue;
            for (UUID depId : outgoing.getOrDefault(id, Set.of())) {
                stack.push(dependencies.get(depId).dependentId());
            }
        }
        return false;
    }

    private Optional<GoalDependency> findEdge(UUID prerequisiteId, UUID dependentId) {
        return outgoing.getOrDefault(prerequisiteId, Set.of()).stream()
                .map(dependencies::get)
                .filter(d -> d.dependentId().equals(dependentId))
                .findFirst();
    }

    private Set<UUID> edgesTouching(UUID goalId) {
        var ids = new LinkedHashSet<UUID>();
        ids.addAll(outgoing.getOrDefault(goalId, Set.of()));
        ids.addAll(incoming.getOrDefault(goalId, Set.of()));
        return ids;
    }

    private void putDependency(GoalDependency edge) {
        dependencies.put(edge.id(), edge);
        outgoing.computeIfAbsent(edge.prerequisiteId(), k -> new LinkedHashSet<>()).add(edge.id());
        incoming.computeIfAbsent(edge.dependentId(), k -> new LinkedHashSet<>()).add(edge.id());
    }

    private boolean removeDependencyInternal(UUID dependencyId) {
        GoalDependency edge = dependencies.remove(dependencyId);
        if (edge == null) return false;
        Set<UUID> out = outgoing.get(edge.prerequisiteId());
        if (out != null) out.remove(dependencyId);
        Set<UUID> in = incoming.get(edge.dependentId());
        if (in != null) in.remove(dependencyId);
        if (addedDependencies.remove(dependencyId) == null) {
            removedDependencies.add(dependencyId);
        }
        return true;
    }

    private void clearAll() {
        goals.clear();
        parentOf.clear();
        childrenOf.clear();
        dependencies.clear();
        outgoing.clear();
        incoming.clear();
        dirtyGoals.clear();
        deletedGoals.clear();
        addedDependencies.clear();
        removedDependencies.clear();
    }
}
