package com.waypoint.core.breakdown;

import com.waypoint.core.error.CycleException;
import com.waypoint.core.error.InvalidDecompositionException;
import com.waypoint.core.graph.GoalGraph;
import com.waypoint.core.metrics.WaypointMetrics;
import com.waypoint.core.model.DependencyKind;
import com.waypoint.core.model.Goal;
import com.waypoint.core.model.Priority;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Turns a proposed decomposition into child goals and dependency edges.
 * <p>
 * The tree is validated before anything is written. Goals are then created in
 * pre-order and dependencies resolved only after every goal exists, all under
 * the graph write lock, so readers never see edges pointing at goals that are
 * not there yet. If an unexpected error escapes half way, the created goals are
 * removed again.
 * <p>
 * This is a pure builder: callers decide whether the target may be broken down.
 */
@Component
public class GoalBreakdownBuilder {

    private static final Logger log = LoggerFactory.getLogger(GoalBreakdownBuilder.class);

    private final GoalGraph graph;
    private final WaypointMetrics metrics;

    public GoalBreakdownBuilder(GoalGraph graph, WaypointMetrics metrics) {
        this.graph = graph;
        this.metrics = metrics;
    }

    /**
     * @throws InvalidDecompositionException if ids collide or a dependency names an unknown node
     */
    public BreakdownResult apply(DecompositionTree tree, UUID parentId) {
        Map<DecompositionNode, String> identifiers = assignIdentifiers(tree);
        List<DecompositionNode> roots = orderRoots(tree, identifiers);

        return graph.write(() -> {
            Goal parent = graph.get(parentId);
            var build = new Build(identifiers);
            try {
                for (DecompositionNode node : roots) {
                    create(node, parent, build);
                }
                resolveDependencies(build);
                if (!parent.isBrokenDown()) {
                    parent.markBrokenDown();
                }
                graph.touch(parentId);
            } catch (RuntimeException e) {
                log.error("Breakdown of goal {} failed after creating {} goal(s); rolling back",
                        parentId, build.created.size(), e);
                for (Goal created : build.created) {
                    graph.delete(created.getId());
                }
                throw e;
            }

            double hours = tree.totalEstimatedHours() != null ? tree.totalEstimatedHours() : build.estimatedHours;
            log.info("Broke down goal {}: {} goals, {} atomic, {} dependencies ({} dropped)", parentId,
                    build.created.size(), build.atomicCount, build.dependencyCount, build.dropped);
            metrics.recordBreakdown(build.created.size(), build.dependencyCount);
            return new BreakdownResult(build.created, build.atomicCount, build.dependencyCount,
                    build.dropped, build.assigned, hours);
        });
    }

    // ── Validation ──────────────────────────────────────────────────

    private Map<DecompositionNode, String> assignIdentifiers(DecompositionTree tree) {
        var all = new ArrayList<DecompositionNode>();
        collect(tree.nodes(), all);

        // identity keys: two proposed nodes may be equal records
        Map<DecompositionNode, String> identifiers = new IdentityHashMap<>();
        Set<String> explicit = new HashSet<>();
        for (DecompositionNode node : all) {
            if (node.id() == null || node.id().isBlank()) continue;
            String id = normalize(node.id());
            if (id.isEmpty()) {
                throw new InvalidDecompositionException("Node '" + node.title() + "' has an unusable id '" + node.id() + "'");
            }
            if (!explicit.add(id)) {
                throw new InvalidDecompositionException("Duplicate node id '" + id + "'");
            }
            identifiers.put(node, id);
        }

        Set<String> taken = new HashSet<>(explicit);
        int counter = 0;
        for (DecompositionNode node : all) {
            if (identifiers.containsKey(node)) continue;
            counter++;
            String base = normalize(node.title());
            if (base.isEmpty()) {
                base = "node-" + counter;
            }
            String candidate = base;
            int suffix = 2;
            while (!taken.add(candidate)) {
                candidate = base + "-" + suffix++;
            }
            identifiers.put(node, candidate);
        }

        Set<String> known = new HashSet<>(identifiers.values());
        for (DecompositionNode node : all) {
            for (String raw : node.dependencies()) {
                if (!known.contains(normalize(raw))) {
                    throw new InvalidDecompositionException("Node '" + identifiers.get(node)
                            + "' depends on unknown node '" + raw + "'");
                }
            }
        }
        return identifiers;
    }

    private static void collect(List<DecompositionNode> level, List<DecompositionNode> out) {
        for (DecompositionNode node : level) {
            out.add(node);
            collect(node.children(), out);
        }
    }

    /** Top-level nodes by recommended order; unlisted nodes after, ties in tree order. */
    private List<DecompositionNode> orderRoots(DecompositionTree tree, Map<DecompositionNode, String> identifiers) {
        var rank = new HashMap<String, Integer>();
        for (int i = 0; i < tree.recommendedOrder().size(); i++) {
            rank.putIfAbsent(normalize(tree.recommendedOrder().get(i)), i);
        }
        var roots = new ArrayList<>(tree.nodes());
        roots.sort(Comparator.comparingInt(node -> Math.min(
                rank.getOrDefault(identifiers.get(node), Integer.MAX_VALUE),
                rank.getOrDefault(normalize(node.title()), Integer.MAX_VALUE))));
        return roots;
    }

    /**
     * Lower-case, runs of anything but letters and digits collapsed to one '-',
     * no leading or trailing '-'.
     */
    static String normalize(String raw) {
        if (raw == null) return "";
        var sb = new StringBuilder();
        boolean dash = false;
        for (char c : raw.trim().toLowerCase(Locale.ROOT).toCharArray()) {
            if (Character.isLetterOrDigit(c)) {
                sb.append(c);
                dash = false;
            } else if (!dash) {
                sb.append('-');
                dash = true;
            }
        }
        int start = 0;
        int end = sb.length();
        while (start < end && sb.charAt(start) == '-') start++;
        while (end > start && sb.charAt(end - 1) == '-') end--;
        return sb.substring(start, end);
    }

    // ── Materialization ─────────────────────────────────────────────

    private void create(DecompositionNode node, Goal parent, Build build) {
        var goal = new Goal(node.title(), formatBody(node), parent.getCategory(),
                priorityFor(node.difficulty()), parent.getKind(), graph.clock().instant());
        graph.insert(goal, parent.getId());
        build.created.add(goal);
        String identifier = build.identifiers.get(node);
        build.assigned.put(identifier, goal.getId());
        build.records.add(new NodeRecord(node, goal));
        if (node.estimatedHours() != null && !node.hasChildren()) {
            build.estimatedHours += node.estimatedHours();
        }

        if (node.atomic() || !node.hasChildren()) {
            goal.setAtomic(true);
            build.atomicCount++;
        }
        for (DecompositionNode child : node.children()) {
            create(child, goal, build);
        }
        if (node.hasChildren()) {
            goal.markBrokenDown();
        }
    }

    private void resolveDependencies(Build build) {
        for (NodeRecord record : build.records) {
            UUID dependentId = record.goal().getId();
            for (String raw : record.node().dependencies()) {
                UUID prerequisiteId = build.assigned.get(normalize(raw));
                if (prerequisiteId.equals(dependentId) || graph.hasDependency(prerequisiteId, dependentId)) {
                    continue;
                }
                try {
                    graph.addDependency(prerequisiteId, dependentId, DependencyKind.FINISH_TO_START, null);
                    build.dependencyCount++;
                } catch (CycleException e) {
                    log.warn("Dropped dependency {} -> {}: {}", raw, build.identifiers.get(record.node()), e.getMessage());
                    metrics.recordDroppedDependency("cycle");
                    build.dropped++;
                }
            }
        }
    }

    /** Description plus "Estimate: 2.5h • Difficulty: Hard" when either is known. */
    static String formatBody(DecompositionNode node) {
        String description = node.description() != null ? node.description() : "";
        var metadata = new ArrayList<String>();
        if (node.estimatedHours() != null) {
            metadata.add(String.format(Locale.ROOT, "Estimate: %.1fh", node.estimatedHours()));
        }
        if (node.difficulty() != null && !node.difficulty().isBlank()) {
            String d = node.difficulty().trim().toLowerCase(Locale.ROOT);
            metadata.add("Difficulty: " + Character.toUpperCase(d.charAt(0)) + d.substring(1));
        }
        if (metadata.isEmpty()) {
            return description;
        }
        return description + "\n\n" + String.join(" • ", metadata);
    }

    static Priority priorityFor(String difficulty) {
        if (difficulty == null) return Priority.LATER;
        return switch (difficulty.trim().toLowerCase(Locale.ROOT)) {
            case "hard" -> Priority.NOW;
            case "medium" -> Priority.NEXT;
            default -> Priority.LATER;
        };
    }

    private record NodeRecord(DecompositionNode node, Goal goal) {}

    private static final class Build {
        final Map<DecompositionNode, String> identifiers;
        final List<Goal> created = new ArrayList<>();
        final List<NodeRecord> records = new ArrayList<>();
        final Map<String, UUID> assigned = new LinkedHashMap<>();
        int atomicCount;
        int dependencyCount;
        int dropped;
        double estimatedHours;

        Build(Map<DecompositionNode, String> identifiers) {
            this.identifiers = identifiers;
        }
    }
}
