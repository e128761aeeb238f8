package com.waypoint.core.breakdown;

import java.util.List;

/**
 * A decomposition proposed by the reasoning collaborator.
 *
 * @param nodes               top-level nodes
 * @param recommendedOrder    preferred order of top-level nodes, by id or title
 * @param totalEstimatedHours overall estimate, if the proposal carries one
 */
public record DecompositionTree(
    List<DecompositionNode> nodes,
    List<String> recommendedOrder,
    Double totalEstimatedHours
) {

    public DecompositionTree {
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
        recommendedOrder = recommendedOrder == null ? List.of() : List.copyOf(recommendedOrder);
    }

    public int nodeCount() {
        return count(nodes);
    }

    private static int count(List<DecompositionNode> level) {
        int n = 0;
        for (DecompositionNode node : level) {
            n += 1 + count(node.children());
        }
        return n;
    }
}
