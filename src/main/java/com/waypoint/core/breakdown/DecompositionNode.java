package com.waypoint.core.breakdown;

import java.util.List;

/**
 * One node of a proposed decomposition.
 *
 * @param id             external identifier, referenced by other nodes' {@code dependencies}; the title is used when absent
 * @param title          subgoal title
 * @param description    subgoal description
 * @param estimatedHours effort estimate, if any
 * @param dependencies   external ids this node waits on
 * @param difficulty     "easy", "medium" or "hard"; drives priority
 * @param children       nested nodes
 * @param atomic         whether the node must not be broken down further
 */
public record DecompositionNode(
    String id,
    String title,
    String description,
    Double estimatedHours,
    List<String> dependencies,
    String difficulty,
    List<DecompositionNode> children,
    boolean atomic
) {

    public DecompositionNode {
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
        children = children == null ? List.of() : List.copyOf(children);
    }

    public static DecompositionNode leaf(String id, String title, String description, List<String> dependencies) {
        return new DecompositionNode(id, title, description, null, dependencies, null, List.of(), false);
    }

    public boolean hasChildren() {
        return !children.isEmpty();
    }
}
