package com.waypoint.core.breakdown;

import com.waypoint.core.model.Goal;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Outcome of materializing a decomposition.
 *
 * @param createdGoals        goals created, in pre-order
 * @param atomicTaskCount     nodes flagged atomic
 * @param dependencyCount     dependency edges actually added
 * @param droppedDependencies declared edges skipped because they would close a cycle
 * @param assignedIdentifiers normalized external id to created goal id
 * @param totalEstimatedHours estimate carried by the proposal, or the sum of node estimates
 */
public record BreakdownResult(
    List<Goal> createdGoals,
    int atomicTaskCount,
    int dependencyCount,
    int droppedDependencies,
    Map<String, UUID> assignedIdentifiers,
    double totalEstimatedHours
) {

    public BreakdownResult {
        createdGoals = List.copyOf(createdGoals);
        assignedIdentifiers = Map.copyOf(assignedIdentifiers);
    }
}
