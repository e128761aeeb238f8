package com.waypoint.core.reasoning;

import java.util.List;

/**
 * Model output for a breakdown request.
 */
public record BreakdownResponse(
    List<Subtask> subtasks,
    List<String> recommendedOrder,
    Double totalEstimatedHours
) {

    public record Subtask(
        String id,
        String title,
        String description,
        Double estimatedHours,
        List<String> dependencies,
        String difficulty,
        Boolean atomic,
        List<Subtask> children
    ) {}
}
