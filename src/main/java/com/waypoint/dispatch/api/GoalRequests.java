package com.waypoint.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.waypoint.core.model.TargetMetric;
import com.waypoint.core.reasoning.ActivationPlan;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * JSON request bodies for {@link GoalController}.
 */
public final class GoalRequests {

    private GoalRequests() {}

    public record CreateGoal(
        String title,
        String body,
        String category,
        String priority,
        String kind,
        String emoji,
        @JsonProperty("target_date") Instant targetDate,
        @JsonProperty("target_metric") TargetMetric targetMetric,
        @JsonProperty("parent_id") UUID parentId
    ) {}

    public record UpdateGoal(String title, String body, String category, String priority) {}

    public record SetProgress(Double value) {}

    public record Unlock(String reason) {}

    public record Deactivate(String state, String rationale) {}

    public record ConfirmActivation(ActivationPlan plan) {}

    public record AddDependency(
        @JsonProperty("prerequisite_id") UUID prerequisiteId,
        @JsonProperty("dependent_id") UUID dependentId,
        String kind,
        String note
    ) {}

    public record Reorder(
        @JsonProperty("parent_id") UUID parentId,
        @JsonProperty("ordered_ids") List<UUID> orderedIds
    ) {}
}
