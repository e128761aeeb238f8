package com.waypoint.core.error;

import com.waypoint.core.model.ScheduledEventLink;

import java.util.List;
import java.util.UUID;

/**
 * Thrown when some calendar items were created during activation but the plan
 * could not be fully confirmed. The goal stays in draft; {@link #createdLinks()}
 * lists the links that were recorded before the failure.
 */
public class PartialActivationException extends GoalGraphException {

    private final UUID goalId;
    private final List<ScheduledEventLink> createdLinks;

    public PartialActivationException(UUID goalId, List<ScheduledEventLink> createdLinks, Throwable cause) {
        super("Activation of goal " + goalId + " failed after creating "
                + createdLinks.size() + " calendar item(s)", cause);
        this.goalId = goalId;
        this.createdLinks = List.copyOf(createdLinks);
    }

    public UUID goalId() {
        return goalId;
    }

    public List<ScheduledEventLink> createdLinks() {
        return createdLinks;
    }
}
