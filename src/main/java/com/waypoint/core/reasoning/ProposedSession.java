package com.waypoint.core.reasoning;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * A calendar session suggested for activating a goal.
 *
 * @param timeSlot    "morning", "afternoon" or "evening" as suggested, if any
 * @param preparation things to prepare before the session
 */
public record ProposedSession(
    String title,
    Instant start,
    Duration duration,
    String notes,
    String timeSlot,
    List<String> preparation
) {

    public ProposedSession {
        preparation = preparation == null ? List.of() : List.copyOf(preparation);
    }

    public Instant end() {
        return start.plus(duration);
    }
}
