package com.waypoint.core.reasoning;

import java.util.List;

/**
 * Ordered sessions proposed for a goal, plus scheduling tips.
 * Nothing is committed until the plan is confirmed.
 */
public record ActivationPlan(List<ProposedSession> sessions, List<String> tips) {

    public ActivationPlan {
        sessions = sessions == null ? List.of() : List.copyOf(sessions);
        tips = tips == null ? List.of() : List.copyOf(tips);
    }

    public boolean isEmpty() {
        return sessions.isEmpty();
    }
}
