package com.waypoint.core.model;

import java.util.Locale;

/**
 * What drives a goal's progress: fixed-date events are time-driven,
 * campaigns are metric-driven, hybrids are both.
 */
public enum GoalKind {
    EVENT,
    CAMPAIGN,
    HYBRID;

    /** Whether a target metric contributes checkpoints for this kind. */
    public boolean tracksMetric() {
        return switch (this) {
            case EVENT -> false;
            case CAMPAIGN, HYBRID -> true;
        };
    }

    public static GoalKind parse(String raw, GoalKind fallback) {
        if (raw == null || raw.isBlank()) return fallback;
        try {
            return GoalKind.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return fallback;
        }
    }
}
