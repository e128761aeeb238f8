package com.waypoint.core.model;

import java.util.Locale;

/**
 * Scheduling priority of a goal, as shown on goal cards.
 */
public enum Priority {
    NOW,
    NEXT,
    LATER;

    /**
     * Lenient parse used for values proposed by the reasoning service
     * ("now", "Next", " later ").
     */
    public static Priority parse(String raw, Priority fallback) {
        if (raw == null || raw.isBlank()) return fallback;
        try {
            return Priority.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return fallback;
        }
    }
}
