package com.waypoint.core.timeline;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Closed date interval used to clip timeline projections.
 */
public record Horizon(Instant start, Instant end) {

    public Horizon {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("Horizon end " + end + " is before start " + start);
        }
    }

    public static Horizon ofDays(Instant start, int days) {
        return new Horizon(start, start.plus(Duration.ofDays(days)));
    }

    public boolean intersects(Instant from, Instant to) {
        return !from.isAfter(end) && !to.isBefore(start);
    }

    public boolean contains(Instant instant) {
        return !instant.isBefore(start) && !instant.isAfter(end);
    }

    public long lengthDays() {
        return Duration.between(start, end).toDays();
    }
}
