package com.waypoint.core.calendar;

import java.time.Duration;
import java.time.Instant;

/**
 * The external calendar collaborator. Implementations may block and may fail;
 * callers run them through {@code ExternalCallExecutor}.
 */
public interface CalendarGateway {

    /**
     * @return the identifier of the created calendar item
     */
    String createEvent(String title, Instant start, Duration duration, String notes);

    /** Cancelling an unknown id is a no-op. */
    void cancelEvent(String externalEventId);
}
