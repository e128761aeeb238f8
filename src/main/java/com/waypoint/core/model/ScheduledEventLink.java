package com.waypoint.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.UUID;

/**
 * Ties a goal to an item created in the external calendar.
 *
 * @param id              link id
 * @param externalEventId identifier returned by the calendar collaborator
 * @param start           session start
 * @param end             session end
 * @param status          proposed until the whole activation is confirmed
 */
public record ScheduledEventLink(
    UUID id,
    String externalEventId,
    Instant start,
    Instant end,
    EventLinkStatus status
) implements Serializable {

    public static ScheduledEventLink proposed(String externalEventId, Instant start, Instant end) {
        return new ScheduledEventLink(UUID.randomUUID(), externalEventId, start, end, EventLinkStatus.PROPOSED);
    }

    public ScheduledEventLink withStatus(EventLinkStatus newStatus) {
        return new ScheduledEventLink(id, externalEventId, start, end, newStatus);
    }

    public boolean isPending() {
        return status == EventLinkStatus.PROPOSED;
    }
}
