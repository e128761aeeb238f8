package com.waypoint.core.calendar;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Calendar kept in memory. Used when no real calendar backend is wired in.
 */
public class InMemoryCalendarGateway implements CalendarGateway {

    private static final Logger log = LoggerFactory.getLogger(InMemoryCalendarGateway.class);

    private final Map<String, CalendarItem> items = new ConcurrentHashMap<>();

    @Override
    public String createEvent(String title, Instant start, Duration duration, String notes) {
        String id = "cal-" + UUID.randomUUID();
        items.put(id, new CalendarItem(id, title, start, duration, notes));
        log.debug("Created calendar item {} '{}' at {}", id, title, start);
        return id;
    }

    @Override
    public void cancelEvent(String externalEventId) {
        if (items.remove(externalEventId) != null) {
            log.debug("Cancelled calendar item {}", externalEventId);
        }
    }

    public List<CalendarItem> items() {
        return items.values().stream().sorted(Comparator.comparing(CalendarItem::start)).toList();
    }
}
