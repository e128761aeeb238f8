package com.waypoint.core.calendar;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryCalendarGatewayTest {

    private final InMemoryCalendarGateway calendar = new InMemoryCalendarGateway();

    @Test
    @DisplayName("created items are listed by start time")
    void createAndList() {
        Instant t = Instant.parse("2026-03-02T09:00:00Z");
        String later = calendar.createEvent("Later", t.plusSeconds(3600), Duration.ofHours(1), null);
        String earlier = calendar.createEvent("Earlier", t, Duration.ofMinutes(30), "notes");

        var items = calendar.items();
        assertEquals(2, items.size());
        assertEquals(earlier, items.get(0).id());
        assertEquals(later, items.get(1).id());
        assertEquals("notes", items.get(0).notes());
    }

    @Test
    @DisplayName("cancel removes the item and ignores unknown ids")
    void cancel() {
        String id = calendar.createEvent("Run", Instant.now(), Duration.ofHours(1), null);

        calendar.cancelEvent(id);
        assertDoesNotThrow(() -> calendar.cancelEvent("cal-unknown"));

        assertTrue(calendar.items().isEmpty());
    }
}
