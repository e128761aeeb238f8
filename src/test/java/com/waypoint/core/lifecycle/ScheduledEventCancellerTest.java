package com.waypoint.core.lifecycle;

import com.waypoint.core.calendar.CalendarGateway;
import com.waypoint.core.external.ExternalCallExecutor;
import com.waypoint.core.metrics.WaypointMetrics;
import com.waypoint.core.model.EventLinkStatus;
import com.waypoint.core.model.Goal;
import com.waypoint.core.model.ScheduledEventLink;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class ScheduledEventCancellerTest {

    private static final Instant NOW = Instant.parse("2026-03-01T09:00:00Z");

    private CalendarGateway calendar;
    private SimpleMeterRegistry registry;
    private ExternalCallExecutor external;
    private ScheduledEventCanceller canceller;

    @BeforeEach
    void setUp() {
        calendar = mock(CalendarGateway.class);
        registry = new SimpleMeterRegistry();
        var metrics = new WaypointMetrics(registry);
        external = new ExternalCallExecutor(Duration.ofSeconds(5), metrics);
        canceller = new ScheduledEventCanceller(calendar, external, metrics);
    }

    @AfterEach
    void tearDown() {
        external.shutdown();
    }

    @Test
    @DisplayName("only proposed links are marked cancelled and returned")
    void marksProposedOnly() {
        var goal = new Goal("Swim", "", null, null, null, NOW);
        var proposed = ScheduledEventLink.proposed("cal-1", NOW, NOW.plusSeconds(900));
        var confirmed = ScheduledEventLink.proposed("cal-2", NOW, NOW.plusSeconds(900))
                .withStatus(EventLinkStatus.CONFIRMED);
        goal.addScheduledEvent(proposed);
        goal.addScheduledEvent(confirmed);

        List<ScheduledEventLink> toCancel = canceller.markPendingCancelled(goal);

        assertEquals(List.of(proposed), toCancel);
        assertEquals(EventLinkStatus.CANCELLED, goal.getScheduledEvents().get(0).status());
        assertEquals(EventLinkStatus.CONFIRMED, goal.getScheduledEvents().get(1).status());
        verifyNoInteractions(calendar);
    }

    @Test
    @DisplayName("a calendar failure on one item does not stop the others")
    void keepsGoingAfterFailure() {
        doThrow(new IllegalStateException("gone")).when(calendar).cancelEvent("cal-1");
        var first = ScheduledEventLink.proposed("cal-1", NOW, NOW.plusSeconds(900));
        var second = ScheduledEventLink.proposed("cal-2", NOW, NOW.plusSeconds(900));

        canceller.cancel(UUID.randomUUID(), List.of(first, second));

        verify(calendar).cancelEvent("cal-2");
        assertEquals(1.0, registry.find("waypoint.calendar.cancel_failures").counter().count());
    }
}
