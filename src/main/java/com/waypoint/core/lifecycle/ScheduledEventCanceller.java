package com.waypoint.core.lifecycle;

import com.waypoint.core.calendar.CalendarGateway;
import com.waypoint.core.error.ExternalServiceException;
import com.waypoint.core.external.ExternalCallExecutor;
import com.waypoint.core.metrics.WaypointMetrics;
import com.waypoint.core.model.EventLinkStatus;
import com.waypoint.core.model.Goal;
import com.waypoint.core.model.ScheduledEventLink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Withdraws a goal's calendar items when it leaves the active schedule.
 * <p>
 * Two halves: {@link #markPendingCancelled} flips the links on the goal and runs
 * under the graph write lock; {@link #cancel} asks the calendar to drop the items
 * and runs after the lock is released. Calendar failures are logged and counted,
 * never thrown.
 */
@Component
public class ScheduledEventCanceller {

    private static final Logger log = LoggerFactory.getLogger(ScheduledEventCanceller.class);

    private final CalendarGateway calendar;
    private final ExternalCallExecutor external;
    private final WaypointMetrics metrics;

    public ScheduledEventCanceller(CalendarGateway calendar, ExternalCallExecutor external, WaypointMetrics metrics) {
        this.calendar = calendar;
        this.external = external;
        this.metrics = metrics;
    }

    /**
     * Marks every proposed link of the goal cancelled.
     *
     * @return the links whose calendar items still have to be cancelled
     */
    public List<ScheduledEventLink> markPendingCancelled(Goal goal) {
        var toCancel = new ArrayList<ScheduledEventLink>();
        for (ScheduledEventLink link : goal.getScheduledEvents()) {
            if (link.isPending()) {
                goal.replaceScheduledEvent(link.withStatus(EventLinkStatus.CANCELLED));
                toCancel.add(link);
            }
        }
        return toCancel;
    }

    /** Marks the given links cancelled on the goal, whatever their current status. */
    public void markCancelled(Goal goal, List<ScheduledEventLink> links) {
        for (ScheduledEventLink link : links) {
            goal.replaceScheduledEvent(link.withStatus(EventLinkStatus.CANCELLED));
        }
    }

    public void cancel(UUID goalId, List<ScheduledEventLink> links) {
        links.forEach(link -> cancel(goalId, link));
    }

    public void cancel(UUID goalId, ScheduledEventLink link) {
        try {
            external.call("calendar", "cancel event", () -> {
                calendar.cancelEvent(link.externalEventId());
                return null;
            });
        } catch (ExternalServiceException e) {
            log.warn("Could not cancel calendar item {} of goal {}: {}", link.externalEventId(), goalId, e.getMessage());
            metrics.recordCalendarCancelFailure();
        }
    }
}
