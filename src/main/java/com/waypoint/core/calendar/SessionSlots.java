package com.waypoint.core.calendar;

import com.waypoint.core.model.Priority;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Locale;

/**
 * Places a proposed session on the clock.
 * <p>
 * A named slot maps to a fixed hour (morning 9:00, afternoon 14:00, evening 18:00,
 * anything else 10:00) on the given day. Without a slot the goal's priority decides:
 * NOW starts at the next full hour, NEXT tomorrow at 9:00, LATER in a week at 14:00.
 */
public final class SessionSlots {

    private SessionSlots() {}

    public static int hourFor(String slot) {
        if (slot == null) return 10;
        return switch (slot.trim().toLowerCase(Locale.ROOT)) {
            case "morning" -> 9;
            case "afternoon" -> 14;
            case "evening" -> 18;
            default -> 10;
        };
    }

    /**
     * @param dayOffset days after {@code now}'s date, used only when a slot is named
     */
    public static Instant place(String slot, int dayOffset, Priority priority, Instant now, ZoneId zone) {
        ZonedDateTime local = now.atZone(zone);
        LocalDate today = local.toLocalDate();
        if (slot != null && !slot.isBlank()) {
            return today.plusDays(Math.max(dayOffset, 0)).atTime(hourFor(slot), 0).atZone(zone).toInstant();
        }
        return switch (priority) {
            case NOW -> local.truncatedTo(ChronoUnit.HOURS).plusHours(1).toInstant();
            case NEXT -> today.plusDays(1).atTime(9, 0).atZone(zone).toInstant();
            case LATER -> today.plusDays(7).atTime(14, 0).atZone(zone).toInstant();
        };
    }
}
