package com.waypoint.core.calendar;

import java.time.Duration;
import java.time.Instant;

public record CalendarItem(String id, String title, Instant start, Duration duration, String notes) {}
