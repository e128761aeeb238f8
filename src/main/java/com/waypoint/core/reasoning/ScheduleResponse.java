package com.waypoint.core.reasoning;

import java.util.List;

/**
 * Model output for an activation plan request.
 */
public record ScheduleResponse(List<Session> events, List<String> schedulingTips) {

    /**
     * @param durationMinutes   session length
     * @param suggestedTimeSlot "morning", "afternoon" or "evening"
     * @param dayOffset         days from today
     */
    public record Session(
        String title,
        Integer durationMinutes,
        String suggestedTimeSlot,
        Integer dayOffset,
        String description,
        List<String> preparation
    ) {}
}
