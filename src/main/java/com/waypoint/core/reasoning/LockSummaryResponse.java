package com.waypoint.core.reasoning;

public record LockSummaryResponse(String summary) {}
