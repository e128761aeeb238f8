package com.waypoint.core.reasoning;

public record NextStepResponse(
    String title,
    String guidance,
    Integer daysFromNow,
    Boolean isFinalStep,
    String outcome
) {}
