package com.waypoint.core.reasoning;

/**
 * Model output for a regeneration request; {@code priority} is "now", "next" or "later".
 */
public record RegenerationResponse(String title, String content, String category, String priority) {}
