package com.waypoint.core.reasoning;

import com.waypoint.core.model.Priority;

/**
 * Alternative framing for a goal. Category and priority are optional.
 */
public record RegenerationProposal(String title, String body, String category, Priority priority) {}
