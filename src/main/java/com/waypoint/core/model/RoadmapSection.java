package com.waypoint.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Named grouping of roadmap steps by their zero-based index.
 */
public record RoadmapSection(
    String title,
    List<Integer> stepIndices
) implements Serializable {

    public RoadmapSection {
        stepIndices = stepIndices == null ? List.of() : List.copyOf(stepIndices);
    }
}
