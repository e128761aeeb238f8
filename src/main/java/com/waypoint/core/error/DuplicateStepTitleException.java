package com.waypoint.core.error;

/**
 * Raised when a proposed roadmap step repeats an existing step title.
 * Non-fatal: the roadmap engine logs it and skips creating the step.
 */
public class DuplicateStepTitleException extends GoalGraphException {

    private final String title;

    public DuplicateStepTitleException(String title) {
        super("A step titled '" + title + "' already exists on this roadmap");
        this.title = title;
    }

    public String title() {
        return title;
    }
}
