package com.waypoint.core.reasoning;

/**
 * The next roadmap step suggested after a step completes.
 *
 * @param title       step title
 * @param guidance    free-text advice copied onto the step body
 * @param daysFromNow suggested days until the step's target date
 * @param finalStep   whether this step completes the roadmap
 * @param outcome     expected outcome of the step
 */
public record NextStepProposal(
    String title,
    String guidance,
    Integer daysFromNow,
    boolean finalStep,
    String outcome
) {}
