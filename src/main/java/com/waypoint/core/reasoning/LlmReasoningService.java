package com.waypoint.core.reasoning;

import com.waypoint.core.breakdown.DecompositionNode;
import com.waypoint.core.breakdown.DecompositionTree;
import com.waypoint.core.calendar.SessionSlots;
import com.waypoint.core.config.WaypointProperties;
import com.waypoint.core.llm.LlmService;
import com.waypoint.core.model.Priority;
import com.waypoint.core.query.GoalView;
import com.waypoint.core.timeline.Horizon;
import com.waypoint.core.timeline.TimelineEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * {@link ReasoningService} backed by the chat model through {@link LlmService}.
 * <p>
 * Each request renders the goal context into a prompt and maps the structured
 * answer onto domain types.
 */
@Service
public class LlmReasoningService implements ReasoningService {

    private static final Logger log = LoggerFactory.getLogger(LlmReasoningService.class);

    static final Duration DEFAULT_SESSION = Duration.ofHours(1);

    private static final String BREAKDOWN_PROMPT = """
            You are a planning assistant that breaks a personal or professional goal into subtasks.
            Return:
            - subtasks: 2 to 7 top-level subtasks. Each has a short kebab-case id, a title, a description,
              estimatedHours, difficulty ("easy", "medium" or "hard"), dependencies (ids of subtasks that must
              finish first), atomic (true when it should not be split further) and optional children with
              the same shape.
            - recommendedOrder: the ids of the top-level subtasks in the order they should be tackled.
            - totalEstimatedHours: the sum of all estimates.
            Never let a subtask depend on itself or on one of its own descendants.

            Respond with valid JSON matching the schema provided.
            """;

    private static final String REGENERATION_PROMPT = """
            You rewrite goals. Given a goal, its subgoals and its progress, propose a refined framing:
            a clearer title, a concise motivating description, a category and a priority ("now", "next" or "later").
            Keep the intent of the original goal.

            Respond with valid JSON matching the schema provided.
            """;

    private static final String SCHEDULE_PROMPT = """
            You schedule focus sessions for a goal that is about to become active.
            Propose 1 to 5 sessions. For each give a title, durationMinutes, suggestedTimeSlot
            ("morning", "afternoon" or "evening"), dayOffset (days from today, 0 for today),
            a short description and optional preparation items.
            Avoid piling sessions onto days already busy with the user's other active goals.
            Add a few schedulingTips.

            Respond with valid JSON matching the schema provided.
            """;

    private static final String NEXT_STEP_PROMPT = """
            You guide a user along a sequential roadmap, one step at a time.
            Given the goal, the steps done so far and the step that was just completed, propose the next step:
            a short title that does not repeat an earlier step, guidance on how to approach it, daysFromNow
            for its target date, the expected outcome, and isFinalStep=true only when finishing it completes the goal.

            Respond with valid JSON matching the schema provided.
            """;

    private static final String LOCK_PROMPT = """
            The user is locking this goal to freeze its current wording.
            Summarise in one or two sentences where the goal stands and why it is worth keeping as is.

            Respond with valid JSON matching the schema provided.
            """;

    private static final String TIMELINE_PROMPT = """
            You annotate a goal timeline. For each entry, identified by entryId, give an outcomeSummary,
            up to four highlights, a recommendedAction, a completionLikelihood between 0 and 1 and
            readyToMarkGoalComplete. Finish with a one-line portfolioHeadline.

            Respond with valid JSON matching the schema provided.
            """;

    private final LlmService llmService;
    private final Clock clock;
    private final WaypointProperties properties;

    public LlmReasoningService(LlmService llmService, Clock clock, WaypointProperties properties) {
        this.llmService = llmService;
        this.clock = clock;
        this.properties = properties;
    }

    @Override
    public DecompositionTree requestBreakdown(GoalContext context) {
        var response = llmService.structuredCall(BREAKDOWN_PROMPT, describe(context), BreakdownResponse.class);
        List<DecompositionNode> nodes = response.subtasks() == null ? List.of()
                : response.subtasks().stream().map(LlmReasoningService::toNode).toList();
        return new DecompositionTree(nodes, response.recommendedOrder(), response.totalEstimatedHours());
    }

    private static DecompositionNode toNode(BreakdownResponse.Subtask subtask) {
        List<DecompositionNode> children = subtask.children() == null ? List.of()
                : subtask.children().stream().map(LlmReasoningService::toNode).toList();
        return new DecompositionNode(subtask.id(), subtask.title(), subtask.description(),
                subtask.estimatedHours(), subtask.dependencies(), subtask.difficulty(), children,
                Boolean.TRUE.equals(subtask.atomic()));
    }

    @Override
    public RegenerationProposal requestRegeneration(GoalContext context) {
        var response = llmService.structuredCall(REGENERATION_PROMPT, describe(context), RegenerationResponse.class);
        return new RegenerationProposal(response.title(), response.content(), response.category(),
                Priority.parse(response.priority(), null));
    }

    @Override
    public ActivationPlan requestActivationPlan(GoalContext context, List<GoalView> allGoals) {
        var prompt = new StringBuilder(describe(context)).append("\n\nOther goals:\n");
        for (GoalView other : allGoals) {
            if (other.id().equals(context.goal().id())) continue;
            prompt.append("- ").append(other.title()).append(" [").append(other.activationState())
                    .append(", ").append(other.priority()).append("]\n");
        }
        var response = llmService.structuredCall(SCHEDULE_PROMPT, prompt.toString(), ScheduleResponse.class);

        GoalView goal = context.goal();
        Instant now = clock.instant();
        var sessions = new ArrayList<ProposedSession>();
        List<ScheduleResponse.Session> proposed = response.events() == null ? List.of() : response.events();
        for (int i = 0; i < proposed.size(); i++) {
            var s = proposed.get(i);
            int offset = s.dayOffset() != null ? s.dayOffset() : i + 1;
            Duration duration = s.durationMinutes() != null && s.durationMinutes() > 0
                    ? Duration.ofMinutes(s.durationMinutes())
                    : DEFAULT_SESSION;
            sessions.add(new ProposedSession(s.title(),
                    SessionSlots.place(s.suggestedTimeSlot(), offset, goal.priority(), now, clock.getZone()),
                    duration, s.description(), s.suggestedTimeSlot(), s.preparation()));
        }

        if (sessions.isEmpty() && properties.getReasoning().isActivationFallback()) {
            log.warn("Model proposed no sessions for goal {}; using a starter session", goal.id());
            return starterPlan(goal, now);
        }
        return new ActivationPlan(sessions, response.schedulingTips());
    }

    ActivationPlan starterPlan(GoalView goal, Instant now) {
        var session = new ProposedSession("Work on: " + goal.title(),
                SessionSlots.place(null, 0, goal.priority(), now, clock.getZone()),
                DEFAULT_SESSION, "Auto-generated focus block", null, List.of());
        return new ActivationPlan(List.of(session),
                List.of("We scheduled a starter focus session. Adjust timing as needed."));
    }

    @Override
    public NextStepProposal requestNextStep(GoalContext context, GoalView completedStep) {
        String prompt = describe(context) + "\n\nJust completed: " + completedStep.title()
                + (completedStep.stepOutcome() != null ? " (outcome: " + completedStep.stepOutcome() + ")" : "");
        var response = llmService.structuredCall(NEXT_STEP_PROMPT, prompt, NextStepResponse.class);
        return new NextStepProposal(response.title(), response.guidance(), response.daysFromNow(),
                Boolean.TRUE.equals(response.isFinalStep()), response.outcome());
    }

    @Override
    public String summarizeForLock(GoalContext context) {
        return llmService.structuredCall(LOCK_PROMPT, describe(context), LockSummaryResponse.class).summary();
    }

    @Override
    public TimelineInsights requestTimelineInsights(GoalContext context, List<TimelineEntry> entries, Horizon horizon) {
        var prompt = new StringBuilder(describe(context))
                .append("\n\nHorizon: ").append(horizon.start()).append(" to ").append(horizon.end())
                .append("\nEntries:\n");
        for (TimelineEntry e : entries) {
            prompt.append("- entryId=").append(e.id())
                    .append(" kind=").append(e.kind().name().toLowerCase(Locale.ROOT))
                    .append(" title=\"").append(e.title()).append('"')
                    .append(" start=").append(e.start())
                    .append(" end=").append(e.end());
            if (e.metricSummary() != null) {
                prompt.append(" metric=\"").append(e.metricSummary()).append('"');
            }
            prompt.append('\n');
        }
        return llmService.structuredCall(TIMELINE_PROMPT, prompt.toString(), TimelineInsights.class);
    }

    static String describe(GoalContext context) {
        GoalView goal = context.goal();
        var sb = new StringBuilder();
        sb.append("Goal: ").append(goal.title()).append('\n');
        if (!goal.body().isBlank()) {
            sb.append("Description: ").append(goal.body()).append('\n');
        }
        sb.append("Category: ").append(goal.category())
                .append(" | Priority: ").append(goal.priority())
                .append(" | Kind: ").append(goal.kind())
                .append(" | State: ").append(goal.activationState())
                .append(String.format(Locale.ROOT, " | Progress: %.0f%%", goal.progress() * 100)).append('\n');
        if (goal.targetMetric() != null) {
            var m = goal.targetMetric();
            sb.append("Target metric: ").append(m.label()).append(' ')
                    .append(m.baselineValue()).append(" -> ").append(m.targetValue())
                    .append(m.unit() != null ? " " + m.unit() : "").append('\n');
        }
        if (context.parent() != null) {
            sb.append("Part of: ").append(context.parent().title()).append('\n');
        }
        if (!context.subgoals().isEmpty()) {
            sb.append("Subgoals:\n");
            context.subgoals().forEach(s -> sb.append(String.format(Locale.ROOT, "- %s (%.0f%%)%n",
                    s.title(), s.progress() * 100)));
        }
        if (!context.steps().isEmpty()) {
            sb.append("Roadmap steps:\n");
            context.steps().forEach(s -> sb.append("- ").append(s.title())
                    .append(" [").append(s.stepStatus()).append("]\n"));
        }
        return sb.toString();
    }
}
