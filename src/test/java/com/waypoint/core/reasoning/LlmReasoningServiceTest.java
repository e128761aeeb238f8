package com.waypoint.core.reasoning;

import com.waypoint.core.config.WaypointProperties;
import com.waypoint.core.graph.GoalGraph;
import com.waypoint.core.llm.LlmService;
import com.waypoint.core.model.Goal;
import com.waypoint.core.model.GoalKind;
import com.waypoint.core.model.Priority;
import com.waypoint.core.progress.ProgressAggregator;
import com.waypoint.core.query.GoalViewFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class LlmReasoningServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T09:00:00Z");

    private LlmService llmService;
    private WaypointProperties properties;
    private LlmReasoningService reasoning;
    private GoalContextBuilder contexts;
    private Goal parent;
    private Goal child;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        GoalGraph graph = new GoalGraph(clock);
        var views = new GoalViewFactory(graph, new ProgressAggregator(graph));
        contexts = new GoalContextBuilder(graph, views);

        parent = graph.insert(new Goal("Get fit", "Be healthier by summer", "Health", Priority.NOW, GoalKind.HYBRID, NOW), null);
        child = graph.insert(new Goal("Run 10k", "", "Health", Priority.NOW, GoalKind.EVENT, NOW), parent.getId());

        llmService = mock(LlmService.class);
        properties = new WaypointProperties();
        reasoning = new LlmReasoningService(llmService, clock, properties);
    }

    @Test
    @DisplayName("describe renders the goal, its parent and its subgoals")
    void describe() {
        String parentText = LlmReasoningService.describe(contexts.build(parent.getId()));
        assertTrue(parentText.contains("Goal: Get fit"));
        assertTrue(parentText.contains("Description: Be healthier by summer"));
        assertTrue(parentText.contains("- Run 10k (0%)"));

        String childText = LlmReasoningService.describe(contexts.build(child.getId()));
        assertTrue(childText.contains("Part of: Get fit"));
        assertFalse(childText.contains("Description:"));
    }

    @Test
    @DisplayName("breakdown maps nested subtasks onto decomposition nodes")
    void breakdown() {
        var leaf = new BreakdownResponse.Subtask("shoes", "Buy shoes", "Fit properly", 1.0, null, "easy", true, null);
        var top = new BreakdownResponse.Subtask("gear", "Get gear", "", 2.0, List.of(), "medium", null, List.of(leaf));
        when(llmService.structuredCall(anyString(), anyString(), eq(BreakdownResponse.class)))
                .thenReturn(new BreakdownResponse(List.of(top), List.of("gear"), 3.0));

        var tree = reasoning.requestBreakdown(contexts.build(parent.getId()));

        assertEquals(2, tree.nodeCount());
        assertEquals("gear", tree.nodes().get(0).id());
        assertFalse(tree.nodes().get(0).atomic());
        assertTrue(tree.nodes().get(0).children().get(0).atomic());
        assertEquals(3.0, tree.totalEstimatedHours());
    }

    @Test
    @DisplayName("activation plan places sessions on their slot and offset")
    void activationPlan() {
        when(llmService.structuredCall(anyString(), anyString(), eq(ScheduleResponse.class)))
                .thenReturn(new ScheduleResponse(List.of(
                        new ScheduleResponse.Session("Long run", 90, "evening", 2, "Slow", List.of("Water")),
                        new ScheduleResponse.Session("Intervals", null, "morning", null, null, null)),
                        List.of("Rest on Sundays")));

        var plan = reasoning.requestActivationPlan(contexts.build(parent.getId()), List.of());

        assertEquals(2, plan.sessions().size());
        var first = plan.sessions().get(0);
        assertEquals(Instant.parse("2026-03-03T18:00:00Z"), first.start());
        assertEquals(Duration.ofMinutes(90), first.duration());
        var second = plan.sessions().get(1);
        assertEquals(Instant.parse("2026-03-03T09:00:00Z"), second.start());
        assertEquals(LlmReasoningService.DEFAULT_SESSION, second.duration());
        assertEquals(List.of("Rest on Sundays"), plan.tips());
    }

    @Test
    @DisplayName("an empty schedule yields a starter session when the fallback is on")
    void starterSession() {
        when(llmService.structuredCall(anyString(), anyString(), eq(ScheduleResponse.class)))
                .thenReturn(new ScheduleResponse(List.of(), null));

        var plan = reasoning.requestActivationPlan(contexts.build(parent.getId()), List.of());

        assertEquals(1, plan.sessions().size());
        assertEquals("Work on: Get fit", plan.sessions().get(0).title());
        assertEquals(Instant.parse("2026-03-01T10:00:00Z"), plan.sessions().get(0).start());
    }

    @Test
    @DisplayName("an empty schedule stays empty when the fallback is off")
    void noStarterSession() {
        properties.getReasoning().setActivationFallback(false);
        when(llmService.structuredCall(anyString(), anyString(), eq(ScheduleResponse.class)))
                .thenReturn(new ScheduleResponse(null, null));

        assertTrue(reasoning.requestActivationPlan(contexts.build(parent.getId()), List.of()).isEmpty());
    }

    @Test
    @DisplayName("the activation prompt lists other goals but not the goal itself")
    void activationPromptListsOthers() {
        when(llmService.structuredCall(anyString(), anyString(), eq(ScheduleResponse.class)))
                .thenReturn(new ScheduleResponse(List.of(), null));
        var context = contexts.build(child.getId());

        reasoning.requestActivationPlan(context, List.of(context.goal(), context.parent()));

        ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
        verify(llmService).structuredCall(anyString(), prompt.capture(), eq(ScheduleResponse.class));
        assertTrue(prompt.getValue().contains("- Get fit [DRAFT, NOW]"));
        assertFalse(prompt.getValue().contains("- Run 10k ["));
    }

    @Test
    @DisplayName("regeneration parses the proposed priority leniently")
    void regeneration() {
        when(llmService.structuredCall(anyString(), anyString(), eq(RegenerationResponse.class)))
                .thenReturn(new RegenerationResponse("Get strong", "Lift three times a week", "Fitness", " later "));

        var proposal = reasoning.requestRegeneration(contexts.build(parent.getId()));

        assertEquals("Get strong", proposal.title());
        assertEquals(Priority.LATER, proposal.priority());
    }

    @Test
    @DisplayName("next step treats a missing final flag as not final")
    void nextStep() {
        when(llmService.structuredCall(anyString(), anyString(), eq(NextStepResponse.class)))
                .thenReturn(new NextStepResponse("Tempo run", "Hold pace", 3, null, "Speed"));
        var context = contexts.build(parent.getId());

        var proposal = reasoning.requestNextStep(context, context.subgoals().get(0));

        assertEquals("Tempo run", proposal.title());
        assertFalse(proposal.finalStep());
        assertEquals(3, proposal.daysFromNow());
    }

    @Test
    @DisplayName("lock summary returns the model's summary text")
    void lockSummary() {
        when(llmService.structuredCall(anyString(), anyString(), eq(LockSummaryResponse.class)))
                .thenReturn(new LockSummaryResponse("Solid plan"));

        assertEquals("Solid plan", reasoning.summarizeForLock(contexts.build(parent.getId())));
    }
}
