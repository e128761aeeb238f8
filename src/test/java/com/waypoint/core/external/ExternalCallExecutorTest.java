package com.waypoint.core.external;

import com.waypoint.core.error.ExternalServiceException;
import com.waypoint.core.error.GoalNotFoundException;
import com.waypoint.core.logging.MdcContext;
import com.waypoint.core.metrics.WaypointMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class ExternalCallExecutorTest {

    private SimpleMeterRegistry registry;
    private ExternalCallExecutor executor;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        executor = new ExternalCallExecutor(Duration.ofMillis(200), new WaypointMetrics(registry));
    }

    @AfterEach
    void tearDown() {
        executor.shutdown();
        MDC.clear();
    }

    private long count(String service, String outcome) {
        var timer = registry.find("waypoint.external.duration").tag("service", service).tag("outcome", outcome).timer();
        return timer == null ? 0 : timer.count();
    }

    @Test
    @DisplayName("returns the value and records success")
    void success() {
        assertEquals("ok", executor.call("reasoning", "ping", () -> "ok"));
        assertEquals(1, count("reasoning", "success"));
    }

    @Test
    @DisplayName("a slow call times out as a recoverable failure")
    void timeout() {
        var ex = assertThrows(ExternalServiceException.class, () -> executor.call("calendar", "create event", () -> {
            try {
                Thread.sleep(2_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return "late";
        }));

        assertTrue(ex.recoverable());
        assertEquals("calendar", ex.service());
        assertEquals(1, count("calendar", "timeout"));
    }

    @Test
    @DisplayName("an exception from the collaborator is a non-recoverable failure")
    void failure() {
        var ex = assertThrows(ExternalServiceException.class, () -> executor.call("reasoning", "breakdown", () -> {
            throw new IllegalStateException("model unavailable");
        }));

        assertFalse(ex.recoverable());
        assertInstanceOf(IllegalStateException.class, ex.getCause());
        assertEquals(1, count("reasoning", "failure"));
    }

    @Test
    @DisplayName("an ExternalServiceException from the collaborator passes through unchanged")
    void passThrough() {
        var original = new ExternalServiceException("calendar", "quota", true, null);
        var ex = assertThrows(ExternalServiceException.class,
                () -> executor.call("calendar", "create event", () -> { throw original; }));
        assertSame(original, ex);
    }

    @Test
    @DisplayName("a domain error inside the call is wrapped with its message")
    void domainError() {
        UUID id = UUID.randomUUID();
        var ex = assertThrows(ExternalServiceException.class,
                () -> executor.call("reasoning", "lookup", () -> { throw new GoalNotFoundException(id); }));
        assertTrue(ex.getMessage().contains(id.toString()));
    }

    @Test
    @DisplayName("the caller's MDC is visible inside the call")
    void mdcPropagation() {
        UUID goalId = UUID.randomUUID();
        try (var scope = MdcContext.operation("lock", goalId)) {
            String seen = executor.call("reasoning", "mdc", () -> MDC.get(MdcContext.GOAL_ID));
            assertEquals(goalId.toString(), seen);
        }
    }
}
