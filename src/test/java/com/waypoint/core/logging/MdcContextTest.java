package com.waypoint.core.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class MdcContextTest {

    @AfterEach
    void tearDown() {
        MDC.clear();
    }

    @Test
    @DisplayName("operation sets goal id and operation, close removes them")
    void setsAndClears() {
        UUID goalId = UUID.randomUUID();
        try (var scope = MdcContext.operation("lock", goalId)) {
            assertEquals("lock", MDC.get(MdcContext.OPERATION));
            assertEquals(goalId.toString(), MDC.get(MdcContext.GOAL_ID));
        }
        assertNull(MDC.get(MdcContext.OPERATION));
        assertNull(MDC.get(MdcContext.GOAL_ID));
    }

    @Test
    @DisplayName("nested operations restore the outer values")
    void nested() {
        UUID outer = UUID.randomUUID();
        UUID inner = UUID.randomUUID();
        try (var a = MdcContext.operation("delete", outer)) {
            try (var b = MdcContext.operation("timeline-insights", inner)) {
                assertEquals(inner.toString(), MDC.get(MdcContext.GOAL_ID));
            }
            assertEquals("delete", MDC.get(MdcContext.OPERATION));
            assertEquals(outer.toString(), MDC.get(MdcContext.GOAL_ID));
        }
    }

    @Test
    @DisplayName("a null goal id leaves the goal key untouched")
    void nullGoal() {
        try (var scope = MdcContext.operation("remove-dependency", null)) {
            assertNull(MDC.get(MdcContext.GOAL_ID));
            assertEquals("remove-dependency", MDC.get(MdcContext.OPERATION));
        }
    }

    @Test
    @DisplayName("clear removes both keys")
    void clear() {
        MdcContext.operation("lock", UUID.randomUUID());
        MdcContext.clear();
        assertNull(MDC.get(MdcContext.GOAL_ID));
        assertNull(MDC.get(MdcContext.OPERATION));
    }
}
