package com.waypoint.core.logging;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * MDC keys for goal operations. {@link #operation} returns a scope that restores
 * the previous values on close, so nested operations log their own name and
 * the outer one is back afterwards.
 */
public final class MdcContext {

    public static final String GOAL_ID = "goalId";
    public static final String OPERATION = "operation";

    private MdcContext() {}

    public static Scope operation(String operation, UUID goalId) {
        String previousGoal = MDC.get(GOAL_ID);
        String previousOperation = MDC.get(OPERATION);
        MDC.put(OPERATION, operation);
        if (goalId != null) {
            MDC.put(GOAL_ID, goalId.toString());
        }
        return () -> {
            restore(GOAL_ID, previousGoal);
            restore(OPERATION, previousOperation);
        };
    }

    public static void clear() {
        MDC.remove(GOAL_ID);
        MDC.remove(OPERATION);
    }

    private static void restore(String key, String value) {
        if (value == null) {
            MDC.remove(key);
        } else {
            MDC.put(key, value);
        }
    }

    /** Try-with-resources handle; closing never throws. */
    @FunctionalInterface
    public interface Scope extends AutoCloseable {
        @Override
        void close();
    }
}
