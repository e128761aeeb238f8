package com.waypoint.core.lifecycle;

import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Goals with an external call in flight. Surfaces use it to show a busy marker;
 * it does not block concurrent operations.
 */
@Component
public class InFlightOperations {

    private final ConcurrentHashMap<UUID, AtomicInteger> running = new ConcurrentHashMap<>();

    public Handle begin(UUID goalId) {
        running.computeIfAbsent(goalId, k -> new AtomicInteger()).incrementAndGet();
        return () -> running.computeIfPresent(goalId, (k, count) -> count.decrementAndGet() <= 0 ? null : count);
    }

    public boolean isProcessing(UUID goalId) {
        return running.containsKey(goalId);
    }

    public Set<UUID> processing() {
        return Set.copyOf(running.keySet());
    }

    @FunctionalInterface
    public interface Handle extends AutoCloseable {
        @Override
        void close();
    }
}
