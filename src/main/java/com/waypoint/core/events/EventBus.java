package com.waypoint.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub bus for goal events.
 * <p>
 * Subscribers may follow one goal or every goal. A subscriber that throws is
 * logged and skipped; it never breaks the publishing operation.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final ConcurrentHashMap<UUID, CopyOnWriteArrayList<Consumer<GoalEvent>>> goalSubscribers =
            new ConcurrentHashMap<>();

    private final CopyOnWriteArrayList<Consumer<GoalEvent>> globalSubscribers =
            new CopyOnWriteArrayList<>();

    public void publish(GoalEvent event) {
        log.debug("Publishing event: {} for goal {}", event.eventType(), event.goalId());

        List<Consumer<GoalEvent>> subs = goalSubscribers.get(event.goalId());
        if (subs != null) {
            for (Consumer<GoalEvent> subscriber : subs) {
                deliverSafely(subscriber, event);
            }
        }
        for (Consumer<GoalEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }
    }

    /**
     * Subscribe to events of one goal.
     *
     * @return a handle to cancel the subscription
     */
    public Subscription subscribe(UUID goalId, Consumer<GoalEvent> consumer) {
        goalSubscribers.computeIfAbsent(goalId, k -> new CopyOnWriteArrayList<>()).add(consumer);
        log.debug("Subscribed to goal {}", goalId);
        return () -> {
            CopyOnWriteArrayList<Consumer<GoalEvent>> subs = goalSubscribers.get(goalId);
            if (subs != null) {
                subs.remove(consumer);
            }
        };
    }

    public Subscription subscribeAll(Consumer<GoalEvent> consumer) {
        globalSubscribers.add(consumer);
        log.debug("Subscribed to all goal events");
        return () -> globalSubscribers.remove(consumer);
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<GoalEvent> subscriber, GoalEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.eventType(), e.getMessage(), e);
        }
    }
}
