package com.waypoint.dispatch.api;

import com.waypoint.core.events.EventBus;
import com.waypoint.core.events.GoalEvent;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Bridges {@link EventBus} subscriptions to {@link SseEmitter}s.
 * <p>
 * An emitter follows one goal, or every goal when created without an id.
 * Idle connections get a heartbeat comment every {@value #HEARTBEAT_INTERVAL_SECONDS}
 * seconds so proxies do not drop them.
 */
@Service
public class SseStreamingService {

    private static final Logger log = LoggerFactory.getLogger(SseStreamingService.class);

    /** Default emitter timeout: 30 minutes. */
    private static final long DEFAULT_TIMEOUT_MS = 30 * 60 * 1000L;

    private static final long HEARTBEAT_INTERVAL_SECONDS = 30;

    private final EventBus eventBus;
    private final long timeoutMs;

    private final CopyOnWriteArrayList<EmitterRegistration> activeRegistrations = new CopyOnWriteArrayList<>();

    private final ScheduledExecutorService heartbeatScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "sse-heartbeat");
        t.setDaemon(true);
        return t;
    });

    @Autowired
    public SseStreamingService(EventBus eventBus) {
        this(eventBus, DEFAULT_TIMEOUT_MS);
    }

    SseStreamingService(EventBus eventBus, long timeoutMs) {
        this.eventBus = eventBus;
        this.timeoutMs = timeoutMs;
    }

    @PostConstruct
    void startHeartbeat() {
        heartbeatScheduler.scheduleAtFixedRate(this::sendHeartbeats,
                HEARTBEAT_INTERVAL_SECONDS, HEARTBEAT_INTERVAL_SECONDS, TimeUnit.SECONDS);
        log.info("SSE heartbeat scheduler started (interval={}s)", HEARTBEAT_INTERVAL_SECONDS);
    }

    @PreDestroy
    void stopHeartbeat() {
        heartbeatScheduler.shutdown();
        try {
            if (!heartbeatScheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                heartbeatScheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            heartbeatScheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("SSE heartbeat scheduler stopped");
    }

    void sendHeartbeats() {
        for (EmitterRegistration registration : activeRegistrations) {
            try {
                registration.emitter.send(SseEmitter.event().comment("heartbeat"));
            } catch (IOException | IllegalStateException e) {
                // the emitter's own callbacks clean up closed connections
                log.debug("Heartbeat skipped for {}: {}", registration.label(), e.getMessage());
            }
        }
    }

    /**
     * @param goalId the goal to follow, or {@code null} for every goal
     */
    public SseEmitter createEmitter(UUID goalId) {
        SseEmitter emitter = new SseEmitter(timeoutMs);

        EventBus.Subscription subscription = goalId != null
                ? eventBus.subscribe(goalId, event -> sendEvent(emitter, event))
                : eventBus.subscribeAll(event -> sendEvent(emitter, event));

        var registration = new EmitterRegistration(goalId, emitter, subscription);
        activeRegistrations.add(registration);

        emitter.onCompletion(() -> cleanup(registration));
        emitter.onTimeout(() -> cleanup(registration));
        emitter.onError(ex -> {
            log.debug("SSE emitter error for {}: {}", registration.label(), ex.getMessage());
            cleanup(registration);
        });

        try {
            emitter.send(SseEmitter.event().comment("connected"));
        } catch (IOException e) {
            log.warn("Failed to confirm SSE connection for {}: {}", registration.label(), e.getMessage());
        }

        log.info("SSE emitter created for {} (timeout={}ms)", registration.label(), timeoutMs);
        return emitter;
    }

    public int activeEmitterCount() {
        return activeRegistrations.size();
    }

    private void sendEvent(SseEmitter emitter, GoalEvent event) {
        try {
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("goalId", event.goalId().toString());
            data.putAll(event.payload());
            data.put("timestamp", event.timestamp().toString());
            emitter.send(SseEmitter.event().name(event.eventType()).data(data));
        } catch (IOException | IllegalStateException e) {
            log.debug("Failed to send SSE event {} for goal {}: {}",
                    event.eventType(), event.goalId(), e.getMessage());
        }
    }

    private void cleanup(EmitterRegistration registration) {
        registration.subscription.unsubscribe();
        activeRegistrations.remove(registration);
        log.debug("Cleaned up SSE registration for {}", registration.label());
    }

    private record EmitterRegistration(UUID goalId, SseEmitter emitter, EventBus.Subscription subscription) {
        String label() {
            return goalId != null ? "goal " + goalId : "all goals";
        }
    }
}
