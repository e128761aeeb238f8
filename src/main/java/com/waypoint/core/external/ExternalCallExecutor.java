package com.waypoint.core.external;

import com.waypoint.core.config.WaypointProperties;
import com.waypoint.core.error.ExternalServiceException;
import com.waypoint.core.error.GoalGraphException;
import com.waypoint.core.metrics.WaypointMetrics;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Runs calls to the reasoning and calendar collaborators with a timeout.
 * <p>
 * Every call ends in exactly one outcome for the caller: the value, or an
 * {@link ExternalServiceException}. Timeouts and cancellation are reported as
 * recoverable; anything the collaborator throws is not. Retries are left to
 * the collaborator.
 */
@Component
public class ExternalCallExecutor {

    private static final Logger log = LoggerFactory.getLogger(ExternalCallExecutor.class);

    private final Duration timeout;
    private final WaypointMetrics metrics;
    private final AtomicInteger threadCounter = new AtomicInteger();
    private final ExecutorService executor = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "external-call-" + threadCounter.incrementAndGet());
        t.setDaemon(true);
        return t;
    });

    public ExternalCallExecutor(WaypointProperties properties, WaypointMetrics metrics) {
        this(properties.getExternal().getTimeout(), metrics);
    }

    public ExternalCallExecutor(Duration timeout, WaypointMetrics metrics) {
        this.timeout = timeout;
        this.metrics = metrics;
    }

    /**
     * @param service   collaborator name used in errors and metrics ("reasoning", "calendar")
     * @param operation what is being asked, for logs
     */
    public <T> T call(String service, String operation, Supplier<T> call) {
        Map<String, String> mdc = MDC.getCopyOfContextMap();
        long start = System.currentTimeMillis();
        CompletableFuture<T> future = CompletableFuture
                .supplyAsync(() -> withMdc(mdc, call), executor)
                .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS);
        try {
            T result = future.get();
            metrics.recordExternalCall(service, "success", System.currentTimeMillis() - start);
            return result;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            metrics.recordExternalCall(service, "cancelled", System.currentTimeMillis() - start);
            throw new ExternalServiceException(service, operation + " was interrupted", true, e);
        } catch (CancellationException e) {
            metrics.recordExternalCall(service, "cancelled", System.currentTimeMillis() - start);
            throw new ExternalServiceException(service, operation + " was cancelled", true, e);
        } catch (ExecutionException e) {
            throw translate(service, operation, unwrap(e), start);
        }
    }

    private ExternalServiceException translate(String service, String operation, Throwable cause, long start) {
        long elapsed = System.currentTimeMillis() - start;
        if (cause instanceof TimeoutException) {
            metrics.recordExternalCall(service, "timeout", elapsed);
            log.warn("{} call '{}' timed out after {} ms", service, operation, timeout.toMillis());
            return new ExternalServiceException(service, operation + " timed out after " + timeout, true, cause);
        }
        metrics.recordExternalCall(service, "failure", elapsed);
        if (cause instanceof ExternalServiceException ese) {
            return ese;
        }
        if (cause instanceof GoalGraphException gge) {
            return new ExternalServiceException(service, operation + " failed: " + gge.getMessage(), false, gge);
        }
        log.warn("{} call '{}' failed: {}", service, operation, cause.getMessage());
        return new ExternalServiceException(service, operation + " failed: " + cause.getMessage(), false, cause);
    }

    private static Throwable unwrap(Throwable t) {
        Throwable current = t;
        while ((current instanceof ExecutionException || current instanceof CompletionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static <T> T withMdc(Map<String, String> mdc, Supplier<T> call) {
        if (mdc != null) {
            MDC.setContextMap(mdc);
        }
        try {
            return call.get();
        } finally {
            MDC.clear();
        }
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }
}
