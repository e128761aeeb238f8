package com.waypoint.core.error;

/**
 * Wraps a failure of the reasoning or calendar collaborator.
 * {@code recoverable} is true when retrying later may succeed (timeouts, cancellation).
 */
public class ExternalServiceException extends GoalGraphException {

    private final String service;
    private final boolean recoverable;

    public ExternalServiceException(String service, String message, boolean recoverable, Throwable cause) {
        super(service + ": " + message, cause);
        this.service = service;
        this.recoverable = recoverable;
    }

    public String service() {
        return service;
    }

    public boolean recoverable() {
        return recoverable;
    }
}
