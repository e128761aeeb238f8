package com.waypoint.dispatch.api;

import com.waypoint.core.error.CycleException;
import com.waypoint.core.error.ExternalServiceException;
import com.waypoint.core.error.GoalGraphException;
import com.waypoint.core.error.GoalLockedException;
import com.waypoint.core.error.GoalNotFoundException;
import com.waypoint.core.error.GoalStateException;
import com.waypoint.core.error.InvalidDecompositionException;
import com.waypoint.core.error.PartialActivationException;
import com.waypoint.core.error.SelfDependencyException;
import com.waypoint.core.error.StepLimitExceededException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps goal engine errors to JSON responses:
 * 404 unknown goal, 409 conflicts with current state, 422 invalid graph changes,
 * 502 reasoning or calendar failures.
 */
@RestControllerAdvice(annotations = RestController.class)
public class ApiExceptionAdvice {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionAdvice.class);

    @ExceptionHandler(GoalNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(GoalNotFoundException ex, HttpServletRequest request) {
        return respond(HttpStatus.NOT_FOUND, "not_found", ex, request);
    }

    @ExceptionHandler({GoalLockedException.class, GoalStateException.class, StepLimitExceededException.class})
    public ResponseEntity<Map<String, Object>> handleConflict(GoalGraphException ex, HttpServletRequest request) {
        String code = ex instanceof GoalLockedException ? "locked"
                : ex instanceof StepLimitExceededException ? "step_limit_exceeded"
                : "invalid_state";
        return respond(HttpStatus.CONFLICT, code, ex, request);
    }

    @ExceptionHandler({CycleException.class, SelfDependencyException.class, InvalidDecompositionException.class})
    public ResponseEntity<Map<String, Object>> handleInvalidGraph(GoalGraphException ex, HttpServletRequest request) {
        String code = ex instanceof CycleException ? "cycle"
                : ex instanceof SelfDependencyException ? "self_dependency"
                : "invalid_decomposition";
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, code, ex, request);
    }

    @ExceptionHandler(ExternalServiceException.class)
    public ResponseEntity<Map<String, Object>> handleExternal(ExternalServiceException ex, HttpServletRequest request) {
        log.warn("External {} failure on {}: {}", ex.service(), request.getRequestURI(), ex.getMessage());
        var response = respond(HttpStatus.BAD_GATEWAY, "external_service_failure", ex, request);
        response.getBody().put("service", ex.service());
        response.getBody().put("recoverable", ex.recoverable());
        return response;
    }

    @ExceptionHandler(PartialActivationException.class)
    public ResponseEntity<Map<String, Object>> handlePartialActivation(PartialActivationException ex,
                                                                       HttpServletRequest request) {
        var response = respond(HttpStatus.BAD_GATEWAY, "partial_activation", ex, request);
        response.getBody().put("created_links", ex.createdLinks());
        return response;
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleBadRequest(IllegalArgumentException ex, HttpServletRequest request) {
        return respond(HttpStatus.BAD_REQUEST, "bad_request", ex, request);
    }

    private static ResponseEntity<Map<String, Object>> respond(HttpStatus status, String code, Exception ex,
                                                               HttpServletRequest request) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("timestamp", Instant.now().toString());
        body.put("status", status.value());
        body.put("error", code);
        body.put("message", ex.getMessage());
        body.put("path", request.getRequestURI());
        return ResponseEntity.status(status).body(body);
    }
}
