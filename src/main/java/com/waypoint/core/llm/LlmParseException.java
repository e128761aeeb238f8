package com.waypoint.core.llm;

/**
 * The model answered, but not with JSON matching the requested type.
 */
public class LlmParseException extends RuntimeException {

    public LlmParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
