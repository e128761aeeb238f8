package com.waypoint.core.persistence;

import com.waypoint.core.error.GoalGraphException;

public class PersistenceException extends GoalGraphException {

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
