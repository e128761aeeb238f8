package com.waypoint.core.model;

public enum EventLinkStatus {
    PROPOSED,
    CONFIRMED,
    CANCELLED
}
