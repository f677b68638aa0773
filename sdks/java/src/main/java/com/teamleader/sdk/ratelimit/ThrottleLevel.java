package com.teamleader.sdk.ratelimit;

/**
 * How hard the client is currently pacing itself.
 */
public enum ThrottleLevel {
    NONE("none"),
    LOW("low"),
    MODERATE("moderate"),
    HIGH("high"),
    CRITICAL("critical");

    private final String value;

    ThrottleLevel(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
