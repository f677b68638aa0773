package com.teamleader.sdk.errors;

/**
 * Closed classification of a failed API call.
 */
public enum ErrorKind {
    VALIDATION("validation", false),
    UNAUTHORIZED("unauthorized", false),
    NOT_FOUND("not_found", false),
    RATE_LIMIT_EXCEEDED("rate_limit_exceeded", true),
    SERVER_ERROR("server_error", true),
    TRANSPORT("transport", true),
    CONFIGURATION("configuration", false);

    private final String value;
    private final boolean retryable;

    ErrorKind(String value, boolean retryable) {
        this.value = value;
        this.retryable = retryable;
    }

    public String getValue() {
        return value;
    }

    /**
     * Returns true if a call that failed with this kind may succeed when repeated.
     */
    public boolean isRetryable() {
        return retryable;
    }
}
