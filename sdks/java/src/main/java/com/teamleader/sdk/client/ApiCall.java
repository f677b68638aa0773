package com.teamleader.sdk.client;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * One HTTP attempt as recorded in the {@link CallLog}.
 */
public final class ApiCall {

    @JsonProperty("method")
    private final String method;

    @JsonProperty("path")
    private final String path;

    /** 0 when no response was received. */
    @JsonProperty("status_code")
    private final int statusCode;

    @JsonProperty("duration_ms")
    private final long durationMillis;

    @JsonProperty("timestamp")
    private final Instant timestamp;

    @JsonProperty("attempt")
    private final int attempt;

    @JsonProperty("delay_before_ms")
    private final long delayBeforeMillis;

    public ApiCall(String method, String path, int statusCode, long durationMillis,
                   Instant timestamp, int attempt, long delayBeforeMillis) {
        this.method = method;
        this.path = path;
        this.statusCode = statusCode;
        this.durationMillis = durationMillis;
        this.timestamp = timestamp;
        this.attempt = attempt;
        this.delayBeforeMillis = delayBeforeMillis;
    }

    public String getMethod() {
        return method;
    }

    public String getPath() {
        return path;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public long getDurationMillis() {
        return durationMillis;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public int getAttempt() {
        return attempt;
    }

    /**
     * Backoff slept before this attempt; 0 for first attempts.
     */
    public long getDelayBeforeMillis() {
        return delayBeforeMillis;
    }

    @Override
    public String toString() {
        return "ApiCall{" +
                method + " " + path +
                ", status=" + statusCode +
                ", durationMs=" + durationMillis +
                ", attempt=" + attempt +
                ", delayBeforeMs=" + delayBeforeMillis +
                '}';
    }
}
