package com.teamleader.sdk.ratelimit;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;

/**
 * Point-in-time snapshot of the rate limiter counters.
 */
public class RateLimitStatistics {

    @JsonProperty("total_requests")
    private final int totalRequests;

    @JsonProperty("lifetime_requests")
    private final long lifetimeRequests;

    @JsonProperty("rate_limit")
    private final int rateLimit;

    @JsonProperty("remaining")
    private final int remaining;

    @JsonProperty("usage_percentage")
    private final double usagePercentage;

    @JsonProperty("throttle_level")
    private final ThrottleLevel throttleLevel;

    @JsonProperty("seconds_until_reset")
    private final long secondsUntilReset;

    @JsonProperty("throttled_requests")
    private final long throttledRequests;

    @JsonProperty("total_delay_ms")
    private final long totalDelayMillis;

    @JsonProperty("server_remaining")
    private final Integer serverRemaining;

    @JsonProperty("server_limit")
    private final Integer serverLimit;

    @JsonProperty("reset_time")
    private final Instant resetTime;

    @JsonProperty("last_headers")
    private final Map<String, String> lastHeaders;

    RateLimitStatistics(int totalRequests, long lifetimeRequests, int rateLimit, int remaining,
                        double usagePercentage, ThrottleLevel throttleLevel, long secondsUntilReset,
                        long throttledRequests, long totalDelayMillis, Integer serverRemaining,
                        Integer serverLimit, Instant resetTime, Map<String, String> lastHeaders) {
        this.totalRequests = totalRequests;
        this.lifetimeRequests = lifetimeRequests;
        this.rateLimit = rateLimit;
        this.remaining = remaining;
        this.usagePercentage = usagePercentage;
        this.throttleLevel = throttleLevel;
        this.secondsUntilReset = secondsUntilReset;
        this.throttledRequests = throttledRequests;
        this.totalDelayMillis = totalDelayMillis;
        this.serverRemaining = serverRemaining;
        this.serverLimit = serverLimit;
        this.resetTime = resetTime;
        this.lastHeaders = Map.copyOf(lastHeaders);
    }

    /**
     * Requests recorded in the current sliding window.
     */
    public int getTotalRequests() {
        return totalRequests;
    }

    /**
     * Requests recorded since construction or the last {@link RateLimiter#reset()}.
     */
    public long getLifetimeRequests() {
        return lifetimeRequests;
    }

    public int getRateLimit() {
        return rateLimit;
    }

    /**
     * Configured limit minus the local window count. Server headers do not affect this value.
     */
    public int getRemaining() {
        return remaining;
    }

    public double getUsagePercentage() {
        return usagePercentage;
    }

    public ThrottleLevel getThrottleLevel() {
        return throttleLevel;
    }

    public long getSecondsUntilReset() {
        return secondsUntilReset;
    }

    public long getThrottledRequests() {
        return throttledRequests;
    }

    public long getTotalDelayMillis() {
        return totalDelayMillis;
    }

    public Integer getServerRemaining() {
        return serverRemaining;
    }

    public Integer getServerLimit() {
        return serverLimit;
    }

    public Instant getResetTime() {
        return resetTime;
    }

    public Map<String, String> getLastHeaders() {
        return lastHeaders;
    }

    @Override
    public String toString() {
        return "RateLimitStatistics{" +
                "totalRequests=" + totalRequests +
                ", rateLimit=" + rateLimit +
                ", remaining=" + remaining +
                ", usagePercentage=" + usagePercentage +
                ", throttleLevel=" + throttleLevel +
                ", serverRemaining=" + serverRemaining +
                '}';
    }
}
