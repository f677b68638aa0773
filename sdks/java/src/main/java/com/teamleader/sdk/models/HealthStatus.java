package com.teamleader.sdk.models;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.teamleader.sdk.ratelimit.RateLimitStatistics;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Snapshot of the client's health: configuration, authentication, token, rate limit and API
 * connectivity.
 */
public class HealthStatus {

    public static final String HEALTHY = "healthy";
    public static final String DEGRADED = "degraded";
    public static final String UNHEALTHY = "unhealthy";

    @JsonProperty("status")
    private final String status;

    @JsonProperty("timestamp")
    private final Instant timestamp;

    @JsonProperty("api_version")
    private final String apiVersion;

    @JsonProperty("configuration_errors")
    private final List<String> configurationErrors;

    @JsonProperty("configuration_warnings")
    private final List<String> configurationWarnings;

    @JsonProperty("authenticated")
    private final boolean authenticated;

    @JsonProperty("token")
    private final TokenInfo token;

    @JsonProperty("rate_limit")
    private final RateLimitStatistics rateLimit;

    @JsonProperty("components")
    private final Map<String, String> components;

    public HealthStatus(String status, Instant timestamp, String apiVersion,
                        List<String> configurationErrors, List<String> configurationWarnings,
                        boolean authenticated, TokenInfo token, RateLimitStatistics rateLimit,
                        Map<String, String> components) {
        this.status = status;
        this.timestamp = timestamp;
        this.apiVersion = apiVersion;
        this.configurationErrors = List.copyOf(configurationErrors);
        this.configurationWarnings = List.copyOf(configurationWarnings);
        this.authenticated = authenticated;
        this.token = token;
        this.rateLimit = rateLimit;
        this.components = Map.copyOf(components);
    }

    public String getStatus() {
        return status;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public String getApiVersion() {
        return apiVersion;
    }

    public List<String> getConfigurationErrors() {
        return configurationErrors;
    }

    public List<String> getConfigurationWarnings() {
        return configurationWarnings;
    }

    public boolean isAuthenticated() {
        return authenticated;
    }

    public TokenInfo getToken() {
        return token;
    }

    public RateLimitStatistics getRateLimit() {
        return rateLimit;
    }

    /**
     * Per-component status, e.g. {@code configuration -> ok}, {@code api -> unreachable}.
     */
    public Map<String, String> getComponents() {
        return components;
    }

    /**
     * Returns true if the status is "healthy".
     */
    public boolean isHealthy() {
        return HEALTHY.equals(status);
    }

    @Override
    public String toString() {
        return "HealthStatus{" +
                "status='" + status + '\'' +
                ", authenticated=" + authenticated +
                ", components=" + components +
                '}';
    }
}
