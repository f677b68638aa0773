package com.teamleader.sdk.models;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Diagnostic view of the stored tokens. Never contains the token values themselves.
 */
public class TokenInfo {

    @JsonProperty("has_access_token")
    private final boolean hasAccessToken;

    @JsonProperty("has_refresh_token")
    private final boolean hasRefreshToken;

    @JsonProperty("expires_at")
    private final Instant expiresAt;

    @JsonProperty("expires_in")
    private final long expiresInSeconds;

    @JsonProperty("needs_refresh")
    private final boolean needsRefresh;

    public TokenInfo(boolean hasAccessToken, boolean hasRefreshToken, Instant expiresAt,
                     long expiresInSeconds, boolean needsRefresh) {
        this.hasAccessToken = hasAccessToken;
        this.hasRefreshToken = hasRefreshToken;
        this.expiresAt = expiresAt;
        this.expiresInSeconds = expiresInSeconds;
        this.needsRefresh = needsRefresh;
    }

    public static TokenInfo empty() {
        return new TokenInfo(false, false, null, 0, true);
    }

    public boolean hasAccessToken() {
        return hasAccessToken;
    }

    public boolean hasRefreshToken() {
        return hasRefreshToken;
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }

    public long getExpiresInSeconds() {
        return expiresInSeconds;
    }

    public boolean needsRefresh() {
        return needsRefresh;
    }

    @Override
    public String toString() {
        return "TokenInfo{" +
                "hasAccessToken=" + hasAccessToken +
                ", hasRefreshToken=" + hasRefreshToken +
                ", expiresAt=" + expiresAt +
                ", expiresInSeconds=" + expiresInSeconds +
                ", needsRefresh=" + needsRefresh +
                '}';
    }
}
