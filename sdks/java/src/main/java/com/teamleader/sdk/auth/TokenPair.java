package com.teamleader.sdk.auth;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * An access/refresh token pair with its issuance and expiry instants.
 *
 * <p>Immutable: a refresh produces a new pair, it never updates one in place.</p>
 */
public final class TokenPair {

    private final String accessToken;
    private final String refreshToken;
    private final String tokenType;
    private final Instant issuedAt;
    private final Instant expiresAt;

    public TokenPair(String accessToken, String refreshToken, String tokenType,
                     Instant issuedAt, Instant expiresAt) {
        this.accessToken = Objects.requireNonNull(accessToken, "accessToken must not be null");
        this.refreshToken = refreshToken;
        this.tokenType = tokenType != null ? tokenType : "Bearer";
        this.issuedAt = Objects.requireNonNull(issuedAt, "issuedAt must not be null");
        this.expiresAt = Objects.requireNonNull(expiresAt, "expiresAt must not be null");
        if (!expiresAt.isAfter(issuedAt)) {
            throw new IllegalArgumentException("expiresAt must be after issuedAt");
        }
    }

    public String getAccessToken() {
        return accessToken;
    }

    /**
     * Refresh token, or null if the authorization server never issued one.
     */
    public String getRefreshToken() {
        return refreshToken;
    }

    public String getTokenType() {
        return tokenType;
    }

    public Instant getIssuedAt() {
        return issuedAt;
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }

    /**
     * True once {@code now} is within {@code buffer} of expiry.
     */
    public boolean needsRefresh(Instant now, Duration buffer) {
        return !now.isBefore(expiresAt.minus(buffer));
    }

    public long secondsUntilExpiry(Instant now) {
        return Math.max(0, Duration.between(now, expiresAt).getSeconds());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TokenPair that = (TokenPair) o;
        return accessToken.equals(that.accessToken)
                && Objects.equals(refreshToken, that.refreshToken)
                && issuedAt.equals(that.issuedAt)
                && expiresAt.equals(that.expiresAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(accessToken, refreshToken, issuedAt, expiresAt);
    }

    @Override
    public String toString() {
        return "TokenPair{" +
                "tokenType='" + tokenType + '\'' +
                ", hasRefreshToken=" + (refreshToken != null) +
                ", issuedAt=" + issuedAt +
                ", expiresAt=" + expiresAt +
                '}';
    }
}
