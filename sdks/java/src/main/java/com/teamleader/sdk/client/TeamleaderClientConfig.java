package com.teamleader.sdk.client;

import com.teamleader.sdk.ratelimit.RateLimiterConfig;

import java.time.Duration;
import java.util.Objects;

/**
 * Configuration for the Teamleader client.
 */
public class TeamleaderClientConfig {

    public static final String TOKEN_PATH = "/oauth2/access_token";

    private final String baseUrl;
    private final String authUrl;
    private final String clientId;
    private final String clientSecret;
    private final String redirectUri;
    private final String apiVersion;
    private final Duration connectTimeout;
    private final Duration readTimeout;
    private final Duration timeout;
    private final int maxAttempts;
    private final Duration retryMinDelay;
    private final Duration retryMaxDelay;
    private final Duration retryJitter;
    private final boolean throwExceptions;
    private final Duration refreshBuffer;
    private final Duration refreshLockTimeout;
    private final String accountKey;
    private final Duration tokenTtl;
    private final int callLogCapacity;
    private final RateLimiterConfig rateLimiter;

    private TeamleaderClientConfig(Builder builder) {
        this.baseUrl = builder.baseUrl;
        this.authUrl = builder.authUrl;
        this.clientId = builder.clientId;
        this.clientSecret = builder.clientSecret;
        this.redirectUri = builder.redirectUri;
        this.apiVersion = builder.apiVersion;
        this.connectTimeout = builder.connectTimeout;
        this.readTimeout = builder.readTimeout;
        this.timeout = builder.timeout;
        this.maxAttempts = builder.maxAttempts;
        this.retryMinDelay = builder.retryMinDelay;
        this.retryMaxDelay = builder.retryMaxDelay;
        this.retryJitter = builder.retryJitter;
        this.throwExceptions = builder.throwExceptions;
        this.refreshBuffer = builder.refreshBuffer;
        this.refreshLockTimeout = builder.refreshLockTimeout;
        this.accountKey = builder.accountKey;
        this.tokenTtl = builder.tokenTtl;
        this.callLogCapacity = builder.callLogCapacity;
        this.rateLimiter = builder.rateLimiter;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public String getAuthUrl() {
        return authUrl;
    }

    /**
     * OAuth2 token endpoint used for code and refresh-token exchanges.
     */
    public String getTokenUrl() {
        return authUrl + TOKEN_PATH;
    }

    public String getClientId() {
        return clientId;
    }

    public String getClientSecret() {
        return clientSecret;
    }

    public String getRedirectUri() {
        return redirectUri;
    }

    public String getApiVersion() {
        return apiVersion;
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    public Duration getReadTimeout() {
        return readTimeout;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public Duration getRetryMinDelay() {
        return retryMinDelay;
    }

    public Duration getRetryMaxDelay() {
        return retryMaxDelay;
    }

    public Duration getRetryJitter() {
        return retryJitter;
    }

    public boolean isThrowExceptions() {
        return throwExceptions;
    }

    public Duration getRefreshBuffer() {
        return refreshBuffer;
    }

    public Duration getRefreshLockTimeout() {
        return refreshLockTimeout;
    }

    public String getAccountKey() {
        return accountKey;
    }

    public Duration getTokenTtl() {
        return tokenTtl;
    }

    public int getCallLogCapacity() {
        return callLogCapacity;
    }

    public RateLimiterConfig getRateLimiter() {
        return rateLimiter;
    }

    /**
     * Builder for creating TeamleaderClientConfig instances.
     */
    public static class Builder {
        private String baseUrl = "https://api.focus.teamleader.eu";
        private String authUrl = "https://focus.teamleader.eu";
        private String clientId;
        private String clientSecret;
        private String redirectUri;
        private String apiVersion = "2023-09-26";
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration readTimeout = Duration.ofSeconds(25);
        private Duration timeout = Duration.ofSeconds(30);
        private int maxAttempts = 3;
        private Duration retryMinDelay = Duration.ofSeconds(1);
        private Duration retryMaxDelay = Duration.ofSeconds(30);
        private Duration retryJitter = Duration.ofMillis(100);
        private boolean throwExceptions = false;
        private Duration refreshBuffer = Duration.ofMinutes(5);
        private Duration refreshLockTimeout = Duration.ofSeconds(60);
        private String accountKey = "default";
        private Duration tokenTtl = Duration.ofDays(30);
        private int callLogCapacity = 1000;
        private RateLimiterConfig rateLimiter = RateLimiterConfig.defaultConfig();

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = stripTrailingSlash(Objects.requireNonNull(baseUrl, "baseUrl must not be null"));
            return this;
        }

        public Builder authUrl(String authUrl) {
            this.authUrl = stripTrailingSlash(Objects.requireNonNull(authUrl, "authUrl must not be null"));
            return this;
        }

        public Builder clientId(String clientId) {
            this.clientId = clientId;
            return this;
        }

        public Builder clientSecret(String clientSecret) {
            this.clientSecret = clientSecret;
            return this;
        }

        public Builder redirectUri(String redirectUri) {
            this.redirectUri = redirectUri;
            return this;
        }

        public Builder apiVersion(String apiVersion) {
            this.apiVersion = apiVersion;
            return this;
        }

        public Builder connectTimeout(Duration connectTimeout) {
            this.connectTimeout = Objects.requireNonNull(connectTimeout, "connectTimeout must not be null");
            return this;
        }

        public Builder readTimeout(Duration readTimeout) {
            this.readTimeout = Objects.requireNonNull(readTimeout, "readTimeout must not be null");
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
            return this;
        }

        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder retryMinDelay(Duration retryMinDelay) {
            this.retryMinDelay = Objects.requireNonNull(retryMinDelay, "retryMinDelay must not be null");
            return this;
        }

        public Builder retryMaxDelay(Duration retryMaxDelay) {
            this.retryMaxDelay = Objects.requireNonNull(retryMaxDelay, "retryMaxDelay must not be null");
            return this;
        }

        public Builder retryJitter(Duration retryJitter) {
            this.retryJitter = Objects.requireNonNull(retryJitter, "retryJitter must not be null");
            return this;
        }

        public Builder throwExceptions(boolean throwExceptions) {
            this.throwExceptions = throwExceptions;
            return this;
        }

        public Builder refreshBuffer(Duration refreshBuffer) {
            this.refreshBuffer = Objects.requireNonNull(refreshBuffer, "refreshBuffer must not be null");
            return this;
        }

        public Builder refreshLockTimeout(Duration refreshLockTimeout) {
            this.refreshLockTimeout = Objects.requireNonNull(refreshLockTimeout, "refreshLockTimeout must not be null");
            return this;
        }

        public Builder accountKey(String accountKey) {
            this.accountKey = Objects.requireNonNull(accountKey, "accountKey must not be null");
            return this;
        }

        public Builder tokenTtl(Duration tokenTtl) {
            this.tokenTtl = Objects.requireNonNull(tokenTtl, "tokenTtl must not be null");
            return this;
        }

        public Builder callLogCapacity(int callLogCapacity) {
            this.callLogCapacity = callLogCapacity;
            return this;
        }

        public Builder rateLimiter(RateLimiterConfig rateLimiter) {
            this.rateLimiter = Objects.requireNonNull(rateLimiter, "rateLimiter must not be null");
            return this;
        }

        public TeamleaderClientConfig build() {
            return new TeamleaderClientConfig(this);
        }

        private static String stripTrailingSlash(String url) {
            return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
        }
    }
}
