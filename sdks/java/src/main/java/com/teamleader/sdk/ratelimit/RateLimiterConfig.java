package com.teamleader.sdk.ratelimit;

import java.time.Duration;
import java.util.Objects;

/**
 * Quota and pacing settings for the {@link RateLimiter}.
 *
 * <p>Usage below {@code throttleThreshold} is never delayed. Between the throttle and the
 * aggressive threshold the delay grows linearly from {@code throttleMinDelay} to
 * {@code throttleMaxDelay}; above the aggressive threshold it keeps growing up to
 * {@code aggressiveMaxDelay} as the window fills.</p>
 */
public class RateLimiterConfig {

    private final int limit;
    private final Duration window;
    private final double throttleThreshold;
    private final double aggressiveThreshold;
    private final Duration throttleMinDelay;
    private final Duration throttleMaxDelay;
    private final Duration aggressiveMaxDelay;
    private final double jitterRatio;

    private RateLimiterConfig(Builder builder) {
        this.limit = builder.limit;
        this.window = builder.window;
        this.throttleThreshold = builder.throttleThreshold;
        this.aggressiveThreshold = builder.aggressiveThreshold;
        this.throttleMinDelay = builder.throttleMinDelay;
        this.throttleMaxDelay = builder.throttleMaxDelay;
        this.aggressiveMaxDelay = builder.aggressiveMaxDelay;
        this.jitterRatio = builder.jitterRatio;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static RateLimiterConfig defaultConfig() {
        return builder().build();
    }

    public int getLimit() {
        return limit;
    }

    public Duration getWindow() {
        return window;
    }

    public double getThrottleThreshold() {
        return throttleThreshold;
    }

    public double getAggressiveThreshold() {
        return aggressiveThreshold;
    }

    public Duration getThrottleMinDelay() {
        return throttleMinDelay;
    }

    public Duration getThrottleMaxDelay() {
        return throttleMaxDelay;
    }

    public Duration getAggressiveMaxDelay() {
        return aggressiveMaxDelay;
    }

    public double getJitterRatio() {
        return jitterRatio;
    }

    /**
     * Builder for creating RateLimiterConfig instances.
     */
    public static class Builder {
        private int limit = 200;
        private Duration window = Duration.ofSeconds(60);
        private double throttleThreshold = 0.7;
        private double aggressiveThreshold = 0.9;
        private Duration throttleMinDelay = Duration.ofMillis(200);
        private Duration throttleMaxDelay = Duration.ofMillis(1000);
        private Duration aggressiveMaxDelay = Duration.ofMillis(2000);
        private double jitterRatio = 0.1;

        public Builder limit(int limit) {
            if (limit <= 0) {
                throw new IllegalArgumentException("limit must be positive");
            }
            this.limit = limit;
            return this;
        }

        public Builder window(Duration window) {
            Objects.requireNonNull(window, "window must not be null");
            if (window.isNegative() || window.isZero()) {
                throw new IllegalArgumentException("window must be positive");
            }
            this.window = window;
            return this;
        }

        public Builder throttleThreshold(double throttleThreshold) {
            this.throttleThreshold = throttleThreshold;
            return this;
        }

        public Builder aggressiveThreshold(double aggressiveThreshold) {
            this.aggressiveThreshold = aggressiveThreshold;
            return this;
        }

        public Builder throttleMinDelay(Duration throttleMinDelay) {
            this.throttleMinDelay = Objects.requireNonNull(throttleMinDelay, "throttleMinDelay must not be null");
            return this;
        }

        public Builder throttleMaxDelay(Duration throttleMaxDelay) {
            this.throttleMaxDelay = Objects.requireNonNull(throttleMaxDelay, "throttleMaxDelay must not be null");
            return this;
        }

        public Builder aggressiveMaxDelay(Duration aggressiveMaxDelay) {
            this.aggressiveMaxDelay = Objects.requireNonNull(aggressiveMaxDelay, "aggressiveMaxDelay must not be null");
            return this;
        }

        public Builder jitterRatio(double jitterRatio) {
            if (jitterRatio < 0) {
                throw new IllegalArgumentException("jitterRatio must not be negative");
            }
            this.jitterRatio = jitterRatio;
            return this;
        }

        public RateLimiterConfig build() {
            if (!(throttleThreshold > 0 && throttleThreshold < aggressiveThreshold && aggressiveThreshold < 1.0)) {
                throw new IllegalArgumentException(
                        "thresholds must satisfy 0 < throttleThreshold < aggressiveThreshold < 1");
            }
            return new RateLimiterConfig(this);
        }
    }
}
