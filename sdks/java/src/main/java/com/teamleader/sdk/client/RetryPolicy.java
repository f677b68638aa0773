package com.teamleader.sdk.client;

import com.teamleader.sdk.errors.ApiFailure;
import com.teamleader.sdk.errors.ErrorKind;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.LongUnaryOperator;

/**
 * Exponential backoff between attempts: {@code min(minDelay * 2^(attempt-1), maxDelay)} plus a
 * random jitter. A rate-limit failure waits at least as long as the server's {@code Retry-After}.
 */
public class RetryPolicy {

    private final int maxAttempts;
    private final long minDelayMillis;
    private final long maxDelayMillis;
    private final long jitterMillis;
    private final LongUnaryOperator jitterSource;

    public RetryPolicy(int maxAttempts, Duration minDelay, Duration maxDelay, Duration jitter) {
        this(maxAttempts, minDelay, maxDelay, jitter,
                bound -> bound <= 0 ? 0 : ThreadLocalRandom.current().nextLong(bound + 1));
    }

    RetryPolicy(int maxAttempts, Duration minDelay, Duration maxDelay, Duration jitter,
                LongUnaryOperator jitterSource) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        this.maxAttempts = maxAttempts;
        this.minDelayMillis = minDelay.toMillis();
        this.maxDelayMillis = maxDelay.toMillis();
        this.jitterMillis = jitter.toMillis();
        this.jitterSource = jitterSource;
    }

    public static RetryPolicy from(TeamleaderClientConfig config) {
        return new RetryPolicy(config.getMaxAttempts(), config.getRetryMinDelay(),
                config.getRetryMaxDelay(), config.getRetryJitter());
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    /**
     * Whether another attempt should follow the given failed one.
     *
     * @param attempt 1-based number of the attempt that just failed
     */
    public boolean shouldRetry(ApiFailure failure, int attempt) {
        return failure.isRetryable() && attempt < maxAttempts;
    }

    /**
     * Delay before the attempt following {@code attempt}.
     */
    public long backoffMillis(int attempt, ApiFailure failure) {
        int exponent = Math.min(Math.max(attempt - 1, 0), 30);
        long delay = Math.min(minDelayMillis * (1L << exponent), maxDelayMillis);
        delay += jitterSource.applyAsLong(jitterMillis);

        if (failure != null && failure.getKind() == ErrorKind.RATE_LIMIT_EXCEEDED
                && failure.getRetryAfterSeconds() != null) {
            long retryAfterMillis = failure.getRetryAfterSeconds() >= Long.MAX_VALUE / 1000L
                    ? Long.MAX_VALUE
                    : failure.getRetryAfterSeconds() * 1000L;
            delay = Math.max(delay, retryAfterMillis);
        }
        return delay;
    }
}
