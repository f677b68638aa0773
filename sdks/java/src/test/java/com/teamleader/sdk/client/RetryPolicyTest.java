package com.teamleader.sdk.client;

import com.teamleader.sdk.errors.ApiFailure;
import com.teamleader.sdk.errors.ErrorKind;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class RetryPolicyTest {

    private final RetryPolicy policy = new RetryPolicy(3, Duration.ofSeconds(1), Duration.ofSeconds(30),
            Duration.ofMillis(100), bound -> 0);

    @Test
    void testExponentialBackoffWithCap() {
        ApiFailure failure = ApiFailure.of(ErrorKind.SERVER_ERROR, "boom");

        assertEquals(1000, policy.backoffMillis(1, failure));
        assertEquals(2000, policy.backoffMillis(2, failure));
        assertEquals(4000, policy.backoffMillis(3, failure));
        assertEquals(30_000, policy.backoffMillis(10, failure));
        assertEquals(30_000, policy.backoffMillis(100, failure));
    }

    @Test
    void testJitterIsAdded() {
        RetryPolicy jittered = new RetryPolicy(3, Duration.ofSeconds(1), Duration.ofSeconds(30),
                Duration.ofMillis(100), bound -> bound);

        assertEquals(1100, jittered.backoffMillis(1, ApiFailure.of(ErrorKind.TRANSPORT, "reset")));
    }

    @Test
    void testRetryAfterWinsWhenLonger() {
        ApiFailure rateLimited = ApiFailure.builder(ErrorKind.RATE_LIMIT_EXCEEDED).retryAfterSeconds(7L).build();
        ApiFailure shortRetryAfter = ApiFailure.builder(ErrorKind.RATE_LIMIT_EXCEEDED).retryAfterSeconds(0L).build();
        ApiFailure noRetryAfter = ApiFailure.of(ErrorKind.RATE_LIMIT_EXCEEDED, "slow down");

        assertEquals(7000, policy.backoffMillis(1, rateLimited));
        assertEquals(2000, policy.backoffMillis(2, shortRetryAfter));
        assertEquals(1000, policy.backoffMillis(1, noRetryAfter));
    }

    @Test
    void testShouldRetry() {
        ApiFailure server = ApiFailure.of(ErrorKind.SERVER_ERROR, "boom");
        ApiFailure validation = ApiFailure.of(ErrorKind.VALIDATION, "bad");

        assertTrue(policy.shouldRetry(server, 1));
        assertTrue(policy.shouldRetry(server, 2));
        assertFalse(policy.shouldRetry(server, 3));
        assertFalse(policy.shouldRetry(validation, 1));
    }

    @Test
    void testRejectsZeroAttempts() {
        assertThrows(IllegalArgumentException.class,
                () -> new RetryPolicy(0, Duration.ZERO, Duration.ZERO, Duration.ZERO));
    }

    @Test
    void testHugeRetryAfterDoesNotWrap() {
        ApiFailure rateLimited = ApiFailure.builder(ErrorKind.RATE_LIMIT_EXCEEDED)
                .retryAfterSeconds(Long.MAX_VALUE)
                .build();

        assertEquals(Long.MAX_VALUE, policy.backoffMillis(1, rateLimited));
    }
}
