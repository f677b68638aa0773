package com.teamleader.sdk.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.teamleader.sdk.errors.ApiFailure;
import com.teamleader.sdk.errors.ErrorClassifier;
import com.teamleader.sdk.errors.ErrorKind;
import com.teamleader.sdk.exceptions.AuthenticationException;
import com.teamleader.sdk.exceptions.TeamleaderException;
import com.teamleader.sdk.exceptions.TransportException;
import com.teamleader.sdk.exceptions.ValidationException;
import com.teamleader.sdk.http.HttpTransport;
import com.teamleader.sdk.http.TransportRequest;
import com.teamleader.sdk.http.TransportResponse;
import com.teamleader.sdk.models.RequestOutcome;
import com.teamleader.sdk.ratelimit.RateLimiter;
import com.teamleader.sdk.ratelimit.ThrottleDecision;
import com.teamleader.sdk.support.LogSanitizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Sends one logical API request: acquires a token, paces against the rate limiter, performs
 * the HTTP call, classifies the result and retries retryable failures with backoff.
 *
 * <p>Every attempt is recorded in the {@link CallLog}. A failure is logged once, when it
 * becomes final.</p>
 */
public class RequestDispatcher {

    private static final Logger logger = LoggerFactory.getLogger(RequestDispatcher.class);

    private static final String JSON = "application/json";

    /**
     * One attempt of a retried operation.
     */
    @FunctionalInterface
    interface Attempt<T> {
        /**
         * @param attempt           1-based attempt number
         * @param delayBeforeMillis backoff slept before this attempt
         */
        T run(int attempt, long delayBeforeMillis);
    }

    private final TeamleaderClientConfig config;
    private final HttpTransport transport;
    private final RateLimiter rateLimiter;
    private final ErrorClassifier errorClassifier;
    private final RetryPolicy retryPolicy;
    private final CallLog callLog;
    private final ObjectMapper objectMapper;
    private final Sleeper sleeper;
    private final Clock clock;
    private final Supplier<String> tokenSupplier;

    private volatile String apiVersion;

    public RequestDispatcher(TeamleaderClientConfig config, HttpTransport transport, RateLimiter rateLimiter,
                             ErrorClassifier errorClassifier, RetryPolicy retryPolicy, CallLog callLog,
                             ObjectMapper objectMapper, Sleeper sleeper, Clock clock,
                             Supplier<String> tokenSupplier) {
        this.config = config;
        this.transport = transport;
        this.rateLimiter = rateLimiter;
        this.errorClassifier = errorClassifier;
        this.retryPolicy = retryPolicy;
        this.callLog = callLog;
        this.objectMapper = objectMapper;
        this.sleeper = sleeper;
        this.clock = clock;
        this.tokenSupplier = tokenSupplier;
        this.apiVersion = config.getApiVersion();
    }

    /**
     * Dispatches a request and returns its outcome. In throw mode a failure is raised as the
     * matching {@link TeamleaderException} instead.
     *
     * @param method HTTP method
     * @param path   endpoint path relative to the base URL, e.g. {@code contacts.list}
     * @param body   request body, serialized as JSON; a String is sent as is
     */
    public RequestOutcome dispatch(String method, String path, Object body) {
        String description = method + " " + path;
        try {
            String payload = serialize(description, body);
            return withRetry(description, (attempt, delayBefore) ->
                    sendOnce(method, path, payload, attempt, delayBefore));
        } catch (TeamleaderException e) {
            if (config.isThrowExceptions()) {
                throw e;
            }
            return RequestOutcome.failure(e.getFailure());
        }
    }

    /**
     * Runs {@code attempt} until it succeeds, fails with a non-retryable error or runs out of
     * attempts. The final failure is logged and rethrown.
     */
    <T> T withRetry(String description, Attempt<T> attempt) {
        long delayBefore = 0;
        for (int n = 1; ; n++) {
            try {
                return attempt.run(n, delayBefore);
            } catch (TeamleaderException e) {
                ApiFailure failure = e.getFailure();
                if (Thread.currentThread().isInterrupted() || !retryPolicy.shouldRetry(failure, n)) {
                    logFailure(description, failure, n);
                    throw e;
                }

                delayBefore = retryPolicy.backoffMillis(n, failure);
                logger.warn("{} failed (attempt {}/{}): {} - retrying in {} ms",
                        description, n, retryPolicy.getMaxAttempts(), failure.getMessage(), delayBefore);
                try {
                    pause(delayBefore);
                } catch (TransportException interrupted) {
                    logFailure(description, interrupted.getFailure(), n);
                    throw interrupted;
                }
            }
        }
    }

    public String getApiVersion() {
        return apiVersion;
    }

    void setApiVersion(String apiVersion) {
        this.apiVersion = apiVersion;
    }

    private RequestOutcome sendOnce(String method, String path, String payload, int attempt, long delayBefore) {
        String token = tokenSupplier.get();
        if (token == null || token.isBlank()) {
            throw new AuthenticationException("No access token available. Please authenticate first.");
        }

        awaitRateLimit(method + " " + path);

        TransportRequest.Builder builder = TransportRequest.builder(method, buildUrl(path))
                .header("Authorization", "Bearer " + token)
                .header("X-Api-Version", apiVersion)
                .header("Accept", JSON);
        if (payload != null) {
            builder.body(payload, JSON);
        }
        TransportRequest request = builder.build();

        logger.debug("Sending {} (attempt {}): {}", request, attempt, LogSanitizer.sanitizeBody(payload));

        long started = System.nanoTime();
        TransportResponse response;
        try {
            response = transport.execute(request);
        } catch (IOException e) {
            record(method, path, 0, started, attempt, delayBefore);
            throw errorClassifier.classifyTransportFailure(e).toException();
        }
        record(method, path, response.getStatusCode(), started, attempt, delayBefore);

        if (response.isSuccessful()) {
            rateLimiter.recordRequest();
            rateLimiter.updateFromResponseHeaders(response.getHeaders());
            return toOutcome(response);
        }

        rateLimiter.updateFromResponseHeaders(response.getHeaders());
        ApiFailure failure = errorClassifier.classify(response.getStatusCode(), response.getBody(),
                response.getHeaders());
        if (failure.getKind() == ErrorKind.RATE_LIMIT_EXCEEDED) {
            rateLimiter.handleRateLimitResponse(failure.getRetryAfterSeconds());
        }
        throw failure.toException();
    }

    private void awaitRateLimit(String description) {
        ThrottleDecision decision = rateLimiter.checkAndThrottle();
        if (!decision.canProceed()) {
            logger.warn("Rate limit reached before {}: {} - waiting {} ms",
                    description, decision.getReason(), decision.getDelayMillis());
            pause(decision.getDelayMillis());

            decision = rateLimiter.checkAndThrottle();
            if (!decision.canProceed()) {
                logger.warn("Rate limit still reached after waiting, sending {} anyway", description);
                return;
            }
        }

        if (decision.getDelayMillis() > 0) {
            logger.info("Throttling {} by {} ms ({}, {}% used)", description, decision.getDelayMillis(),
                    decision.getLevel(), decision.getUsagePercentage());
            pause(decision.getDelayMillis());
        }
    }

    private RequestOutcome toOutcome(TransportResponse response) {
        String body = response.getBody();
        if (response.getStatusCode() == 204) {
            return RequestOutcome.noContent(response.getHeaders());
        }
        if (body == null || body.isBlank()) {
            return RequestOutcome.success(response.getStatusCode(), null, response.getHeaders());
        }
        try {
            JsonNode payload = objectMapper.readTree(body);
            return RequestOutcome.success(response.getStatusCode(), payload, response.getHeaders());
        } catch (JsonProcessingException e) {
            throw new ValidationException(ApiFailure.builder(ErrorKind.VALIDATION)
                    .statusCode(response.getStatusCode())
                    .message("Invalid JSON response: " + e.getOriginalMessage())
                    .responseBody(body)
                    .cause(e)
                    .build());
        }
    }

    private String serialize(String description, Object body) {
        if (body == null) {
            return null;
        }
        if (body instanceof String) {
            return (String) body;
        }
        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            ApiFailure failure = ApiFailure.builder(ErrorKind.VALIDATION)
                    .message("Failed to serialize request body: " + e.getOriginalMessage())
                    .cause(e)
                    .build();
            logFailure(description, failure, 0);
            throw new ValidationException(failure);
        }
    }

    private String buildUrl(String path) {
        String relative = path.startsWith("/") ? path.substring(1) : path;
        return config.getBaseUrl() + "/" + relative;
    }

    private void record(String method, String path, int status, long startedNanos, int attempt, long delayBefore) {
        long duration = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
        callLog.record(new ApiCall(method, path, status, duration, clock.instant(), attempt, delayBefore));
    }

    private void pause(long millis) {
        if (millis <= 0) {
            return;
        }
        try {
            sleeper.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException(ApiFailure.builder(ErrorKind.TRANSPORT)
                    .message("Request interrupted")
                    .cause(e)
                    .build());
        }
    }

    private void logFailure(String description, ApiFailure failure, int attempt) {
        int status = failure.getStatusCode();
        String body = LogSanitizer.sanitizeBody(failure.getResponseBody());
        String format = "{} failed after {} attempt(s): [{}] HTTP {} - {} | body: {}";
        Object[] args = {description, attempt, failure.getKind(), status, failure.getMessage(), body};

        if (status >= 500 || failure.getKind() == ErrorKind.TRANSPORT
                || failure.getKind() == ErrorKind.UNAUTHORIZED) {
            logger.error(format, args);
        } else if (status == 404) {
            logger.info(format, args);
        } else {
            logger.warn(format, args);
        }
    }
}
