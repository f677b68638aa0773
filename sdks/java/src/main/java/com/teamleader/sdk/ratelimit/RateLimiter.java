package com.teamleader.sdk.ratelimit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Client-side pacing against the API quota, counted over a sliding window.
 *
 * <p>Every dispatched request is logged with its timestamp; entries older than the window
 * fall out on their own, so the count resets without an explicit {@link #reset()}.
 * Rate-limit headers from real responses can only make the limiter more conservative: the
 * remaining quota used by {@link #checkAndThrottle()} is the smaller of the local estimate
 * and the server-reported value. {@link #getStatistics()} always reflects the local count.</p>
 *
 * <p>Thread-safety: all state is guarded by the instance monitor.</p>
 */
public class RateLimiter {

    private static final Logger logger = LoggerFactory.getLogger(RateLimiter.class);

    static final String HEADER_LIMIT = "x-ratelimit-limit";
    static final String HEADER_REMAINING = "x-ratelimit-remaining";
    static final String HEADER_RESET = "x-ratelimit-reset";

    private static final long UNIX_TIMESTAMP_THRESHOLD = 1_000_000_000L;
    private static final long UNIX_MILLIS_THRESHOLD = 1_000_000_000_000L;
    private static final long MAX_HOLD_SECONDS = Duration.ofDays(1).getSeconds();

    private final RateLimiterConfig config;
    private final Clock clock;
    private final long windowMillis;

    private final ArrayDeque<Instant> requests = new ArrayDeque<>();
    private final Map<String, String> lastHeaders = new LinkedHashMap<>();

    private long lifetimeRequests;
    private long throttledRequests;
    private long totalDelayMillis;

    private Integer serverRemaining;
    private Integer serverLimit;
    private Instant serverObservedAt;
    private long lifetimeAtObservation;
    private Instant serverResetAt;
    private Instant exhaustedUntil;

    public RateLimiter(RateLimiterConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;
        this.windowMillis = config.getWindow().toMillis();
    }

    /**
     * Decides whether a request may be sent now and how long to pace it.
     *
     * <p>Does not count as a request; call {@link #recordRequest()} once the request is sent.</p>
     */
    public synchronized ThrottleDecision checkAndThrottle() {
        Instant now = clock.instant();
        prune(now);

        int effectiveLimit = effectiveLimit();
        int remaining = effectiveRemaining(now, effectiveLimit);
        double used = (double) (effectiveLimit - remaining) / effectiveLimit;
        double usagePercentage = round(used * 100);
        ThrottleLevel level = levelFor(used);

        if (remaining <= 0) {
            long waitMillis = Math.max(1, millisUntilSlot(now, effectiveLimit));
            logger.info("Rate limiting: quota exhausted, next slot in {} ms (usage {}%)",
                    waitMillis, usagePercentage);
            return new ThrottleDecision(false, waitMillis,
                    "Sliding window rate limit exceeded, waiting for slot",
                    usagePercentage, 0, ThrottleLevel.CRITICAL);
        }

        long delay = delayFor(used);
        String reason = reasonFor(level);
        if (delay > 0) {
            throttledRequests++;
            totalDelayMillis += delay;
            logger.debug("Rate limiting: throttling {} ms at {}% usage ({})", delay, usagePercentage, reason);
        }
        return new ThrottleDecision(true, delay, reason, usagePercentage, remaining, level);
    }

    /**
     * Counts one dispatched request against the current window.
     */
    public synchronized void recordRequest() {
        Instant now = clock.instant();
        requests.addLast(now);
        lifetimeRequests++;
        prune(now);

        logger.debug("API request recorded: {} in window, {} lifetime", requests.size(), lifetimeRequests);
    }

    /**
     * Folds {@code X-RateLimit-Limit}, {@code X-RateLimit-Remaining} and {@code X-RateLimit-Reset}
     * from a response into the limiter state. Header names are matched case-insensitively;
     * absent or non-numeric headers are ignored.
     */
    public synchronized void updateFromResponseHeaders(Map<String, List<String>> headers) {
        if (headers == null || headers.isEmpty()) {
            return;
        }

        Map<String, String> rateLimitHeaders = new LinkedHashMap<>();
        headers.forEach((name, values) -> {
            String normalized = name.toLowerCase(Locale.ROOT);
            if ((normalized.equals(HEADER_LIMIT) || normalized.equals(HEADER_REMAINING)
                    || normalized.equals(HEADER_RESET)) && values != null && !values.isEmpty()) {
                rateLimitHeaders.put(normalized, values.get(0));
            }
        });
        if (rateLimitHeaders.isEmpty()) {
            return;
        }

        Instant now = clock.instant();
        Integer limit = parseInt(rateLimitHeaders.get(HEADER_LIMIT));
        if (limit != null && limit > 0) {
            serverLimit = limit;
        }

        Integer remaining = parseInt(rateLimitHeaders.get(HEADER_REMAINING));
        if (remaining != null) {
            serverRemaining = Math.max(0, remaining);
            serverObservedAt = now;
            lifetimeAtObservation = lifetimeRequests;
        }

        Long reset = parseLong(rateLimitHeaders.get(HEADER_RESET));
        if (reset != null && reset >= 0) {
            if (reset > UNIX_MILLIS_THRESHOLD) {
                serverResetAt = Instant.ofEpochMilli(reset);
            } else if (reset > UNIX_TIMESTAMP_THRESHOLD) {
                serverResetAt = Instant.ofEpochSecond(reset);
            } else {
                serverResetAt = now.plusSeconds(reset);
            }
        }

        lastHeaders.clear();
        lastHeaders.putAll(rateLimitHeaders);

        logger.debug("Rate limit headers processed: {} (local usage {})", rateLimitHeaders, requests.size());
    }

    /**
     * Marks the quota as exhausted after a 429 response.
     *
     * @param retryAfterSeconds server-provided wait, or null to block for one window
     */
    public synchronized void handleRateLimitResponse(Long retryAfterSeconds) {
        Instant now = clock.instant();
        exhaustedUntil = retryAfterSeconds != null
                ? now.plusSeconds(Math.min(Math.max(0L, retryAfterSeconds), MAX_HOLD_SECONDS))
                : now.plusMillis(windowMillis);

        logger.info("Rate limit exceeded on server, holding requests until {}", exhaustedUntil);
    }

    /**
     * Returns fresh counters; nothing here is cached.
     */
    public synchronized RateLimitStatistics getStatistics() {
        Instant now = clock.instant();
        prune(now);

        int limit = config.getLimit();
        int count = requests.size();
        double used = (double) count / limit;

        return new RateLimitStatistics(
                count,
                lifetimeRequests,
                limit,
                Math.max(0, limit - count),
                round(used * 100),
                levelFor(used),
                secondsUntilOldestExpires(now),
                throttledRequests,
                totalDelayMillis,
                serverRemaining,
                serverLimit,
                serverResetAt,
                lastHeaders);
    }

    /**
     * Clears all counters and server-reported state.
     */
    public synchronized void reset() {
        requests.clear();
        lastHeaders.clear();
        lifetimeRequests = 0;
        throttledRequests = 0;
        totalDelayMillis = 0;
        serverRemaining = null;
        serverLimit = null;
        serverObservedAt = null;
        lifetimeAtObservation = 0;
        serverResetAt = null;
        exhaustedUntil = null;
    }

    /**
     * Returns true once local usage reaches the throttle threshold.
     */
    public synchronized boolean isThrottled() {
        prune(clock.instant());
        return requests.size() >= config.getLimit() * config.getThrottleThreshold();
    }

    /**
     * Returns the pacing delay the next request would get, without counting it as throttled.
     */
    public synchronized long getRecommendedDelay() {
        Instant now = clock.instant();
        prune(now);
        int effectiveLimit = effectiveLimit();
        int remaining = effectiveRemaining(now, effectiveLimit);
        return delayFor((double) (effectiveLimit - remaining) / effectiveLimit);
    }

    /**
     * Seconds until the oldest request leaves the window.
     */
    public synchronized long getTimeUntilReset() {
        Instant now = clock.instant();
        prune(now);
        return secondsUntilOldestExpires(now);
    }

    public RateLimiterConfig getConfig() {
        return config;
    }

    private void prune(Instant now) {
        Instant cutoff = now.minusMillis(windowMillis);
        while (!requests.isEmpty() && !requests.peekFirst().isAfter(cutoff)) {
            requests.removeFirst();
        }
        if (serverObservedAt != null && !now.isBefore(serverObservedAt.plusMillis(windowMillis))) {
            serverRemaining = null;
            serverObservedAt = null;
        }
        if (serverResetAt != null && !now.isBefore(serverResetAt)) {
            serverResetAt = null;
            if (serverObservedAt != null) {
                serverRemaining = null;
                serverObservedAt = null;
            }
        }
        if (exhaustedUntil != null && !now.isBefore(exhaustedUntil)) {
            exhaustedUntil = null;
        }
    }

    private int effectiveLimit() {
        return serverLimit != null ? Math.min(config.getLimit(), serverLimit) : config.getLimit();
    }

    private int effectiveRemaining(Instant now, int effectiveLimit) {
        if (exhaustedUntil != null && now.isBefore(exhaustedUntil)) {
            return 0;
        }
        int remaining = effectiveLimit - requests.size();
        if (serverRemaining != null) {
            long sinceObservation = lifetimeRequests - lifetimeAtObservation;
            remaining = (int) Math.min(remaining, serverRemaining - sinceObservation);
        }
        return Math.max(0, remaining);
    }

    private long millisUntilSlot(Instant now, int effectiveLimit) {
        long wait = 0;
        if (exhaustedUntil != null) {
            wait = Math.max(wait, ceilMillis(now, exhaustedUntil));
        }
        if (requests.size() >= effectiveLimit && !requests.isEmpty()) {
            Instant oldestExpiry = requests.peekFirst().plusMillis(windowMillis);
            wait = Math.max(wait, ceilMillis(now, oldestExpiry));
        }
        if (serverRemaining != null && serverRemaining - (lifetimeRequests - lifetimeAtObservation) <= 0) {
            Instant serverSlot = serverResetAt != null
                    ? serverResetAt
                    : serverObservedAt.plusMillis(windowMillis);
            wait = Math.max(wait, ceilMillis(now, serverSlot));
        }
        return wait;
    }

    private static long ceilMillis(Instant from, Instant to) {
        Duration between = Duration.between(from, to);
        long millis = between.toMillis();
        return between.minusMillis(millis).isZero() ? millis : millis + 1;
    }

    private long delayFor(double used) {
        double throttle = config.getThrottleThreshold();
        double aggressive = config.getAggressiveThreshold();
        long minDelay = config.getThrottleMinDelay().toMillis();
        long maxDelay = config.getThrottleMaxDelay().toMillis();
        long aggressiveMax = config.getAggressiveMaxDelay().toMillis();

        long delay;
        if (used < throttle) {
            return 0;
        } else if (used < aggressive) {
            double fraction = (used - throttle) / (aggressive - throttle);
            delay = minDelay + Math.round((maxDelay - minDelay) * fraction);
        } else {
            double fraction = Math.min(1.0, (used - aggressive) / (1.0 - aggressive));
            delay = maxDelay + Math.round((aggressiveMax - maxDelay) * fraction);
        }

        long jitterBound = (long) (delay * config.getJitterRatio());
        if (jitterBound > 0) {
            delay += ThreadLocalRandom.current().nextLong(jitterBound + 1);
        }
        return delay;
    }

    private ThrottleLevel levelFor(double used) {
        double throttle = config.getThrottleThreshold();
        double aggressive = config.getAggressiveThreshold();
        if (used >= (aggressive + 1.0) / 2) return ThrottleLevel.CRITICAL;
        if (used >= aggressive) return ThrottleLevel.HIGH;
        if (used >= (throttle + aggressive) / 2) return ThrottleLevel.MODERATE;
        if (used >= throttle) return ThrottleLevel.LOW;
        return ThrottleLevel.NONE;
    }

    private static String reasonFor(ThrottleLevel level) {
        switch (level) {
            case CRITICAL:
                return "Sliding window critical - approaching limit";
            case HIGH:
                return "Sliding window high usage";
            case MODERATE:
                return "Sliding window moderate usage";
            case LOW:
                return "Sliding window preventive throttling";
            default:
                return "Normal operation";
        }
    }

    private long secondsUntilOldestExpires(Instant now) {
        if (requests.isEmpty()) {
            return 0;
        }
        Instant expiresAt = requests.peekFirst().plusMillis(windowMillis);
        return Math.max(0, Duration.between(now, expiresAt).getSeconds());
    }

    private static Integer parseInt(String value) {
        if (value == null) {
            return null;
        }
        try {
            return Integer.valueOf(value.trim());
        } catch (NumberFormatException e) {
            logger.debug("Ignoring non-numeric rate limit header value '{}'", value);
            return null;
        }
    }

    private static Long parseLong(String value) {
        if (value == null) {
            return null;
        }
        try {
            return Long.valueOf(value.trim());
        } catch (NumberFormatException e) {
            logger.debug("Ignoring non-numeric rate limit header value '{}'", value);
            return null;
        }
    }

    private static double round(double value) {
        return Math.round(value * 10) / 10.0;
    }
}
