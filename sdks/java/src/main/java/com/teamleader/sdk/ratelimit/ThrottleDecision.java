package com.teamleader.sdk.ratelimit;

/**
 * Result of {@link RateLimiter#checkAndThrottle()}.
 *
 * <p>When {@link #canProceed()} is false, {@link #getDelayMillis()} is the time until a slot
 * frees up. Otherwise it is the pacing delay to apply before sending, possibly zero.</p>
 */
public final class ThrottleDecision {

    private final boolean canProceed;
    private final long delayMillis;
    private final String reason;
    private final double usagePercentage;
    private final int remaining;
    private final ThrottleLevel level;

    ThrottleDecision(boolean canProceed, long delayMillis, String reason,
                     double usagePercentage, int remaining, ThrottleLevel level) {
        this.canProceed = canProceed;
        this.delayMillis = delayMillis;
        this.reason = reason;
        this.usagePercentage = usagePercentage;
        this.remaining = remaining;
        this.level = level;
    }

    public boolean canProceed() {
        return canProceed;
    }

    public long getDelayMillis() {
        return delayMillis;
    }

    public String getReason() {
        return reason;
    }

    public double getUsagePercentage() {
        return usagePercentage;
    }

    /**
     * Remaining quota used for this decision: the more conservative of the local
     * and the server-reported value.
     */
    public int getRemaining() {
        return remaining;
    }

    public ThrottleLevel getLevel() {
        return level;
    }

    @Override
    public String toString() {
        return "ThrottleDecision{" +
                "canProceed=" + canProceed +
                ", delayMillis=" + delayMillis +
                ", usagePercentage=" + usagePercentage +
                ", remaining=" + remaining +
                ", level=" + level +
                ", reason='" + reason + '\'' +
                '}';
    }
}
