package com.meddiag.common.ratelimit;

/**
 * Answer of a rate-limit check.
 *
 * @param remaining         admissions left in the current window after this one
 * @param retryAfterSeconds 0 when allowed
 * @param blocked           true when the denial comes from a block rather than a full window
 * @param degraded          true when the backend could not be asked and its outage policy answered;
 *                          such a denial is not a quota overflow and never escalates to a block
 */
public record RateLimitDecision(
        boolean allowed,
        int remaining,
        long retryAfterSeconds,
        boolean blocked,
        boolean degraded
) {

    public static RateLimitDecision allow(int remaining) {
        return new RateLimitDecision(true, remaining, 0, false, false);
    }

    public static RateLimitDecision windowFull(long windowSeconds) {
        return new RateLimitDecision(false, 0, windowSeconds, false, false);
    }

    public static RateLimitDecision blocked(long secondsLeft) {
        return new RateLimitDecision(false, 0, secondsLeft, true, false);
    }

    /**
     * Backend unreachable: admit ({@code failOpen}) or deny for one window, flagged as degraded.
     */
    public static RateLimitDecision unavailable(boolean failOpen, int maxRequests, long windowSeconds) {
        if (failOpen) {
            return new RateLimitDecision(true, Math.max(0, maxRequests - 1), 0, false, true);
        }
        return new RateLimitDecision(false, 0, windowSeconds, false, true);
    }
}
