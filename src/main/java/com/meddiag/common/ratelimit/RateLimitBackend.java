package com.meddiag.common.ratelimit;

/**
 * Storage strategy behind {@link RateLimiter}: a sliding window of request timestamps per key plus
 * an optional block marker.
 */
public interface RateLimitBackend {

    /**
     * If {@code key} is blocked: {@code (false, 0, secondsLeftInBlock)}. Otherwise drop timestamps older
     * than the window; with {@code count >= maxRequests} reject without recording; else record now
     * and return {@code (true, maxRequests - count - 1, 0)}.
     *
     * <p>Must be atomic per key: two concurrent calls never both see the last free slot.</p>
     */
    RateLimitDecision check(String key, int maxRequests, long windowSeconds);

    /** Sets or refreshes the block of {@code key} to {@code now + durationSeconds}. */
    void block(String key, long durationSeconds);

    BlockStatus isBlocked(String key);

    String name();
}
