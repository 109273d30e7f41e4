package com.meddiag.common.ratelimit;

/**
 * Quota of one operation. {@code blockDurationSeconds == 0} means a full window is only a soft rejection.
 */
public record RateLimitPolicy(
        int maxRequests,
        long windowSeconds,
        long blockDurationSeconds
) {

    public RateLimitPolicy {
        if (maxRequests < 1) {
            throw new IllegalArgumentException("maxRequests must be >= 1");
        }
        if (windowSeconds < 1) {
            throw new IllegalArgumentException("windowSeconds must be >= 1");
        }
        if (blockDurationSeconds < 0) {
            throw new IllegalArgumentException("blockDurationSeconds must be >= 0");
        }
    }
}
