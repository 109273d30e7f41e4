package com.meddiag.common.ratelimit;

import lombok.extern.slf4j.Slf4j;

import java.util.Map;

/**
 * Sliding-window admission control with escalation to a temporary block.
 *
 * <p>A full window on its own is a soft rejection ({@code retryAfter = window}). When the operation
 * has a block duration, the first rejection also blocks the key and reports the full block
 * duration; every check during the block is rejected with the time left. A denial made by the
 * backend's outage policy ({@link RateLimitDecision#degraded()}) is passed through as is.</p>
 *
 * <p>Never throws: backend trouble is handled inside the backend.</p>
 */
@Slf4j
public class RateLimiter {

    private final RateLimitBackend backend;
    private final Map<String, RateLimitPolicy> policies;
    private final boolean enabled;

    public RateLimiter(RateLimitBackend backend, Map<String, RateLimitPolicy> policies, boolean enabled) {
        this.backend = backend;
        this.policies = Map.copyOf(policies);
        this.enabled = enabled;
        if (!this.policies.containsKey(RateLimitProperties.DEFAULT_OPERATION)) {
            throw new IllegalArgumentException("policy table needs a '" + RateLimitProperties.DEFAULT_OPERATION + "' entry");
        }
        log.info("rate limiter ready: backend={}, enabled={}, policies={}", backend.name(), enabled, this.policies.keySet());
    }

    public RateLimitDecision checkRateLimit(String key, int maxRequests, long windowSeconds, long blockDurationSeconds) {
        if (!enabled) {
            return RateLimitDecision.allow(maxRequests);
        }
        RateLimitDecision decision = backend.check(key, maxRequests, windowSeconds);
        if (decision.allowed() || decision.blocked() || decision.degraded() || blockDurationSeconds <= 0) {
            return decision;
        }
        if (backend.isBlocked(key).blocked()) {
            return decision;
        }
        backend.block(key, blockDurationSeconds);
        return RateLimitDecision.blocked(blockDurationSeconds);
    }

    public RateLimitDecision checkRateLimit(String key, RateLimitPolicy policy) {
        return checkRateLimit(key, policy.maxRequests(), policy.windowSeconds(), policy.blockDurationSeconds());
    }

    public BlockStatus isBlocked(String key) {
        return backend.isBlocked(key);
    }

    /**
     * Policy of {@code operation}, or the {@code default} one for unknown names.
     */
    public RateLimitPolicy policyFor(String operation) {
        RateLimitPolicy policy = operation == null ? null : policies.get(operation);
        return policy != null ? policy : policies.get(RateLimitProperties.DEFAULT_OPERATION);
    }

    public boolean isEnabled() {
        return enabled;
    }

    public RateLimitBackend backend() {
        return backend;
    }
}
