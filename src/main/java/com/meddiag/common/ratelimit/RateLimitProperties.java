package com.meddiag.common.ratelimit;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@ConfigurationProperties(prefix = "meddiag.ratelimit")
public class RateLimitProperties {

    public static final String DEFAULT_OPERATION = "default";

    /** Global switch; off admits everything (test environments). */
    private boolean enabled = true;

    /** {@code memory} or {@code redis}. */
    private String backend = "memory";

    /** Redis backend only: admit (true) or deny (false) while Redis is unreachable. */
    private boolean failOpen = true;

    /** Redis key prefix. */
    private String keyPrefix = "meddiag:rl:";

    /** Derive the client address from X-Forwarded-For / X-Real-IP. */
    private boolean trustForwardedHeaders = true;

    /** When non-empty, forwarded headers are only trusted if the direct peer is one of these addresses. */
    private List<String> trustedProxies = new ArrayList<>();

    /** In-memory backend: sweep period and idle age after which a key's window is dropped. */
    private long sweepIntervalMs = 60_000;
    private long idleEvictSeconds = 3_600;

    private Map<String, Policy> policies = defaultPolicies();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getBackend() {
        return backend;
    }

    public void setBackend(String backend) {
        this.backend = backend;
    }

    public boolean isFailOpen() {
        return failOpen;
    }

    public void setFailOpen(boolean failOpen) {
        this.failOpen = failOpen;
    }

    public String getKeyPrefix() {
        return keyPrefix;
    }

    public void setKeyPrefix(String keyPrefix) {
        this.keyPrefix = keyPrefix;
    }

    public boolean isTrustForwardedHeaders() {
        return trustForwardedHeaders;
    }

    public void setTrustForwardedHeaders(boolean trustForwardedHeaders) {
        this.trustForwardedHeaders = trustForwardedHeaders;
    }

    public List<String> getTrustedProxies() {
        return trustedProxies;
    }

    public void setTrustedProxies(List<String> trustedProxies) {
        this.trustedProxies = trustedProxies;
    }

    public long getSweepIntervalMs() {
        return sweepIntervalMs;
    }

    public void setSweepIntervalMs(long sweepIntervalMs) {
        this.sweepIntervalMs = sweepIntervalMs;
    }

    public long getIdleEvictSeconds() {
        return idleEvictSeconds;
    }

    public void setIdleEvictSeconds(long idleEvictSeconds) {
        this.idleEvictSeconds = idleEvictSeconds;
    }

    public Map<String, Policy> getPolicies() {
        return policies;
    }

    public void setPolicies(Map<String, Policy> policies) {
        this.policies = policies;
    }

    /**
     * Immutable snapshot of the policy table, taken once when the limiter is built.
     */
    public Map<String, RateLimitPolicy> toPolicyTable() {
        Map<String, RateLimitPolicy> table = new LinkedHashMap<>();
        defaultPolicies().forEach((name, p) -> table.put(name, p.toPolicy()));
        if (policies != null) {
            policies.forEach((name, p) -> table.put(name, p.toPolicy()));
        }
        return Map.copyOf(table);
    }

    private static Map<String, Policy> defaultPolicies() {
        Map<String, Policy> m = new LinkedHashMap<>();
        m.put("login", new Policy(5, 60, 300));
        m.put("register", new Policy(3, 60, 600));
        m.put("forgot_password", new Policy(3, 60, 300));
        m.put("google_auth", new Policy(10, 60, 300));
        m.put(DEFAULT_OPERATION, new Policy(60, 60, 0));
        return m;
    }

    public static class Policy {

        private int maxRequests;
        private long windowSeconds;
        private long blockDurationSeconds;

        public Policy() {
        }

        public Policy(int maxRequests, long windowSeconds, long blockDurationSeconds) {
            this.maxRequests = maxRequests;
            this.windowSeconds = windowSeconds;
            this.blockDurationSeconds = blockDurationSeconds;
        }

        public int getMaxRequests() {
            return maxRequests;
        }

        public void setMaxRequests(int maxRequests) {
            this.maxRequests = maxRequests;
        }

        public long getWindowSeconds() {
            return windowSeconds;
        }

        public void setWindowSeconds(long windowSeconds) {
            this.windowSeconds = windowSeconds;
        }

        public long getBlockDurationSeconds() {
            return blockDurationSeconds;
        }

        public void setBlockDurationSeconds(long blockDurationSeconds) {
            this.blockDurationSeconds = blockDurationSeconds;
        }

        RateLimitPolicy toPolicy() {
            return new RateLimitPolicy(maxRequests, windowSeconds, blockDurationSeconds);
        }
    }
}
