package com.meddiag.auth.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.TimeUnit;

/**
 * Process-local revocation set.
 *
 * <p>Backed by Caffeine with a per-entry expiry equal to the revoked credential's own {@code exp},
 * so the set never outgrows the population of still-live tokens.</p>
 */
public class InMemoryRevocationStore implements RevocationStore {

    private final Clock clock;
    private final Cache<String, Instant> revoked;

    public InMemoryRevocationStore(Clock clock) {
        this.clock = clock;
        this.revoked = Caffeine.newBuilder()
                .ticker(clockTicker(clock))
                .expireAfter(new UntilTokenExpiry(clock))
                .build();
    }

    @Override
    public boolean revoke(String tokenId, Instant expiresAt) {
        if (tokenId == null || tokenId.isBlank()) {
            return false;
        }
        revoked.asMap().merge(tokenId, expiresAt, (a, b) -> a.isAfter(b) ? a : b);
        return true;
    }

    @Override
    public boolean revokeIfAbsent(String tokenId, Instant expiresAt) {
        if (tokenId == null || tokenId.isBlank()) {
            return false;
        }
        return revoked.asMap().putIfAbsent(tokenId, expiresAt) == null;
    }

    @Override
    public boolean isRevoked(String tokenId) {
        if (tokenId == null) {
            return false;
        }
        Instant until = revoked.getIfPresent(tokenId);
        return until != null && until.isAfter(clock.instant());
    }

    long size() {
        revoked.cleanUp();
        return revoked.estimatedSize();
    }

    private static Ticker clockTicker(Clock clock) {
        return () -> TimeUnit.MILLISECONDS.toNanos(clock.millis());
    }

    private record UntilTokenExpiry(Clock clock) implements Expiry<String, Instant> {

        @Override
        public long expireAfterCreate(String key, Instant expiresAt, long currentTime) {
            return nanosUntil(expiresAt);
        }

        @Override
        public long expireAfterUpdate(String key, Instant expiresAt, long currentTime, long currentDuration) {
            return nanosUntil(expiresAt);
        }

        @Override
        public long expireAfterRead(String key, Instant expiresAt, long currentTime, long currentDuration) {
            return currentDuration;
        }

        private long nanosUntil(Instant expiresAt) {
            long nanos = Duration.between(clock.instant(), expiresAt).toNanos();
            return Math.max(0, nanos);
        }
    }
}
