package com.meddiag.auth.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Revocation set shared by every node, one key per revoked token id with a TTL up to the token's expiry.
 *
 * <p>Lookups fail closed: if Redis cannot answer, the credential is treated as revoked. Writes that
 * fail are logged and reported as not recorded, so a rotation is refused rather than replayable.</p>
 */
@Slf4j
public class RedisRevocationStore implements RevocationStore {

    private static final String KEY_PREFIX = "meddiag:auth:revoked:";

    private final StringRedisTemplate redis;
    private final Clock clock;

    public RedisRevocationStore(StringRedisTemplate redis, Clock clock) {
        this.redis = redis;
        this.clock = clock;
    }

    @Override
    public boolean revoke(String tokenId, Instant expiresAt) {
        Duration ttl = ttl(expiresAt);
        if (tokenId == null || ttl == null) {
            // already expired: nothing left to revoke
            return tokenId != null;
        }
        try {
            redis.opsForValue().set(key(tokenId), "1", ttl);
            return true;
        } catch (Exception e) {
            log.warn("revoke failed, redis unavailable? jti={}, err={}", tokenId, e.toString());
            return false;
        }
    }

    @Override
    public boolean revokeIfAbsent(String tokenId, Instant expiresAt) {
        Duration ttl = ttl(expiresAt);
        if (tokenId == null || ttl == null) {
            return false;
        }
        try {
            Boolean set = redis.opsForValue().setIfAbsent(key(tokenId), "1", ttl);
            return Boolean.TRUE.equals(set);
        } catch (Exception e) {
            log.warn("revokeIfAbsent failed, redis unavailable? jti={}, err={}", tokenId, e.toString());
            return false;
        }
    }

    @Override
    public boolean isRevoked(String tokenId) {
        if (tokenId == null) {
            return false;
        }
        try {
            return Boolean.TRUE.equals(redis.hasKey(key(tokenId)));
        } catch (Exception e) {
            log.warn("revocation lookup failed, treating as revoked: jti={}, err={}", tokenId, e.toString());
            return true;
        }
    }

    private Duration ttl(Instant expiresAt) {
        Duration ttl = Duration.between(clock.instant(), expiresAt);
        if (ttl.isNegative() || ttl.isZero()) {
            return null;
        }
        // Redis EX has second granularity
        return ttl.getSeconds() == 0 ? Duration.ofSeconds(1) : ttl.plusSeconds(1);
    }

    private String key(String tokenId) {
        return KEY_PREFIX + tokenId;
    }
}
