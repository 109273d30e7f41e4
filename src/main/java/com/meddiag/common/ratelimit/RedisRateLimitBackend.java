package com.meddiag.common.ratelimit;

import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Backend shared by every node: a sorted set of timestamps per key and an expiring block marker.
 *
 * <p>Prune, count and the conditional add run in one Lua script, so a rejected attempt is never
 * recorded. Each call is bounded by the client command timeout ({@code spring.data.redis.timeout});
 * when Redis fails the configured policy applies ({@code fail-open}: admit, otherwise deny for one
 * window) and further calls skip Redis for a short fail-fast period.</p>
 */
@Slf4j
public class RedisRateLimitBackend implements RateLimitBackend {

    static final long REDIS_FAIL_FAST_MS = 5_000;

    private static final String BLOCK_SUFFIX = ":block";

    private final StringRedisTemplate redis;
    private final Clock clock;
    private final String keyPrefix;
    private final boolean failOpen;
    private final AtomicLong unavailableUntilMs = new AtomicLong(0);
    private final DefaultRedisScript<Long> script = buildScript();

    public RedisRateLimitBackend(StringRedisTemplate redis, Clock clock, String keyPrefix, boolean failOpen) {
        this.redis = redis;
        this.clock = clock;
        this.keyPrefix = keyPrefix == null ? "" : keyPrefix;
        this.failOpen = failOpen;
    }

    @Override
    public String name() {
        return "redis";
    }

    @Override
    public RateLimitDecision check(String key, int maxRequests, long windowSeconds) {
        if (shouldFailFast()) {
            return unavailable(maxRequests, windowSeconds);
        }
        long now = clock.millis();
        String member = now + "-" + Long.toHexString(ThreadLocalRandom.current().nextLong());
        try {
            Long result = redis.execute(
                    script,
                    List.of(windowKey(key), blockKey(key)),
                    String.valueOf(now),
                    String.valueOf(windowSeconds * 1000L),
                    String.valueOf(maxRequests),
                    member,
                    String.valueOf(windowSeconds + 1)
            );
            if (result == null) {
                throw new IllegalStateException("rate limit script returned null");
            }
            if (result < 0) {
                return RateLimitDecision.blocked(ceilSeconds(-result));
            }
            if (result == 0) {
                return RateLimitDecision.windowFull(windowSeconds);
            }
            return RateLimitDecision.allow((int) Math.max(0, maxRequests - result));
        } catch (Exception e) {
            markDown(e);
            return unavailable(maxRequests, windowSeconds);
        }
    }

    @Override
    public void block(String key, long durationSeconds) {
        if (shouldFailFast()) {
            return;
        }
        try {
            redis.opsForValue().set(blockKey(key), "1", Duration.ofSeconds(durationSeconds));
            log.warn("rate limit block: key={}, seconds={}, backend=redis", key, durationSeconds);
        } catch (Exception e) {
            markDown(e);
        }
    }

    @Override
    public BlockStatus isBlocked(String key) {
        if (shouldFailFast()) {
            return BlockStatus.NOT_BLOCKED;
        }
        try {
            Long ttlMs = redis.getExpire(blockKey(key), TimeUnit.MILLISECONDS);
            if (ttlMs != null && ttlMs > 0) {
                return new BlockStatus(true, ceilSeconds(ttlMs));
            }
            return BlockStatus.NOT_BLOCKED;
        } catch (Exception e) {
            markDown(e);
            return BlockStatus.NOT_BLOCKED;
        }
    }

    private RateLimitDecision unavailable(int maxRequests, long windowSeconds) {
        return RateLimitDecision.unavailable(failOpen, maxRequests, windowSeconds);
    }

    private String windowKey(String key) {
        return keyPrefix + key;
    }

    private String blockKey(String key) {
        return keyPrefix + key + BLOCK_SUFFIX;
    }

    private boolean shouldFailFast() {
        return clock.millis() < unavailableUntilMs.get();
    }

    private void markDown(Exception e) {
        long until = clock.millis() + REDIS_FAIL_FAST_MS;
        long prev = unavailableUntilMs.getAndAccumulate(until, Math::max);
        if (prev < clock.millis()) {
            log.warn("rate limit redis unavailable, {} for {}ms: err={}",
                    failOpen ? "fail-open" : "fail-closed", REDIS_FAIL_FAST_MS, e.toString());
        }
    }

    private static long ceilSeconds(long millis) {
        return (millis + 999) / 1000;
    }

    /*
     * KEYS[1] window zset, KEYS[2] block marker
     * ARGV now_ms, window_ms, max, member, expire_s
     * returns -block_pttl when blocked, 0 when the window is full, else the count including this request
     */
    private static DefaultRedisScript<Long> buildScript() {
        DefaultRedisScript<Long> s = new DefaultRedisScript<>();
        s.setResultType(Long.class);
        s.setScriptText("""
                local pttl = redis.call('PTTL', KEYS[2])
                if pttl > 0 then
                  return -pttl
                end
                local now = tonumber(ARGV[1])
                redis.call('ZREMRANGEBYSCORE', KEYS[1], '-inf', now - tonumber(ARGV[2]))
                local count = redis.call('ZCARD', KEYS[1])
                if count >= tonumber(ARGV[3]) then
                  return 0
                end
                redis.call('ZADD', KEYS[1], now, ARGV[4])
                redis.call('EXPIRE', KEYS[1], ARGV[5])
                return count + 1
                """);
        return s;
    }
}
