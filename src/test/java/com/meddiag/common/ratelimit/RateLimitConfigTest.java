package com.meddiag.common.ratelimit;

import com.meddiag.support.MutableClock;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class RateLimitConfigTest {

    private final MutableClock clock = MutableClock.startingAt("2026-01-01T00:00:00Z");
    private final RateLimitConfig config = new RateLimitConfig();

    @Test
    void rateLimitBackend_ShouldDefaultToMemory() {
        RateLimitBackend backend = config.rateLimitBackend(new RateLimitProperties(), provider(null), clock);

        assertThat(backend).isInstanceOf(InMemoryRateLimitBackend.class);
    }

    @Test
    void rateLimitBackend_ShouldFallBackToMemory_WhenRedisUnreachable() {
        StringRedisTemplate redis = mock(StringRedisTemplate.class);
        when(redis.execute(any(RedisCallback.class), eq(true))).thenThrow(new RedisConnectionFailureException("refused"));
        RateLimitProperties props = new RateLimitProperties();
        props.setBackend("redis");

        RateLimitBackend backend = config.rateLimitBackend(props, provider(redis), clock);

        assertThat(backend.name()).isEqualTo("memory");
    }

    @Test
    void rateLimitBackend_ShouldUseRedis_WhenPingAnswers() {
        StringRedisTemplate redis = mock(StringRedisTemplate.class);
        when(redis.execute(any(RedisCallback.class), eq(true))).thenReturn("PONG");
        RateLimitProperties props = new RateLimitProperties();
        props.setBackend(" Redis ");

        RateLimitBackend backend = config.rateLimitBackend(props, provider(redis), clock);

        assertThat(backend).isInstanceOf(RedisRateLimitBackend.class);
    }

    @Test
    void sweeper_ShouldIgnoreNonMemoryBackends() {
        RateLimitBackend redisBackend = new RedisRateLimitBackend(mock(StringRedisTemplate.class), clock, "p:", true);

        new RateLimitSweeper(redisBackend, new RateLimitProperties()).sweep();

        InMemoryRateLimitBackend memory = new InMemoryRateLimitBackend(clock);
        memory.check("idle", 5, 60);
        clock.advanceSeconds(7200);
        new RateLimitSweeper(memory, new RateLimitProperties()).sweep();
        assertThat(memory.trackedKeys()).isZero();
    }

    @SuppressWarnings("unchecked")
    private static ObjectProvider<StringRedisTemplate> provider(StringRedisTemplate redis) {
        ObjectProvider<StringRedisTemplate> provider = mock(ObjectProvider.class);
        when(provider.getIfAvailable()).thenReturn(redis);
        return provider;
    }
}
