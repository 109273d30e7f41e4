package com.meddiag.common.ratelimit;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;
import java.util.Locale;

@Slf4j
@Configuration
@EnableConfigurationProperties(RateLimitProperties.class)
public class RateLimitConfig {

    /**
     * {@code backend: redis} needs Redis to answer a PING at startup; otherwise the in-memory backend is
     * used and the fallback is logged.
     */
    @Bean
    public RateLimitBackend rateLimitBackend(RateLimitProperties props,
                                             ObjectProvider<StringRedisTemplate> redisProvider,
                                             Clock clock) {
        String backend = props.getBackend() == null ? "memory" : props.getBackend().trim().toLowerCase(Locale.ROOT);
        if ("redis".equals(backend)) {
            StringRedisTemplate redis = redisProvider.getIfAvailable();
            if (redis != null && ping(redis)) {
                log.info("rate limit backend: redis, failOpen={}", props.isFailOpen());
                return new RedisRateLimitBackend(redis, clock, props.getKeyPrefix(), props.isFailOpen());
            }
            log.warn("rate limit backend: redis unreachable at startup, falling back to memory");
        } else if (!"memory".equals(backend)) {
            log.warn("rate limit backend: unknown value '{}', using memory", props.getBackend());
        }
        return new InMemoryRateLimitBackend(clock);
    }

    @Bean
    public RateLimiter rateLimiter(RateLimitBackend backend, RateLimitProperties props) {
        return new RateLimiter(backend, props.toPolicyTable(), props.isEnabled());
    }

    @Bean
    public ClientKeyResolver clientKeyResolver(RateLimitProperties props) {
        return ClientKeyResolver.from(props);
    }

    @Bean
    public RateLimitSweeper rateLimitSweeper(RateLimitBackend backend, RateLimitProperties props) {
        return new RateLimitSweeper(backend, props);
    }

    static boolean ping(StringRedisTemplate redis) {
        try {
            String pong = redis.execute(connection -> connection.ping(), true);
            return "PONG".equalsIgnoreCase(pong);
        } catch (Exception e) {
            log.warn("redis ping failed: err={}", e.toString());
            return false;
        }
    }
}
