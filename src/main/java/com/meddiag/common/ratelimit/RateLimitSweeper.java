package com.meddiag.common.ratelimit;

import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;

/**
 * Periodically drops idle in-memory windows and finished blocks. No-op for other backends,
 * whose keys expire on their own.
 */
@Slf4j
public class RateLimitSweeper {

    private final RateLimitBackend backend;
    private final RateLimitProperties props;

    public RateLimitSweeper(RateLimitBackend backend, RateLimitProperties props) {
        this.backend = backend;
        this.props = props;
    }

    @Scheduled(fixedDelayString = "${meddiag.ratelimit.sweep-interval-ms:60000}")
    public void sweep() {
        if (!(backend instanceof InMemoryRateLimitBackend memory)) {
            return;
        }
        int removed = memory.sweep(Math.max(1, props.getIdleEvictSeconds()));
        if (removed > 0) {
            log.debug("rate limit sweep: removedWindows={}", removed);
        }
    }
}
