package com.meddiag.common.ratelimit;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Single-process backend.
 *
 * <p>Each key owns a {@link Window}; prune, count and append happen under that window's monitor, so
 * checks on one key are linearizable while different keys never contend. Blocks live in a separate
 * map and are removed lazily once expired.</p>
 */
@Slf4j
public class InMemoryRateLimitBackend implements RateLimitBackend {

    private final Clock clock;
    private final Map<String, Window> windows = new ConcurrentHashMap<>();
    private final Map<String, Long> blockedUntilMs = new ConcurrentHashMap<>();

    public InMemoryRateLimitBackend(Clock clock) {
        this.clock = clock;
    }

    @Override
    public String name() {
        return "memory";
    }

    @Override
    public RateLimitDecision check(String key, int maxRequests, long windowSeconds) {
        BlockStatus block = isBlocked(key);
        if (block.blocked()) {
            return RateLimitDecision.blocked(block.secondsRemaining());
        }

        while (true) {
            Window window = windows.computeIfAbsent(key, k -> new Window());
            synchronized (window) {
                if (window.evicted) {
                    // lost a race with sweep(); the key now maps to a fresh window
                    continue;
                }
                long now = clock.millis();
                window.prune(now - windowSeconds * 1000L);
                int count = window.timestamps.size();
                if (count >= maxRequests) {
                    return RateLimitDecision.windowFull(windowSeconds);
                }
                window.timestamps.addLast(now);
                return RateLimitDecision.allow(maxRequests - count - 1);
            }
        }
    }

    @Override
    public void block(String key, long durationSeconds) {
        blockedUntilMs.put(key, clock.millis() + durationSeconds * 1000L);
        log.warn("rate limit block: key={}, seconds={}, backend=memory", key, durationSeconds);
    }

    @Override
    public BlockStatus isBlocked(String key) {
        Long until = blockedUntilMs.get(key);
        if (until == null) {
            return BlockStatus.NOT_BLOCKED;
        }
        long leftMs = until - clock.millis();
        if (leftMs > 0) {
            return new BlockStatus(true, ceilSeconds(leftMs));
        }
        blockedUntilMs.remove(key, until);
        return BlockStatus.NOT_BLOCKED;
    }

    /**
     * Drops windows whose newest entry is older than {@code idleSeconds} and blocks that already ended.
     *
     * @return number of windows removed
     */
    public int sweep(long idleSeconds) {
        long now = clock.millis();
        long cutoff = now - idleSeconds * 1000L;
        int removed = 0;
        for (String key : windows.keySet()) {
            boolean[] dropped = {false};
            windows.computeIfPresent(key, (k, window) -> {
                synchronized (window) {
                    Long newest = window.timestamps.peekLast();
                    if (newest == null || newest <= cutoff) {
                        window.evicted = true;
                        dropped[0] = true;
                        return null;
                    }
                    return window;
                }
            });
            if (dropped[0]) {
                removed++;
            }
        }
        blockedUntilMs.entrySet().removeIf(e -> e.getValue() <= now);
        return removed;
    }

    int trackedKeys() {
        return windows.size();
    }

    private static long ceilSeconds(long millis) {
        return (millis + 999) / 1000;
    }

    private static final class Window {

        private final Deque<Long> timestamps = new ArrayDeque<>();
        private boolean evicted;

        private void prune(long cutoffMs) {
            while (!timestamps.isEmpty() && timestamps.peekFirst() <= cutoffMs) {
                timestamps.pollFirst();
            }
        }
    }
}
