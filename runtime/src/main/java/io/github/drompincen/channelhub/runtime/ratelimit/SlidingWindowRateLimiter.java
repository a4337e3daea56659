package io.github.drompincen.channelhub.runtime.ratelimit;

import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory sliding-window limiter. Each key keeps the timestamps of its allowed attempts inside the
 * window; rejected attempts are not recorded, so a caller that backs off regains capacity on schedule.
 */
@Component
public class SlidingWindowRateLimiter implements RateLimiter {

    private static final int CLEANUP_THRESHOLD = 10_000;

    // a key's deque is only touched inside compute calls, which ConcurrentHashMap runs one at a time per key
    private final ConcurrentHashMap<String, Deque<Long>> windows = new ConcurrentHashMap<>();
    private final Clock clock;
    private final int cleanupThreshold;

    public SlidingWindowRateLimiter() {
        this(Clock.systemUTC());
    }

    SlidingWindowRateLimiter(Clock clock) {
        this(clock, CLEANUP_THRESHOLD);
    }

    SlidingWindowRateLimiter(Clock clock, int cleanupThreshold) {
        this.clock = clock;
        this.cleanupThreshold = cleanupThreshold;
    }

    @Override
    public RateLimitResult check(String identifier, String bucket, RateLimitRule rule) {
        String key = "ratelimit:" + bucket + ":" + identifier;
        long now = clock.millis();
        long windowMs = rule.windowSeconds() * 1000;
        long windowStart = now - windowMs;

        RateLimitResult[] result = new RateLimitResult[1];
        windows.compute(key, (k, existing) -> {
            Deque<Long> hits = existing != null ? existing : new ArrayDeque<>();
            while (!hits.isEmpty() && hits.peekFirst() <= windowStart) {
                hits.pollFirst();
            }
            boolean allowed = hits.size() < rule.limit();
            if (allowed) {
                hits.addLast(now);
            }
            long oldest = hits.isEmpty() ? now : hits.peekFirst();
            result[0] = new RateLimitResult(allowed, Math.max(0, rule.limit() - hits.size()),
                    Instant.ofEpochMilli(oldest + windowMs));
            return hits;
        });

        if (windows.size() > cleanupThreshold) {
            for (String candidate : windows.keySet()) {
                windows.computeIfPresent(candidate, (k, hits) -> {
                    Long last = hits.peekLast();
                    return last == null || last <= windowStart ? null : hits;
                });
            }
        }
        return result[0];
    }
}
