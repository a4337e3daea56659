package io.github.drompincen.channelhub.runtime.ratelimit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SlidingWindowRateLimiterTest {

    private static final RateLimitRule THREE_PER_MINUTE = new RateLimitRule(3, 60);

    private MutableClock clock;
    private SlidingWindowRateLimiter limiter;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        limiter = new SlidingWindowRateLimiter(clock);
    }

    @Test
    void allowsUpToLimitThenRejects() {
        assertThat(limiter.check("tenant:u1", "channel-message", THREE_PER_MINUTE).remaining()).isEqualTo(2);
        assertThat(limiter.check("tenant:u1", "channel-message", THREE_PER_MINUTE).remaining()).isEqualTo(1);
        assertThat(limiter.check("tenant:u1", "channel-message", THREE_PER_MINUTE).allowed()).isTrue();

        RateLimitResult rejected = limiter.check("tenant:u1", "channel-message", THREE_PER_MINUTE);

        assertThat(rejected.allowed()).isFalse();
        assertThat(rejected.remaining()).isZero();
        assertThat(rejected.resetAt()).isEqualTo(Instant.parse("2026-01-01T00:01:00Z"));
    }

    @Test
    void capacityReturnsAsTheWindowSlides() {
        limiter.check("tenant:u1", "b", THREE_PER_MINUTE);
        clock.advance(Duration.ofSeconds(30));
        limiter.check("tenant:u1", "b", THREE_PER_MINUTE);
        limiter.check("tenant:u1", "b", THREE_PER_MINUTE);
        assertThat(limiter.check("tenant:u1", "b", THREE_PER_MINUTE).allowed()).isFalse();

        clock.advance(Duration.ofSeconds(31));

        assertThat(limiter.check("tenant:u1", "b", THREE_PER_MINUTE).allowed()).isTrue();
        assertThat(limiter.check("tenant:u1", "b", THREE_PER_MINUTE).allowed()).isFalse();
    }

    @Test
    void rejectedAttemptsDoNotExtendTheWindow() {
        for (int i = 0; i < 3; i++) limiter.check("tenant:u1", "b", THREE_PER_MINUTE);
        for (int i = 0; i < 10; i++) {
            clock.advance(Duration.ofSeconds(5));
            limiter.check("tenant:u1", "b", THREE_PER_MINUTE);
        }

        clock.advance(Duration.ofSeconds(11));

        assertThat(limiter.check("tenant:u1", "b", THREE_PER_MINUTE).allowed()).isTrue();
    }

    @Test
    void identifiersAndBucketsAreIndependent() {
        for (int i = 0; i < 3; i++) limiter.check("tenant:u1", "b", THREE_PER_MINUTE);

        assertThat(limiter.check("tenant:u2", "b", THREE_PER_MINUTE).allowed()).isTrue();
        assertThat(limiter.check("tenant:u1", "other", THREE_PER_MINUTE).allowed()).isTrue();
    }

    @Test
    void concurrentCallersNeverExceedTheLimitWhileStaleWindowsAreSwept() throws Exception {
        SlidingWindowRateLimiter sweeping = new SlidingWindowRateLimiter(clock, 0);
        RateLimitRule fiftyPerMinute = new RateLimitRule(50, 60);
        for (int i = 0; i < 50; i++) sweeping.check("tenant:u1", "b", fiftyPerMinute);
        clock.advance(Duration.ofSeconds(61));

        AtomicInteger allowed = new AtomicInteger();
        ExecutorService callers = Executors.newFixedThreadPool(8);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < 8; t++) {
                futures.add(callers.submit(() -> {
                    for (int i = 0; i < 100; i++) {
                        if (sweeping.check("tenant:u1", "b", fiftyPerMinute).allowed()) allowed.incrementAndGet();
                        sweeping.check("tenant:u" + i, "other", fiftyPerMinute);
                    }
                }));
            }
            for (Future<?> future : futures) future.get(10, TimeUnit.SECONDS);
        } finally {
            callers.shutdownNow();
        }

        assertThat(allowed.get()).isEqualTo(50);
    }

    @Test
    void ruleRejectsNonPositiveValues() {
        assertThatThrownBy(() -> new RateLimitRule(0, 60)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RateLimitRule(1, 0)).isInstanceOf(IllegalArgumentException.class);
    }

    static final class MutableClock extends Clock {
        private Instant now;

        MutableClock(Instant now) { this.now = now; }

        void advance(Duration d) { now = now.plus(d); }

        @Override public ZoneId getZone() { return ZoneOffset.UTC; }
        @Override public Clock withZone(ZoneId zone) { return this; }
        @Override public Instant instant() { return now; }
    }
}
