package io.github.drompincen.channelhub.runtime.connector;

import io.github.drompincen.channelhub.runtime.config.ChannelHubProperties;

import java.time.Duration;

/**
 * Bounded exponential backoff for polling and socket loops: {@code min(initial * 2^n, max)} for at
 * most {@code maxAttempts} consecutive failures. Not thread-safe; each loop owns one.
 */
public class ReconnectBackoff {

    private final int maxAttempts;
    private final Duration initialDelay;
    private final Duration maxDelay;
    private int attempts;

    public ReconnectBackoff(ChannelHubProperties.Reconnect policy) {
        this(policy.maxAttempts(), policy.initialDelay(), policy.maxDelay());
    }

    public ReconnectBackoff(int maxAttempts, Duration initialDelay, Duration maxDelay) {
        this.maxAttempts = maxAttempts;
        this.initialDelay = initialDelay;
        this.maxDelay = maxDelay;
    }

    public boolean exhausted() {
        return attempts >= maxAttempts;
    }

    public int attempts() {
        return attempts;
    }

    /** Delay before the next attempt; counts as one attempt. */
    public Duration nextDelay() {
        if (exhausted()) {
            throw new IllegalStateException("Reconnect attempts exhausted after " + attempts);
        }
        long factor = 1L << Math.min(attempts, 20);
        Duration delay = initialDelay.multipliedBy(factor);
        attempts++;
        return delay.compareTo(maxDelay) > 0 ? maxDelay : delay;
    }

    public void reset() {
        attempts = 0;
    }
}
