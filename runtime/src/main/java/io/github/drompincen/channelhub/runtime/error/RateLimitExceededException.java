package io.github.drompincen.channelhub.runtime.error;

import java.time.Instant;

public class RateLimitExceededException extends ChannelException {

    private final Instant resetAt;

    public RateLimitExceededException(String message, Instant resetAt) {
        super("rate_limited", message);
        this.resetAt = resetAt;
    }

    public Instant resetAt() { return resetAt; }
}
