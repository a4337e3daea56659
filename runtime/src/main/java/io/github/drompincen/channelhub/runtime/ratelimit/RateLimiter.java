package io.github.drompincen.channelhub.runtime.ratelimit;

public interface RateLimiter {

    /** Counts one attempt for {@code identifier} in {@code bucket} and reports whether it is allowed. */
    RateLimitResult check(String identifier, String bucket, RateLimitRule rule);
}
