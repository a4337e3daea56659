package io.github.drompincen.channelhub.runtime.ratelimit;

import java.time.Instant;

public record RateLimitResult(boolean allowed, int remaining, Instant resetAt) {}
