package io.github.drompincen.channelhub.runtime.ratelimit;

public record RateLimitRule(int limit, long windowSeconds) {

    public static final RateLimitRule CHAT = new RateLimitRule(30, 60);
    public static final RateLimitRule API = new RateLimitRule(100, 60);

    public RateLimitRule {
        if (limit <= 0) throw new IllegalArgumentException("limit must be positive");
        if (windowSeconds <= 0) throw new IllegalArgumentException("windowSeconds must be positive");
    }
}
