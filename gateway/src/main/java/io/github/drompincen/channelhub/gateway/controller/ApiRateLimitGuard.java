package io.github.drompincen.channelhub.gateway.controller;

import io.github.drompincen.channelhub.runtime.error.RateLimitExceededException;
import io.github.drompincen.channelhub.runtime.ratelimit.RateLimitResult;
import io.github.drompincen.channelhub.runtime.ratelimit.RateLimitRule;
import io.github.drompincen.channelhub.runtime.ratelimit.RateLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Per-tenant budget for management calls that open connections or start OAuth flows. */
@Component
public class ApiRateLimitGuard {

    static final String BUCKET = "channel-api";

    private static final Logger log = LoggerFactory.getLogger(ApiRateLimitGuard.class);

    private final RateLimiter rateLimiter;

    public ApiRateLimitGuard(RateLimiter rateLimiter) {
        this.rateLimiter = rateLimiter;
    }

    public void check(String tenantId) {
        RateLimitResult result = rateLimiter.check("tenant:" + tenantId, BUCKET, RateLimitRule.API);
        if (!result.allowed()) {
            log.warn("Channel API rate limit exceeded for tenant {}", tenantId);
            throw new RateLimitExceededException("Too many channel requests. Try again later.", result.resetAt());
        }
    }
}
