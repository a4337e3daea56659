package io.github.drompincen.channelhub.gateway.controller;

import io.github.drompincen.channelhub.runtime.error.RateLimitExceededException;
import io.github.drompincen.channelhub.runtime.ratelimit.RateLimitRule;
import io.github.drompincen.channelhub.runtime.ratelimit.SlidingWindowRateLimiter;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ApiRateLimitGuardTest {

    @Test
    void throwsOncePerTenantBudgetIsSpent() {
        ApiRateLimitGuard guard = new ApiRateLimitGuard(new SlidingWindowRateLimiter());
        for (int i = 0; i < RateLimitRule.API.limit(); i++) {
            guard.check("u1");
        }

        assertThatThrownBy(() -> guard.check("u1"))
                .isInstanceOfSatisfying(RateLimitExceededException.class,
                        e -> assertThat(e.resetAt()).isNotNull());
        assertThatCode(() -> guard.check("u2")).doesNotThrowAnyException();
    }
}
