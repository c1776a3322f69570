package com.coursehub.backend.global.web;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

import java.time.Duration;

import com.coursehub.backend.modules.audit.application.SecurityEventLogger;
import com.coursehub.backend.modules.ratelimit.application.SlidingWindowRateLimiter;
import com.coursehub.backend.modules.ratelimit.domain.RateLimitPolicy;

import org.junit.jupiter.api.Test;
import org.springframework.mock.env.MockEnvironment;

class WebConfigTest {

    @Test
    void policyFallsBackToDefaults() {
        WebConfig config = new WebConfig(mock(SlidingWindowRateLimiter.class), mock(SecurityEventLogger.class),
                new MockEnvironment());

        assertThat(config.policyFor("login")).isEqualTo(RateLimitPolicy.DEFAULT);
    }

    @Test
    void policyReadsPerScopeOverrides() {
        MockEnvironment environment = new MockEnvironment()
                .withProperty("app.rate-limit.forgot-password.max-requests", "3")
                .withProperty("app.rate-limit.forgot-password.window", "PT10M")
                .withProperty("app.rate-limit.forgot-password.block", "PT1H");
        WebConfig config = new WebConfig(mock(SlidingWindowRateLimiter.class), mock(SecurityEventLogger.class), environment);

        assertThat(config.policyFor("forgot-password"))
                .isEqualTo(new RateLimitPolicy(3, Duration.ofMinutes(10), Duration.ofHours(1)));
        assertThat(config.policyFor("login")).isEqualTo(RateLimitPolicy.DEFAULT);
    }
}
