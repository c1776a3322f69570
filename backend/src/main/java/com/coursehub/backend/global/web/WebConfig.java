package com.coursehub.backend.global.web;

import java.time.Duration;
import java.util.List;

import com.coursehub.backend.modules.audit.application.SecurityEventLogger;
import com.coursehub.backend.modules.ratelimit.application.SlidingWindowRateLimiter;
import com.coursehub.backend.modules.ratelimit.domain.RateLimitPolicy;
import com.coursehub.backend.modules.ratelimit.presentation.RateLimitGate;

import org.springframework.boot.convert.DurationStyle;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Puts a rate-limit gate in front of every sensitive authentication endpoint. Each endpoint
 * reads its own limits from {@code app.rate-limit.<scope>.*} and falls back to
 * {@link RateLimitPolicy#DEFAULT}.
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {

    static final List<GatedEndpoint> GATED_ENDPOINTS = List.of(
            new GatedEndpoint("login", "/auth/login"),
            new GatedEndpoint("register", "/auth/register"),
            new GatedEndpoint("forgot-password", "/auth/forgot-password"),
            new GatedEndpoint("reset-password", "/auth/reset-password")
    );

    private final SlidingWindowRateLimiter rateLimiter;
    private final SecurityEventLogger securityEventLogger;
    private final Environment environment;

    public WebConfig(SlidingWindowRateLimiter rateLimiter,
                     SecurityEventLogger securityEventLogger,
                     Environment environment) {
        this.rateLimiter = rateLimiter;
        this.securityEventLogger = securityEventLogger;
        this.environment = environment;
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        if (!environment.getProperty("app.rate-limit.enabled", Boolean.class, true)) {
            return;
        }
        for (GatedEndpoint endpoint : GATED_ENDPOINTS) {
            RateLimitGate gate = new RateLimitGate(endpoint.scope(), policyFor(endpoint.scope()), rateLimiter, securityEventLogger);
            registry.addInterceptor(new RequestGateInterceptor(List.of(gate)))
                    .addPathPatterns(endpoint.path());
        }
    }

    RateLimitPolicy policyFor(String scope) {
        String prefix = "app.rate-limit." + scope + ".";
        RateLimitPolicy defaults = RateLimitPolicy.DEFAULT;
        return new RateLimitPolicy(
                environment.getProperty(prefix + "max-requests", Integer.class, defaults.maxRequests()),
                durationProperty(prefix + "window", defaults.window()),
                durationProperty(prefix + "block", defaults.blockDuration())
        );
    }

    private Duration durationProperty(String key, Duration fallback) {
        String value = environment.getProperty(key);
        return value == null || value.isBlank() ? fallback : DurationStyle.detectAndParse(value.trim());
    }

    record GatedEndpoint(String scope, String path) {
    }
}
