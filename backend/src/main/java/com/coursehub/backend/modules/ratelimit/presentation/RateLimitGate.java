package com.coursehub.backend.modules.ratelimit.presentation;

import jakarta.servlet.http.HttpServletRequest;

import com.coursehub.backend.global.error.RetryableProblemException;
import com.coursehub.backend.global.web.GateDecision;
import com.coursehub.backend.global.web.RequestGate;
import com.coursehub.backend.modules.audit.application.SecurityEventLogger;
import com.coursehub.backend.modules.audit.domain.SecurityEventType;
import com.coursehub.backend.modules.ratelimit.application.SlidingWindowRateLimiter;
import com.coursehub.backend.modules.ratelimit.domain.RateLimitPolicy;

import org.springframework.http.HttpStatus;

/**
 * Rejects a client that exceeded {@link RateLimitPolicy} for one scope (login, register, ...).
 * Buckets are keyed by {@code scope:clientId}, so each scope counts independently.
 */
public class RateLimitGate implements RequestGate {

    public static final String CODE = "RATE_LIMIT_EXCEEDED";
    static final String DETAIL = "Rate limit exceeded. Please try again later.";

    private final String scope;
    private final RateLimitPolicy policy;
    private final SlidingWindowRateLimiter rateLimiter;
    private final SecurityEventLogger securityEventLogger;

    public RateLimitGate(String scope,
                         RateLimitPolicy policy,
                         SlidingWindowRateLimiter rateLimiter,
                         SecurityEventLogger securityEventLogger) {
        this.scope = scope;
        this.policy = policy;
        this.rateLimiter = rateLimiter;
        this.securityEventLogger = securityEventLogger;
    }

    @Override
    public GateDecision evaluate(HttpServletRequest request, String clientId) {
        if (rateLimiter.isAllowed(bucketKey(clientId), policy)) {
            return GateDecision.allow();
        }
        securityEventLogger.log(SecurityEventType.RATE_LIMIT_EXCEEDED,
                "Rate limit exceeded for " + scope + " from " + clientId);
        return GateDecision.reject(new RetryableProblemException(
                HttpStatus.TOO_MANY_REQUESTS, CODE, DETAIL, policy.blockDuration().toSeconds()));
    }

    public String bucketKey(String clientId) {
        return scope + ":" + clientId;
    }

    public String scope() {
        return scope;
    }

    public RateLimitPolicy policy() {
        return policy;
    }
}
