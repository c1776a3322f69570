package com.coursehub.backend.modules.ratelimit.domain;

import java.time.Duration;
import java.util.Objects;

/**
 * Limits for one call site: at most {@code maxRequests} inside the trailing {@code window};
 * hitting the limit blocks the identifier for {@code blockDuration}.
 */
public record RateLimitPolicy(int maxRequests, Duration window, Duration blockDuration) {

    public static final RateLimitPolicy DEFAULT =
            new RateLimitPolicy(5, Duration.ofSeconds(300), Duration.ofSeconds(900));

    public RateLimitPolicy {
        Objects.requireNonNull(window, "window");
        Objects.requireNonNull(blockDuration, "blockDuration");
        if (maxRequests < 1) {
            throw new IllegalArgumentException("maxRequests must be >= 1");
        }
        if (window.isNegative() || window.isZero()) {
            throw new IllegalArgumentException("window must be positive");
        }
        if (blockDuration.isNegative()) {
            throw new IllegalArgumentException("blockDuration must not be negative");
        }
    }

    public static RateLimitPolicy ofSeconds(int maxRequests, long windowSeconds, long blockSeconds) {
        return new RateLimitPolicy(maxRequests, Duration.ofSeconds(windowSeconds), Duration.ofSeconds(blockSeconds));
    }
}
