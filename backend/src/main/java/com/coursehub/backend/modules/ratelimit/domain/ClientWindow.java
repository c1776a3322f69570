package com.coursehub.backend.modules.ratelimit.domain;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Mutable per-identifier state: admitted request times in arrival order and an optional block marker.
 * Not thread-safe; the owner serialises access per identifier.
 */
public final class ClientWindow {

    private final Deque<Instant> admitted = new ArrayDeque<>();
    private Instant blockedUntil;
    private Duration lastWindow;

    public boolean tryAcquire(Instant now, RateLimitPolicy policy) {
        if (blockedUntil != null) {
            if (now.isBefore(blockedUntil)) {
                return false;
            }
            blockedUntil = null;
        }

        prune(now, policy);

        if (admitted.size() >= policy.maxRequests()) {
            blockedUntil = now.plus(policy.blockDuration());
            return false;
        }

        admitted.addLast(now);
        return true;
    }

    public int remaining(Instant now, RateLimitPolicy policy) {
        prune(now, policy);
        return Math.max(0, policy.maxRequests() - admitted.size());
    }

    public boolean isBlocked(Instant now) {
        return blockedUntil != null && now.isBefore(blockedUntil);
    }

    /**
     * True when nothing is admitted inside the last window seen and no block is in force, so the
     * window can be dropped without changing any future decision.
     */
    public boolean isIdle(Instant now) {
        if (lastWindow != null) {
            prune(now, lastWindow);
        }
        return admitted.isEmpty() && !isBlocked(now);
    }

    private void prune(Instant now, RateLimitPolicy policy) {
        lastWindow = policy.window();
        prune(now, policy.window());
    }

    private void prune(Instant now, Duration window) {
        Instant cutoff = now.minus(window);
        while (!admitted.isEmpty() && admitted.peekFirst().isBefore(cutoff)) {
            admitted.pollFirst();
        }
    }
}
