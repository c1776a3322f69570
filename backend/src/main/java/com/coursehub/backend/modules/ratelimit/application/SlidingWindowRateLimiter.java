package com.coursehub.backend.modules.ratelimit.application;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicReference;

import com.coursehub.backend.modules.ratelimit.domain.ClientWindow;
import com.coursehub.backend.modules.ratelimit.domain.RateLimitPolicy;

import org.springframework.stereotype.Component;

/**
 * Sliding-window request counter with a temporary block list, keyed by client identifier.
 *
 * <p>State lives in this instance; one instance is created at startup and shared by every gate.
 * Each identifier's prune/count/append/block sequence runs inside {@link ConcurrentMap#compute},
 * so concurrent requests from the same identifier cannot be over-admitted while different
 * identifiers proceed in parallel.
 *
 * <p>Identifiers with nothing left in their window and no block in force are swept on the request
 * path at most once per {@link #SWEEP_INTERVAL}.
 *
 * <p>State is not shared across processes and is lost on restart.
 */
@Component
public class SlidingWindowRateLimiter {

    static final Duration SWEEP_INTERVAL = Duration.ofMinutes(1);

    private final ConcurrentMap<String, ClientWindow> windows = new ConcurrentHashMap<>();
    private final AtomicReference<Instant> nextSweepAt = new AtomicReference<>();
    private final Clock clock;

    public SlidingWindowRateLimiter(Clock clock) {
        this.clock = clock;
    }

    /**
     * Admits and records the request, or rejects it. The request that trips the limit is not
     * recorded; it starts a block of {@link RateLimitPolicy#blockDuration()}.
     */
    public boolean isAllowed(String clientId, RateLimitPolicy policy) {
        Instant now = clock.instant();
        sweepIfDue(now);
        boolean[] allowed = new boolean[1];
        windows.compute(clientId, (key, window) -> {
            ClientWindow current = window != null ? window : new ClientWindow();
            allowed[0] = current.tryAcquire(now, policy);
            return current;
        });
        return allowed[0];
    }

    /**
     * Requests left in the current window, ignoring any block.
     */
    public int remaining(String clientId, RateLimitPolicy policy) {
        Instant now = clock.instant();
        int[] remaining = {policy.maxRequests()};
        windows.computeIfPresent(clientId, (key, window) -> {
            remaining[0] = window.remaining(now, policy);
            return window.isIdle(now) ? null : window;
        });
        return remaining[0];
    }

    public boolean isBlocked(String clientId) {
        Instant now = clock.instant();
        boolean[] blocked = new boolean[1];
        windows.computeIfPresent(clientId, (key, window) -> {
            blocked[0] = window.isBlocked(now);
            return window;
        });
        return blocked[0];
    }

    public void reset(String clientId) {
        windows.remove(clientId);
    }

    public int trackedClients() {
        return windows.size();
    }

    private void sweepIfDue(Instant now) {
        Instant due = nextSweepAt.get();
        if (due == null) {
            nextSweepAt.compareAndSet(null, now.plus(SWEEP_INTERVAL));
            return;
        }
        if (now.isBefore(due) || !nextSweepAt.compareAndSet(due, now.plus(SWEEP_INTERVAL))) {
            return;
        }
        for (String clientId : windows.keySet()) {
            windows.computeIfPresent(clientId, (key, window) -> window.isIdle(now) ? null : window);
        }
    }
}
