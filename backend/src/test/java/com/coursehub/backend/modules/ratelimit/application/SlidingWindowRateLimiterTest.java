package com.coursehub.backend.modules.ratelimit.application;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import com.coursehub.backend.modules.ratelimit.domain.RateLimitPolicy;
import com.coursehub.backend.support.MutableClock;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SlidingWindowRateLimiterTest {

    private static final RateLimitPolicy POLICY = RateLimitPolicy.ofSeconds(5, 300, 900);
    private static final String CLIENT = "203.0.113.7";

    private MutableClock clock;
    private SlidingWindowRateLimiter rateLimiter;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-03-01T10:00:00Z");
        rateLimiter = new SlidingWindowRateLimiter(clock);
    }

    @Test
    void admitsUpToLimitThenBlocks() {
        for (int i = 0; i < 5; i++) {
            assertThat(rateLimiter.isAllowed(CLIENT, POLICY)).as("request %d", i + 1).isTrue();
            clock.advance(Duration.ofSeconds(10));
        }

        assertThat(rateLimiter.isAllowed(CLIENT, POLICY)).isFalse();
        assertThat(rateLimiter.isBlocked(CLIENT)).isTrue();
    }

    @Test
    void blockHoldsForFullDurationEvenAfterWindowEmpties() {
        exhaust(CLIENT);
        assertThat(rateLimiter.isAllowed(CLIENT, POLICY)).isFalse();

        // window (300s) has long passed, block (900s) has not
        clock.advance(Duration.ofSeconds(899));
        assertThat(rateLimiter.isAllowed(CLIENT, POLICY)).isFalse();

        clock.advance(Duration.ofSeconds(1));
        assertThat(rateLimiter.isAllowed(CLIENT, POLICY)).isTrue();
        assertThat(rateLimiter.isBlocked(CLIENT)).isFalse();
        assertThat(rateLimiter.remaining(CLIENT, POLICY)).isEqualTo(4);
    }

    @Test
    void rejectedRequestsAreNotCounted() {
        RateLimitPolicy noBlock = RateLimitPolicy.ofSeconds(2, 60, 0);
        assertThat(rateLimiter.isAllowed(CLIENT, noBlock)).isTrue();
        assertThat(rateLimiter.isAllowed(CLIENT, noBlock)).isTrue();
        assertThat(rateLimiter.isAllowed(CLIENT, noBlock)).isFalse();
        assertThat(rateLimiter.isAllowed(CLIENT, noBlock)).isFalse();

        // only the two admitted requests occupy the window
        clock.advance(Duration.ofSeconds(61));
        assertThat(rateLimiter.remaining(CLIENT, noBlock)).isEqualTo(2);
    }

    @Test
    void windowSlidesRatherThanResettingOnBoundaries() {
        RateLimitPolicy policy = RateLimitPolicy.ofSeconds(2, 60, 0);
        assertThat(rateLimiter.isAllowed(CLIENT, policy)).isTrue();
        clock.advance(Duration.ofSeconds(40));
        assertThat(rateLimiter.isAllowed(CLIENT, policy)).isTrue();

        clock.advance(Duration.ofSeconds(21));
        assertThat(rateLimiter.remaining(CLIENT, policy)).isEqualTo(1);
        assertThat(rateLimiter.isAllowed(CLIENT, policy)).isTrue();
        assertThat(rateLimiter.remaining(CLIENT, policy)).isZero();
    }

    @Test
    void remainingIgnoresBlockAndNeverGoesNegative() {
        assertThat(rateLimiter.remaining(CLIENT, POLICY)).isEqualTo(5);
        exhaust(CLIENT);
        rateLimiter.isAllowed(CLIENT, POLICY);

        assertThat(rateLimiter.isBlocked(CLIENT)).isTrue();
        assertThat(rateLimiter.remaining(CLIENT, POLICY)).isZero();

        clock.advance(Duration.ofSeconds(301));
        assertThat(rateLimiter.remaining(CLIENT, POLICY)).isEqualTo(5);
    }

    @Test
    void identifiersAreIndependent() {
        exhaust(CLIENT);
        assertThat(rateLimiter.isAllowed(CLIENT, POLICY)).isFalse();

        assertThat(rateLimiter.isAllowed("198.51.100.1", POLICY)).isTrue();
    }

    @Test
    void resetDropsAllState() {
        exhaust(CLIENT);
        rateLimiter.isAllowed(CLIENT, POLICY);

        rateLimiter.reset(CLIENT);

        assertThat(rateLimiter.isBlocked(CLIENT)).isFalse();
        assertThat(rateLimiter.isAllowed(CLIENT, POLICY)).isTrue();
    }

    @Test
    void idleClientsAreEvicted() {
        rateLimiter.isAllowed(CLIENT, POLICY);
        assertThat(rateLimiter.trackedClients()).isEqualTo(1);

        clock.advance(Duration.ofSeconds(301));
        rateLimiter.remaining(CLIENT, POLICY);

        assertThat(rateLimiter.trackedClients()).isZero();
    }

    @Test
    void idleClientsAreSweptOnTheRequestPath() {
        for (int i = 0; i < 10_000; i++) {
            rateLimiter.isAllowed("10.0." + (i / 256) + "." + (i % 256), POLICY);
        }
        assertThat(rateLimiter.trackedClients()).isEqualTo(10_000);

        clock.advance(Duration.ofDays(1));
        assertThat(rateLimiter.isAllowed(CLIENT, POLICY)).isTrue();

        assertThat(rateLimiter.trackedClients()).isEqualTo(1);
    }

    @Test
    void sweepKeepsBlockedAndActiveClients() {
        exhaust(CLIENT);
        assertThat(rateLimiter.isAllowed(CLIENT, POLICY)).isFalse();
        rateLimiter.isAllowed("198.51.100.1", POLICY);

        // both windows have emptied but the block still runs
        clock.advance(Duration.ofSeconds(301));
        rateLimiter.isAllowed("198.51.100.2", POLICY);

        assertThat(rateLimiter.trackedClients()).isEqualTo(2);
        assertThat(rateLimiter.isBlocked(CLIENT)).isTrue();
        assertThat(rateLimiter.isAllowed(CLIENT, POLICY)).isFalse();
    }

    @Test
    void concurrentRequestsFromOneClientAreNotOverAdmitted() throws Exception {
        int threads = 16;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Boolean>> results = new ArrayList<>();
            for (int i = 0; i < threads * 4; i++) {
                Callable<Boolean> attempt = () -> {
                    start.await();
                    return rateLimiter.isAllowed(CLIENT, POLICY);
                };
                results.add(executor.submit(attempt));
            }
            start.countDown();

            int admitted = 0;
            for (Future<Boolean> result : results) {
                if (result.get(10, TimeUnit.SECONDS)) {
                    admitted++;
                }
            }
            assertThat(admitted).isEqualTo(POLICY.maxRequests());
        } finally {
            executor.shutdownNow();
        }
    }

    private void exhaust(String clientId) {
        for (int i = 0; i < POLICY.maxRequests(); i++) {
            assertThat(rateLimiter.isAllowed(clientId, POLICY)).isTrue();
        }
    }
}
