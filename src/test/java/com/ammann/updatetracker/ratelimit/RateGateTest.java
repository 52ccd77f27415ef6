/* (C)2026 */
package com.ammann.updatetracker.ratelimit;

import static com.ammann.updatetracker.support.Injection.injectField;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

import com.ammann.updatetracker.support.MutableClock;
import com.ammann.updatetracker.support.TestTrackerConfig;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.jboss.logging.Logger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("RateGate")
class RateGateTest {

    RateGate rateGate;
    TestTrackerConfig config;
    MutableClock clock;

    @BeforeEach
    void setUp() {
        config = new TestTrackerConfig();
        clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        rateGate = create(clock);
    }

    private RateGate create(Clock gateClock) {
        RateGate gate = new RateGate();
        injectField(gate, "config", config);
        injectField(gate, "clock", gateClock);
        injectField(gate, "logger", mock(Logger.class));
        return gate;
    }

    @Nested
    @DisplayName("acquire")
    class Acquire {

        @Test
        @DisplayName("should grant the first caller immediately")
        void shouldGrantFirstCallerImmediately() throws Exception {
            long grant = rateGate.acquire(1000);

            assertThat(grant).isEqualTo(clock.millis());
        }

        @Test
        @DisplayName("should space concurrent grants by at least the minimum spacing")
        void shouldSpaceConcurrentGrants() throws Exception {
            RateGate gate = create(Clock.systemUTC());
            int callers = 6;
            long spacing = 40;
            ExecutorService executor = Executors.newFixedThreadPool(callers);
            CountDownLatch start = new CountDownLatch(1);
            try {
                List<Future<Long>> futures = new ArrayList<>();
                for (int i = 0; i < callers; i++) {
                    futures.add(
                            executor.submit(
                                    () -> {
                                        start.await();
                                        return gate.acquire(spacing);
                                    }));
                }
                start.countDown();

                List<Long> grants = new ArrayList<>();
                for (Future<Long> future : futures) {
                    grants.add(future.get(10, TimeUnit.SECONDS));
                }
                Collections.sort(grants);

                assertThat(grants).doesNotHaveDuplicates();
                for (int i = 1; i < grants.size(); i++) {
                    assertThat(grants.get(i) - grants.get(i - 1))
                            .isGreaterThanOrEqualTo(spacing);
                }
            } finally {
                executor.shutdownNow();
            }
        }
    }

    @Nested
    @DisplayName("circuit breaker")
    class CircuitBreaker {

        @Test
        @DisplayName("should open after five consecutive rate-limit failures")
        void shouldOpenAfterFiveRateLimitFailures() {
            for (int i = 0; i < 4; i++) {
                assertThat(rateGate.recordFailure(true)).isFalse();
                clock.advance(Duration.ofSeconds(5));
            }

            boolean open = rateGate.recordFailure(true);

            assertThat(open).isTrue();
            assertThat(rateGate.isOpen()).isTrue();
            assertThat(rateGate.consecutiveFailures()).isEqualTo(5);
        }

        @Test
        @DisplayName("should reset the count on success")
        void shouldResetCountOnSuccess() {
            for (int i = 0; i < 5; i++) {
                rateGate.recordFailure(true);
            }

            rateGate.recordSuccess();

            assertThat(rateGate.consecutiveFailures()).isZero();
            assertThat(rateGate.isOpen()).isFalse();
        }

        @Test
        @DisplayName("should ignore failures that are not rate limiting")
        void shouldIgnoreOtherFailures() {
            for (int i = 0; i < 10; i++) {
                rateGate.recordFailure(false);
            }

            assertThat(rateGate.consecutiveFailures()).isZero();
            assertThat(rateGate.isOpen()).isFalse();
        }

        @Test
        @DisplayName("should restart the count when the previous failure is outside the window")
        void shouldRestartCountOutsideWindow() {
            for (int i = 0; i < 4; i++) {
                rateGate.recordFailure(true);
            }
            clock.advance(Duration.ofSeconds(61));

            rateGate.recordFailure(true);

            assertThat(rateGate.consecutiveFailures()).isEqualTo(1);
            assertThat(rateGate.isOpen()).isFalse();
        }

        @Test
        @DisplayName("should close once the window passes without further failures")
        void shouldCloseAfterWindow() {
            for (int i = 0; i < 5; i++) {
                rateGate.recordFailure(true);
            }
            assertThat(rateGate.secondsUntilClose()).isEqualTo(60);

            clock.advance(Duration.ofSeconds(61));

            assertThat(rateGate.isOpen()).isFalse();
            assertThat(rateGate.secondsUntilClose()).isZero();
        }

        @Test
        @DisplayName("should honour a configured threshold")
        void shouldHonourConfiguredThreshold() {
            config.failureThreshold = 2;

            rateGate.recordFailure(true);

            assertThat(rateGate.recordFailure(true)).isTrue();
        }
    }
}
