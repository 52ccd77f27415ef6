/* (C)2026 */
package com.ammann.updatetracker.ratelimit;

import com.ammann.updatetracker.config.TrackerConfig;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Clock;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import org.jboss.logging.Logger;

/**
 * Throttles outbound registry calls and trips a circuit breaker on repeated rate limiting.
 *
 * <p>{@link #acquire(long)} queues callers on a fair lock and hands out strictly increasing
 * grant times spaced at least the requested interval apart, across all callers. The breaker
 * counts consecutive rate-limit failures; reaching the configured threshold within the failure
 * window opens it until the window passes without another failure or a call succeeds.
 *
 * <p>Breaker state is a single immutable {@link BreakerState} swapped atomically.
 */
@ApplicationScoped
public class RateGate {

    @Inject TrackerConfig config;

    @Inject Clock clock;

    @Inject Logger logger;

    private final ReentrantLock grantLock = new ReentrantLock(true);

    private final AtomicReference<BreakerState> breaker =
            new AtomicReference<>(BreakerState.CLOSED);

    // Guarded by grantLock
    private long lastGrantMs = Long.MIN_VALUE;

    /**
     * Blocks until at least {@code minSpacingMs} has passed since the previous grant.
     *
     * @param minSpacingMs the minimum spacing between two grants, in milliseconds
     * @return the grant time in epoch milliseconds
     * @throws InterruptedException if the caller is interrupted while waiting
     */
    public long acquire(long minSpacingMs) throws InterruptedException {
        long spacing = Math.max(1, minSpacingMs);
        grantLock.lockInterruptibly();
        try {
            long now = clock.millis();
            if (lastGrantMs != Long.MIN_VALUE) {
                long earliest = lastGrantMs + spacing;
                while (now < earliest) {
                    TimeUnit.MILLISECONDS.sleep(earliest - now);
                    now = clock.millis();
                }
            }
            lastGrantMs = now;
            return now;
        } finally {
            grantLock.unlock();
        }
    }

    /** Blocks until the configured minimum spacing has passed since the previous grant. */
    public long acquire() throws InterruptedException {
        return acquire(config.rateGate().minSpacingMs());
    }

    /**
     * Records a failed call. Only rate-limit failures count toward the breaker.
     *
     * @param isRateLimitError whether the registry refused the call because of rate limiting
     * @return whether the breaker is open after recording the failure
     */
    public boolean recordFailure(boolean isRateLimitError) {
        if (!isRateLimitError) {
            return isOpen();
        }
        long now = clock.millis();
        long window = config.rateGate().failureWindow().toMillis();
        BreakerState updated =
                breaker.updateAndGet(
                        state -> {
                            boolean stale =
                                    state.lastFailureMs() != null
                                            && now - state.lastFailureMs() > window;
                            int count = stale ? 1 : state.consecutiveFailures() + 1;
                            return new BreakerState(count, now);
                        });

        boolean open = isOpen();
        if (open) {
            logger.warnf(
                    "Rate limit breaker open after %d consecutive rate-limit failures",
                    updated.consecutiveFailures());
        } else {
            logger.debugf(
                    "Recorded rate-limit failure %d/%d",
                    updated.consecutiveFailures(), config.rateGate().failureThreshold());
        }
        return open;
    }

    /** Resets the consecutive failure count. */
    public void recordSuccess() {
        BreakerState previous = breaker.getAndSet(BreakerState.CLOSED);
        if (previous.consecutiveFailures() > 0) {
            logger.debugf(
                    "Rate limit failure count reset after %d failures",
                    previous.consecutiveFailures());
        }
    }

    /**
     * Returns whether the breaker is open: the failure count reached the threshold and the last
     * failure is still within the window.
     */
    public boolean isOpen() {
        BreakerState state = breaker.get();
        if (state.lastFailureMs() == null
                || state.consecutiveFailures() < config.rateGate().failureThreshold()) {
            return false;
        }
        return clock.millis() - state.lastFailureMs()
                <= config.rateGate().failureWindow().toMillis();
    }

    /** Returns the current consecutive rate-limit failure count. */
    public int consecutiveFailures() {
        return breaker.get().consecutiveFailures();
    }

    /**
     * Returns the seconds until the breaker closes by itself, 0 if it is not open.
     */
    public long secondsUntilClose() {
        BreakerState state = breaker.get();
        if (!isOpen()) {
            return 0;
        }
        long closesAt = state.lastFailureMs() + config.rateGate().failureWindow().toMillis();
        long remaining = closesAt - clock.millis();
        return Math.max(1, TimeUnit.MILLISECONDS.toSeconds(remaining + 999));
    }

    record BreakerState(int consecutiveFailures, Long lastFailureMs) {
        static final BreakerState CLOSED = new BreakerState(0, null);
    }
}
