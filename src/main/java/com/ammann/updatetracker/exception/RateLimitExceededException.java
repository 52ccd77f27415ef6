/* (C)2026 */
package com.ammann.updatetracker.exception;

/**
 * Runtime exception signalling that the registry rate limit was hit and the circuit breaker is
 * open. The condition is retryable; it is never retried automatically.
 *
 * <p>When the breaker opened during a batch, {@link #getProcessed()} and {@link #getTotal()}
 * tell how far the batch got. Mapped to HTTP 429 by {@link RateLimitExceededExceptionMapper}.
 */
public class RateLimitExceededException extends RuntimeException {

    private final int processed;
    private final int total;
    private final long retryAfterSeconds;

    public RateLimitExceededException(String message, long retryAfterSeconds) {
        this(message, 0, 0, retryAfterSeconds);
    }

    /**
     * @param message           the detail message
     * @param processed         items checked before the breaker opened
     * @param total             items the batch contained
     * @param retryAfterSeconds seconds after which a retry may succeed
     */
    public RateLimitExceededException(
            String message, int processed, int total, long retryAfterSeconds) {
        super(message);
        this.processed = processed;
        this.total = total;
        this.retryAfterSeconds = retryAfterSeconds;
    }

    public int getProcessed() {
        return processed;
    }

    public int getTotal() {
        return total;
    }

    public long getRetryAfterSeconds() {
        return retryAfterSeconds;
    }
}
