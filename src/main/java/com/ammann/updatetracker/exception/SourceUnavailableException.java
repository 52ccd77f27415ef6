/* (C)2026 */
package com.ammann.updatetracker.exception;

/**
 * Runtime exception thrown when no container host could be listed and nothing is cached to fall
 * back on. Mapped to HTTP 503 by {@link SourceUnavailableExceptionMapper}.
 */
public class SourceUnavailableException extends RuntimeException {

    public SourceUnavailableException(String message) {
        super(message);
    }

    public SourceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
