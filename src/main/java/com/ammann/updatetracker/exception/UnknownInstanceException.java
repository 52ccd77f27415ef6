/* (C)2026 */
package com.ammann.updatetracker.exception;

/**
 * Runtime exception thrown when a request names a container host that is not configured.
 * Mapped to HTTP 404 by {@link UnknownInstanceExceptionMapper}.
 */
public class UnknownInstanceException extends RuntimeException {

    private final String instance;

    public UnknownInstanceException(String instance) {
        super("Unknown instance: " + instance);
        this.instance = instance;
    }

    public String getInstance() {
        return instance;
    }
}
