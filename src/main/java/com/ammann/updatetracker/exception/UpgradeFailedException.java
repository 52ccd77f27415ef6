/* (C)2026 */
package com.ammann.updatetracker.exception;

/**
 * Runtime exception thrown when recreating a container with its latest image fails.
 * Mapped to HTTP 500 by {@link UpgradeFailedExceptionMapper}.
 */
public class UpgradeFailedException extends RuntimeException {

    private final String containerName;

    public UpgradeFailedException(String containerName, String message, Throwable cause) {
        super(message, cause);
        this.containerName = containerName;
    }

    public String getContainerName() {
        return containerName;
    }
}
