/* (C)2026 */
package com.ammann.updatetracker.exception;

/**
 * Runtime exception thrown when an upgrade is attempted on a blacklisted container.
 *
 * <p>Containers may be blacklisted by their identifier, name, or image name via
 * {@code tracker.upgrade.blacklist}. This exception is mapped to an HTTP 403 Forbidden response
 * by {@link ServiceBlacklistedExceptionMapper}.
 */
public class ServiceBlacklistedException extends RuntimeException {

    private final String instance;
    private final String containerId;

    /**
     * Constructs a new exception for the given container.
     *
     * @param instance    the instance the container runs on
     * @param containerId the identifier of the blacklisted container
     */
    public ServiceBlacklistedException(String instance, String containerId) {
        super("Container is blacklisted and cannot be upgraded: " + instance + "/" + containerId);
        this.instance = instance;
        this.containerId = containerId;
    }

    public String getInstance() {
        return instance;
    }

    /**
     * Returns the identifier of the blacklisted container.
     *
     * @return the container identifier
     */
    public String getContainerId() {
        return containerId;
    }
}
