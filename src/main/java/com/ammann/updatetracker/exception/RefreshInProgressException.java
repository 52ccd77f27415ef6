/* (C)2026 */
package com.ammann.updatetracker.exception;

/**
 * Runtime exception thrown when a full refresh is requested while another one of the same job
 * is still running. Mapped to HTTP 409 by {@link RefreshInProgressExceptionMapper}.
 */
public class RefreshInProgressException extends RuntimeException {

    private final String jobType;

    public RefreshInProgressException(String jobType) {
        super("A " + jobType + " run is already in progress");
        this.jobType = jobType;
    }

    public String getJobType() {
        return jobType;
    }
}
