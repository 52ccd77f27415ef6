/* (C)2026 */
package com.ammann.updatetracker.exception;

/**
 * Runtime exception thrown when a request names a batch job type that does not exist.
 * Mapped to HTTP 404 by {@link UnknownJobTypeExceptionMapper}.
 */
public class UnknownJobTypeException extends RuntimeException {

    private final String jobType;

    public UnknownJobTypeException(String jobType) {
        super("Unknown job type: " + jobType);
        this.jobType = jobType;
    }

    public String getJobType() {
        return jobType;
    }
}
