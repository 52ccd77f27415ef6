/* (C)2026 */
package com.ammann.updatetracker.model;

/**
 * Outcome of checking one container's image against its registry.
 *
 * @param latestDigest the digest the registry reports, {@code null} unless found
 * @param latestTag    the tag that was resolved, {@code null} unless found
 * @param error        why the check produced no digest, {@code null} on success
 * @param message      detail for the error, {@code null} on success
 */
public record UpdateCheckResult(
        String latestDigest, String latestTag, CheckError error, String message) {

    /** Failure categories of a registry check. */
    public enum CheckError {
        /** The image or tag does not exist in the registry; conclusive. */
        NOT_FOUND,
        /** The registry refused the request because of rate limiting. */
        RATE_LIMITED,
        /** Any other failure, including timeouts. */
        FAILED
    }

    public static UpdateCheckResult found(String digest, String tag) {
        return new UpdateCheckResult(digest, tag, null, null);
    }

    public static UpdateCheckResult notFound(String message) {
        return new UpdateCheckResult(null, null, CheckError.NOT_FOUND, message);
    }

    public static UpdateCheckResult rateLimited(String message) {
        return new UpdateCheckResult(null, null, CheckError.RATE_LIMITED, message);
    }

    public static UpdateCheckResult failed(String message) {
        return new UpdateCheckResult(null, null, CheckError.FAILED, message);
    }

    public boolean isSuccess() {
        return error == null;
    }
}
