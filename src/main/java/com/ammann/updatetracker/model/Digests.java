/* (C)2026 */
package com.ammann.updatetracker.model;

import java.util.Locale;

/** Helpers for comparing image digests reported in different notations. */
public final class Digests {

    private Digests() {}

    /**
     * Normalizes a digest for comparison: strips an optional {@code repo@} prefix and the
     * {@code sha256:} algorithm prefix, trims and lower-cases.
     *
     * @param digest the digest, possibly {@code null}
     * @return the normalized digest, or {@code null} if none was given
     */
    public static String normalize(String digest) {
        if (digest == null || digest.isBlank()) {
            return null;
        }
        String value = digest.trim();
        int at = value.lastIndexOf('@');
        if (at >= 0) {
            value = value.substring(at + 1);
        }
        value = value.toLowerCase(Locale.ROOT);
        if (value.startsWith("sha256:")) {
            value = value.substring("sha256:".length());
        }
        return value.isEmpty() ? null : value;
    }

    /**
     * Extracts the digest part of a {@code RepoDigests} entry.
     *
     * @param repoDigest an entry such as {@code nginx@sha256:abc}
     * @return the digest ({@code sha256:abc}), or the input if it has no repository part
     */
    public static String digestOf(String repoDigest) {
        if (repoDigest == null) {
            return null;
        }
        int at = repoDigest.lastIndexOf('@');
        return at >= 0 ? repoDigest.substring(at + 1) : repoDigest;
    }
}
