/* (C)2026 */
package com.ammann.updatetracker.model;

import java.time.Instant;

/**
 * Refresh timestamps attached to a cache entry.
 *
 * @param lastCheapRefresh     when the container hosts were last listed
 * @param lastExpensiveRefresh when the registry was last consulted, {@code null} if never
 */
public record CacheMetadata(Instant lastCheapRefresh, Instant lastExpensiveRefresh) {

    public static CacheMetadata empty() {
        return new CacheMetadata(null, null);
    }

    /** Metadata patch for a refresh that only listed containers. */
    public static CacheMetadata cheap(Instant at) {
        return new CacheMetadata(at, null);
    }

    /** Metadata patch for a refresh that listed containers and consulted the registry. */
    public static CacheMetadata full(Instant at) {
        return new CacheMetadata(at, at);
    }

    /**
     * Merges a patch into this metadata field by field; non-null patch fields win.
     *
     * @param patch the patch, may be {@code null}
     * @return the merged metadata
     */
    public CacheMetadata mergedWith(CacheMetadata patch) {
        if (patch == null) {
            return this;
        }
        return new CacheMetadata(
                patch.lastCheapRefresh() != null ? patch.lastCheapRefresh() : lastCheapRefresh,
                patch.lastExpensiveRefresh() != null
                        ? patch.lastExpensiveRefresh()
                        : lastExpensiveRefresh);
    }
}
