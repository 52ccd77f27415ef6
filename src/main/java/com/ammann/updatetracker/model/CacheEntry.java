/* (C)2026 */
package com.ammann.updatetracker.model;

/**
 * A keyed cache entry: the payload, its refresh metadata and the schema version that wrote it.
 *
 * @param key           the cache key (e.g. {@code containers})
 * @param payload       the cached containers
 * @param metadata      the refresh timestamps
 * @param schemaVersion the payload layout version the entry was written with
 */
public record CacheEntry(
        String key, ContainerPayload payload, CacheMetadata metadata, int schemaVersion) {

    /** Version 2 added the network topology flags. */
    public static final int CURRENT_SCHEMA_VERSION = 2;

    public CacheEntry {
        payload = payload == null ? ContainerPayload.empty() : payload;
        metadata = metadata == null ? CacheMetadata.empty() : metadata;
    }

    public static CacheEntry of(String key, ContainerPayload payload, CacheMetadata metadata) {
        return new CacheEntry(key, payload, metadata, CURRENT_SCHEMA_VERSION);
    }

    /**
     * Returns whether the entry lacks fields the current layout requires: it was written by an
     * older schema version or one of its items has no topology flags.
     *
     * @return {@code true} if the entry must be backfilled from the container hosts
     */
    public boolean hasSchemaDrift() {
        if (schemaVersion < CURRENT_SCHEMA_VERSION) {
            return true;
        }
        return payload.items().stream().anyMatch(item -> !item.hasTopologyFlags());
    }
}
