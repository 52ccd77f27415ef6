/* (C)2026 */
package com.ammann.updatetracker.cache;

import com.ammann.updatetracker.model.CacheEntry;
import com.ammann.updatetracker.model.CacheMetadata;
import com.ammann.updatetracker.model.ContainerPayload;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import org.jboss.logging.Logger;

/**
 * Last-known-good store of container payloads, keyed by collection name.
 *
 * <p>Two write operations exist. {@link #merge} applies a partial result: items it does not
 * mention keep their cached state, including update availability obtained by an earlier
 * registry check, and registry fields are only overwritten by items that carry registry data.
 * {@link #replace} stores the result of a complete refresh.
 *
 * <p>Every write is a read-modify-write under a lock for its key, so concurrent merges on the
 * same key never lose updates while different keys proceed independently.
 */
@ApplicationScoped
public class CacheStore {

    @Inject CacheRepository repository;

    @Inject Logger logger;

    private final ConcurrentMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    /**
     * Reads an entry.
     *
     * @param key the cache key
     * @return the entry, or empty if nothing is cached under the key
     */
    public Optional<CacheEntry> get(String key) {
        return repository.read(key);
    }

    /**
     * Merges a partial payload into the entry; see {@link #merge(String, ContainerPayload,
     * CacheMetadata, Set)}. No instance is treated as completely listed, so no item is dropped.
     */
    public CacheEntry merge(String key, ContainerPayload partial, CacheMetadata metadataPatch) {
        return merge(key, partial, metadataPatch, Set.of());
    }

    /**
     * Merges a partial payload into the entry.
     *
     * <p>Items of the partial payload replace their cached counterparts field by field. Cached
     * items absent from it are kept, unless they belong to one of {@code authoritativeInstances},
     * which were listed completely and therefore no longer run them. Metadata fields are merged
     * key by key and unused image counts per instance.
     *
     * @param key                    the cache key
     * @param partial                the freshly fetched items
     * @param metadataPatch          metadata fields to update; {@code null} fields are kept
     * @param authoritativeInstances instances whose listing in {@code partial} is complete
     * @return the entry as written
     */
    public CacheEntry merge(
            String key,
            ContainerPayload partial,
            CacheMetadata metadataPatch,
            Set<String> authoritativeInstances) {
        return update(
                key,
                prior -> {
                    ContainerPayload merged =
                            PayloadMerger.merge(prior.payload(), partial, authoritativeInstances);
                    logger.debugf(
                            "Merged %d items into cache %s (%d cached before, %d after)",
                            partial.items().size(),
                            key,
                            prior.payload().items().size(),
                            merged.items().size());
                    return CacheEntry.of(key, merged, prior.metadata().mergedWith(metadataPatch));
                });
    }

    /**
     * Replaces the payload with the result of a complete refresh. Items no longer present are
     * dropped; items whose registry check produced no result keep their cached registry data.
     *
     * @param key         the cache key
     * @param fullPayload the complete payload
     * @param metadata    the refresh metadata
     * @return the entry as written
     */
    public CacheEntry replace(String key, ContainerPayload fullPayload, CacheMetadata metadata) {
        return update(
                key,
                prior -> {
                    logger.debugf(
                            "Replacing cache %s with %d items", key, fullPayload.items().size());
                    return CacheEntry.of(
                            key,
                            PayloadMerger.carryForward(prior.payload(), fullPayload),
                            prior.metadata().mergedWith(metadata));
                });
    }

    /**
     * Removes an entry.
     *
     * @param key the cache key
     */
    public void clear(String key) {
        ReentrantLock lock = lockFor(key);
        lock.lock();
        try {
            repository.delete(key);
            logger.infof("Cleared cache %s", key);
        } finally {
            lock.unlock();
        }
    }

    private CacheEntry update(String key, Function<CacheEntry, CacheEntry> change) {
        ReentrantLock lock = lockFor(key);
        lock.lock();
        try {
            CacheEntry prior =
                    repository
                            .read(key)
                            .orElseGet(
                                    () ->
                                            CacheEntry.of(
                                                    key,
                                                    ContainerPayload.empty(),
                                                    CacheMetadata.empty()));
            CacheEntry updated = change.apply(prior);
            repository.write(updated);
            return updated;
        } finally {
            lock.unlock();
        }
    }

    private ReentrantLock lockFor(String key) {
        return locks.computeIfAbsent(key, k -> new ReentrantLock());
    }
}
