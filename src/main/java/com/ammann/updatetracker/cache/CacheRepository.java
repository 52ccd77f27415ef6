/* (C)2026 */
package com.ammann.updatetracker.cache;

import com.ammann.updatetracker.model.CacheEntry;
import java.util.Optional;

/**
 * Key/value storage behind {@link CacheStore}. Implementations make a single {@link #write}
 * atomic; read-modify-write sequences are serialized by the store.
 */
public interface CacheRepository {

    Optional<CacheEntry> read(String key);

    void write(CacheEntry entry);

    void delete(String key);
}
