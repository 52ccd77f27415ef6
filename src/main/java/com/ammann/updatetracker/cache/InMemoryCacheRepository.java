/* (C)2026 */
package com.ammann.updatetracker.cache;

import com.ammann.updatetracker.model.CacheEntry;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/** Cache repository that keeps entries in memory; contents are lost on restart. */
public class InMemoryCacheRepository implements CacheRepository {

    private final Map<String, CacheEntry> entries = new ConcurrentHashMap<>();

    @Override
    public Optional<CacheEntry> read(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    @Override
    public void write(CacheEntry entry) {
        entries.put(entry.key(), entry);
    }

    @Override
    public void delete(String key) {
        entries.remove(key);
    }
}
