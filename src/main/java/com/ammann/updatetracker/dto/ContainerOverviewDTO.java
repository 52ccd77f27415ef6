/* (C)2026 */
package com.ammann.updatetracker.dto;

import com.ammann.updatetracker.model.CacheEntry;
import com.ammann.updatetracker.model.CacheMetadata;
import com.ammann.updatetracker.model.ContainerPayload;
import com.ammann.updatetracker.model.StackGroup;
import com.ammann.updatetracker.model.TrackedItem;
import java.util.List;

/**
 * View of the tracked containers returned to clients.
 *
 * @param items       the tracked containers, each with its derived update flag
 * @param stacks      the containers grouped by stack
 * @param unusedCount the number of images no container uses
 * @param metadata    when the containers and the registry were last consulted
 */
public record ContainerOverviewDTO(
        List<TrackedItem> items,
        List<StackGroup> stacks,
        int unusedCount,
        CacheMetadata metadata) {

    /**
     * Builds the view of a cache entry, optionally restricted to one instance.
     *
     * @param entry    the cache entry
     * @param instance the instance to restrict to, or {@code null}
     * @return the view
     */
    public static ContainerOverviewDTO from(CacheEntry entry, String instance) {
        ContainerPayload payload = entry.payload().forInstance(instance);
        return new ContainerOverviewDTO(
                payload.items(), payload.stacks(), payload.unusedCount(), entry.metadata());
    }
}
