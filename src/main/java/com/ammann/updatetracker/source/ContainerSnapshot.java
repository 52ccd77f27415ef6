/* (C)2026 */
package com.ammann.updatetracker.source;

import com.ammann.updatetracker.model.ContainerPayload;
import com.ammann.updatetracker.model.TrackedItem;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Result of listing containers.
 *
 * @param items                  the containers, without registry data
 * @param unusedImagesByInstance images no container uses, per listed instance
 * @param listedInstances        the instances that were listed completely
 */
public record ContainerSnapshot(
        List<TrackedItem> items,
        Map<String, Integer> unusedImagesByInstance,
        Set<String> listedInstances) {

    public ContainerSnapshot {
        items = items == null ? List.of() : List.copyOf(items);
        unusedImagesByInstance =
                unusedImagesByInstance == null ? Map.of() : Map.copyOf(unusedImagesByInstance);
        listedInstances = listedInstances == null ? Set.of() : Set.copyOf(listedInstances);
    }

    public ContainerPayload toPayload() {
        return new ContainerPayload(items, unusedImagesByInstance);
    }
}
