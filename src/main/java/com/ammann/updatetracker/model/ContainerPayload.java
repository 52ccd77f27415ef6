/* (C)2026 */
package com.ammann.updatetracker.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * The cached collection of tracked containers.
 *
 * <p>Only the items and the per-instance unused image counts are stored; the stack grouping
 * and the total unused count are derived from them whenever they are requested.
 *
 * @param items                  the tracked containers in listing order
 * @param unusedImagesByInstance the number of images no container uses, per instance
 */
public record ContainerPayload(
        List<TrackedItem> items, Map<String, Integer> unusedImagesByInstance) {

    public ContainerPayload {
        items = items == null ? List.of() : List.copyOf(items);
        unusedImagesByInstance =
                unusedImagesByInstance == null
                        ? Map.of()
                        : Map.copyOf(unusedImagesByInstance);
    }

    /** Returns an empty payload. */
    public static ContainerPayload empty() {
        return new ContainerPayload(List.of(), Map.of());
    }

    /**
     * Groups the items by stack. Named stacks are sorted by name and containers outside any
     * stack are collected in a trailing {@link StackGroup#UNSTACKED} group.
     *
     * @return the stack groups
     */
    @JsonIgnore
    public List<StackGroup> stacks() {
        Map<String, List<TrackedItem>> named = new TreeMap<>();
        List<TrackedItem> unstacked = new ArrayList<>();
        for (TrackedItem item : items) {
            String key = item.ownerGroupKey();
            if (key == null || key.isBlank()) {
                unstacked.add(item);
            } else {
                named.computeIfAbsent(key, k -> new ArrayList<>()).add(item);
            }
        }

        List<StackGroup> groups = new ArrayList<>();
        named.forEach((name, members) -> groups.add(new StackGroup(name, members)));
        if (!unstacked.isEmpty()) {
            groups.add(new StackGroup(StackGroup.UNSTACKED, unstacked));
        }
        return groups;
    }

    /** Returns the number of unused images across all instances. */
    @JsonIgnore
    public int unusedCount() {
        return unusedImagesByInstance.values().stream().mapToInt(Integer::intValue).sum();
    }

    /**
     * Restricts the payload to one instance.
     *
     * @param instance the instance name, or {@code null} for no restriction
     * @return the filtered payload
     */
    public ContainerPayload forInstance(String instance) {
        if (instance == null) {
            return this;
        }
        Map<String, Integer> unused = new LinkedHashMap<>();
        Integer count = unusedImagesByInstance.get(instance);
        if (count != null) {
            unused.put(instance, count);
        }
        return new ContainerPayload(
                items.stream().filter(item -> instance.equals(item.instance())).toList(), unused);
    }
}
