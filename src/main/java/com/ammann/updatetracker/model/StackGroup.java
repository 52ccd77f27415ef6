/* (C)2026 */
package com.ammann.updatetracker.model;

import java.util.List;

/**
 * Containers grouped under one stack (compose project or swarm stack namespace).
 *
 * @param name  the stack name, {@link #UNSTACKED} for containers outside any stack
 * @param items the containers of the stack in payload order
 */
public record StackGroup(String name, List<TrackedItem> items) {

    public static final String UNSTACKED = "Unstacked";

    public StackGroup {
        items = items == null ? List.of() : List.copyOf(items);
    }
}
