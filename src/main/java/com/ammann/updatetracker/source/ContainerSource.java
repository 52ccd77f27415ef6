/* (C)2026 */
package com.ammann.updatetracker.source;

import java.util.List;

/**
 * Cheap source of truth for which containers exist right now. Never consults a registry.
 */
public interface ContainerSource {

    /** Returns the names of all instances this source can list. */
    List<String> instances();

    /**
     * Lists the containers of one instance or of all instances.
     *
     * @param scope the instance to list, or {@code null} for all instances
     * @return the listed containers; instances that could not be reached are left out
     * @throws com.ammann.updatetracker.exception.UnknownInstanceException if the scope names no
     *     configured instance
     * @throws com.ammann.updatetracker.exception.SourceUnavailableException if no requested
     *     instance could be reached
     */
    ContainerSnapshot listCurrent(String scope);
}
