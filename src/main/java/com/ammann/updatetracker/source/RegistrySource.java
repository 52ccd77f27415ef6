/* (C)2026 */
package com.ammann.updatetracker.source;

import com.ammann.updatetracker.model.TrackedItem;
import com.ammann.updatetracker.model.UpdateCheckResult;

/**
 * Expensive, rate-limited source of truth for the latest image of a container. Callers pass
 * every call through {@link com.ammann.updatetracker.ratelimit.RateGate}.
 */
public interface RegistrySource {

    /**
     * Resolves the latest digest of the container's image. Failures are reported in the result
     * rather than thrown.
     *
     * @param item the container to check
     * @return the check outcome
     */
    UpdateCheckResult checkUpdate(TrackedItem item);
}
