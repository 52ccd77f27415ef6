/* (C)2026 */
package com.ammann.updatetracker.schedule;

import com.ammann.updatetracker.exception.UnknownJobTypeException;
import java.util.List;

/** Batch job types known to the tracker. */
public final class JobTypes {

    /** Full refresh of all instances against their registries. */
    public static final String REGISTRY_CHECK = "registry-check";

    public static final List<String> ALL = List.of(REGISTRY_CHECK);

    private JobTypes() {}

    /**
     * @throws UnknownJobTypeException if {@code jobType} is not a known job type
     */
    public static String requireKnown(String jobType) {
        if (!ALL.contains(jobType)) {
            throw new UnknownJobTypeException(jobType);
        }
        return jobType;
    }
}
