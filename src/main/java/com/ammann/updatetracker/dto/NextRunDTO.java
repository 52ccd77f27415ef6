/* (C)2026 */
package com.ammann.updatetracker.dto;

import java.time.Instant;

/**
 * Next scheduled run of a batch job.
 *
 * @param jobType         the job type
 * @param description     the configured description of the job, {@code null} if none
 * @param enabled         whether the job is enabled
 * @param intervalMinutes the configured interval, {@code null} if none
 * @param nextRun         when the job runs next, {@code null} if it is not scheduled
 */
public record NextRunDTO(
        String jobType,
        String description,
        boolean enabled,
        Integer intervalMinutes,
        Instant nextRun) {}
