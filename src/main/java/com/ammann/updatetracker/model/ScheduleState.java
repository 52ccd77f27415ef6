/* (C)2026 */
package com.ammann.updatetracker.model;

import java.time.Instant;
import java.util.Optional;

/**
 * Memoized schedule of one job type.
 *
 * <p>The next run time is only recomputed when the anchor (the run the schedule is based on) or
 * the interval changes; otherwise {@link #baseScheduledTimeMs()} is returned as it was.
 *
 * @param enabled             whether the job is enabled
 * @param intervalMinutes     the configured interval, {@code null} if none
 * @param lastAnchorId        the run id (or {@link #NO_RUN_ANCHOR}) the time was computed from
 * @param lastAnchorInterval  the interval the time was computed with
 * @param baseScheduledTimeMs the computed next run time in epoch milliseconds
 */
public record ScheduleState(
        boolean enabled,
        Integer intervalMinutes,
        String lastAnchorId,
        Integer lastAnchorInterval,
        Long baseScheduledTimeMs) {

    /** Anchor used while a job has never run. */
    public static final String NO_RUN_ANCHOR = "none";

    public static ScheduleState cleared(boolean enabled, Integer intervalMinutes) {
        return new ScheduleState(enabled, intervalMinutes, null, null, null);
    }

    /** Returns whether this state was computed for the given anchor and interval. */
    public boolean isAnchoredAt(String anchorId, int interval) {
        return baseScheduledTimeMs != null
                && anchorId.equals(lastAnchorId)
                && lastAnchorInterval != null
                && lastAnchorInterval == interval;
    }

    public Optional<Instant> nextRun() {
        return Optional.ofNullable(baseScheduledTimeMs).map(Instant::ofEpochMilli);
    }
}
