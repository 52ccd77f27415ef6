/* (C)2026 */
package com.ammann.updatetracker.schedule;

import com.ammann.updatetracker.config.TrackerConfig;
import com.ammann.updatetracker.model.RunRecord;
import com.ammann.updatetracker.model.RunStatus;
import com.ammann.updatetracker.model.ScheduleState;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Computes when a recurring job runs next.
 *
 * <p>The next run is anchored on the latest completed run of the job, or on the running run if
 * none has completed. A job that never ran is anchored on the moment its schedule was first
 * computed. The result is memoized on {@code (anchor, interval)}: as long as neither changes,
 * the previously computed time is returned exactly, so the schedule does not creep forward
 * while it is being polled.
 */
@ApplicationScoped
public class ScheduleCalculator {

    private static final long MILLIS_PER_MINUTE = 60_000L;

    @Inject Clock clock;

    /**
     * Computes the schedule of a job.
     *
     * @param job     the job configuration, {@code null} if the job is not configured
     * @param runs    recent runs, of any job type
     * @param jobType the job to compute the schedule for
     * @param memo    the previously computed state, {@code null} on the first call
     * @return the new state; {@link ScheduleState#nextRun()} is empty when the job is disabled
     *     or has no interval
     */
    public ScheduleState computeNext(
            TrackerConfig.Job job, List<RunRecord> runs, String jobType, ScheduleState memo) {
        boolean enabled = job != null && job.enabled();
        Integer interval = job != null ? job.intervalMinutes().orElse(null) : null;
        if (!enabled || interval == null || interval < 1) {
            return ScheduleState.cleared(enabled, interval);
        }

        Anchor anchor = findAnchor(runs, jobType);
        if (memo != null && memo.isAnchoredAt(anchor.id(), interval)) {
            return memo;
        }

        long anchorMs = anchor.timeMs() != null ? anchor.timeMs() : clock.millis();
        return new ScheduleState(
                true, interval, anchor.id(), interval, anchorMs + interval * MILLIS_PER_MINUTE);
    }

    private static Anchor findAnchor(List<RunRecord> runs, String jobType) {
        Optional<RunRecord> completed =
                latest(runs, jobType, RunStatus.COMPLETED, RunRecord::completedAt);
        if (completed.isPresent()) {
            RunRecord run = completed.get();
            return new Anchor(String.valueOf(run.id()), run.completedAt().toEpochMilli());
        }
        Optional<RunRecord> running =
                latest(runs, jobType, RunStatus.RUNNING, RunRecord::startedAt);
        if (running.isPresent()) {
            RunRecord run = running.get();
            return new Anchor(String.valueOf(run.id()), run.startedAt().toEpochMilli());
        }
        return new Anchor(ScheduleState.NO_RUN_ANCHOR, null);
    }

    private static Optional<RunRecord> latest(
            List<RunRecord> runs,
            String jobType,
            RunStatus status,
            Function<RunRecord, Instant> time) {
        return runs.stream()
                .filter(run -> jobType.equals(run.jobType()))
                .filter(run -> run.status() == status)
                .filter(run -> time.apply(run) != null)
                .max(Comparator.comparing(time).thenComparingLong(RunRecord::id));
    }

    private record Anchor(String id, Long timeMs) {}
}
