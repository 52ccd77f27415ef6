/* (C)2026 */
package com.ammann.updatetracker.schedule;

import com.ammann.updatetracker.config.TrackerConfig;
import com.ammann.updatetracker.ledger.RunLedger;
import com.ammann.updatetracker.model.RunRecord;
import com.ammann.updatetracker.model.ScheduleState;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.jboss.logging.Logger;

/** Owns the memoized {@link ScheduleState} of every job type. */
@ApplicationScoped
public class ScheduleService {

    static final int RUN_HISTORY_DEPTH = 50;

    @Inject TrackerConfig config;

    @Inject RunLedger runLedger;

    @Inject ScheduleCalculator calculator;

    @Inject Logger logger;

    private final ConcurrentMap<String, ScheduleState> states = new ConcurrentHashMap<>();

    /**
     * Returns when a job runs next.
     *
     * @param jobType the job type
     * @return the next run time, empty if the job is disabled or has no interval
     * @throws com.ammann.updatetracker.exception.UnknownJobTypeException if the job type is
     *     unknown
     */
    public Optional<Instant> computeNextScheduledRun(String jobType) {
        return stateOf(jobType).nextRun();
    }

    /**
     * Returns the current schedule state of a job, recomputing it only if its anchor or
     * interval changed.
     */
    public ScheduleState stateOf(String jobType) {
        JobTypes.requireKnown(jobType);
        TrackerConfig.Job job = config.jobs().get(jobType);
        List<RunRecord> runs = runLedger.recentRuns(jobType, RUN_HISTORY_DEPTH);

        ScheduleState state =
                states.compute(
                        jobType, (type, memo) -> calculator.computeNext(job, runs, type, memo));
        logger.debugf("Next %s run: %s", jobType, state.nextRun().orElse(null));
        return state;
    }

    /** Returns the configured human readable description of a job, if any. */
    public Optional<String> descriptionOf(String jobType) {
        JobTypes.requireKnown(jobType);
        return Optional.ofNullable(config.jobs().get(jobType))
                .flatMap(TrackerConfig.Job::description);
    }
}
