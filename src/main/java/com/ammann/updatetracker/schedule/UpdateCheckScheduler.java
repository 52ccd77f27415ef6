/* (C)2026 */
package com.ammann.updatetracker.schedule;

import com.ammann.updatetracker.config.TrackerConfig;
import com.ammann.updatetracker.exception.RateLimitExceededException;
import com.ammann.updatetracker.exception.RefreshInProgressException;
import com.ammann.updatetracker.ledger.RunLedger;
import com.ammann.updatetracker.model.RunRecord;
import com.ammann.updatetracker.model.RunStatus;
import com.ammann.updatetracker.model.RunTrigger;
import com.ammann.updatetracker.service.BatchJobService;
import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.jboss.logging.Logger;

/**
 * Scheduled background service that starts batch jobs when they are due.
 *
 * <p>A job is due when it is enabled with an interval, no run of it is in progress, and it
 * either never completed or its interval has elapsed since the last completion. A job whose
 * latest run failed is retried once {@code tracker.scheduler.retry-after-failure} has passed.
 * Failures are logged and never propagated to the scheduler.
 */
@ApplicationScoped
public class UpdateCheckScheduler {

    private static final int RUN_HISTORY_DEPTH = 50;

    @Inject TrackerConfig config;

    @Inject RunLedger runLedger;

    @Inject BatchJobService batchJobService;

    @Inject Clock clock;

    @Inject Logger logger;

    /** Checks every known job and runs those that are due. */
    @Scheduled(
            every = "${tracker.scheduler.poll-interval:30s}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    public void poll() {
        for (String jobType : JobTypes.ALL) {
            try {
                if (isDue(jobType)) {
                    batchJobService.run(jobType, RunTrigger.SCHEDULED);
                }
            } catch (RefreshInProgressException e) {
                logger.debugf("Skipping scheduled %s: %s", jobType, e.getMessage());
            } catch (RateLimitExceededException e) {
                logger.warnf("Scheduled %s stopped by rate limit: %s", jobType, e.getMessage());
            } catch (Exception e) {
                logger.errorf(e, "Scheduled %s failed", jobType);
            }
        }
    }

    /**
     * Determines whether a job should run now.
     *
     * @param jobType the job type
     * @return {@code true} if the job is due
     */
    boolean isDue(String jobType) {
        TrackerConfig.Job job = config.jobs().get(jobType);
        if (job == null || !job.enabled()) {
            return false;
        }
        Optional<Integer> interval = job.intervalMinutes().filter(minutes -> minutes >= 1);
        if (interval.isEmpty()) {
            return false;
        }

        List<RunRecord> runs = runLedger.recentRuns(jobType, RUN_HISTORY_DEPTH);
        if (runs.stream().anyMatch(RunRecord::isRunning)) {
            return false;
        }

        Instant now = clock.instant();
        if (!runs.isEmpty() && runs.get(0).status() == RunStatus.FAILED) {
            Instant retryAt =
                    runs.get(0).completedAt().plus(config.scheduler().retryAfterFailure());
            return !now.isBefore(retryAt);
        }

        Optional<RunRecord> lastCompleted =
                runs.stream().filter(run -> run.status() == RunStatus.COMPLETED).findFirst();
        if (lastCompleted.isEmpty()) {
            return true;
        }
        Instant dueAt = lastCompleted.get().completedAt().plusSeconds(interval.get() * 60L);
        return !now.isBefore(dueAt);
    }
}
