/* (C)2026 */
package com.ammann.updatetracker.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.time.Instant;

/**
 * One execution of a batch job.
 *
 * <p>A record is created {@link RunStatus#RUNNING} and transitions exactly once, to
 * {@link RunStatus#COMPLETED} or {@link RunStatus#FAILED}.
 *
 * @param id             the run identifier, assigned by the ledger
 * @param jobType        the job that ran (e.g. {@code registry-check})
 * @param status         the current status
 * @param startedAt      when the run started
 * @param completedAt    when the run finished, {@code null} while running
 * @param itemsChecked   how many containers were checked
 * @param itemsUpdated   how many containers had an update available
 * @param errorMessage   why the run failed, {@code null} otherwise
 * @param trigger        whether the run was started manually or by the scheduler
 */
public record RunRecord(
        long id,
        String jobType,
        RunStatus status,
        Instant startedAt,
        Instant completedAt,
        int itemsChecked,
        int itemsUpdated,
        String errorMessage,
        RunTrigger trigger) {

    public static RunRecord started(long id, String jobType, RunTrigger trigger, Instant at) {
        return new RunRecord(id, jobType, RunStatus.RUNNING, at, null, 0, 0, null, trigger);
    }

    public RunRecord complete(Instant at, int checked, int updated) {
        requireRunning();
        return new RunRecord(
                id, jobType, RunStatus.COMPLETED, startedAt, at, checked, updated, null, trigger);
    }

    public RunRecord fail(Instant at, int checked, int updated, String message) {
        requireRunning();
        return new RunRecord(
                id, jobType, RunStatus.FAILED, startedAt, at, checked, updated, message, trigger);
    }

    @JsonIgnore
    public boolean isRunning() {
        return status == RunStatus.RUNNING;
    }

    private void requireRunning() {
        if (status != RunStatus.RUNNING) {
            throw new IllegalStateException("Run " + id + " is already " + status);
        }
    }
}
