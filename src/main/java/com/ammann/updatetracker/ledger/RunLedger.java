/* (C)2026 */
package com.ammann.updatetracker.ledger;

import com.ammann.updatetracker.model.RunRecord;
import com.ammann.updatetracker.model.RunTrigger;
import java.util.List;
import java.util.Optional;

/**
 * History of batch job runs. Records are appended and updated by id, never deleted.
 */
public interface RunLedger {

    /**
     * Starts a run.
     *
     * @param jobType the job being run
     * @param trigger what started it
     * @return the new record, in {@code RUNNING} state
     */
    RunRecord createRun(String jobType, RunTrigger trigger);

    /**
     * Marks a run completed.
     *
     * @throws IllegalStateException if the run is unknown or has already finished
     */
    RunRecord completeRun(long runId, int itemsChecked, int itemsUpdated);

    /**
     * Marks a run failed.
     *
     * @throws IllegalStateException if the run is unknown or has already finished
     */
    RunRecord failRun(long runId, int itemsChecked, int itemsUpdated, String errorMessage);

    Optional<RunRecord> find(long runId);

    /** Returns the most recent runs of all jobs, newest first. */
    List<RunRecord> recentRuns(int limit);

    /** Returns the most recent runs of one job, newest first. */
    List<RunRecord> recentRuns(String jobType, int limit);
}
