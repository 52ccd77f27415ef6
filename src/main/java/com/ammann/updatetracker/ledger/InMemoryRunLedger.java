/* (C)2026 */
package com.ammann.updatetracker.ledger;

import com.ammann.updatetracker.model.RunRecord;
import com.ammann.updatetracker.model.RunTrigger;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.UnaryOperator;
import org.jboss.logging.Logger;

/** Run ledger held in memory. Run ids increase monotonically. */
@ApplicationScoped
public class InMemoryRunLedger implements RunLedger {

    @Inject Clock clock;

    @Inject Logger logger;

    private final AtomicLong sequence = new AtomicLong();

    private final ConcurrentMap<Long, RunRecord> runs = new ConcurrentHashMap<>();

    @Override
    public RunRecord createRun(String jobType, RunTrigger trigger) {
        RunRecord run =
                RunRecord.started(sequence.incrementAndGet(), jobType, trigger, clock.instant());
        runs.put(run.id(), run);
        logger.infof("Started %s run %d (%s)", jobType, run.id(), trigger);
        return run;
    }

    @Override
    public RunRecord completeRun(long runId, int itemsChecked, int itemsUpdated) {
        RunRecord run =
                transition(runId, r -> r.complete(clock.instant(), itemsChecked, itemsUpdated));
        logger.infof(
                "Completed %s run %d: %d checked, %d with updates",
                run.jobType(), runId, itemsChecked, itemsUpdated);
        return run;
    }

    @Override
    public RunRecord failRun(long runId, int itemsChecked, int itemsUpdated, String errorMessage) {
        RunRecord run =
                transition(
                        runId,
                        r -> r.fail(clock.instant(), itemsChecked, itemsUpdated, errorMessage));
        logger.warnf("Failed %s run %d: %s", run.jobType(), runId, errorMessage);
        return run;
    }

    @Override
    public Optional<RunRecord> find(long runId) {
        return Optional.ofNullable(runs.get(runId));
    }

    @Override
    public List<RunRecord> recentRuns(int limit) {
        return runs.values().stream()
                .sorted(Comparator.comparingLong(RunRecord::id).reversed())
                .limit(limit)
                .toList();
    }

    @Override
    public List<RunRecord> recentRuns(String jobType, int limit) {
        return runs.values().stream()
                .filter(run -> run.jobType().equals(jobType))
                .sorted(Comparator.comparingLong(RunRecord::id).reversed())
                .limit(limit)
                .toList();
    }

    private RunRecord transition(long runId, UnaryOperator<RunRecord> change) {
        RunRecord updated = runs.computeIfPresent(runId, (id, run) -> change.apply(run));
        if (updated == null) {
            throw new IllegalStateException("Unknown run " + runId);
        }
        return updated;
    }
}
