/* (C)2026 */
package com.ammann.updatetracker.service;

import com.ammann.updatetracker.model.RunRecord;
import com.ammann.updatetracker.model.RunTrigger;
import com.ammann.updatetracker.schedule.JobTypes;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

/** Dispatches batch jobs by job type. */
@ApplicationScoped
public class BatchJobService {

    @Inject UpdateOrchestrator orchestrator;

    @Inject Logger logger;

    /**
     * Runs a job now and waits for it to finish.
     *
     * @param jobType the job type
     * @param trigger what started the run
     * @return the finished run
     * @throws com.ammann.updatetracker.exception.UnknownJobTypeException if the job type is
     *     unknown
     */
    public RunRecord run(String jobType, RunTrigger trigger) {
        JobTypes.requireKnown(jobType);
        logger.infof("Running %s (%s)", jobType, trigger);
        return switch (jobType) {
            case JobTypes.REGISTRY_CHECK -> orchestrator.refreshAll(trigger);
            default -> throw new IllegalStateException("No handler for job type " + jobType);
        };
    }
}
