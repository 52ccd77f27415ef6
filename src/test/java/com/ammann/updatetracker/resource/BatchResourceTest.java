/* (C)2026 */
package com.ammann.updatetracker.resource;

import static com.ammann.updatetracker.support.Injection.injectField;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.ammann.updatetracker.dto.NextRunDTO;
import com.ammann.updatetracker.exception.UnknownJobTypeException;
import com.ammann.updatetracker.ledger.RunLedger;
import com.ammann.updatetracker.model.RunRecord;
import com.ammann.updatetracker.model.RunTrigger;
import com.ammann.updatetracker.model.ScheduleState;
import com.ammann.updatetracker.schedule.JobTypes;
import com.ammann.updatetracker.schedule.ScheduleService;
import com.ammann.updatetracker.service.BatchJobService;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.jboss.logging.Logger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("BatchResource")
class BatchResourceTest {

    private static final Instant STARTED = Instant.parse("2026-02-02T02:00:00Z");

    BatchResource resource;
    RunLedger runLedger;
    ScheduleService scheduleService;
    BatchJobService batchJobService;

    @BeforeEach
    void setUp() {
        resource = new BatchResource();
        runLedger = mock(RunLedger.class);
        scheduleService = mock(ScheduleService.class);
        batchJobService = mock(BatchJobService.class);

        injectField(resource, "runLedger", runLedger);
        injectField(resource, "scheduleService", scheduleService);
        injectField(resource, "batchJobService", batchJobService);
        injectField(resource, "logger", mock(Logger.class));
    }

    @Test
    @DisplayName("should return recent runs")
    void shouldReturnRecentRuns() {
        List<RunRecord> runs =
                List.of(RunRecord.started(3, JobTypes.REGISTRY_CHECK, RunTrigger.MANUAL, STARTED));
        when(runLedger.recentRuns(10)).thenReturn(runs);

        assertThat(resource.recentRuns(10)).isEqualTo(runs);
    }

    @Test
    @DisplayName("should describe the next scheduled run")
    void shouldDescribeNextRun() {
        Instant next = STARTED.plusSeconds(3600);
        when(scheduleService.stateOf(JobTypes.REGISTRY_CHECK))
                .thenReturn(new ScheduleState(true, 60, "3", 60, next.toEpochMilli()));
        when(scheduleService.descriptionOf(JobTypes.REGISTRY_CHECK))
                .thenReturn(Optional.of("Check all images"));

        NextRunDTO dto = resource.nextRun(JobTypes.REGISTRY_CHECK);

        assertThat(dto)
                .isEqualTo(
                        new NextRunDTO(
                                JobTypes.REGISTRY_CHECK, "Check all images", true, 60, next));
    }

    @Test
    @DisplayName("should report no next run for a disabled job")
    void shouldReportNoNextRunForDisabledJob() {
        when(scheduleService.stateOf(JobTypes.REGISTRY_CHECK))
                .thenReturn(ScheduleState.cleared(false, 60));
        when(scheduleService.descriptionOf(JobTypes.REGISTRY_CHECK)).thenReturn(Optional.empty());

        NextRunDTO dto = resource.nextRun(JobTypes.REGISTRY_CHECK);

        assertThat(dto.nextRun()).isNull();
        assertThat(dto.description()).isNull();
    }

    @Test
    @DisplayName("should trigger a manual run")
    void shouldTriggerManualRun() {
        RunRecord run =
                RunRecord.started(4, JobTypes.REGISTRY_CHECK, RunTrigger.MANUAL, STARTED)
                        .complete(STARTED, 5, 1);
        when(batchJobService.run(JobTypes.REGISTRY_CHECK, RunTrigger.MANUAL)).thenReturn(run);

        assertThat(resource.trigger(JobTypes.REGISTRY_CHECK)).isEqualTo(run);
    }

    @Test
    @DisplayName("should propagate unknown job types")
    void shouldPropagateUnknownJobTypes() {
        when(scheduleService.stateOf("prune")).thenThrow(new UnknownJobTypeException("prune"));

        assertThatThrownBy(() -> resource.nextRun("prune"))
                .isInstanceOf(UnknownJobTypeException.class);
    }
}
