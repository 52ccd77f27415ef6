package com.ammann.updatetracker.resource;

import com.ammann.updatetracker.dto.NextRunDTO;
import com.ammann.updatetracker.ledger.RunLedger;
import com.ammann.updatetracker.model.RunRecord;
import com.ammann.updatetracker.model.RunTrigger;
import com.ammann.updatetracker.model.ScheduleState;
import com.ammann.updatetracker.properties.ApiProperties;
import com.ammann.updatetracker.schedule.ScheduleService;
import com.ammann.updatetracker.service.BatchJobService;
import jakarta.inject.Inject;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.enums.SchemaType;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.parameters.Parameter;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.RestPath;
import org.jboss.resteasy.reactive.RestQuery;

/** REST Resource for batch job history, schedules and manual triggers. */
@Path(ApiProperties.BASE_URL_V1 + ApiProperties.Batch.BASE)
@Tag(name = "Batch Jobs", description = "Scheduled registry checks")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class BatchResource {

    @Inject Logger logger;

    @Inject RunLedger runLedger;

    @Inject ScheduleService scheduleService;

    @Inject BatchJobService batchJobService;

    @GET
    @Path(ApiProperties.Batch.RUNS)
    @Operation(summary = "List runs", description = "Returns the most recent runs, newest first")
    @APIResponses({
        @APIResponse(
                responseCode = "200",
                description = "Recent runs",
                content =
                        @Content(
                                mediaType = MediaType.APPLICATION_JSON,
                                schema =
                                        @Schema(
                                                type = SchemaType.ARRAY,
                                                implementation = RunRecord.class))),
        @APIResponse(responseCode = "400", description = "Invalid limit")
    })
    public List<RunRecord> recentRuns(
            @Parameter(description = "Number of runs to return (1-500)")
                    @RestQuery("limit")
                    @DefaultValue("50")
                    @Min(value = 1, message = "Limit must be at least 1")
                    @Max(value = 500, message = "Limit must not exceed 500")
                    int limit) {
        return runLedger.recentRuns(limit);
    }

    @GET
    @Path("/{jobType}/next-run")
    @Operation(
            summary = "Next scheduled run",
            description = "Returns when the job runs next; nextRun is null when not scheduled")
    @APIResponses({
        @APIResponse(
                responseCode = "200",
                description = "Schedule of the job",
                content =
                        @Content(
                                mediaType = MediaType.APPLICATION_JSON,
                                schema = @Schema(implementation = NextRunDTO.class))),
        @APIResponse(responseCode = "404", description = "Unknown job type")
    })
    public NextRunDTO nextRun(
            @Parameter(description = "Job type, e.g. registry-check", required = true)
                    @RestPath("jobType")
                    String jobType) {
        ScheduleState state = scheduleService.stateOf(jobType);
        return new NextRunDTO(
                jobType,
                scheduleService.descriptionOf(jobType).orElse(null),
                state.enabled(),
                state.intervalMinutes(),
                state.nextRun().orElse(null));
    }

    @POST
    @Path("/{jobType}/trigger")
    @Operation(summary = "Run job now", description = "Runs the job and returns the finished run")
    @APIResponses({
        @APIResponse(
                responseCode = "200",
                description = "The finished run",
                content =
                        @Content(
                                mediaType = MediaType.APPLICATION_JSON,
                                schema = @Schema(implementation = RunRecord.class))),
        @APIResponse(responseCode = "404", description = "Unknown job type"),
        @APIResponse(responseCode = "409", description = "The job is already running"),
        @APIResponse(responseCode = "429", description = "Registry rate limit exceeded"),
        @APIResponse(responseCode = "503", description = "No container host reachable")
    })
    public RunRecord trigger(
            @Parameter(description = "Job type, e.g. registry-check", required = true)
                    @RestPath("jobType")
                    String jobType) {
        logger.infof("Manual trigger of %s", jobType);
        return batchJobService.run(jobType, RunTrigger.MANUAL);
    }
}
