package com.ammann.updatetracker.resource;

import com.ammann.updatetracker.dto.ContainerOverviewDTO;
import com.ammann.updatetracker.properties.ApiProperties;
import com.ammann.updatetracker.service.ContainerUpgradeService;
import com.ammann.updatetracker.service.UpdateOrchestrator;
import jakarta.inject.Inject;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.parameters.Parameter;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.RestPath;
import org.jboss.resteasy.reactive.RestQuery;

/**
 * REST Resource for tracked containers.
 *
 * <p>Serves the cached container overview, optionally after a full registry refresh, and
 * upgrades containers to the latest image of their tag.</p>
 */
@Path(ApiProperties.BASE_URL_V1 + ApiProperties.Container.BASE)
@Tag(name = "Containers", description = "Tracked containers and image updates")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class ContainerResource {

    private static final String CONTAINER_ID_PATTERN = "^[a-fA-F0-9]{12,64}$";
    private static final String CONTAINER_ID_DESCRIPTION =
            "Docker container ID (12-64 hex characters)";

    @Inject Logger logger;

    @Inject UpdateOrchestrator orchestrator;

    @Inject ContainerUpgradeService upgradeService;

    @GET
    @Operation(
            summary = "List tracked containers",
            description =
                    "Returns the cached containers with their update state. With refresh=true"
                            + " every image is checked against its registry first.")
    @APIResponses({
        @APIResponse(
                responseCode = "200",
                description = "Tracked containers",
                content =
                        @Content(
                                mediaType = MediaType.APPLICATION_JSON,
                                schema = @Schema(implementation = ContainerOverviewDTO.class))),
        @APIResponse(responseCode = "404", description = "Unknown instance"),
        @APIResponse(responseCode = "409", description = "A refresh is already running"),
        @APIResponse(responseCode = "429", description = "Registry rate limit exceeded"),
        @APIResponse(responseCode = "503", description = "No container host reachable")
    })
    public ContainerOverviewDTO listContainers(
            @Parameter(description = "Check every image against its registry first")
                    @RestQuery("refresh")
                    @DefaultValue("false")
                    boolean refresh,
            @Parameter(description = "Restrict the answer and the refresh to one instance")
                    @RestQuery("instance")
                    String instance) {

        logger.debugf("Listing containers (refresh=%s, instance=%s)", refresh, instance);
        return orchestrator.getCurrent(refresh, instance);
    }

    @POST
    @Path("/{instance}/{id}/upgrade")
    @Operation(
            summary = "Upgrade container",
            description = "Pulls the latest image and recreates the container with it")
    @APIResponses({
        @APIResponse(responseCode = "204", description = "Container upgraded successfully"),
        @APIResponse(responseCode = "400", description = "Invalid container ID format"),
        @APIResponse(responseCode = "403", description = "Container is blacklisted"),
        @APIResponse(responseCode = "404", description = "Unknown instance"),
        @APIResponse(responseCode = "500", description = "Docker daemon error or image pull failed")
    })
    public Response upgradeContainer(
            @Parameter(description = "Instance the container runs on", required = true)
                    @RestPath("instance")
                    @NotBlank
                    String instance,
            @Parameter(description = CONTAINER_ID_DESCRIPTION, required = true)
                    @RestPath("id")
                    @NotBlank
                    @Pattern(regexp = CONTAINER_ID_PATTERN, message = "Invalid container ID format")
                    String containerId) {

        logger.infof("Upgrading container %s on %s", containerId, instance);
        upgradeService.upgrade(instance, containerId);
        return Response.noContent().build();
    }
}
