/* (C)2026 */
package com.ammann.updatetracker.exception;

import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import java.util.Map;

/** Maps {@link UpgradeFailedException} to HTTP 500 Internal Server Error. */
@Provider
public class UpgradeFailedExceptionMapper implements ExceptionMapper<UpgradeFailedException> {

    @Override
    public Response toResponse(UpgradeFailedException exception) {
        return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                .entity(
                        Map.of(
                                "error", "Internal Server Error",
                                "message", exception.getMessage(),
                                "container", exception.getContainerName()))
                .build();
    }
}
