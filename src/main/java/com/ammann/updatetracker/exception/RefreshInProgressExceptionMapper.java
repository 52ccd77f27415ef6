/* (C)2026 */
package com.ammann.updatetracker.exception;

import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import java.util.Map;

/** Maps {@link RefreshInProgressException} to HTTP 409 Conflict. */
@Provider
public class RefreshInProgressExceptionMapper
        implements ExceptionMapper<RefreshInProgressException> {

    @Override
    public Response toResponse(RefreshInProgressException exception) {
        return Response.status(Response.Status.CONFLICT)
                .entity(
                        Map.of(
                                "error", "Conflict",
                                "message", exception.getMessage(),
                                "jobType", exception.getJobType()))
                .build();
    }
}
