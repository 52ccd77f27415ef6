/* (C)2026 */
package com.ammann.updatetracker.exception;

import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import java.util.Map;

/** Maps {@link UnknownJobTypeException} to HTTP 404 Not Found. */
@Provider
public class UnknownJobTypeExceptionMapper implements ExceptionMapper<UnknownJobTypeException> {

    @Override
    public Response toResponse(UnknownJobTypeException exception) {
        return Response.status(Response.Status.NOT_FOUND)
                .entity(
                        Map.of(
                                "error", "Not Found",
                                "message", exception.getMessage(),
                                "jobType", exception.getJobType()))
                .build();
    }
}
