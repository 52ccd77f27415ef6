/* (C)2026 */
package com.ammann.updatetracker.exception;

import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import java.util.Map;

/** Maps {@link SourceUnavailableException} to HTTP 503 Service Unavailable. */
@Provider
public class SourceUnavailableExceptionMapper
        implements ExceptionMapper<SourceUnavailableException> {

    @Override
    public Response toResponse(SourceUnavailableException exception) {
        return Response.status(Response.Status.SERVICE_UNAVAILABLE)
                .entity(Map.of("error", "Service Unavailable", "message", exception.getMessage()))
                .build();
    }
}
