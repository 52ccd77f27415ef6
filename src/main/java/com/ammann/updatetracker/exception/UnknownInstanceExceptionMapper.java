/* (C)2026 */
package com.ammann.updatetracker.exception;

import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import java.util.Map;

/** Maps {@link UnknownInstanceException} to HTTP 404 Not Found. */
@Provider
public class UnknownInstanceExceptionMapper implements ExceptionMapper<UnknownInstanceException> {

    @Override
    public Response toResponse(UnknownInstanceException exception) {
        return Response.status(Response.Status.NOT_FOUND)
                .entity(
                        Map.of(
                                "error", "Not Found",
                                "message", exception.getMessage(),
                                "instance", exception.getInstance()))
                .build();
    }
}
