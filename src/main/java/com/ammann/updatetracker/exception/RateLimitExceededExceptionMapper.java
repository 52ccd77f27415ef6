/* (C)2026 */
package com.ammann.updatetracker.exception;

import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import java.util.Map;

/**
 * JAX-RS exception mapper that converts {@link RateLimitExceededException} into an HTTP 429 Too
 * Many Requests response with a {@code Retry-After} header and the batch progress in the body.
 */
@Provider
public class RateLimitExceededExceptionMapper
        implements ExceptionMapper<RateLimitExceededException> {

    @Override
    public Response toResponse(RateLimitExceededException exception) {
        return Response.status(Response.Status.TOO_MANY_REQUESTS)
                .header(HttpHeaders.RETRY_AFTER, exception.getRetryAfterSeconds())
                .entity(
                        Map.of(
                                "error", "Too Many Requests",
                                "message", exception.getMessage(),
                                "processed", exception.getProcessed(),
                                "total", exception.getTotal()))
                .build();
    }
}
