package com.catalog.resolution.rest.dto;

import jakarta.ws.rs.core.Response;

import java.time.Instant;

/**
 * Body of every non-2xx search response.
 *
 * @param status    HTTP status code
 * @param error     the status reason phrase
 * @param message   what the caller should fix, or a generic hint for server-side failures
 * @param path      request path that failed
 * @param timestamp when the error was produced
 */
public record ErrorResponse(
        int status,
        String error,
        String message,
        String path,
        Instant timestamp
) {
    public static ErrorResponse of(Response.StatusType status, String message, String path) {
        return new ErrorResponse(status.getStatusCode(), status.getReasonPhrase(), message, path, Instant.now());
    }
}
