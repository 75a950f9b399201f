package com.docanalyzer.shared.dto;

import java.time.Instant;

/**
 * Body of every non-2xx response. {@code traceId} is the request's X-Request-ID.
 */
public record ErrorResponse(
        String error,
        String message,
        Instant timestamp,
        String traceId
) {
    public ErrorResponse(String error, String message, String traceId) {
        this(error, message, Instant.now(), traceId);
    }
}
