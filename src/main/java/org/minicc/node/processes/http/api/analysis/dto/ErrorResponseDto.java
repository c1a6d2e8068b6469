package org.minicc.node.processes.http.api.analysis.dto;

import java.time.Instant;

/**
 * Response body for requests that could not be processed at all.
 *
 * @param timestamp ISO-8601 timestamp when the error occurred
 * @param status    HTTP status code
 * @param error     HTTP status message (e.g., "Bad Request")
 * @param message   Human-readable error message
 */
public record ErrorResponseDto(
    String timestamp,
    int status,
    String error,
    String message
) {
    /**
     * Creates an ErrorResponseDto stamped with the current time.
     *
     * @param status  HTTP status code
     * @param error   HTTP status message
     * @param message Human-readable error message
     * @return A new ErrorResponseDto instance
     */
    public static ErrorResponseDto of(final int status, final String error, final String message) {
        return new ErrorResponseDto(Instant.now().toString(), status, error, message);
    }
}
