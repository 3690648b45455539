package com.entity.linking.rest.dto;

import java.time.Instant;
import java.util.Map;

/**
 * Standardized error response DTO.
 */
public record ErrorResponse(
        int status,
        String error,
        String message,
        String path,
        Instant timestamp,
        Map<String, String> details
) {
    public ErrorResponse(int status, String error, String message, String path) {
        this(status, error, message, path, Instant.now(), null);
    }

    public ErrorResponse(int status, String error, String message, String path,
                         Map<String, String> details) {
        this(status, error, message, path, Instant.now(), details);
    }

    public static ErrorResponse badRequest(String message, String path) {
        return new ErrorResponse(400, "Bad Request", message, path);
    }

    public static ErrorResponse notFound(String message, String path) {
        return new ErrorResponse(404, "Not Found", message, path);
    }

    /**
     * A backend collaborator failed; the message must already be sanitized.
     */
    public static ErrorResponse badGateway(String message, String path, String backend) {
        return new ErrorResponse(502, "Bad Gateway", message, path, Map.of("backend", backend));
    }

    public static ErrorResponse internalError(String message, String path) {
        return new ErrorResponse(500, "Internal Server Error", message, path);
    }
}
