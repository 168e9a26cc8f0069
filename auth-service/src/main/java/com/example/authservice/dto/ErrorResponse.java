package com.example.authservice.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.Map;

/**
 * Standard error response format.
 * {@code errors} carries field errors or exception details and is omitted when empty.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
    String code,
    String message,
    Instant timestamp,
    Map<String, ?> errors
) {
    public static ErrorResponse of(String code, String message) {
        return new ErrorResponse(code, message, Instant.now(), null);
    }

    public static ErrorResponse of(String code, String message, Map<String, ?> errors) {
        return new ErrorResponse(code, message, Instant.now(), errors == null || errors.isEmpty() ? null : errors);
    }
}
