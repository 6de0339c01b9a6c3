package com.example.authservice.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * Standard error response DTO.
 * error: machine-readable code (ErrorCode name, VALIDATION_FAILED or INTERNAL_ERROR)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
    @JsonProperty("error")
    String error,

    @JsonProperty("message")
    String message,

    @JsonProperty("timestamp")
    LocalDateTime timestamp,

    @JsonProperty("errors")
    Map<String, String> errors
) {
    public static ErrorResponse of(String error, String message) {
        return new ErrorResponse(error, message, LocalDateTime.now(), null);
    }

    public static ErrorResponse of(String error, String message, Map<String, String> errors) {
        return new ErrorResponse(error, message, LocalDateTime.now(), errors);
    }
}
