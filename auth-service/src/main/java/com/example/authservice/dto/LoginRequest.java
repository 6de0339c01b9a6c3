package com.example.authservice.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

/**
 * Login request DTO.
 */
public record LoginRequest(
    @JsonProperty("email")
    @NotBlank(message = "Email is required")
    String email,

    @JsonProperty("password")
    @NotBlank(message = "Password is required")
    String password
) {
}
