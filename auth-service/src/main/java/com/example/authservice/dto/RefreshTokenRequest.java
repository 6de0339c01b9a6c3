package com.example.authservice.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

/**
 * Refresh token request DTO, used by refresh and logout.
 */
public record RefreshTokenRequest(
    @JsonProperty("refresh_token")
    @NotBlank(message = "Refresh token is required")
    String refreshToken
) {
}
