package com.example.authservice.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Token pair response DTO, returned by register, login and refresh.
 */
public record AuthResponse(
    @JsonProperty("access_token")
    String accessToken,

    @JsonProperty("refresh_token")
    String refreshToken,

    @JsonProperty("token_type")
    String tokenType,

    @JsonProperty("expires_in")
    long expiresIn,

    @JsonProperty("user")
    UserDto user
) {
    /**
     * Factory method with default tokenType = "Bearer"
     */
    public static AuthResponse of(String accessToken, String refreshToken, long expiresIn, UserDto user) {
        return new AuthResponse(accessToken, refreshToken, "Bearer", expiresIn, user);
    }
}
