package com.example.authservice.security;

import java.time.Instant;

/**
 * Verified claims of an access token.
 */
public record AccessTokenClaims(
    String userId,
    String email,
    String issuer,
    Instant issuedAt,
    Instant expiresAt
) {
}
