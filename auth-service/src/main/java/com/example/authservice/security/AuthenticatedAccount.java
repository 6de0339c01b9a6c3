package com.example.authservice.security;

/**
 * Principal stored in the SecurityContext for requests carrying a valid access token.
 * Built from token claims only; no database lookup.
 */
public record AuthenticatedAccount(String userId, String email) {
}
