package com.example.authservice.exception;

/**
 * Thrown when a refresh token that was already revoked is presented.
 * Response: 401 Unauthorized
 */
public class TokenRevokedException extends AuthException {

    public TokenRevokedException() {
        super(ErrorCode.TOKEN_REVOKED, "Token revoked");
    }
}
