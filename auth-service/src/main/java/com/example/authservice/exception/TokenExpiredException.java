package com.example.authservice.exception;

/**
 * Thrown when a refresh token is presented after its expiry.
 * Response: 401 Unauthorized
 */
public class TokenExpiredException extends AuthException {

    public TokenExpiredException() {
        super(ErrorCode.TOKEN_EXPIRED, "Token expired");
    }
}
