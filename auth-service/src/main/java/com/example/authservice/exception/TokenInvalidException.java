package com.example.authservice.exception;

/**
 * Thrown when a refresh token is unknown or an access token fails validation.
 * Response: 401 Unauthorized
 */
public class TokenInvalidException extends AuthException {

    public TokenInvalidException() {
        super(ErrorCode.INVALID_TOKEN, "Token invalid");
    }
}
