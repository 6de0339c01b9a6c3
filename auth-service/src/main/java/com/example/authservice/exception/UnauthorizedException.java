package com.example.authservice.exception;

/**
 * Thrown when an operation requires an authenticated account and none is present.
 */
public class UnauthorizedException extends AuthException {

    public UnauthorizedException() {
        super(ErrorCode.UNAUTHORIZED, "Unauthorized");
    }
}
