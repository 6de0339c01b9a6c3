package com.example.authservice.exception;

/**
 * Base class for the expected failures of register, login, refresh and
 * token validation. Each subclass maps to exactly one {@link ErrorCode}.
 */
public abstract class AuthException extends RuntimeException {

    private final ErrorCode errorCode;

    protected AuthException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }
}
