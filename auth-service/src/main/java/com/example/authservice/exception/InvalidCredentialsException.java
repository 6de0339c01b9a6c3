package com.example.authservice.exception;

/**
 * Thrown when login credentials are invalid.
 * Unknown email and wrong password deliberately share this exception and message.
 * Response: 401 Unauthorized
 */
public class InvalidCredentialsException extends AuthException {

    public InvalidCredentialsException() {
        super(ErrorCode.INVALID_CREDENTIALS, "Invalid credentials");
    }
}
