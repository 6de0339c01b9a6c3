package com.example.authservice.exception;

/**
 * Thrown when registering an email that already belongs to an account.
 * Response: 409 Conflict
 */
public class EmailAlreadyExistsException extends AuthException {

    public EmailAlreadyExistsException() {
        super(ErrorCode.ACCOUNT_ALREADY_EXISTS, "Email already registered");
    }
}
