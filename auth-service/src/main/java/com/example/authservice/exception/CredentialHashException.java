package com.example.authservice.exception;

/**
 * A stored password hash is not a well-formed BCrypt string.
 * Internal error: must never be reported as invalid credentials.
 */
public class CredentialHashException extends RuntimeException {

    public CredentialHashException(String message) {
        super(message);
    }
}
