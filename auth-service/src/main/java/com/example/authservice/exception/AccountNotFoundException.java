package com.example.authservice.exception;

/**
 * Thrown when the account referenced by a token or request no longer exists.
 */
public class AccountNotFoundException extends AuthException {

    public AccountNotFoundException() {
        super(ErrorCode.ACCOUNT_NOT_FOUND, "Account not found");
    }
}
