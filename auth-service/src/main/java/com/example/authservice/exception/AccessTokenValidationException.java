package com.example.authservice.exception;

/**
 * Internal result of a failed access token validation.
 * The {@link Reason} is for logs only; callers see {@link TokenInvalidException}.
 */
public class AccessTokenValidationException extends RuntimeException {

    public enum Reason {
        MALFORMED,
        WRONG_ALGORITHM,
        BAD_SIGNATURE,
        EXPIRED,
        NOT_YET_VALID,
        INVALID_CLAIMS
    }

    private final Reason reason;

    public AccessTokenValidationException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
