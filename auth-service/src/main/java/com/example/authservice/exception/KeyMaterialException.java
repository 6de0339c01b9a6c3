package com.example.authservice.exception;

/**
 * Signing key material is missing, unparseable, of the wrong type, or the
 * public and private halves do not belong together. Raised at startup.
 */
public class KeyMaterialException extends RuntimeException {

    public KeyMaterialException(String message) {
        super(message);
    }

    public KeyMaterialException(String message, Throwable cause) {
        super(message, cause);
    }
}
