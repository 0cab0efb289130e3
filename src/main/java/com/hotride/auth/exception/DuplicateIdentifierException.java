package com.hotride.auth.exception;

/**
 * Thrown by the account repository when a conditional create loses to an existing identifier claim.
 */
public class DuplicateIdentifierException extends RuntimeException {

    public DuplicateIdentifierException(String message, Throwable cause) {
        super(message, cause);
    }
}
