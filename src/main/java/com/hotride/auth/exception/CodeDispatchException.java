package com.hotride.auth.exception;

/**
 * A verification code could not be handed to the mail server or SMS gateway.
 */
public class CodeDispatchException extends RuntimeException {

    public CodeDispatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
