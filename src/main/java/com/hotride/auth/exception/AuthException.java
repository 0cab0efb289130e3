package com.hotride.auth.exception;

import org.springframework.http.HttpStatus;

/**
 * Every expected authentication failure. The handler renders it as
 * {@code {error, message, retryable}} with the code's HTTP status.
 */
public class AuthException extends RuntimeException {

    private final AuthErrorCode errorCode;

    public AuthException(AuthErrorCode errorCode) {
        this(errorCode, errorCode.getDefaultMessage());
    }

    public AuthException(AuthErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public AuthException(AuthErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public AuthErrorCode getErrorCode() {
        return errorCode;
    }

    public HttpStatus getHttpStatus() {
        return errorCode.getHttpStatus();
    }

    public static AuthException invalidCredentials() {
        return new AuthException(AuthErrorCode.INVALID_CREDENTIALS);
    }

    public static AuthException invalidToken(String message) {
        return new AuthException(AuthErrorCode.INVALID_TOKEN, message);
    }

    public static AuthException providerUnavailable(String message, Throwable cause) {
        return new AuthException(AuthErrorCode.PROVIDER_UNAVAILABLE, message, cause);
    }

    public static AuthException validation(String message) {
        return new AuthException(AuthErrorCode.VALIDATION_FAILED, message);
    }
}
