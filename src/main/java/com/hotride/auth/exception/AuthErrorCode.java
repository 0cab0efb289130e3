package com.hotride.auth.exception;

import org.springframework.http.HttpStatus;

/**
 * Stable failure codes returned to clients in the {@code error} field.
 */
public enum AuthErrorCode {

    INVALID_CREDENTIALS(HttpStatus.UNAUTHORIZED, "Invalid email/phone or password."),
    INVALID_TOKEN(HttpStatus.UNAUTHORIZED, "The identity token could not be verified."),
    NONCE_MISMATCH(HttpStatus.UNAUTHORIZED, "The sign-in request could not be matched to this device."),
    ACCOUNT_DISABLED(HttpStatus.FORBIDDEN, "This account has been disabled."),
    ACCOUNT_NOT_VERIFIED(HttpStatus.FORBIDDEN, "This account is not verified. Please verify your email first."),

    /**
     * An identity provider, SMS gateway or mail server could not be reached. Retryable.
     */
    PROVIDER_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE, "A required service is unavailable. Please try again."),

    CODE_EXPIRED(HttpStatus.BAD_REQUEST, "This code has expired. Please request a new one."),
    CODE_MISMATCH(HttpStatus.BAD_REQUEST, "The code you entered is incorrect."),
    NO_ACTIVE_CODE(HttpStatus.BAD_REQUEST, "No active code. Please request a new one."),
    DUPLICATE_ACCOUNT(HttpStatus.CONFLICT, "An account with this email already exists. Please log in with your original sign-in method."),
    ALREADY_VERIFIED(HttpStatus.CONFLICT, "This account is already verified."),
    ACCOUNT_NOT_FOUND(HttpStatus.NOT_FOUND, "Account not found."),
    PHONE_NOT_VERIFIED(HttpStatus.BAD_REQUEST, "Please verify your phone number first."),
    VALIDATION_FAILED(HttpStatus.BAD_REQUEST, "The request is invalid."),
    INVALID_IDENTIFIER(HttpStatus.BAD_REQUEST, "Enter a valid email address or phone number."),
    RATE_LIMITED(HttpStatus.TOO_MANY_REQUESTS, "Please wait before requesting another code."),
    INVALID_RESET_TOKEN(HttpStatus.UNAUTHORIZED, "This password reset link is invalid or has expired."),
    SESSION_EXPIRED(HttpStatus.UNAUTHORIZED, "Session expired. Please log in again.");

    private final HttpStatus httpStatus;
    private final String defaultMessage;

    AuthErrorCode(HttpStatus httpStatus, String defaultMessage) {
        this.httpStatus = httpStatus;
        this.defaultMessage = defaultMessage;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }

    public String getDefaultMessage() {
        return defaultMessage;
    }

    public boolean isRetryable() {
        return this == PROVIDER_UNAVAILABLE;
    }
}
