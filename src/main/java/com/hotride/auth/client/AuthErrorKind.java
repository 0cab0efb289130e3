package com.hotride.auth.client;

import java.util.Arrays;

/**
 * Failure kinds surfaced to the app. Mirrors the service's error codes plus the purely local
 * {@link #NETWORK_ERROR} and {@link #UNKNOWN}.
 */
public enum AuthErrorKind {
    INVALID_CREDENTIALS,
    INVALID_TOKEN,
    NONCE_MISMATCH,
    ACCOUNT_DISABLED,
    ACCOUNT_NOT_VERIFIED,
    PROVIDER_UNAVAILABLE,
    CODE_EXPIRED,
    CODE_MISMATCH,
    NO_ACTIVE_CODE,
    DUPLICATE_ACCOUNT,
    ALREADY_VERIFIED,
    ACCOUNT_NOT_FOUND,
    PHONE_NOT_VERIFIED,
    VALIDATION_FAILED,
    INVALID_IDENTIFIER,
    RATE_LIMITED,
    INVALID_RESET_TOKEN,
    SESSION_EXPIRED,
    NETWORK_ERROR,
    UNKNOWN;

    public boolean isRetryable() {
        return this == NETWORK_ERROR || this == PROVIDER_UNAVAILABLE;
    }

    static AuthErrorKind fromWire(String error) {
        if (error == null) {
            return UNKNOWN;
        }
        return Arrays.stream(values())
                .filter(kind -> kind.name().equals(error))
                .findFirst()
                .orElse(UNKNOWN);
    }
}
