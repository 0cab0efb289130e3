package com.hotride.auth.client;

public class AuthClientException extends RuntimeException {

    private final AuthErrorKind kind;

    public AuthClientException(AuthErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public AuthClientException(AuthErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public AuthErrorKind getKind() {
        return kind;
    }

    public boolean isRetryable() {
        return kind.isRetryable();
    }
}
