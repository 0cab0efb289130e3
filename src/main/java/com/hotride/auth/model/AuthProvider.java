package com.hotride.auth.model;

/**
 * Which credential path created an account. Fixed at creation.
 */
public enum AuthProvider {
    EMAIL,
    GOOGLE,
    APPLE;

    public boolean isOAuth() {
        return this != EMAIL;
    }

    /**
     * Lower-case wire name ({@code email}, {@code google}, {@code apple}).
     */
    public String wireName() {
        return name().toLowerCase(java.util.Locale.ROOT);
    }
}
