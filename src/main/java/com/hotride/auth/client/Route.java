package com.hotride.auth.client;

import java.util.Arrays;
import java.util.Optional;

/**
 * App screens the guard knows about, by their navigation path.
 */
public enum Route {
    ENTRY("", Access.ENTRY),
    LOGIN("login", Access.PUBLIC),
    SIGNUP("signup", Access.PUBLIC),
    VERIFY_EMAIL("verify-email", Access.PUBLIC),
    VERIFY_PHONE("verify-phone", Access.PUBLIC),
    PROFILE_SETUP_FULL("profile-setup-full", Access.PUBLIC),
    ENABLE_LOCATION("enable-location", Access.PUBLIC),
    FORGOT_PASSWORD("forgot-password", Access.PUBLIC),
    HOME("home", Access.PROTECTED),
    EDIT_PROFILE("edit-profile", Access.PROTECTED),
    BOOKING("booking", Access.PROTECTED),
    RIDE_HISTORY("ride-history", Access.PROTECTED),
    PAYMENT_METHODS("payment-methods", Access.PROTECTED);

    public enum Access {
        /** The launch screen; it decides where to go itself and is never redirected. */
        ENTRY,
        PUBLIC,
        PROTECTED
    }

    private final String path;
    private final Access access;

    Route(String path, Access access) {
        this.path = path;
        this.access = access;
    }

    public String path() {
        return path;
    }

    public Access access() {
        return access;
    }

    public static Optional<Route> fromPath(String path) {
        String segment = path == null ? "" : path.replaceFirst("^/", "");
        return Arrays.stream(values()).filter(route -> route.path.equals(segment)).findFirst();
    }
}
