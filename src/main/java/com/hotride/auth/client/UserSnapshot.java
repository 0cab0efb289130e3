package com.hotride.auth.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * The rider as last reported by the service, cached next to the session token.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record UserSnapshot(String id, String email, String phone, String fullName, String profilePictureRef,
                           String authProvider, boolean emailVerified, boolean phoneVerified,
                           boolean profileComplete) {
}
