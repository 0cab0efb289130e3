package com.hotride.auth.service.credential;

/**
 * Identity attributes read from a verified provider token. Only {@code subject} is always present.
 */
public record ProviderClaims(String subject, String email, boolean emailVerified, String name,
                             String picture, String nonce) {
}
