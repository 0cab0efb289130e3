package com.hotride.auth.service.credential;

/**
 * @param nonce    the raw nonce the client generated; the token carries its SHA-256 hex
 * @param userData present only on the first consent, may be {@code null}
 */
public record AppleCredential(String identityToken, String nonce, AppleUserData userData) implements Credential {
}
