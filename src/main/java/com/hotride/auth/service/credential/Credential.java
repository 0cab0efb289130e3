package com.hotride.auth.service.credential;

/**
 * Proof of identity presented at sign-in.
 */
public sealed interface Credential permits PasswordCredential, GoogleCredential, AppleCredential {
}
