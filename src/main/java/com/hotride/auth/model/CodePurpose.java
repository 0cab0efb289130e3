package com.hotride.auth.model;

/**
 * What a verification code proves. Each purpose has its own slot per (channel, target),
 * so a password reset never invalidates a pending email verification.
 */
public enum CodePurpose {
    VERIFY,
    PASSWORD_RESET
}
