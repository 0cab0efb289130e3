package com.hotride.auth.model;

/**
 * Onboarding position of an account. Derived from the stored flags, never persisted.
 * Phone verification is a side branch and does not appear here.
 */
public enum AccountState {
    UNREGISTERED,
    REGISTERED_UNVERIFIED,
    EMAIL_VERIFIED,
    PROFILE_COMPLETE;

    public boolean isAtLeast(AccountState other) {
        return ordinal() >= other.ordinal();
    }

    public static AccountState of(Account account) {
        if (account == null) {
            return UNREGISTERED;
        }
        if (account.getAuthProvider() == AuthProvider.EMAIL && !Boolean.TRUE.equals(account.getEmailVerified())) {
            return REGISTERED_UNVERIFIED;
        }
        if (account.getProfileCompletedAt() != null) {
            return PROFILE_COMPLETE;
        }
        return EMAIL_VERIFIED;
    }
}
