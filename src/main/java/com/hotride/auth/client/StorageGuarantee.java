package com.hotride.auth.client;

/**
 * How well a {@link SecureSessionStore} protects what it holds at rest.
 */
public enum StorageGuarantee {
    /** Encrypted by a platform keystore or keychain. */
    PLATFORM_KEYSTORE(true),
    /** A file readable only by the owning OS user. */
    OWNER_ONLY_FILE(true),
    /** A file without owner-only permissions. */
    PLAIN_FILE(false),
    /** Held in memory only; gone when the process exits. */
    VOLATILE(false);

    private final boolean secure;

    StorageGuarantee(boolean secure) {
        this.secure = secure;
    }

    public boolean isSecure() {
        return secure;
    }
}
