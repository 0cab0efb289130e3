package com.hotride.auth.client;

import java.util.Optional;

/**
 * Durable key-value slots for session material.
 * <p>
 * Every method may throw {@link SessionStoreException} when the underlying storage fails.
 */
public interface SecureSessionStore {

    Optional<String> get(String slot);

    void put(String slot, String value);

    /** Removing an absent slot is not an error. */
    void delete(String slot);

    StorageGuarantee guarantee();
}
