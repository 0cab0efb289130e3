package com.hotride.auth.client;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemorySecureSessionStore implements SecureSessionStore {

    private final Map<String, String> slots = new ConcurrentHashMap<>();

    @Override
    public Optional<String> get(String slot) {
        return Optional.ofNullable(slots.get(slot));
    }

    @Override
    public void put(String slot, String value) {
        slots.put(slot, value);
    }

    @Override
    public void delete(String slot) {
        slots.remove(slot);
    }

    @Override
    public StorageGuarantee guarantee() {
        return StorageGuarantee.VOLATILE;
    }
}
