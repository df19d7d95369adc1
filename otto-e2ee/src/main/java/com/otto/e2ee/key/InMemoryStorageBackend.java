package com.otto.e2ee.key;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of SecureStorageBackend for testing and development.
 * Production deployments should use platform-specific secure storage.
 */
public class InMemoryStorageBackend implements SecureStorageBackend {

    private final Map<String, byte[]> entries;

    public InMemoryStorageBackend() {
        this.entries = new ConcurrentHashMap<>();
    }

    @Override
    public byte[] get(String key) {
        byte[] value = entries.get(key);
        return value != null ? value.clone() : null;
    }

    @Override
    public void set(String key, byte[] value) {
        entries.put(key, value.clone());
    }

    @Override
    public void delete(String key) {
        entries.remove(key);
    }

    @Override
    public boolean isPersistent() {
        return false; // In-memory is lost on exit
    }

    /**
     * Gets the count of stored entries (for testing).
     */
    public int size() {
        return entries.size();
    }

    /**
     * Checks for an entry without copying it (for testing).
     */
    public boolean contains(String key) {
        return entries.containsKey(key);
    }
}
