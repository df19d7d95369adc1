package com.otto.e2ee.key;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * SecureKeyStore over a platform backend that degrades to process memory.
 *
 * The store starts in {@link SecureBackend} mode. The first backend exception on any
 * operation with a valid key name moves it to {@link MemoryFallback} for the rest of the process lifetime;
 * the failed operation and every later one are served from memory and the backend is
 * never consulted again. Entries held by the backend before the switch are not
 * visible in memory mode.
 */
public class FallbackSecureKeyStore implements SecureKeyStore {

    private static final Logger log = LoggerFactory.getLogger(FallbackSecureKeyStore.class);

    private final SecureStorageBackend keyRules;
    private final AtomicReference<StorageMode> mode;

    public FallbackSecureKeyStore(SecureStorageBackend backend) {
        if (backend == null) {
            throw new IllegalArgumentException("Storage backend cannot be null");
        }
        this.keyRules = backend;
        this.mode = new AtomicReference<>(new SecureBackend(backend));
    }

    /**
     * Creates a store that is in memory mode from the start.
     */
    public static FallbackSecureKeyStore inMemory() {
        FallbackSecureKeyStore store = new FallbackSecureKeyStore(new InMemoryStorageBackend());
        store.mode.set(new MemoryFallback(new ConcurrentHashMap<>(), null));
        return store;
    }

    @Override
    public Optional<byte[]> read(String key) {
        requireKey(key);
        StorageMode current = mode.get();
        if (current instanceof SecureBackend secure) {
            try {
                return Optional.ofNullable(secure.backend().get(key));
            } catch (SecureStorageBackend.SecureStorageException | RuntimeException e) {
                return degrade("read", key, e).read(key);
            }
        }
        return ((MemoryFallback) current).read(key);
    }

    @Override
    public void write(String key, byte[] value) {
        requireKey(key);
        if (value == null) {
            throw new IllegalArgumentException("Value cannot be null");
        }
        StorageMode current = mode.get();
        if (current instanceof SecureBackend secure) {
            try {
                secure.backend().set(key, value);
                return;
            } catch (SecureStorageBackend.SecureStorageException | RuntimeException e) {
                degrade("write", key, e).write(key, value);
                return;
            }
        }
        ((MemoryFallback) current).write(key, value);
    }

    @Override
    public void delete(String key) {
        requireKey(key);
        StorageMode current = mode.get();
        if (current instanceof SecureBackend secure) {
            try {
                secure.backend().delete(key);
                return;
            } catch (SecureStorageBackend.SecureStorageException | RuntimeException e) {
                degrade("delete", key, e).delete(key);
                return;
            }
        }
        ((MemoryFallback) current).delete(key);
    }

    @Override
    public boolean isEphemeral() {
        StorageMode current = mode.get();
        return current instanceof MemoryFallback
                || !((SecureBackend) current).backend().isPersistent();
    }

    /**
     * Gets the current storage mode.
     */
    public StorageMode getMode() {
        return mode.get();
    }

    private MemoryFallback degrade(String operation, String key, Exception cause) {
        MemoryFallback fallback = new MemoryFallback(new ConcurrentHashMap<>(), cause);
        StorageMode previous = mode.get();
        if (previous instanceof MemoryFallback existing) {
            return existing;
        }
        if (mode.compareAndSet(previous, fallback)) {
            log.warn("Secure storage {} of '{}' failed, switching to in-memory key storage; "
                    + "identity keys will not survive a restart", operation, key, cause);
            return fallback;
        }
        return (MemoryFallback) mode.get();
    }

    /**
     * Key names follow the backend's rules in both modes, and a rejected name never
     * triggers the switch to memory.
     */
    private void requireKey(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Storage key cannot be null or blank");
        }
        keyRules.validateKey(key);
    }

    // ==================== Storage Modes ====================

    /**
     * Where the store currently keeps its entries.
     */
    public sealed interface StorageMode permits SecureBackend, MemoryFallback {
    }

    /**
     * Entries live in the platform backend.
     */
    public record SecureBackend(SecureStorageBackend backend) implements StorageMode {
    }

    /**
     * Entries live in process memory after a backend failure.
     *
     * @param cause The backend failure that caused the switch, or null if the store
     *              was created in memory mode
     */
    public record MemoryFallback(Map<String, byte[]> entries, Exception cause) implements StorageMode {

        Optional<byte[]> read(String key) {
            byte[] value = entries.get(key);
            return value != null ? Optional.of(value.clone()) : Optional.empty();
        }

        void write(String key, byte[] value) {
            entries.put(key, value.clone());
        }

        void delete(String key) {
            entries.remove(key);
        }
    }
}
