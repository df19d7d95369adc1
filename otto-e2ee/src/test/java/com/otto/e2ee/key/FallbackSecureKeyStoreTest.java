package com.otto.e2ee.key;

import net.jqwik.api.*;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for the two-state secure store: platform backend first, process memory after
 * the first backend failure.
 */
class FallbackSecureKeyStoreTest {

    // ==================== Secure Backend Mode ====================

    @Property(tries = 50)
    void writeThenRead_returnsSameBytes(
            @ForAll("storageKeys") String key,
            @ForAll byte[] value) {
        FallbackSecureKeyStore store = new FallbackSecureKeyStore(new InMemoryStorageBackend());

        store.write(key, value);

        assertThat(store.read(key)).hasValueSatisfying(read -> assertThat(read).isEqualTo(value));
        assertThat(store.getMode()).isInstanceOf(FallbackSecureKeyStore.SecureBackend.class);
    }

    @Test
    void read_missingKeyIsEmpty() {
        FallbackSecureKeyStore store = new FallbackSecureKeyStore(new InMemoryStorageBackend());

        assertThat(store.read(StorageKeys.IDENTITY_SEED_HEX)).isEmpty();
    }

    @Test
    void delete_removesEntry() {
        InMemoryStorageBackend backend = new InMemoryStorageBackend();
        FallbackSecureKeyStore store = new FallbackSecureKeyStore(backend);
        store.write(StorageKeys.SERVER_PUBLIC_KEY_PEM, bytes("pem"));

        store.delete(StorageKeys.SERVER_PUBLIC_KEY_PEM);

        assertThat(store.read(StorageKeys.SERVER_PUBLIC_KEY_PEM)).isEmpty();
        assertThat(backend.contains(StorageKeys.SERVER_PUBLIC_KEY_PEM)).isFalse();
    }

    @Test
    void returnedBytes_areDefensiveCopies() {
        FallbackSecureKeyStore store = new FallbackSecureKeyStore(new InMemoryStorageBackend());
        byte[] value = bytes("abc");
        store.write("entry", value);
        value[0] = 'z';

        byte[] read = store.read("entry").orElseThrow();
        read[1] = 'z';

        assertThat(store.read("entry")).hasValueSatisfying(v -> assertThat(v).isEqualTo(bytes("abc")));
    }

    @Test
    void isEphemeral_reflectsBackendPersistence() {
        FallbackSecureKeyStore memoryBacked = new FallbackSecureKeyStore(new InMemoryStorageBackend());
        FallbackSecureKeyStore persistent = new FallbackSecureKeyStore(new FlakyBackend(true));

        assertThat(memoryBacked.isEphemeral()).isTrue();
        assertThat(persistent.isEphemeral()).isFalse();
        assertThat(FallbackSecureKeyStore.inMemory().isEphemeral()).isTrue();
    }

    // ==================== Degradation ====================

    @Test
    void backendFailure_switchesToMemoryAndServesOperation() {
        FlakyBackend backend = new FlakyBackend(true);
        FallbackSecureKeyStore store = new FallbackSecureKeyStore(backend);
        backend.failing.set(true);

        store.write(StorageKeys.IDENTITY_SEED_HEX, bytes("seed"));

        assertThat(store.getMode()).isInstanceOf(FallbackSecureKeyStore.MemoryFallback.class);
        assertThat(store.isEphemeral()).isTrue();
        assertThat(store.read(StorageKeys.IDENTITY_SEED_HEX))
                .hasValueSatisfying(v -> assertThat(v).isEqualTo(bytes("seed")));
        FallbackSecureKeyStore.MemoryFallback fallback = (FallbackSecureKeyStore.MemoryFallback) store.getMode();
        assertThat(fallback.cause()).isInstanceOf(SecureStorageBackend.SecureStorageException.class);
    }

    @Test
    void degradation_isOneDirectional() {
        FlakyBackend backend = new FlakyBackend(true);
        FallbackSecureKeyStore store = new FallbackSecureKeyStore(backend);
        backend.failing.set(true);
        assertThat(store.read("entry")).isEmpty();
        int callsAtSwitch = backend.calls.get();

        backend.failing.set(false);
        store.write("entry", bytes("after"));
        store.read("entry");
        store.delete("other");

        assertThat(backend.calls.get()).isEqualTo(callsAtSwitch);
        assertThat(store.getMode()).isInstanceOf(FallbackSecureKeyStore.MemoryFallback.class);
        assertThat(backend.stored).isNull();
    }

    @Test
    void runtimeExceptionFromBackend_alsoDegrades() {
        SecureStorageBackend exploding = new SecureStorageBackend() {
            @Override
            public byte[] get(String key) {
                throw new IllegalStateException("keychain locked");
            }

            @Override
            public void set(String key, byte[] value) {
                throw new IllegalStateException("keychain locked");
            }

            @Override
            public void delete(String key) {
                throw new IllegalStateException("keychain locked");
            }

            @Override
            public boolean isPersistent() {
                return true;
            }
        };
        FallbackSecureKeyStore store = new FallbackSecureKeyStore(exploding);

        store.delete("entry");

        assertThat(store.getMode()).isInstanceOf(FallbackSecureKeyStore.MemoryFallback.class);
    }

    @Test
    void keyRejectedByBackend_failsCallerAndKeepsBackend(@TempDir Path dir) {
        FallbackSecureKeyStore store = new FallbackSecureKeyStore(new FileStorageBackend(dir));
        store.write(StorageKeys.IDENTITY_SEED_HEX, bytes("seed"));

        assertThatThrownBy(() -> store.read("Conversation-Key"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> store.write("../escape", bytes("x")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> store.delete("UPPER"))
                .isInstanceOf(IllegalArgumentException.class);

        assertThat(store.getMode()).isInstanceOf(FallbackSecureKeyStore.SecureBackend.class);
        assertThat(store.isEphemeral()).isFalse();
        assertThat(store.read(StorageKeys.IDENTITY_SEED_HEX))
                .hasValueSatisfying(v -> assertThat(v).isEqualTo(bytes("seed")));
    }

    @Test
    void backendKeyRules_stillApplyAfterDegrading() {
        FlakyBackend backend = new FlakyBackend(true) {
            @Override
            public void validateKey(String key) {
                if (!key.equals(key.toLowerCase())) {
                    throw new IllegalArgumentException("Invalid storage key: " + key);
                }
            }
        };
        FallbackSecureKeyStore store = new FallbackSecureKeyStore(backend);
        backend.failing.set(true);
        store.write("entry", bytes("v"));

        assertThat(store.getMode()).isInstanceOf(FallbackSecureKeyStore.MemoryFallback.class);
        assertThatThrownBy(() -> store.write("Entry", bytes("v")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsBlankKeyAndNullValue() {
        FallbackSecureKeyStore store = new FallbackSecureKeyStore(new InMemoryStorageBackend());

        assertThatThrownBy(() -> store.read(" "))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> store.write("entry", null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new FallbackSecureKeyStore(null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    // ==================== Arbitraries ====================

    @Provide
    Arbitrary<String> storageKeys() {
        return Arbitraries.strings()
                .withCharRange('a', 'z')
                .withChars('_')
                .ofMinLength(1)
                .ofMaxLength(40);
    }

    private static byte[] bytes(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }

    /**
     * Backend that fails on demand and counts every call it receives.
     */
    static class FlakyBackend implements SecureStorageBackend {
        final AtomicBoolean failing = new AtomicBoolean();
        final AtomicInteger calls = new AtomicInteger();
        private final boolean persistent;
        volatile byte[] stored;

        FlakyBackend(boolean persistent) {
            this.persistent = persistent;
        }

        @Override
        public byte[] get(String key) throws SecureStorageException {
            check();
            return stored;
        }

        @Override
        public void set(String key, byte[] value) throws SecureStorageException {
            check();
            stored = value.clone();
        }

        @Override
        public void delete(String key) throws SecureStorageException {
            check();
            stored = null;
        }

        @Override
        public boolean isPersistent() {
            return persistent;
        }

        private void check() throws SecureStorageException {
            calls.incrementAndGet();
            if (failing.get()) {
                throw new SecureStorageException("backend unavailable");
            }
        }
    }
}
