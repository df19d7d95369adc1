package com.otto.e2ee.key;

import java.util.Optional;

/**
 * Interface for secure key storage.
 * Implementations should use hardware-backed storage when available (Keychain/Keystore).
 *
 * Values are opaque byte strings addressed by the names in {@link StorageKeys}.
 * None of the operations throw on backend failure: a store that loses its secure
 * backend keeps working from memory and reports it through {@link #isEphemeral()}.
 */
public interface SecureKeyStore {

    /**
     * Reads a value.
     *
     * @param key The storage key
     * @return The stored bytes, or empty if nothing is stored under the key
     */
    Optional<byte[]> read(String key);

    /**
     * Stores a value, replacing any previous value.
     *
     * @param key The storage key
     * @param value The bytes to store
     */
    void write(String key, byte[] value);

    /**
     * Deletes a value. Deleting a missing key is a no-op.
     *
     * @param key The storage key
     */
    void delete(String key);

    /**
     * Checks whether values written now will be lost when the process exits.
     *
     * @return true if the store is running without persistent secure storage
     */
    boolean isEphemeral();
}
