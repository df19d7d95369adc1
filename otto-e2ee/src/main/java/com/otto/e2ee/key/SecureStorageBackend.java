package com.otto.e2ee.key;

/**
 * Platform secure storage capability (keychain, keystore, protected files).
 *
 * Backends report every failure as {@link SecureStorageException}; deciding what to
 * do about it is left to the {@link SecureKeyStore} wrapping them.
 */
public interface SecureStorageBackend {

    /**
     * @return The stored bytes, or null if the key is absent
     */
    byte[] get(String key) throws SecureStorageException;

    void set(String key, byte[] value) throws SecureStorageException;

    void delete(String key) throws SecureStorageException;

    /**
     * Rejects key names this backend cannot store. Called before any storage access,
     * so a bad name is reported to the caller instead of looking like a storage failure.
     *
     * @throws IllegalArgumentException if the key is not acceptable
     */
    default void validateKey(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Storage key cannot be null or blank");
        }
    }

    /**
     * Checks if this backend survives a process restart.
     */
    boolean isPersistent();

    /**
     * Failure of the underlying platform storage.
     */
    class SecureStorageException extends Exception {
        public SecureStorageException(String message) {
            super(message);
        }

        public SecureStorageException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
