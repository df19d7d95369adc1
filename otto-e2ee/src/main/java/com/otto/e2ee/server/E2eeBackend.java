package com.otto.e2ee.server;

import com.otto.e2ee.backup.EncryptedSeedBackup;

import java.util.concurrent.CompletableFuture;

/**
 * Backend endpoints the E2EE subsystem talks to.
 *
 * Futures fail with {@link FetchTimeoutException} on timeouts and
 * {@link E2eeBackendException} on error responses or transport failures.
 */
public interface E2eeBackend {

    /**
     * {@code GET {baseUrl}/users/server-public-key}, returning the PEM from {@code public_key}.
     */
    CompletableFuture<String> fetchServerPublicKeyPem(String baseUrl);

    /**
     * {@code POST {baseUrl}/users/me/public-key} with the base64 Ed25519 identity key.
     */
    CompletableFuture<Void> uploadIdentityPublicKey(String baseUrl, String username, String publicKeyBase64);

    /**
     * {@code GET {baseUrl}/users/{username}/public-key}, returning the raw Ed25519 key.
     */
    CompletableFuture<byte[]> fetchPeerPublicKey(String baseUrl, String username);

    /**
     * {@code POST {baseUrl}/users/me/seed-backup}.
     */
    CompletableFuture<Void> uploadSeedBackup(String baseUrl, String username, EncryptedSeedBackup backup);
}
