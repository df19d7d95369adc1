package com.otto.e2ee.server;

import com.otto.e2ee.E2eeException;
import com.otto.e2ee.codec.KeyCodec;
import com.otto.e2ee.codec.KeyFormatException;
import com.otto.e2ee.key.SecureKeyStore;
import com.otto.e2ee.key.StorageKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.interfaces.RSAPublicKey;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Encrypts small payloads (message keys) to the backend's RSA public key.
 *
 * The key is held in memory and mirrored in the secure store as PEM. When it is
 * missing at encryption time the channel loads the stored copy, then fetches from
 * the configured base URL, and only then gives up.
 */
public class HybridServerChannel {

    private static final Logger log = LoggerFactory.getLogger(HybridServerChannel.class);

    public static final int MIN_SERVER_KEY_BITS = 2048;

    private final SecureKeyStore keyStore;
    private final E2eeBackend backend;
    private final String defaultBaseUrl;
    private final Executor executor;
    private final AtomicReference<RSAPublicKey> serverKey;
    private final AtomicReference<CompletableFuture<RSAPublicKey>> inFlight;

    public HybridServerChannel(SecureKeyStore keyStore, E2eeBackend backend, String defaultBaseUrl, Executor executor) {
        if (keyStore == null || backend == null || executor == null) {
            throw new IllegalArgumentException("Key store, backend, and executor are required");
        }
        this.keyStore = keyStore;
        this.backend = backend;
        this.defaultBaseUrl = defaultBaseUrl;
        this.executor = executor;
        this.serverKey = new AtomicReference<>();
        this.inFlight = new AtomicReference<>();
    }

    // ==================== Server Key Lifecycle ====================

    /**
     * Fetches, validates and caches the server key.
     *
     * If the fetch fails the key already in memory is kept, or else the stored copy is
     * loaded. With neither available the
     * channel stays {@link ServerKeyState#NO_SERVER_KEY} and the future fails with the
     * fetch error ({@link FetchTimeoutException}, {@link E2eeBackendException} or
     * {@link KeyFormatException}).
     */
    public CompletableFuture<RSAPublicKey> fetchServerPublicKey(String baseUrl) {
        CompletableFuture<String> fetch;
        try {
            fetch = backend.fetchServerPublicKeyPem(baseUrl);
        } catch (RuntimeException e) {
            fetch = CompletableFuture.failedFuture(e);
        }
        return fetch
                .thenApplyAsync(this::acceptPem, executor)
                .handleAsync((key, error) -> {
                    if (error == null) {
                        return key;
                    }
                    Throwable cause = unwrap(error);
                    RSAPublicKey current = serverKey.get();
                    if (current != null) {
                        log.warn("Server public key fetch failed, keeping the key in memory: {}", cause.getMessage());
                        return current;
                    }
                    log.warn("Server public key fetch failed, trying stored copy: {}", cause.getMessage());
                    return loadStoredKey().orElseThrow(() -> asCompletionException(cause));
                }, executor);
    }

    /**
     * The in-memory key, loading or fetching it when absent.
     *
     * @return Future failing with {@link ServerKeyUnavailableException} if no key can be obtained
     */
    public CompletableFuture<RSAPublicKey> requireServerKey() {
        while (true) {
            RSAPublicKey current = serverKey.get();
            if (current != null) {
                return CompletableFuture.completedFuture(current);
            }
            CompletableFuture<RSAPublicKey> pending = inFlight.get();
            if (pending != null) {
                return pending;
            }
            CompletableFuture<RSAPublicKey> attempt = new CompletableFuture<>();
            if (inFlight.compareAndSet(null, attempt)) {
                resolveKey().whenComplete((key, error) -> {
                    inFlight.compareAndSet(attempt, null);
                    if (error != null) {
                        attempt.completeExceptionally(error);
                    } else {
                        attempt.complete(key);
                    }
                });
                return attempt;
            }
        }
    }

    private CompletableFuture<RSAPublicKey> resolveKey() {
        return CompletableFuture.supplyAsync(this::loadStoredKey, executor)
                .thenCompose(stored -> {
                    if (stored.isPresent()) {
                        return CompletableFuture.completedFuture(stored.get());
                    }
                    if (defaultBaseUrl == null || defaultBaseUrl.isBlank()) {
                        return CompletableFuture.failedFuture(
                                new ServerKeyUnavailableException("Server public key not loaded and no backend URL configured"));
                    }
                    return fetchServerPublicKey(defaultBaseUrl)
                            .handle((key, error) -> {
                                if (error != null) {
                                    throw new CompletionException(new ServerKeyUnavailableException(
                                            "Server public key not loaded and fetch failed", unwrap(error)));
                                }
                                return key;
                            });
                });
    }

    /**
     * Drops the in-memory and stored server key.
     */
    public void invalidateServerKey() {
        serverKey.set(null);
        keyStore.delete(StorageKeys.SERVER_PUBLIC_KEY_PEM);
        log.info("Server public key invalidated");
    }

    public ServerKeyState getState() {
        return serverKey.get() != null ? ServerKeyState.HAS_SERVER_KEY : ServerKeyState.NO_SERVER_KEY;
    }

    public Optional<RSAPublicKey> currentServerKey() {
        return Optional.ofNullable(serverKey.get());
    }

    // ==================== Encryption ====================

    /**
     * RSA-OAEP-SHA256 encryption to the server key.
     */
    public CompletableFuture<byte[]> encryptForServer(byte[] data) {
        if (data == null) {
            throw new IllegalArgumentException("Data cannot be null");
        }
        byte[] plaintext = data.clone();
        return requireServerKey().thenApply(key -> RsaOaep.encrypt(key, plaintext));
    }

    // ==================== Helpers ====================

    private RSAPublicKey acceptPem(String pem) {
        RSAPublicKey key = KeyCodec.decodePublicKeyPem(pem);
        if (key.getModulus().bitLength() < MIN_SERVER_KEY_BITS) {
            throw new KeyFormatException("modulus",
                    "Server key too short: " + key.getModulus().bitLength() + " bits");
        }
        keyStore.write(StorageKeys.SERVER_PUBLIC_KEY_PEM, pem.getBytes(StandardCharsets.US_ASCII));
        serverKey.set(key);
        log.info("Server public key accepted, fingerprint {}", KeyCodec.fingerprint(key));
        return key;
    }

    private Optional<RSAPublicKey> loadStoredKey() {
        Optional<byte[]> stored = keyStore.read(StorageKeys.SERVER_PUBLIC_KEY_PEM);
        if (stored.isEmpty() || stored.get().length == 0) {
            return Optional.empty();
        }
        try {
            RSAPublicKey key = KeyCodec.decodePublicKeyPem(new String(stored.get(), StandardCharsets.US_ASCII));
            serverKey.set(key);
            log.info("Server public key loaded from storage, fingerprint {}", KeyCodec.fingerprint(key));
            return Optional.of(key);
        } catch (KeyFormatException e) {
            log.warn("Stored server public key is unreadable ({}), discarding it", e.getField());
            invalidateServerKey();
            return Optional.empty();
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static CompletionException asCompletionException(Throwable cause) {
        if (cause instanceof E2eeException) {
            return new CompletionException(cause);
        }
        return new CompletionException(new ServerKeyUnavailableException("Server public key fetch failed", cause));
    }
}
