package com.otto.e2ee.identity;

import com.otto.e2ee.key.SecureKeyStore;
import com.otto.e2ee.key.StorageKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owns the device's long-term identity: load or generate on init, seed import,
 * recovery phrases and signing.
 *
 * Only the 32-byte seed is persisted (hex, under {@link StorageKeys#IDENTITY_SEED_HEX});
 * the Ed25519 keypair is re-derived from it on every start. Initialization runs at
 * most once at a time: concurrent callers share the in-flight future, so two
 * callers can never race to write different seeds.
 */
public class IdentityKeyManager {

    private static final Logger log = LoggerFactory.getLogger(IdentityKeyManager.class);

    private final SecureKeyStore keyStore;
    private final MnemonicCodec mnemonicCodec;
    private final SecureRandom secureRandom;
    private final Executor executor;
    private final List<IdentityListener> listeners;
    private final AtomicReference<CompletableFuture<SeedIdentity>> initialization;
    private final Object stateLock = new Object();

    private volatile SeedIdentity identity;
    private volatile IdentityState state;
    private volatile boolean keysWereJustGenerated;

    public IdentityKeyManager(SecureKeyStore keyStore, MnemonicCodec mnemonicCodec,
                              SecureRandom secureRandom, Executor executor) {
        if (keyStore == null) {
            throw new IllegalArgumentException("KeyStore cannot be null");
        }
        if (executor == null) {
            throw new IllegalArgumentException("Executor cannot be null");
        }
        this.keyStore = keyStore;
        this.mnemonicCodec = mnemonicCodec != null ? mnemonicCodec : new MnemonicCodec();
        this.secureRandom = secureRandom != null ? secureRandom : new SecureRandom();
        this.executor = executor;
        this.listeners = new CopyOnWriteArrayList<>();
        this.initialization = new AtomicReference<>();
        this.state = IdentityState.UNINITIALIZED;
    }

    public IdentityKeyManager(SecureKeyStore keyStore) {
        this(keyStore, new MnemonicCodec(), new SecureRandom(), ForkJoinPool.commonPool());
    }

    // ==================== Initialization ====================

    /**
     * Loads the stored seed or generates a new one, then derives the keypair.
     *
     * A missing or malformed stored seed is replaced by a fresh one and never fails
     * the call. If derivation itself fails the manager becomes {@link IdentityState#DEGRADED}
     * and the future fails with {@link KeysUnavailableException}; the next call tries again.
     *
     * @return Future of the initialized identity, shared with concurrent callers
     */
    public CompletableFuture<SeedIdentity> initializeKeys() {
        while (true) {
            SeedIdentity current = identity;
            if (current != null) {
                return CompletableFuture.completedFuture(current);
            }
            CompletableFuture<SeedIdentity> inFlight = initialization.get();
            if (inFlight != null) {
                return inFlight;
            }
            CompletableFuture<SeedIdentity> attempt = new CompletableFuture<>();
            if (initialization.compareAndSet(null, attempt)) {
                startInitialization(attempt);
                return attempt;
            }
        }
    }

    private void startInitialization(CompletableFuture<SeedIdentity> attempt) {
        // The slot is cleared before completion so callbacks on the attempt start a fresh one
        Runnable task = () -> {
            SeedIdentity loaded;
            try {
                loaded = loadOrGenerate();
            } catch (RuntimeException e) {
                state = IdentityState.DEGRADED;
                log.error("Cannot initialize secure identity", e);
                initialization.compareAndSet(attempt, null);
                attempt.completeExceptionally(new KeysUnavailableException("Cannot initialize secure identity", e));
                return;
            }
            initialization.compareAndSet(attempt, null);
            attempt.complete(loaded);
        };
        try {
            executor.execute(task);
        } catch (RejectedExecutionException e) {
            state = IdentityState.DEGRADED;
            initialization.compareAndSet(attempt, null);
            attempt.completeExceptionally(new KeysUnavailableException("Identity executor rejected initialization", e));
        }
    }

    private SeedIdentity loadOrGenerate() {
        synchronized (stateLock) {
            if (identity != null) {
                return identity;
            }

            Optional<IdentitySeed> stored = readStoredSeed();
            if (stored.isPresent()) {
                SeedIdentity loaded = new SeedIdentity(IdentityKeyPair.derive(stored.get()));
                install(loaded, false);
                log.info("Loaded device identity from stored seed");
                return loaded;
            }

            IdentitySeed seed = IdentitySeed.random(secureRandom);
            SeedIdentity generated = new SeedIdentity(IdentityKeyPair.derive(seed));
            keyStore.write(StorageKeys.IDENTITY_SEED_HEX, seed.toHex().getBytes(StandardCharsets.US_ASCII));
            install(generated, true);
            log.info("Generated new device identity");
            if (keyStore.isEphemeral()) {
                log.warn("Device identity is held in memory only and will not survive an app restart");
            }
            return generated;
        }
    }

    private Optional<IdentitySeed> readStoredSeed() {
        Optional<byte[]> raw = keyStore.read(StorageKeys.IDENTITY_SEED_HEX);
        if (raw.isEmpty() || raw.get().length == 0) {
            return Optional.empty();
        }
        String hex = new String(raw.get(), StandardCharsets.US_ASCII).trim();
        try {
            return Optional.of(IdentitySeed.fromHex(hex));
        } catch (IllegalArgumentException e) {
            log.warn("Discarding malformed stored identity seed ({} characters)", hex.length());
            keyStore.delete(StorageKeys.IDENTITY_SEED_HEX);
            return Optional.empty();
        }
    }

    private void install(SeedIdentity next, boolean generated) {
        identity = next;
        keysWereJustGenerated = generated;
        state = IdentityState.INITIALIZED;
    }

    // ==================== Import / Recovery ====================

    /**
     * Replaces the device identity with the given seed.
     *
     * Destructive: the stored seed is overwritten and every listener is told to drop
     * key material derived from the previous identity.
     *
     * @param seedBytes Exactly 32 bytes
     * @throws IllegalArgumentException immediately if the seed has the wrong length
     */
    public CompletableFuture<SeedIdentity> importIdentitySeed(byte[] seedBytes) {
        IdentitySeed seed = IdentitySeed.of(seedBytes);
        return CompletableFuture.supplyAsync(() -> replaceIdentity(seed), executor);
    }

    /**
     * Recovers the identity from a 24-word phrase and imports it.
     *
     * @throws InvalidMnemonicException immediately if the phrase is invalid
     */
    public CompletableFuture<SeedIdentity> importMnemonic(String phrase) {
        return importIdentitySeed(seedFromMnemonic(phrase).toBytes());
    }

    SeedIdentity replaceIdentity(IdentitySeed seed) {
        SeedIdentity previous;
        SeedIdentity imported;
        synchronized (stateLock) {
            previous = identity;
            imported = new SeedIdentity(IdentityKeyPair.derive(seed));
            keyStore.write(StorageKeys.IDENTITY_SEED_HEX, seed.toHex().getBytes(StandardCharsets.US_ASCII));
            install(imported, false);
        }
        log.info("Device identity replaced by imported seed");
        for (IdentityListener listener : listeners) {
            listener.onIdentityReplaced(previous, imported);
        }
        return imported;
    }

    public String mnemonicFromSeed(IdentitySeed seed) {
        return mnemonicCodec.toPhrase(seed);
    }

    public IdentitySeed seedFromMnemonic(String phrase) {
        return mnemonicCodec.toSeed(phrase);
    }

    /**
     * Recovery phrase of the current identity, initializing it first if needed.
     */
    public CompletableFuture<String> exportMnemonic() {
        return initializeKeys().thenApply(current -> mnemonicCodec.toPhrase(current.seed()));
    }

    // ==================== Identity Operations ====================

    /**
     * Signs data with the identity key, initializing it first if needed.
     */
    public CompletableFuture<byte[]> sign(byte[] data) {
        if (data == null) {
            throw new IllegalArgumentException("Data cannot be null");
        }
        return initializeKeys().thenApply(current -> current.keyPair().sign(data));
    }

    public boolean verify(byte[] publicKey, byte[] data, byte[] signature) {
        return IdentityKeyPair.verify(publicKey, data, signature);
    }

    public CompletableFuture<String> getPublicKeyBase64() {
        return initializeKeys().thenApply(SeedIdentity::publicKeyBase64);
    }

    /**
     * Current identity, initializing it first if needed.
     */
    public CompletableFuture<SeedIdentity> requireIdentity() {
        return initializeKeys();
    }

    public Optional<SeedIdentity> currentIdentity() {
        return Optional.ofNullable(identity);
    }

    public IdentityState getState() {
        return state;
    }

    /**
     * Whether the identity was generated (not loaded or imported) in this session.
     */
    public boolean keysWereJustGenerated() {
        return keysWereJustGenerated;
    }

    /**
     * Reads and clears the generated flag, so exactly one caller acts on it.
     */
    public boolean consumeKeysWereJustGenerated() {
        synchronized (stateLock) {
            boolean generated = keysWereJustGenerated;
            keysWereJustGenerated = false;
            return generated;
        }
    }

    /**
     * Whether the identity lives in memory only and will be lost on restart.
     */
    public boolean isEphemeral() {
        return keyStore.isEphemeral();
    }

    public void addIdentityListener(IdentityListener listener) {
        if (listener == null) {
            throw new IllegalArgumentException("Listener cannot be null");
        }
        listeners.add(listener);
    }
}
