package com.otto.e2ee;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.otto.e2ee.agreement.IdentityKeyAgreement;
import com.otto.e2ee.backup.EncryptedSeedBackup;
import com.otto.e2ee.backup.SeedBackupService;
import com.otto.e2ee.cipher.ConversationKeyCache;
import com.otto.e2ee.cipher.SymmetricCipher;
import com.otto.e2ee.cipher.SymmetricKey;
import com.otto.e2ee.config.E2eeConfig;
import com.otto.e2ee.config.ObjectMappers;
import com.otto.e2ee.identity.IdentityKeyManager;
import com.otto.e2ee.identity.IdentityMigration;
import com.otto.e2ee.identity.KeysUnavailableException;
import com.otto.e2ee.identity.LegacyIdentityExport;
import com.otto.e2ee.identity.LegacyIdentityStore;
import com.otto.e2ee.identity.MnemonicCodec;
import com.otto.e2ee.identity.SeedIdentity;
import com.otto.e2ee.key.FallbackSecureKeyStore;
import com.otto.e2ee.key.FileStorageBackend;
import com.otto.e2ee.key.InMemoryStorageBackend;
import com.otto.e2ee.key.SecureKeyStore;
import com.otto.e2ee.key.SecureStorageBackend;
import com.otto.e2ee.message.MessageEncryptor;
import com.otto.e2ee.server.E2eeBackend;
import com.otto.e2ee.server.HttpE2eeBackend;
import com.otto.e2ee.server.HybridServerChannel;
import com.otto.e2ee.server.ServerKeyState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Long-lived wiring of the E2EE services for one process.
 *
 * Build it once at app start, call {@link #start()}, and hand the individual services
 * to the code that needs them. Closing the session stops the executor it created; an
 * executor passed in by the caller is left running.
 */
public class E2eeSession implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(E2eeSession.class);

    private final E2eeConfig config;
    private final ExecutorService ownedExecutor;
    private final SecureKeyStore keyStore;
    private final E2eeBackend backend;
    private final IdentityKeyManager keyManager;
    private final LegacyIdentityStore legacyStore;
    private final IdentityMigration migration;
    private final LegacyIdentityExport legacyExport;
    private final IdentityKeyAgreement keyAgreement;
    private final SymmetricCipher cipher;
    private final ConversationKeyCache conversationKeys;
    private final HybridServerChannel serverChannel;
    private final MessageEncryptor messageEncryptor;
    private final SeedBackupService seedBackup;

    private E2eeSession(E2eeConfig config, SecureStorageBackend storageBackend, E2eeBackend backend,
                        Executor executor, ExecutorService ownedExecutor) {
        SecureRandom secureRandom = new SecureRandom();
        ObjectMapper objectMapper = ObjectMappers.create();

        this.config = config;
        this.ownedExecutor = ownedExecutor;
        this.keyStore = new FallbackSecureKeyStore(storageBackend);
        this.backend = backend != null
                ? backend
                : new HttpE2eeBackend(config.connectTimeout(), config.requestTimeout(), objectMapper, executor);
        this.keyManager = new IdentityKeyManager(keyStore, new MnemonicCodec(), secureRandom, executor);
        this.legacyStore = new LegacyIdentityStore(keyStore, secureRandom);
        this.migration = new IdentityMigration(keyManager, legacyStore, executor);
        this.legacyExport = new LegacyIdentityExport(legacyStore, objectMapper);
        this.keyAgreement = new IdentityKeyAgreement(keyManager);
        this.cipher = new SymmetricCipher(secureRandom);
        this.conversationKeys = new ConversationKeyCache(cipher, keyAgreement, executor);
        this.serverChannel = new HybridServerChannel(keyStore, this.backend, config.backendBaseUrl(), executor);
        this.messageEncryptor = new MessageEncryptor(cipher, conversationKeys, serverChannel, objectMapper);
        this.seedBackup = new SeedBackupService(cipher, this.backend, config.backupPolicy(), secureRandom, Clock.systemUTC());

        keyManager.addIdentityListener(conversationKeys);
    }

    /**
     * Session with file or memory storage per the config, the HTTP backend and an own executor.
     */
    public static E2eeSession create(E2eeConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("Config cannot be null");
        }
        SecureStorageBackend storage = config.storageDirectory() != null
                ? new FileStorageBackend(config.storageDirectory())
                : new InMemoryStorageBackend();
        ExecutorService executor = newExecutor();
        return new E2eeSession(config, storage, null, executor, executor);
    }

    /**
     * Session over caller-supplied collaborators. The executor is not shut down on close.
     */
    public static E2eeSession create(E2eeConfig config, SecureStorageBackend storage,
                                     E2eeBackend backend, Executor executor) {
        if (config == null || storage == null || executor == null) {
            throw new IllegalArgumentException("Config, storage, and executor are required");
        }
        return new E2eeSession(config, storage, backend, executor, null);
    }

    // ==================== Startup ====================

    /**
     * Migrates legacy keys, initializes the identity, publishes a newly generated public
     * key, and fetches the server key.
     *
     * Fails with {@link KeysUnavailableException} when the identity cannot be set up. A
     * failed key upload is only logged and stays pending for the next call in this
     * process. A failed server key fetch is tolerated when a stored key exists;
     * otherwise the network error is returned.
     */
    public CompletableFuture<StartResult> start() {
        return migration.migrateIfNeeded()
                .thenCompose(migrated -> publishIdentityKeyIfNeeded()
                        .thenCompose(published -> refreshServerKey()
                                .thenApply(state -> new StartResult(
                                        migrated.identity(), migrated, published, state))));
    }

    /**
     * Uploads the identity public key if it was generated in this process and not yet published.
     *
     * @return Future of whether an upload happened
     */
    public CompletableFuture<Boolean> publishIdentityKeyIfNeeded() {
        if (!keyManager.keysWereJustGenerated()) {
            return CompletableFuture.completedFuture(false);
        }
        if (config.backendBaseUrl() == null || config.username() == null) {
            log.info("Identity key not published: backend URL or username not configured");
            return CompletableFuture.completedFuture(false);
        }
        return keyManager.getPublicKeyBase64()
                .thenCompose(publicKey -> backend.uploadIdentityPublicKey(
                        config.backendBaseUrl(), config.username(), publicKey))
                .handle((ignored, error) -> {
                    if (error != null) {
                        log.warn("Identity public key upload failed, keeping it pending: {}", error.getMessage());
                        return false;
                    }
                    keyManager.consumeKeysWereJustGenerated();
                    log.info("Identity public key published for {}", config.username());
                    return true;
                });
    }

    private CompletableFuture<ServerKeyState> refreshServerKey() {
        if (config.backendBaseUrl() == null) {
            return CompletableFuture.completedFuture(serverChannel.getState());
        }
        return serverChannel.fetchServerPublicKey(config.backendBaseUrl())
                .thenApply(key -> serverChannel.getState());
    }

    // ==================== Peers ====================

    /**
     * Conversation key agreed with another user, fetching their published identity key.
     */
    public CompletableFuture<SymmetricKey> conversationKeyWith(String conversationId, String peerUsername) {
        if (config.backendBaseUrl() == null) {
            throw new IllegalStateException("Peer key lookup requires a backend URL");
        }
        Optional<CompletableFuture<SymmetricKey>> agreed = conversationKeys.findAgreed(conversationId);
        if (agreed.isPresent()) {
            return agreed.get();
        }
        return backend.fetchPeerPublicKey(config.backendBaseUrl(), peerUsername)
                .thenCompose(peerKey -> conversationKeys.getOrDerive(conversationId, peerKey));
    }

    // ==================== Seed Backup ====================

    /**
     * Encrypts the current seed under the passphrase and uploads it.
     */
    public CompletableFuture<EncryptedSeedBackup> backupSeed(char[] passphrase) {
        if (config.backendBaseUrl() == null || config.username() == null) {
            throw new IllegalStateException("Seed backup requires a backend URL and username");
        }
        return keyManager.initializeKeys()
                .thenApply(identity -> seedBackup.create(identity.seed(), passphrase))
                .thenCompose(backup -> seedBackup.upload(config.backendBaseUrl(), config.username(), backup)
                        .thenApply(ignored -> backup));
    }

    /**
     * Decrypts a backup and replaces the device identity with it.
     */
    public CompletableFuture<SeedIdentity> restoreSeedBackup(EncryptedSeedBackup backup, char[] passphrase) {
        return keyManager.importIdentitySeed(seedBackup.restore(backup, passphrase).toBytes());
    }

    // ==================== Accessors ====================

    public E2eeConfig config() {
        return config;
    }

    public SecureKeyStore keyStore() {
        return keyStore;
    }

    public E2eeBackend backend() {
        return backend;
    }

    public IdentityKeyManager keyManager() {
        return keyManager;
    }

    public LegacyIdentityStore legacyStore() {
        return legacyStore;
    }

    public LegacyIdentityExport legacyExport() {
        return legacyExport;
    }

    public IdentityKeyAgreement keyAgreement() {
        return keyAgreement;
    }

    public SymmetricCipher cipher() {
        return cipher;
    }

    public ConversationKeyCache conversationKeys() {
        return conversationKeys;
    }

    public HybridServerChannel serverChannel() {
        return serverChannel;
    }

    public MessageEncryptor messageEncryptor() {
        return messageEncryptor;
    }

    public SeedBackupService seedBackup() {
        return seedBackup;
    }

    @Override
    public void close() {
        if (ownedExecutor != null) {
            ownedExecutor.shutdown();
        }
    }

    private static ExecutorService newExecutor() {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory factory = runnable -> {
            Thread thread = new Thread(runnable, "otto-e2ee-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newFixedThreadPool(2, factory);
    }

    /**
     * Outcome of {@link #start()}.
     */
    public record StartResult(
            SeedIdentity identity,
            IdentityMigration.MigrationResult migration,
            boolean identityKeyPublished,
            ServerKeyState serverKeyState
    ) {}
}
