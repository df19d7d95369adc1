package com.otto.e2ee.identity;

import com.otto.e2ee.codec.KeyFormatException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Moves a device from the legacy RSA identity to the seed identity.
 *
 * The legacy PEMs stay in storage until a seed has been persisted; a device whose
 * storage is memory-only keeps them, since the new seed would be gone after a restart.
 */
public class IdentityMigration {

    private static final Logger log = LoggerFactory.getLogger(IdentityMigration.class);

    private final IdentityKeyManager keyManager;
    private final LegacyIdentityStore legacyStore;
    private final Executor executor;

    public IdentityMigration(IdentityKeyManager keyManager, LegacyIdentityStore legacyStore, Executor executor) {
        if (keyManager == null || legacyStore == null || executor == null) {
            throw new IllegalArgumentException("Key manager, legacy store, and executor are required");
        }
        this.keyManager = keyManager;
        this.legacyStore = legacyStore;
        this.executor = executor;
    }

    /**
     * Migrates when legacy keys are present, otherwise just initializes the identity.
     */
    public CompletableFuture<MigrationResult> migrateIfNeeded() {
        return CompletableFuture.supplyAsync(this::inspect, executor)
                .thenCompose(before -> keyManager.initializeKeys()
                        .thenApply(identity -> complete(before, identity)));
    }

    private Snapshot inspect() {
        Set<LegacyIdentityStore.StoredScheme> schemes = legacyStore.detectStoredSchemes();
        if (!schemes.contains(LegacyIdentityStore.StoredScheme.LEGACY_RSA)) {
            return new Snapshot(schemes, null);
        }
        try {
            return new Snapshot(schemes, legacyStore.load().orElse(null));
        } catch (KeyFormatException | IllegalArgumentException e) {
            log.warn("Stored legacy identity is unreadable and will be discarded: {}", e.getMessage());
            return new Snapshot(schemes, null);
        }
    }

    private MigrationResult complete(Snapshot before, SeedIdentity identity) {
        if (!before.schemes().contains(LegacyIdentityStore.StoredScheme.LEGACY_RSA)) {
            return new MigrationResult(MigrationStatus.NOT_NEEDED, identity, null);
        }
        if (keyManager.isEphemeral()) {
            log.warn("Keeping legacy identity: the new seed is not persisted");
            return new MigrationResult(MigrationStatus.DEFERRED, identity, before.legacy());
        }

        legacyStore.delete();
        if (before.schemes().contains(LegacyIdentityStore.StoredScheme.SEED)) {
            log.info("Removed leftover legacy identity from an earlier migration");
            return new MigrationResult(MigrationStatus.LEGACY_REMOVED, identity, before.legacy());
        }
        log.info("Migrated legacy RSA identity to seed identity");
        return new MigrationResult(MigrationStatus.MIGRATED, identity, before.legacy());
    }

    private record Snapshot(Set<LegacyIdentityStore.StoredScheme> schemes, LegacyRsaIdentity legacy) {
    }

    public enum MigrationStatus {
        /** No legacy keys were stored. */
        NOT_NEEDED,
        /** Legacy keys replaced by a newly generated seed. */
        MIGRATED,
        /** Seed already existed; stale legacy keys were deleted. */
        LEGACY_REMOVED,
        /** Storage is memory-only; legacy keys were left in place. */
        DEFERRED
    }

    /**
     * Outcome of {@link #migrateIfNeeded()}.
     *
     * @param status What the migration did
     * @param identity The seed identity now in use
     * @param retiredLegacy The legacy keypair found before migration, null if none was readable
     */
    public record MigrationResult(MigrationStatus status, SeedIdentity identity, LegacyRsaIdentity retiredLegacy) {

        public Optional<LegacyRsaIdentity> retiredLegacyIdentity() {
            return Optional.ofNullable(retiredLegacy);
        }

        public boolean migrated() {
            return status == MigrationStatus.MIGRATED;
        }
    }
}
