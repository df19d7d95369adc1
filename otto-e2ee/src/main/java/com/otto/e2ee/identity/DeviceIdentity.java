package com.otto.e2ee.identity;

/**
 * A device identity under one of the two key schemes the client has shipped.
 *
 * Callers switch on the variant rather than null-checking parallel fields. A device
 * found holding only a {@link LegacyRsaIdentity} is migrated by {@link IdentityMigration}.
 */
public sealed interface DeviceIdentity permits SeedIdentity, LegacyRsaIdentity {
}
