package com.otto.e2ee.key;

/**
 * Names of the entries the E2EE subsystem keeps in the {@link SecureKeyStore}.
 */
public final class StorageKeys {

    /** Identity seed, 64 lowercase hex characters. */
    public static final String IDENTITY_SEED_HEX = "device_identity_seed_hex";

    /** Legacy RSA private key, PKCS8 PEM. Kept until migration removes it. */
    public static final String LEGACY_PRIVATE_KEY_PEM = "device_private_key_pem";

    /** Legacy RSA public key, SubjectPublicKeyInfo PEM. Kept until migration removes it. */
    public static final String LEGACY_PUBLIC_KEY_PEM = "device_public_key_pem";

    /** Last accepted server RSA public key, PEM. */
    public static final String SERVER_PUBLIC_KEY_PEM = "server_public_key_pem";

    private StorageKeys() {
    }
}
