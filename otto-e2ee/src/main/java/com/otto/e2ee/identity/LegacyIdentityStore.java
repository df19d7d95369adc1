package com.otto.e2ee.identity;

import com.otto.e2ee.codec.KeyCodec;
import com.otto.e2ee.codec.KeyFormatException;
import com.otto.e2ee.key.SecureKeyStore;
import com.otto.e2ee.key.StorageKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.SecureRandom;
import java.security.interfaces.RSAPrivateKey;
import java.security.interfaces.RSAPublicKey;
import java.security.spec.RSAKeyGenParameterSpec;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Storage access for the legacy RSA identity and detection of which identity
 * schemes are present on the device.
 */
public class LegacyIdentityStore {

    private static final Logger log = LoggerFactory.getLogger(LegacyIdentityStore.class);

    public static final int RSA_KEY_SIZE = 2048;

    private final SecureKeyStore keyStore;
    private final SecureRandom secureRandom;

    public LegacyIdentityStore(SecureKeyStore keyStore, SecureRandom secureRandom) {
        if (keyStore == null) {
            throw new IllegalArgumentException("KeyStore cannot be null");
        }
        this.keyStore = keyStore;
        this.secureRandom = secureRandom != null ? secureRandom : new SecureRandom();
    }

    public LegacyIdentityStore(SecureKeyStore keyStore) {
        this(keyStore, new SecureRandom());
    }

    /**
     * Which identity schemes currently have key material in storage.
     */
    public Set<StoredScheme> detectStoredSchemes() {
        Set<StoredScheme> schemes = EnumSet.noneOf(StoredScheme.class);
        if (isPresent(StorageKeys.IDENTITY_SEED_HEX)) {
            schemes.add(StoredScheme.SEED);
        }
        if (isPresent(StorageKeys.LEGACY_PRIVATE_KEY_PEM) || isPresent(StorageKeys.LEGACY_PUBLIC_KEY_PEM)) {
            schemes.add(StoredScheme.LEGACY_RSA);
        }
        return schemes;
    }

    public boolean hasLegacyKeys() {
        return detectStoredSchemes().contains(StoredScheme.LEGACY_RSA);
    }

    /**
     * Loads the stored legacy keypair.
     *
     * @return Empty if either PEM is missing
     * @throws KeyFormatException if a stored PEM cannot be parsed
     * @throws IllegalArgumentException if the two stored keys do not form a pair
     */
    public Optional<LegacyRsaIdentity> load() {
        Optional<String> privatePem = readText(StorageKeys.LEGACY_PRIVATE_KEY_PEM);
        Optional<String> publicPem = readText(StorageKeys.LEGACY_PUBLIC_KEY_PEM);
        if (privatePem.isEmpty() || publicPem.isEmpty()) {
            return Optional.empty();
        }
        RSAPrivateKey privateKey = KeyCodec.decodePrivateKeyPem(privatePem.get());
        RSAPublicKey publicKey = KeyCodec.decodePublicKeyPem(publicPem.get());
        return Optional.of(new LegacyRsaIdentity(publicKey, privateKey));
    }

    /**
     * Overwrites the stored legacy keypair.
     */
    public void save(LegacyRsaIdentity identity) {
        if (identity == null) {
            throw new IllegalArgumentException("Identity cannot be null");
        }
        keyStore.write(StorageKeys.LEGACY_PRIVATE_KEY_PEM, identity.privateKeyPem().getBytes(StandardCharsets.US_ASCII));
        keyStore.write(StorageKeys.LEGACY_PUBLIC_KEY_PEM, identity.publicKeyPem().getBytes(StandardCharsets.US_ASCII));
        log.info("Stored legacy RSA identity, fingerprint {}", KeyCodec.fingerprint(identity.publicKey()));
    }

    public void delete() {
        keyStore.delete(StorageKeys.LEGACY_PRIVATE_KEY_PEM);
        keyStore.delete(StorageKeys.LEGACY_PUBLIC_KEY_PEM);
    }

    /**
     * Generates a fresh RSA-2048 keypair with public exponent 65537.
     */
    public LegacyRsaIdentity generate() {
        try {
            KeyPairGenerator generator = KeyPairGenerator.getInstance("RSA");
            generator.initialize(new RSAKeyGenParameterSpec(RSA_KEY_SIZE, RSAKeyGenParameterSpec.F4), secureRandom);
            KeyPair pair = generator.generateKeyPair();
            return new LegacyRsaIdentity((RSAPublicKey) pair.getPublic(), (RSAPrivateKey) pair.getPrivate());
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("RSA key generation unavailable", e);
        }
    }

    private boolean isPresent(String key) {
        return keyStore.read(key).map(value -> value.length > 0).orElse(false);
    }

    private Optional<String> readText(String key) {
        return keyStore.read(key)
                .filter(value -> value.length > 0)
                .map(value -> new String(value, StandardCharsets.US_ASCII));
    }

    /**
     * Identity schemes that can be found in storage.
     */
    public enum StoredScheme {
        SEED,
        LEGACY_RSA
    }
}
