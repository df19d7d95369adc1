package com.otto.e2ee.identity;

/**
 * Current scheme: Ed25519/X25519 keys derived from a 32-byte seed.
 */
public record SeedIdentity(IdentityKeyPair keyPair) implements DeviceIdentity {

    public SeedIdentity {
        if (keyPair == null) {
            throw new IllegalArgumentException("Key pair cannot be null");
        }
    }

    public IdentitySeed seed() {
        return keyPair.seed();
    }

    public String publicKeyBase64() {
        return keyPair.publicKeyBase64();
    }
}
