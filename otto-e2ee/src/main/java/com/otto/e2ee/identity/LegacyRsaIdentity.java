package com.otto.e2ee.identity;

import com.otto.e2ee.codec.KeyCodec;

import java.security.interfaces.RSAPrivateKey;
import java.security.interfaces.RSAPublicKey;

/**
 * Previous scheme: an independently generated RSA-2048 keypair stored as PEM.
 *
 * Still needed to unwrap keys the backend wrapped for older clients and to export
 * the keypair to another device during the migration window.
 */
public record LegacyRsaIdentity(RSAPublicKey publicKey, RSAPrivateKey privateKey) implements DeviceIdentity {

    public LegacyRsaIdentity {
        if (publicKey == null || privateKey == null) {
            throw new IllegalArgumentException("Public and private key cannot be null");
        }
        if (!publicKey.getModulus().equals(privateKey.getModulus())) {
            throw new IllegalArgumentException("Public and private key do not belong to the same keypair");
        }
    }

    public String publicKeyPem() {
        return KeyCodec.encodePublicKeyPem(publicKey);
    }

    public String privateKeyPem() {
        return KeyCodec.encodePrivateKeyPem(privateKey);
    }
}
