package com.otto.e2ee.identity;

import com.otto.e2ee.codec.KeyFormatException;
import org.bouncycastle.crypto.params.Ed25519PrivateKeyParameters;
import org.bouncycastle.crypto.params.Ed25519PublicKeyParameters;
import org.bouncycastle.crypto.signers.Ed25519Signer;

import java.util.Base64;

/**
 * Ed25519 signing keypair derived deterministically from an {@link IdentitySeed}.
 *
 * The seed is the RFC 8032 private key, so the same seed always yields the same
 * public key. The keypair is never persisted; only the seed is.
 */
public final class IdentityKeyPair {

    public static final int PUBLIC_KEY_LENGTH = Ed25519PublicKeyParameters.KEY_SIZE;
    public static final int SIGNATURE_LENGTH = Ed25519PrivateKeyParameters.SIGNATURE_SIZE;

    private final IdentitySeed seed;
    private final Ed25519PrivateKeyParameters privateKey;
    private final byte[] publicKey;

    private IdentityKeyPair(IdentitySeed seed, Ed25519PrivateKeyParameters privateKey) {
        this.seed = seed;
        this.privateKey = privateKey;
        this.publicKey = privateKey.generatePublicKey().getEncoded();
    }

    public static IdentityKeyPair derive(IdentitySeed seed) {
        if (seed == null) {
            throw new IllegalArgumentException("Seed cannot be null");
        }
        return new IdentityKeyPair(seed, new Ed25519PrivateKeyParameters(seed.toBytes(), 0));
    }

    public IdentitySeed seed() {
        return seed;
    }

    public byte[] publicKey() {
        return publicKey.clone();
    }

    public String publicKeyBase64() {
        return Base64.getEncoder().encodeToString(publicKey);
    }

    public byte[] sign(byte[] data) {
        if (data == null) {
            throw new IllegalArgumentException("Data cannot be null");
        }
        Ed25519Signer signer = new Ed25519Signer();
        signer.init(true, privateKey);
        signer.update(data, 0, data.length);
        return signer.generateSignature();
    }

    /**
     * Verifies an Ed25519 signature.
     *
     * @throws KeyFormatException if the public key is not a valid Ed25519 point encoding
     */
    public static boolean verify(byte[] publicKey, byte[] data, byte[] signature) {
        if (publicKey == null || data == null || signature == null) {
            throw new IllegalArgumentException("Public key, data, and signature cannot be null");
        }
        Ed25519Signer verifier = new Ed25519Signer();
        verifier.init(false, decodePublicKey(publicKey));
        verifier.update(data, 0, data.length);
        return verifier.verifySignature(signature);
    }

    /**
     * Parses a raw 32-byte Ed25519 public key, rejecting encodings that are not curve points.
     */
    public static Ed25519PublicKeyParameters decodePublicKey(byte[] publicKey) {
        if (publicKey == null || publicKey.length != PUBLIC_KEY_LENGTH) {
            throw new KeyFormatException("publicKey",
                    "Ed25519 public key must be " + PUBLIC_KEY_LENGTH + " bytes");
        }
        try {
            return new Ed25519PublicKeyParameters(publicKey, 0);
        } catch (IllegalArgumentException e) {
            throw new KeyFormatException("publicKey", "Not a valid Ed25519 public key", e);
        }
    }
}
