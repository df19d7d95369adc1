package com.otto.e2ee.agreement;

import com.otto.e2ee.codec.KeyFormatException;
import com.otto.e2ee.identity.IdentityKeyPair;
import com.otto.e2ee.identity.IdentitySeed;
import org.bouncycastle.crypto.digests.SHA512Digest;

import java.math.BigInteger;
import java.util.Arrays;

/**
 * Converts Ed25519 keys to their X25519 counterparts.
 *
 * Public keys use the birational map u = (1 + y) / (1 - y) mod 2^255 - 19 from
 * RFC 7748 section 4.1. Secret keys use the clamped lower half of SHA-512(seed), which is
 * the RFC 8032 section 5.1.5 signing scalar. Both match libsodium's
 * {@code crypto_sign_ed25519_pk_to_curve25519} and {@code crypto_sign_ed25519_sk_to_curve25519}.
 */
public final class EdwardsToMontgomery {

    public static final int KEY_LENGTH = 32;

    static final BigInteger FIELD_PRIME = BigInteger.ONE.shiftLeft(255).subtract(BigInteger.valueOf(19));

    private EdwardsToMontgomery() {
    }

    /**
     * X25519 private scalar for an identity seed, already clamped.
     */
    public static byte[] secretScalar(IdentitySeed seed) {
        if (seed == null) {
            throw new IllegalArgumentException("Seed cannot be null");
        }
        SHA512Digest digest = new SHA512Digest();
        byte[] input = seed.toBytes();
        byte[] hash = new byte[digest.getDigestSize()];
        digest.update(input, 0, input.length);
        digest.doFinal(hash, 0);
        Arrays.fill(input, (byte) 0);

        byte[] scalar = Arrays.copyOf(hash, KEY_LENGTH);
        Arrays.fill(hash, (byte) 0);
        scalar[0] &= (byte) 248;
        scalar[31] &= (byte) 127;
        scalar[31] |= (byte) 64;
        return scalar;
    }

    /**
     * X25519 u-coordinate for an Ed25519 public key.
     *
     * @throws KeyFormatException if the key is not a valid, non-identity Edwards point
     */
    public static byte[] publicKey(byte[] edwardsPublicKey) {
        IdentityKeyPair.decodePublicKey(edwardsPublicKey);

        byte[] littleEndian = edwardsPublicKey.clone();
        littleEndian[31] &= 0x7F;
        BigInteger y = new BigInteger(1, reverse(littleEndian));
        if (y.compareTo(FIELD_PRIME) >= 0) {
            throw new KeyFormatException("publicKey", "Non-canonical Ed25519 y-coordinate");
        }
        BigInteger denominator = BigInteger.ONE.subtract(y).mod(FIELD_PRIME);
        if (denominator.signum() == 0) {
            throw new KeyFormatException("publicKey", "Ed25519 identity point has no X25519 counterpart");
        }
        BigInteger u = BigInteger.ONE.add(y)
                .multiply(denominator.modInverse(FIELD_PRIME))
                .mod(FIELD_PRIME);
        return toLittleEndian(u);
    }

    private static byte[] toLittleEndian(BigInteger value) {
        byte[] bigEndian = value.toByteArray();
        byte[] out = new byte[KEY_LENGTH];
        int length = Math.min(bigEndian.length, KEY_LENGTH);
        for (int i = 0; i < length; i++) {
            out[i] = bigEndian[bigEndian.length - 1 - i];
        }
        return out;
    }

    private static byte[] reverse(byte[] bytes) {
        byte[] out = new byte[bytes.length];
        for (int i = 0; i < bytes.length; i++) {
            out[i] = bytes[bytes.length - 1 - i];
        }
        return out;
    }
}
