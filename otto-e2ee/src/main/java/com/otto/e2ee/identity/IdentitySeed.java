package com.otto.e2ee.identity;

import org.bouncycastle.util.encoders.DecoderException;
import org.bouncycastle.util.encoders.Hex;

import java.security.MessageDigest;
import java.security.SecureRandom;
import java.util.Arrays;

/**
 * The 32-byte root secret of a device identity.
 *
 * Both the Ed25519 signing key and the X25519 agreement key trace back to this
 * value, so it is the only thing a backup has to carry. Instances are immutable and
 * never expose their internal array.
 */
public final class IdentitySeed {

    public static final int LENGTH = 32;
    public static final int HEX_LENGTH = LENGTH * 2;

    private final byte[] bytes;

    private IdentitySeed(byte[] bytes) {
        this.bytes = bytes;
    }

    public static IdentitySeed of(byte[] bytes) {
        if (bytes == null || bytes.length != LENGTH) {
            throw new IllegalArgumentException("Identity seed must be exactly " + LENGTH + " bytes");
        }
        return new IdentitySeed(bytes.clone());
    }

    public static IdentitySeed random(SecureRandom random) {
        byte[] bytes = new byte[LENGTH];
        random.nextBytes(bytes);
        return new IdentitySeed(bytes);
    }

    /**
     * Parses the stored hex form.
     *
     * @throws IllegalArgumentException if the text is not exactly 64 hex characters
     */
    public static IdentitySeed fromHex(String hex) {
        if (hex == null || hex.length() != HEX_LENGTH) {
            throw new IllegalArgumentException("Seed hex must be " + HEX_LENGTH + " characters");
        }
        try {
            return new IdentitySeed(Hex.decodeStrict(hex));
        } catch (DecoderException e) {
            throw new IllegalArgumentException("Seed hex contains non-hex characters", e);
        }
    }

    public byte[] toBytes() {
        return bytes.clone();
    }

    /**
     * Lowercase hex, the persisted form.
     */
    public String toHex() {
        return Hex.toHexString(bytes);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof IdentitySeed other && MessageDigest.isEqual(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return "IdentitySeed[redacted]";
    }
}
