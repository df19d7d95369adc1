package com.otto.e2ee.cipher;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;

/**
 * AES-256-GCM with a fresh random 96-bit nonce per message and a detached 128-bit tag.
 *
 * Decryption fails closed: any modification of ciphertext, nonce or tag, and any
 * wrong key, raises {@link AuthenticationFailedException} and returns no plaintext.
 */
public class SymmetricCipher {

    private static final String ENCRYPTION_ALGORITHM = "AES/GCM/NoPadding";
    public static final int GCM_TAG_LENGTH = 128;
    public static final int GCM_IV_LENGTH = 12;
    public static final int TAG_BYTES = GCM_TAG_LENGTH / 8;

    private final SecureRandom secureRandom;

    public SymmetricCipher(SecureRandom secureRandom) {
        this.secureRandom = secureRandom != null ? secureRandom : new SecureRandom();
    }

    public SymmetricCipher() {
        this(new SecureRandom());
    }

    public SymmetricKey generateKey() {
        return SymmetricKey.random(secureRandom);
    }

    public SealedBox encrypt(String plaintext, SymmetricKey key) {
        if (plaintext == null) {
            throw new IllegalArgumentException("Plaintext cannot be null");
        }
        return encrypt(plaintext.getBytes(StandardCharsets.UTF_8), key);
    }

    public SealedBox encrypt(byte[] plaintext, SymmetricKey key) {
        if (plaintext == null || key == null) {
            throw new IllegalArgumentException("Plaintext and key cannot be null");
        }
        byte[] nonce = new byte[GCM_IV_LENGTH];
        secureRandom.nextBytes(nonce);
        try {
            Cipher cipher = Cipher.getInstance(ENCRYPTION_ALGORITHM);
            cipher.init(Cipher.ENCRYPT_MODE, key.toSecretKey(), new GCMParameterSpec(GCM_TAG_LENGTH, nonce));
            byte[] sealed = cipher.doFinal(plaintext);
            int split = sealed.length - TAG_BYTES;
            return new SealedBox(
                    Arrays.copyOfRange(sealed, 0, split),
                    nonce,
                    Arrays.copyOfRange(sealed, split, sealed.length));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("AES-GCM encryption unavailable", e);
        }
    }

    public byte[] decrypt(SealedBox box, SymmetricKey key) {
        if (box == null || key == null) {
            throw new IllegalArgumentException("Sealed box and key cannot be null");
        }
        byte[] nonce = box.nonce();
        byte[] tag = box.tag();
        if (nonce.length != GCM_IV_LENGTH || tag.length != TAG_BYTES) {
            throw new AuthenticationFailedException("Malformed nonce or authentication tag");
        }
        byte[] ciphertext = box.ciphertext();
        byte[] sealed = Arrays.copyOf(ciphertext, ciphertext.length + TAG_BYTES);
        System.arraycopy(tag, 0, sealed, ciphertext.length, TAG_BYTES);
        try {
            Cipher cipher = Cipher.getInstance(ENCRYPTION_ALGORITHM);
            cipher.init(Cipher.DECRYPT_MODE, key.toSecretKey(), new GCMParameterSpec(GCM_TAG_LENGTH, nonce));
            return cipher.doFinal(sealed);
        } catch (AEADBadTagException e) {
            throw new AuthenticationFailedException("Message authentication failed", e);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("AES-GCM decryption unavailable", e);
        }
    }

    public String decryptToString(SealedBox box, SymmetricKey key) {
        return new String(decrypt(box, key), StandardCharsets.UTF_8);
    }
}
