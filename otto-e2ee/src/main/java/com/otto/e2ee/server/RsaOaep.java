package com.otto.e2ee.server;

import com.otto.e2ee.cipher.AuthenticationFailedException;

import javax.crypto.BadPaddingException;
import javax.crypto.Cipher;
import javax.crypto.IllegalBlockSizeException;
import javax.crypto.spec.OAEPParameterSpec;
import javax.crypto.spec.PSource;
import java.security.GeneralSecurityException;
import java.security.interfaces.RSAPrivateKey;
import java.security.interfaces.RSAPublicKey;
import java.security.spec.MGF1ParameterSpec;

/**
 * RSA-OAEP with SHA-256 for both the label hash and MGF1.
 *
 * The parameters are spelled out because the JCA default for "OAEPPadding" uses
 * MGF1 with SHA-1, which the backend does not accept.
 */
public final class RsaOaep {

    private static final String KEY_WRAP_ALGORITHM = "RSA/ECB/OAEPPadding";
    private static final OAEPParameterSpec OAEP_SHA256 = new OAEPParameterSpec(
            "SHA-256", "MGF1", MGF1ParameterSpec.SHA256, PSource.PSpecified.DEFAULT);

    /** SHA-256 output length, twice, plus two bytes of OAEP overhead. */
    private static final int OVERHEAD = 2 * 32 + 2;

    private RsaOaep() {
    }

    public static int maxPlaintextLength(RSAPublicKey key) {
        return (key.getModulus().bitLength() + 7) / 8 - OVERHEAD;
    }

    public static byte[] encrypt(RSAPublicKey key, byte[] data) {
        if (key == null || data == null) {
            throw new IllegalArgumentException("Key and data cannot be null");
        }
        if (data.length > maxPlaintextLength(key)) {
            throw new IllegalArgumentException("Data too large for RSA-OAEP: " + data.length
                    + " bytes, limit " + maxPlaintextLength(key));
        }
        try {
            Cipher cipher = Cipher.getInstance(KEY_WRAP_ALGORITHM);
            cipher.init(Cipher.ENCRYPT_MODE, key, OAEP_SHA256);
            return cipher.doFinal(data);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("RSA-OAEP encryption unavailable", e);
        }
    }

    /**
     * @throws AuthenticationFailedException if the ciphertext was not made for this key
     */
    public static byte[] decrypt(RSAPrivateKey key, byte[] ciphertext) {
        if (key == null || ciphertext == null) {
            throw new IllegalArgumentException("Key and ciphertext cannot be null");
        }
        try {
            Cipher cipher = Cipher.getInstance(KEY_WRAP_ALGORITHM);
            cipher.init(Cipher.DECRYPT_MODE, key, OAEP_SHA256);
            return cipher.doFinal(ciphertext);
        } catch (BadPaddingException | IllegalBlockSizeException e) {
            throw new AuthenticationFailedException("Wrapped key could not be decrypted", e);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("RSA-OAEP decryption unavailable", e);
        }
    }
}
