package com.otto.e2ee.cipher;

import java.util.Arrays;

/**
 * AES-GCM output with the authentication tag kept separate from the ciphertext.
 *
 * @param ciphertext Encrypted bytes, same length as the plaintext
 * @param nonce 12-byte nonce
 * @param tag 16-byte authentication tag
 */
public record SealedBox(byte[] ciphertext, byte[] nonce, byte[] tag) {

    public SealedBox {
        if (ciphertext == null || nonce == null || tag == null) {
            throw new IllegalArgumentException("Ciphertext, nonce, and tag cannot be null");
        }
        ciphertext = ciphertext.clone();
        nonce = nonce.clone();
        tag = tag.clone();
    }

    @Override
    public byte[] ciphertext() {
        return ciphertext.clone();
    }

    @Override
    public byte[] nonce() {
        return nonce.clone();
    }

    @Override
    public byte[] tag() {
        return tag.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof SealedBox other
                && Arrays.equals(ciphertext, other.ciphertext)
                && Arrays.equals(nonce, other.nonce)
                && Arrays.equals(tag, other.tag);
    }

    @Override
    public int hashCode() {
        int result = Arrays.hashCode(ciphertext);
        result = 31 * result + Arrays.hashCode(nonce);
        return 31 * result + Arrays.hashCode(tag);
    }

    @Override
    public String toString() {
        return "SealedBox[ciphertext=" + ciphertext.length + " bytes]";
    }
}
