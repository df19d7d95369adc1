package com.otto.e2ee.cipher;

import net.jqwik.api.*;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.*;

/**
 * AES-256-GCM sealing and its fail-closed decryption.
 */
class SymmetricCipherPropertyTest {

    private final SymmetricCipher cipher = new SymmetricCipher();

    // ==================== Encrypt / Decrypt ====================

    @Property(tries = 50)
    void decrypt_recoversPlaintext(@ForAll("messages") String message) {
        SymmetricKey key = cipher.generateKey();

        SealedBox box = cipher.encrypt(message, key);

        assertThat(box.nonce()).hasSize(SymmetricCipher.GCM_IV_LENGTH);
        assertThat(box.tag()).hasSize(SymmetricCipher.TAG_BYTES);
        assertThat(box.ciphertext()).hasSize(message.getBytes(StandardCharsets.UTF_8).length);
        assertThat(cipher.decryptToString(box, key)).isEqualTo(message);
    }

    @Test
    void sameMessageTwice_usesFreshNonces() {
        SymmetricKey key = cipher.generateKey();

        SealedBox first = cipher.encrypt("hello", key);
        SealedBox second = cipher.encrypt("hello", key);

        assertThat(first.nonce()).isNotEqualTo(second.nonce());
        assertThat(first.ciphertext()).isNotEqualTo(second.ciphertext());
    }

    @Test
    void emptyPlaintext_isSupported() {
        SymmetricKey key = cipher.generateKey();

        SealedBox box = cipher.encrypt(new byte[0], key);

        assertThat(box.ciphertext()).isEmpty();
        assertThat(cipher.decrypt(box, key)).isEmpty();
    }

    // ==================== Tampering ====================

    // Property: flipping any single bit of ciphertext, nonce or tag fails authentication
    @Property(tries = 50)
    void anyBitFlip_failsAuthentication(
            @ForAll("messages") String message,
            @ForAll("parts") int part,
            @ForAll("bitIndexes") int bitIndex) {
        SymmetricKey key = cipher.generateKey();
        SealedBox box = cipher.encrypt(message, key);
        byte[] ciphertext = box.ciphertext();
        byte[] nonce = box.nonce();
        byte[] tag = box.tag();
        byte[] target = part == 0 ? ciphertext : part == 1 ? nonce : tag;
        Assume.that(target.length > 0);
        int bit = bitIndex % (target.length * 8);
        target[bit / 8] ^= (byte) (1 << (bit % 8));

        SealedBox tampered = new SealedBox(ciphertext, nonce, tag);

        assertThatThrownBy(() -> cipher.decrypt(tampered, key))
                .isInstanceOf(AuthenticationFailedException.class);
    }

    @Test
    void wrongKey_failsAuthentication() {
        SealedBox box = cipher.encrypt("secret", cipher.generateKey());

        assertThatThrownBy(() -> cipher.decrypt(box, cipher.generateKey()))
                .isInstanceOf(AuthenticationFailedException.class)
                .satisfies(e -> assertThat(((AuthenticationFailedException) e).isRetryable()).isFalse());
    }

    @Test
    void truncatedTagOrNonce_failsAuthentication() {
        SymmetricKey key = cipher.generateKey();
        SealedBox box = cipher.encrypt("secret", key);

        assertThatThrownBy(() -> cipher.decrypt(new SealedBox(box.ciphertext(), box.nonce(), new byte[8]), key))
                .isInstanceOf(AuthenticationFailedException.class);
        assertThatThrownBy(() -> cipher.decrypt(new SealedBox(box.ciphertext(), new byte[16], box.tag()), key))
                .isInstanceOf(AuthenticationFailedException.class);
    }

    // ==================== Keys ====================

    @Test
    void symmetricKey_validatesLengthAndRedacts() {
        SymmetricKey key = cipher.generateKey();

        assertThat(key.toBytes()).hasSize(SymmetricKey.LENGTH);
        assertThat(SymmetricKey.of(key.toBytes())).isEqualTo(key);
        assertThat(key.toString()).doesNotContain(key.toBase64());
        assertThatThrownBy(() -> SymmetricKey.of(new byte[16]))
                .isInstanceOf(IllegalArgumentException.class);
    }

    // ==================== Arbitraries ====================

    @Provide
    Arbitrary<String> messages() {
        return Arbitraries.strings()
                .alpha()
                .numeric()
                .withChars(" .,!?äöüß€")
                .ofMinLength(0)
                .ofMaxLength(300);
    }

    @Provide
    Arbitrary<Integer> parts() {
        return Arbitraries.integers().between(0, 2);
    }

    @Provide
    Arbitrary<Integer> bitIndexes() {
        return Arbitraries.integers().between(0, 10_000);
    }
}
