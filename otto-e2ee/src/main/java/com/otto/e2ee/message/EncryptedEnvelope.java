package com.otto.e2ee.message;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.otto.e2ee.cipher.SealedBox;
import com.otto.e2ee.codec.KeyFormatException;

import java.util.Base64;
import java.util.Optional;

/**
 * Wire form of an encrypted message. Every field is base64.
 *
 * @param encryptedContent AES-GCM ciphertext without the tag
 * @param encryptedKey Message key wrapped to the recipient's RSA key; null when the
 *        recipient already holds the conversation key
 * @param iv 12-byte GCM nonce
 * @param tag 16-byte GCM tag
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EncryptedEnvelope(
        @JsonProperty("encrypted_content") String encryptedContent,
        @JsonProperty("encrypted_key") String encryptedKey,
        @JsonProperty("iv") String iv,
        @JsonProperty("tag") String tag
) {

    public EncryptedEnvelope {
        if (encryptedContent == null || iv == null || tag == null) {
            throw new IllegalArgumentException("Encrypted content, iv, and tag are required");
        }
    }

    public static EncryptedEnvelope of(SealedBox box, byte[] wrappedKey) {
        Base64.Encoder encoder = Base64.getEncoder();
        return new EncryptedEnvelope(
                encoder.encodeToString(box.ciphertext()),
                wrappedKey != null ? encoder.encodeToString(wrappedKey) : null,
                encoder.encodeToString(box.nonce()),
                encoder.encodeToString(box.tag()));
    }

    @JsonIgnore
    public boolean hasEncryptedKey() {
        return encryptedKey != null;
    }

    /**
     * @throws KeyFormatException if a field is not valid base64
     */
    public SealedBox toSealedBox() {
        return new SealedBox(
                decode("encrypted_content", encryptedContent),
                decode("iv", iv),
                decode("tag", tag));
    }

    public Optional<byte[]> encryptedKeyBytes() {
        return Optional.ofNullable(encryptedKey).map(value -> decode("encrypted_key", value));
    }

    private static byte[] decode(String field, String value) {
        try {
            return Base64.getDecoder().decode(value);
        } catch (IllegalArgumentException e) {
            throw new KeyFormatException(field, "Field is not valid base64", e);
        }
    }
}
