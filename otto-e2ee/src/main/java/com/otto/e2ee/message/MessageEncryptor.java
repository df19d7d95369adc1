package com.otto.e2ee.message;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.otto.e2ee.cipher.AuthenticationFailedException;
import com.otto.e2ee.cipher.ConversationKeyCache;
import com.otto.e2ee.cipher.SealedBox;
import com.otto.e2ee.cipher.SymmetricCipher;
import com.otto.e2ee.cipher.SymmetricKey;
import com.otto.e2ee.codec.KeyFormatException;
import com.otto.e2ee.config.ObjectMappers;
import com.otto.e2ee.identity.LegacyRsaIdentity;
import com.otto.e2ee.server.HybridServerChannel;
import com.otto.e2ee.server.RsaOaep;

import java.util.Arrays;
import java.util.concurrent.CompletableFuture;

/**
 * Turns chat text into {@link EncryptedEnvelope}s and back.
 *
 * Server-bound messages get a fresh AES key per message, wrapped to the server's RSA
 * key. Conversation messages use the cached conversation key and carry no wrapped key.
 */
public class MessageEncryptor {

    private final SymmetricCipher cipher;
    private final ConversationKeyCache keyCache;
    private final HybridServerChannel serverChannel;
    private final ObjectMapper objectMapper;

    public MessageEncryptor(SymmetricCipher cipher, ConversationKeyCache keyCache,
                            HybridServerChannel serverChannel, ObjectMapper objectMapper) {
        if (cipher == null || keyCache == null || serverChannel == null) {
            throw new IllegalArgumentException("Cipher, key cache, and server channel are required");
        }
        this.cipher = cipher;
        this.keyCache = keyCache;
        this.serverChannel = serverChannel;
        this.objectMapper = objectMapper != null ? objectMapper : ObjectMappers.create();
    }

    // ==================== Encrypt ====================

    public CompletableFuture<EncryptedEnvelope> encryptForServer(String plaintext) {
        SymmetricKey messageKey = cipher.generateKey();
        SealedBox box = cipher.encrypt(plaintext, messageKey);
        return serverChannel.encryptForServer(messageKey.toBytes())
                .thenApply(wrappedKey -> EncryptedEnvelope.of(box, wrappedKey));
    }

    public CompletableFuture<EncryptedEnvelope> encryptForConversation(String conversationId, String plaintext) {
        if (plaintext == null) {
            throw new IllegalArgumentException("Plaintext cannot be null");
        }
        return keyCache.getOrCreate(conversationId)
                .thenApply(key -> EncryptedEnvelope.of(cipher.encrypt(plaintext, key), null));
    }

    /**
     * Encrypts with the key agreed with a peer, so the peer can decrypt without a wrapped key.
     */
    public CompletableFuture<EncryptedEnvelope> encryptForPeer(String conversationId, byte[] peerPublicKey, String plaintext) {
        if (plaintext == null) {
            throw new IllegalArgumentException("Plaintext cannot be null");
        }
        return keyCache.getOrDerive(conversationId, peerPublicKey)
                .thenApply(key -> EncryptedEnvelope.of(cipher.encrypt(plaintext, key), null));
    }

    // ==================== Decrypt ====================

    /**
     * @throws AuthenticationFailedException if the envelope was altered or the key is wrong
     */
    public String decrypt(EncryptedEnvelope envelope, SymmetricKey key) {
        if (envelope == null) {
            throw new IllegalArgumentException("Envelope cannot be null");
        }
        return cipher.decryptToString(envelope.toSealedBox(), key);
    }

    public CompletableFuture<String> decryptForConversation(String conversationId, EncryptedEnvelope envelope) {
        return keyCache.getOrCreate(conversationId).thenApply(key -> decrypt(envelope, key));
    }

    public CompletableFuture<String> decryptFromPeer(String conversationId, byte[] peerPublicKey, EncryptedEnvelope envelope) {
        return keyCache.getOrDerive(conversationId, peerPublicKey).thenApply(key -> decrypt(envelope, key));
    }

    /**
     * Unwraps the message key with the legacy RSA private key, then decrypts.
     *
     * @throws KeyFormatException if the envelope carries no wrapped key
     * @throws AuthenticationFailedException if the key was wrapped for someone else
     *         or the content was altered
     */
    public String decryptWithLegacyKey(EncryptedEnvelope envelope, LegacyRsaIdentity identity) {
        if (envelope == null || identity == null) {
            throw new IllegalArgumentException("Envelope and identity cannot be null");
        }
        byte[] wrappedKey = envelope.encryptedKeyBytes()
                .orElseThrow(() -> new KeyFormatException("encrypted_key", "Envelope has no wrapped key"));
        byte[] keyBytes = RsaOaep.decrypt(identity.privateKey(), wrappedKey);
        try {
            if (keyBytes.length != SymmetricKey.LENGTH) {
                throw new AuthenticationFailedException("Unwrapped key has the wrong length");
            }
            return decrypt(envelope, SymmetricKey.of(keyBytes));
        } finally {
            Arrays.fill(keyBytes, (byte) 0);
        }
    }

    // ==================== Wire Format ====================

    public String toJson(EncryptedEnvelope envelope) {
        try {
            return objectMapper.writeValueAsString(envelope);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize envelope", e);
        }
    }

    /**
     * @throws KeyFormatException if the JSON is malformed or misses a required field
     */
    public EncryptedEnvelope fromJson(String json) {
        if (json == null || json.isBlank()) {
            throw new KeyFormatException("envelope", "Envelope JSON is empty");
        }
        try {
            return objectMapper.readValue(json, EncryptedEnvelope.class);
        } catch (JsonProcessingException e) {
            throw new KeyFormatException("envelope", "Malformed envelope JSON", e);
        }
    }
}
