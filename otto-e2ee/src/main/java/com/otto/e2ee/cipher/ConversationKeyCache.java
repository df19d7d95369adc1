package com.otto.e2ee.cipher;

import com.otto.e2ee.agreement.IdentityKeyAgreement;
import com.otto.e2ee.identity.IdentityListener;
import com.otto.e2ee.identity.SeedIdentity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

/**
 * Process-lifetime cache of per-conversation AES keys.
 *
 * The cache stores futures rather than keys, so concurrent callers asking for the same
 * conversation share one creation or derivation and observe the same key. Random keys
 * and peer-agreed keys are kept apart, so one never stands in for the other. Failed
 * futures are evicted and the next call starts over. Keys are never persisted: random
 * keys only protect server-bound messages, and agreement keys can be derived again
 * from the peer's published identity key.
 */
public class ConversationKeyCache implements IdentityListener {

    private static final Logger log = LoggerFactory.getLogger(ConversationKeyCache.class);

    private final SymmetricCipher cipher;
    private final IdentityKeyAgreement keyAgreement;
    private final Executor executor;
    private final Map<String, CompletableFuture<SymmetricKey>> randomKeys;
    private final Map<String, CompletableFuture<SymmetricKey>> agreedKeys;

    public ConversationKeyCache(SymmetricCipher cipher, IdentityKeyAgreement keyAgreement, Executor executor) {
        if (cipher == null || executor == null) {
            throw new IllegalArgumentException("Cipher and executor are required");
        }
        this.cipher = cipher;
        this.keyAgreement = keyAgreement;
        this.executor = executor;
        this.randomKeys = new ConcurrentHashMap<>();
        this.agreedKeys = new ConcurrentHashMap<>();
    }

    /**
     * Key for the conversation, generating a random one on first use.
     */
    public CompletableFuture<SymmetricKey> getOrCreate(String conversationId) {
        requireConversationId(conversationId);
        return memoize(randomKeys, conversationId,
                () -> CompletableFuture.supplyAsync(cipher::generateKey, executor));
    }

    /**
     * Key for the conversation agreed with a peer, deriving it on first use.
     */
    public CompletableFuture<SymmetricKey> getOrDerive(String conversationId, byte[] peerPublicKey) {
        requireConversationId(conversationId);
        if (keyAgreement == null) {
            throw new IllegalStateException("Key agreement not configured");
        }
        if (peerPublicKey == null) {
            throw new IllegalArgumentException("Peer public key cannot be null");
        }
        byte[] peer = peerPublicKey.clone();
        return memoize(agreedKeys, conversationId, () -> keyAgreement.deriveConversationKey(conversationId, peer));
    }

    /**
     * The peer-agreed key for the conversation if one is cached or being derived.
     */
    public Optional<CompletableFuture<SymmetricKey>> findAgreed(String conversationId) {
        requireConversationId(conversationId);
        return Optional.ofNullable(agreedKeys.get(conversationId));
    }

    public boolean contains(String conversationId) {
        return randomKeys.containsKey(conversationId) || agreedKeys.containsKey(conversationId);
    }

    public int size() {
        return randomKeys.size() + agreedKeys.size();
    }

    public void clear() {
        randomKeys.clear();
        agreedKeys.clear();
    }

    @Override
    public void onIdentityReplaced(SeedIdentity previous, SeedIdentity current) {
        int dropped = size();
        clear();
        log.info("Identity replaced, dropped {} conversation keys", dropped);
    }

    private static CompletableFuture<SymmetricKey> memoize(Map<String, CompletableFuture<SymmetricKey>> keys,
                                                          String conversationId, KeySource source) {
        CompletableFuture<SymmetricKey> pending = new CompletableFuture<>();
        CompletableFuture<SymmetricKey> existing = keys.putIfAbsent(conversationId, pending);
        if (existing != null) {
            return existing;
        }
        try {
            source.start().whenComplete((key, error) -> {
                if (error != null) {
                    keys.remove(conversationId, pending);
                    pending.completeExceptionally(error);
                } else {
                    pending.complete(key);
                }
            });
        } catch (RuntimeException e) {
            keys.remove(conversationId, pending);
            pending.completeExceptionally(e);
        }
        return pending;
    }

    private static void requireConversationId(String conversationId) {
        if (conversationId == null || conversationId.isBlank()) {
            throw new IllegalArgumentException("Conversation ID cannot be null or blank");
        }
    }

    @FunctionalInterface
    private interface KeySource {
        CompletableFuture<SymmetricKey> start();
    }
}
