package com.otto.e2ee.cipher;

import com.otto.e2ee.agreement.IdentityKeyAgreement;
import com.otto.e2ee.identity.IdentityKeyManager;
import com.otto.e2ee.identity.IdentityKeyPair;
import com.otto.e2ee.identity.IdentitySeed;
import com.otto.e2ee.identity.MnemonicCodec;
import com.otto.e2ee.key.FallbackSecureKeyStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.*;

class ConversationKeyCacheTest {

    private final ExecutorService executor = Executors.newFixedThreadPool(8);

    @AfterEach
    void shutdown() {
        executor.shutdownNow();
    }

    @Test
    void concurrentGetOrCreate_sharesOneKey() {
        ConversationKeyCache cache = new ConversationKeyCache(new SymmetricCipher(), null, executor);
        List<CompletableFuture<SymmetricKey>> futures = new ArrayList<>();
        for (int i = 0; i < 32; i++) {
            futures.add(CompletableFuture.supplyAsync(() -> cache.getOrCreate("conv-1"), executor)
                    .thenCompose(future -> future));
        }

        SymmetricKey first = futures.get(0).join();
        for (CompletableFuture<SymmetricKey> future : futures) {
            assertThat(future.join()).isEqualTo(first);
        }
        assertThat(cache.size()).isEqualTo(1);
    }

    @Test
    void distinctConversations_getDistinctKeys() {
        ConversationKeyCache cache = new ConversationKeyCache(new SymmetricCipher(), null, executor);

        SymmetricKey a = cache.getOrCreate("a").join();
        SymmetricKey b = cache.getOrCreate("b").join();

        assertThat(a).isNotEqualTo(b);
        assertThat(cache.contains("a")).isTrue();
    }

    @Test
    void getOrDerive_matchesDirectAgreement() {
        IdentityKeyManager manager = new IdentityKeyManager(
                FallbackSecureKeyStore.inMemory(), new MnemonicCodec(), new SecureRandom(), executor);
        IdentityKeyAgreement agreement = new IdentityKeyAgreement(manager);
        ConversationKeyCache cache = new ConversationKeyCache(new SymmetricCipher(), agreement, executor);
        byte[] peer = IdentityKeyPair.derive(IdentitySeed.of(new byte[32])).publicKey();

        SymmetricKey cached = cache.getOrDerive("dm", peer).join();

        assertThat(cached).isEqualTo(agreement.deriveConversationKey("dm", peer).join());
        assertThat(cache.getOrDerive("dm", peer).join()).isSameAs(cached);
    }

    @Test
    void randomAndAgreedKeys_doNotShareAConversationSlot() {
        IdentityKeyManager manager = new IdentityKeyManager(
                FallbackSecureKeyStore.inMemory(), new MnemonicCodec(), new SecureRandom(), executor);
        IdentityKeyAgreement agreement = new IdentityKeyAgreement(manager);
        ConversationKeyCache cache = new ConversationKeyCache(new SymmetricCipher(), agreement, executor);
        byte[] peer = IdentityKeyPair.derive(IdentitySeed.of(new byte[32])).publicKey();

        SymmetricKey random = cache.getOrCreate("dm").join();
        assertThat(cache.findAgreed("dm")).isEmpty();

        SymmetricKey agreed = cache.getOrDerive("dm", peer).join();

        assertThat(agreed).isNotEqualTo(random);
        assertThat(agreed).isEqualTo(agreement.deriveConversationKey("dm", peer).join());
        assertThat(cache.findAgreed("dm")).hasValueSatisfying(f -> assertThat(f.join()).isSameAs(agreed));
        assertThat(cache.getOrCreate("dm").join()).isSameAs(random);
        assertThat(cache.size()).isEqualTo(2);
    }

    @Test
    void failedDerivation_isEvicted() {
        IdentityKeyManager manager = new IdentityKeyManager(
                FallbackSecureKeyStore.inMemory(), new MnemonicCodec(), new SecureRandom(), executor);
        ConversationKeyCache cache = new ConversationKeyCache(
                new SymmetricCipher(), new IdentityKeyAgreement(manager), executor);

        CompletableFuture<SymmetricKey> failed = cache.getOrDerive("dm", new byte[5]);

        assertThatThrownBy(failed::join).isInstanceOf(CompletionException.class);
        assertThat(cache.contains("dm")).isFalse();
    }

    @Test
    void identityReplacement_clearsCache() {
        ConversationKeyCache cache = new ConversationKeyCache(new SymmetricCipher(), null, executor);
        cache.getOrCreate("a").join();
        cache.getOrCreate("b").join();

        cache.onIdentityReplaced(null, null);

        assertThat(cache.size()).isZero();
    }

    @Test
    void rejectsBlankConversationId() {
        ConversationKeyCache cache = new ConversationKeyCache(new SymmetricCipher(), null, executor);

        assertThatThrownBy(() -> cache.getOrCreate(" "))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> cache.getOrDerive("dm", new byte[32]))
                .isInstanceOf(IllegalStateException.class);
    }
}
