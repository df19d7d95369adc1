package com.otto.e2ee.server;

import com.otto.e2ee.cipher.AuthenticationFailedException;
import com.otto.e2ee.codec.KeyCodec;
import com.otto.e2ee.codec.KeyFormatException;
import com.otto.e2ee.key.FallbackSecureKeyStore;
import com.otto.e2ee.key.StorageKeys;
import org.junit.jupiter.api.Test;

import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.security.interfaces.RSAPrivateKey;
import java.security.interfaces.RSAPublicKey;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

import static org.assertj.core.api.Assertions.*;

/**
 * Server key lifecycle and RSA-OAEP wrapping.
 */
class HybridServerChannelTest {

    private static final String BASE_URL = "https://chat.example";

    private final Executor executor = Runnable::run;
    private final FallbackSecureKeyStore keyStore = FallbackSecureKeyStore.inMemory();

    private static String serverPem() {
        return KeyCodec.encodePublicKeyPem((RSAPublicKey) ServerKeys.server().getPublic());
    }

    private HybridServerChannel channel(FakeE2eeBackend backend, String baseUrl) {
        return new HybridServerChannel(keyStore, backend, baseUrl, executor);
    }

    // ==================== Fetch ====================

    @Test
    void fetch_storesKeyAndUpdatesState() {
        HybridServerChannel channel = channel(new FakeE2eeBackend().serveServerKey(serverPem()), BASE_URL);
        assertThat(channel.getState()).isEqualTo(ServerKeyState.NO_SERVER_KEY);

        RSAPublicKey key = channel.fetchServerPublicKey(BASE_URL).join();

        assertThat(key.getModulus()).isEqualTo(((RSAPublicKey) ServerKeys.server().getPublic()).getModulus());
        assertThat(channel.getState()).isEqualTo(ServerKeyState.HAS_SERVER_KEY);
        assertThat(keyStore.read(StorageKeys.SERVER_PUBLIC_KEY_PEM))
                .hasValueSatisfying(pem -> assertThat(new String(pem, StandardCharsets.US_ASCII)).isEqualTo(serverPem()));
    }

    @Test
    void failedFetch_fallsBackToStoredKey() {
        keyStore.write(StorageKeys.SERVER_PUBLIC_KEY_PEM, serverPem().getBytes(StandardCharsets.US_ASCII));
        HybridServerChannel channel = channel(new FakeE2eeBackend()
                .failServerKey(new FetchTimeoutException("timed out", new HttpTimeoutException("slow"))), BASE_URL);

        RSAPublicKey key = channel.fetchServerPublicKey(BASE_URL).join();

        assertThat(KeyCodec.fingerprint(key))
                .isEqualTo(KeyCodec.fingerprint((RSAPublicKey) ServerKeys.server().getPublic()));
        assertThat(channel.getState()).isEqualTo(ServerKeyState.HAS_SERVER_KEY);

        byte[] messageKey = new byte[32];
        messageKey[0] = 7;
        byte[] wrapped = channel.encryptForServer(messageKey).join();

        assertThat(RsaOaep.decrypt((RSAPrivateKey) ServerKeys.server().getPrivate(), wrapped)).isEqualTo(messageKey);
    }

    @Test
    void failedRefetch_keepsKeyInMemoryWhenStoreLostIt() {
        FakeE2eeBackend backend = new FakeE2eeBackend().serveServerKey(serverPem());
        HybridServerChannel channel = channel(backend, BASE_URL);
        channel.fetchServerPublicKey(BASE_URL).join();
        keyStore.delete(StorageKeys.SERVER_PUBLIC_KEY_PEM);
        backend.failServerKey(new E2eeBackendException(E2eeBackendException.NO_RESPONSE, "offline"));

        RSAPublicKey key = channel.fetchServerPublicKey(BASE_URL).join();

        assertThat(key.getModulus()).isEqualTo(((RSAPublicKey) ServerKeys.server().getPublic()).getModulus());
        assertThat(channel.getState()).isEqualTo(ServerKeyState.HAS_SERVER_KEY);
        assertThat(backend.serverKeyFetches.get()).isEqualTo(2);
    }

    @Test
    void failedFetchWithoutStoredKey_reportsFetchError() {
        HybridServerChannel channel = channel(new FakeE2eeBackend()
                .failServerKey(new FetchTimeoutException("timed out", new HttpTimeoutException("slow"))), BASE_URL);

        assertThatThrownBy(() -> channel.fetchServerPublicKey(BASE_URL).join())
                .isInstanceOf(CompletionException.class)
                .hasCauseInstanceOf(FetchTimeoutException.class);
        assertThat(channel.getState()).isEqualTo(ServerKeyState.NO_SERVER_KEY);
    }

    @Test
    void undersizedServerKey_isRejected() {
        RSAPublicKey small = (RSAPublicKey) ServerKeys.generate(1024).getPublic();
        HybridServerChannel channel = channel(
                new FakeE2eeBackend().serveServerKey(KeyCodec.encodePublicKeyPem(small)), BASE_URL);

        assertThatThrownBy(() -> channel.fetchServerPublicKey(BASE_URL).join())
                .hasCauseInstanceOf(KeyFormatException.class);
        assertThat(keyStore.read(StorageKeys.SERVER_PUBLIC_KEY_PEM)).isEmpty();
    }

    @Test
    void malformedServerPem_isRejected() {
        HybridServerChannel channel = channel(new FakeE2eeBackend().serveServerKey("not a pem"), BASE_URL);

        assertThatThrownBy(() -> channel.fetchServerPublicKey(BASE_URL).join())
                .hasCauseInstanceOf(KeyFormatException.class);
    }

    // ==================== Require ====================

    @Test
    void requireServerKey_prefersStoredCopyOverNetwork() {
        keyStore.write(StorageKeys.SERVER_PUBLIC_KEY_PEM, serverPem().getBytes(StandardCharsets.US_ASCII));
        FakeE2eeBackend backend = new FakeE2eeBackend().serveServerKey(serverPem());
        HybridServerChannel channel = channel(backend, BASE_URL);

        channel.requireServerKey().join();

        assertThat(backend.serverKeyFetches.get()).isZero();
        assertThat(channel.getState()).isEqualTo(ServerKeyState.HAS_SERVER_KEY);
    }

    @Test
    void requireServerKey_fetchesWhenNothingStored() {
        FakeE2eeBackend backend = new FakeE2eeBackend().serveServerKey(serverPem());
        HybridServerChannel channel = channel(backend, BASE_URL);

        channel.requireServerKey().join();
        channel.requireServerKey().join();

        assertThat(backend.serverKeyFetches.get()).isEqualTo(1);
    }

    @Test
    void concurrentRequire_sharesOneFetch() {
        CompletableFuture<String> pending = new CompletableFuture<>();
        FakeE2eeBackend backend = new FakeE2eeBackend().serveServerKey(() -> pending);
        HybridServerChannel channel = channel(backend, BASE_URL);

        CompletableFuture<RSAPublicKey> first = channel.requireServerKey();
        CompletableFuture<RSAPublicKey> second = channel.requireServerKey();
        pending.complete(serverPem());

        assertThat(first.join()).isSameAs(second.join());
        assertThat(backend.serverKeyFetches.get()).isEqualTo(1);
    }

    @Test
    void requireServerKey_failsWhenUnobtainable() {
        HybridServerChannel channel = channel(
                new FakeE2eeBackend().failServerKey(new E2eeBackendException(503, "down")), BASE_URL);

        assertThatThrownBy(() -> channel.requireServerKey().join())
                .hasCauseInstanceOf(ServerKeyUnavailableException.class)
                .satisfies(e -> assertThat(((ServerKeyUnavailableException) e.getCause()).isRetryable()).isTrue());
    }

    @Test
    void requireServerKey_withoutBaseUrlFails() {
        HybridServerChannel channel = channel(new FakeE2eeBackend(), null);

        assertThatThrownBy(() -> channel.requireServerKey().join())
                .hasCauseInstanceOf(ServerKeyUnavailableException.class);
    }

    @Test
    void corruptStoredKey_isDiscardedThenFetched() {
        keyStore.write(StorageKeys.SERVER_PUBLIC_KEY_PEM, "-----BEGIN PUBLIC KEY-----\nAAAA\n-----END PUBLIC KEY-----\n"
                .getBytes(StandardCharsets.US_ASCII));
        FakeE2eeBackend backend = new FakeE2eeBackend().serveServerKey(serverPem());
        HybridServerChannel channel = channel(backend, BASE_URL);

        channel.requireServerKey().join();

        assertThat(backend.serverKeyFetches.get()).isEqualTo(1);
        assertThat(channel.getState()).isEqualTo(ServerKeyState.HAS_SERVER_KEY);
    }

    @Test
    void invalidate_dropsMemoryAndStoredKey() {
        HybridServerChannel channel = channel(new FakeE2eeBackend().serveServerKey(serverPem()), BASE_URL);
        channel.fetchServerPublicKey(BASE_URL).join();

        channel.invalidateServerKey();

        assertThat(channel.getState()).isEqualTo(ServerKeyState.NO_SERVER_KEY);
        assertThat(channel.currentServerKey()).isEmpty();
        assertThat(keyStore.read(StorageKeys.SERVER_PUBLIC_KEY_PEM)).isEmpty();
    }

    // ==================== Encryption ====================

    @Test
    void encryptForServer_decryptsWithServerPrivateKey() {
        HybridServerChannel channel = channel(new FakeE2eeBackend().serveServerKey(serverPem()), BASE_URL);
        byte[] messageKey = new byte[32];
        messageKey[7] = 7;

        byte[] wrapped = channel.encryptForServer(messageKey).join();

        assertThat(wrapped).hasSize(256);
        assertThat(RsaOaep.decrypt((RSAPrivateKey) ServerKeys.server().getPrivate(), wrapped)).isEqualTo(messageKey);
    }

    @Test
    void wrappedKey_cannotBeOpenedByAnotherKey() {
        byte[] wrapped = RsaOaep.encrypt((RSAPublicKey) ServerKeys.server().getPublic(), new byte[32]);

        assertThatThrownBy(() -> RsaOaep.decrypt((RSAPrivateKey) ServerKeys.other().getPrivate(), wrapped))
                .isInstanceOf(AuthenticationFailedException.class);
    }

    @Test
    void oversizedPayload_isRejected() {
        RSAPublicKey key = (RSAPublicKey) ServerKeys.server().getPublic();

        assertThat(RsaOaep.maxPlaintextLength(key)).isEqualTo(190);
        assertThatThrownBy(() -> RsaOaep.encrypt(key, new byte[191]))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
