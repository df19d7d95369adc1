package com.otto.e2ee.agreement;

import com.otto.e2ee.cipher.SymmetricKey;
import com.otto.e2ee.codec.KeyFormatException;
import com.otto.e2ee.identity.IdentityKeyManager;
import com.otto.e2ee.identity.IdentitySeed;
import com.otto.e2ee.identity.KeysUnavailableException;
import org.bouncycastle.crypto.agreement.X25519Agreement;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.generators.HKDFBytesGenerator;
import org.bouncycastle.crypto.params.HKDFParameters;
import org.bouncycastle.crypto.params.X25519PrivateKeyParameters;
import org.bouncycastle.crypto.params.X25519PublicKeyParameters;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.concurrent.CompletableFuture;

/**
 * X25519 key agreement on top of the Ed25519 identity.
 *
 * Both parties only publish their Ed25519 identity key; each side converts the other's
 * key to X25519 and arrives at the same 32-byte secret.
 */
public class IdentityKeyAgreement {

    public static final int SHARED_SECRET_LENGTH = 32;

    private static final byte[] CONVERSATION_KEY_INFO_PREFIX =
            "otto-e2ee/conversation-key/v1:".getBytes(StandardCharsets.US_ASCII);

    private final IdentityKeyManager keyManager;

    public IdentityKeyAgreement(IdentityKeyManager keyManager) {
        if (keyManager == null) {
            throw new IllegalArgumentException("Key manager cannot be null");
        }
        this.keyManager = keyManager;
    }

    /**
     * Shared secret between a local seed and a remote Ed25519 public key.
     *
     * @throws KeyFormatException if the remote key is not a usable curve point
     */
    public byte[] deriveSharedSecret(IdentitySeed localSeed, byte[] remoteEd25519PublicKey) {
        if (localSeed == null) {
            throw new IllegalArgumentException("Local seed cannot be null");
        }
        byte[] remoteU = EdwardsToMontgomery.publicKey(remoteEd25519PublicKey);
        byte[] scalar = EdwardsToMontgomery.secretScalar(localSeed);
        try {
            X25519Agreement agreement = new X25519Agreement();
            agreement.init(new X25519PrivateKeyParameters(scalar, 0));
            byte[] secret = new byte[agreement.getAgreementSize()];
            agreement.calculateAgreement(new X25519PublicKeyParameters(remoteU, 0), secret, 0);
            return secret;
        } catch (IllegalStateException e) {
            // BC refuses an all-zero result, which only a low-order remote point produces
            throw new KeyFormatException("publicKey", "Remote key is a low-order point", e);
        } finally {
            Arrays.fill(scalar, (byte) 0);
        }
    }

    /**
     * Shared secret between the device identity and a remote key.
     *
     * The returned future fails with {@link KeysUnavailableException} when the identity
     * cannot be initialized.
     */
    public CompletableFuture<byte[]> deriveSharedSecret(byte[] remoteEd25519PublicKey) {
        return keyManager.initializeKeys()
                .thenApply(identity -> deriveSharedSecret(identity.seed(), remoteEd25519PublicKey));
    }

    /**
     * HKDF-SHA256 expansion of a shared secret into a conversation-scoped AES-256 key.
     */
    public SymmetricKey deriveConversationKey(byte[] sharedSecret, String conversationId) {
        if (sharedSecret == null || sharedSecret.length != SHARED_SECRET_LENGTH) {
            throw new IllegalArgumentException("Shared secret must be " + SHARED_SECRET_LENGTH + " bytes");
        }
        if (conversationId == null || conversationId.isBlank()) {
            throw new IllegalArgumentException("Conversation ID cannot be null or blank");
        }
        byte[] id = conversationId.getBytes(StandardCharsets.UTF_8);
        byte[] info = Arrays.copyOf(CONVERSATION_KEY_INFO_PREFIX, CONVERSATION_KEY_INFO_PREFIX.length + id.length);
        System.arraycopy(id, 0, info, CONVERSATION_KEY_INFO_PREFIX.length, id.length);

        HKDFBytesGenerator hkdf = new HKDFBytesGenerator(new SHA256Digest());
        hkdf.init(new HKDFParameters(sharedSecret, null, info));
        byte[] key = new byte[SymmetricKey.LENGTH];
        hkdf.generateBytes(key, 0, key.length);
        try {
            return SymmetricKey.of(key);
        } finally {
            Arrays.fill(key, (byte) 0);
        }
    }

    /**
     * Conversation key shared with a peer, derived from the device identity.
     */
    public CompletableFuture<SymmetricKey> deriveConversationKey(String conversationId, byte[] peerEd25519PublicKey) {
        return deriveSharedSecret(peerEd25519PublicKey)
                .thenApply(secret -> {
                    try {
                        return deriveConversationKey(secret, conversationId);
                    } finally {
                        Arrays.fill(secret, (byte) 0);
                    }
                });
    }
}
