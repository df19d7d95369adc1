package com.otto.e2ee.backup;

import com.otto.e2ee.cipher.AuthenticationFailedException;
import com.otto.e2ee.cipher.SealedBox;
import com.otto.e2ee.cipher.SymmetricCipher;
import com.otto.e2ee.cipher.SymmetricKey;
import com.otto.e2ee.codec.KeyFormatException;
import com.otto.e2ee.identity.IdentitySeed;
import com.otto.e2ee.server.E2eeBackend;
import org.bouncycastle.crypto.generators.Argon2BytesGenerator;
import org.bouncycastle.crypto.params.Argon2Parameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.Arrays;
import java.util.Base64;
import java.util.concurrent.CompletableFuture;

/**
 * Encrypts the identity seed under a user passphrase so it can be kept on the backend.
 *
 * The wrapping key is Argon2id(passphrase, salt); the seed is sealed with AES-256-GCM.
 * Every parameter needed for restore travels with the backup.
 */
public class SeedBackupService {

    private static final Logger log = LoggerFactory.getLogger(SeedBackupService.class);

    public static final String KDF_TYPE = "argon2id";
    public static final int SALT_LENGTH = 16;

    private final SymmetricCipher cipher;
    private final E2eeBackend backend;
    private final KdfPolicy policy;
    private final SecureRandom secureRandom;
    private final Clock clock;

    public SeedBackupService(SymmetricCipher cipher, E2eeBackend backend, KdfPolicy policy,
                             SecureRandom secureRandom, Clock clock) {
        if (cipher == null) {
            throw new IllegalArgumentException("Cipher cannot be null");
        }
        this.cipher = cipher;
        this.backend = backend;
        this.policy = policy != null ? policy : KdfPolicy.defaults();
        this.secureRandom = secureRandom != null ? secureRandom : new SecureRandom();
        this.clock = clock != null ? clock : Clock.systemUTC();
    }

    // ==================== Create / Restore ====================

    /**
     * Encrypts a seed under the passphrase with fresh salt and nonce.
     *
     * @throws IllegalArgumentException if the passphrase is shorter than the policy allows
     */
    public EncryptedSeedBackup create(IdentitySeed seed, char[] passphrase) {
        if (seed == null) {
            throw new IllegalArgumentException("Seed cannot be null");
        }
        if (passphrase == null || passphrase.length < policy.minPassphraseLength()) {
            throw new IllegalArgumentException(
                    "Passphrase must be at least " + policy.minPassphraseLength() + " characters");
        }
        byte[] salt = new byte[SALT_LENGTH];
        secureRandom.nextBytes(salt);
        EncryptedSeedBackup.KdfParams params = new EncryptedSeedBackup.KdfParams(
                KDF_TYPE,
                Base64.getEncoder().encodeToString(salt),
                policy.iterations(),
                policy.memoryKib(),
                policy.parallelism(),
                SymmetricKey.LENGTH,
                SymmetricCipher.GCM_IV_LENGTH,
                SymmetricCipher.TAG_BYTES);

        SymmetricKey wrappingKey = deriveKey(params, salt, passphrase);
        byte[] seedBytes = seed.toBytes();
        try {
            SealedBox box = cipher.encrypt(seedBytes, wrappingKey);
            return new EncryptedSeedBackup(params, Base64.getEncoder().encodeToString(concat(box)), clock.instant());
        } finally {
            Arrays.fill(seedBytes, (byte) 0);
        }
    }

    /**
     * Decrypts a backup.
     *
     * @throws AuthenticationFailedException if the passphrase is wrong or the backup was altered
     * @throws KeyFormatException if the backup uses unsupported or out-of-range parameters
     */
    public IdentitySeed restore(EncryptedSeedBackup backup, char[] passphrase) {
        if (backup == null || passphrase == null) {
            throw new IllegalArgumentException("Backup and passphrase cannot be null");
        }
        EncryptedSeedBackup.KdfParams params = backup.kdf();
        validate(params);
        byte[] salt = decode("salt", params.salt());
        byte[] blob = decode("ciphertext", backup.ciphertext());
        int nonceLength = params.nonceLength();
        int macLength = params.macLength();
        if (blob.length != nonceLength + IdentitySeed.LENGTH + macLength) {
            throw new KeyFormatException("ciphertext", "Backup ciphertext has the wrong length");
        }
        SealedBox box = new SealedBox(
                Arrays.copyOfRange(blob, nonceLength, blob.length - macLength),
                Arrays.copyOfRange(blob, 0, nonceLength),
                Arrays.copyOfRange(blob, blob.length - macLength, blob.length));

        byte[] seedBytes = cipher.decrypt(box, deriveKey(params, salt, passphrase));
        try {
            return IdentitySeed.of(seedBytes);
        } finally {
            Arrays.fill(seedBytes, (byte) 0);
        }
    }

    // ==================== Upload ====================

    public CompletableFuture<Void> upload(String baseUrl, String username, EncryptedSeedBackup backup) {
        if (backend == null) {
            throw new IllegalStateException("No backend configured for seed backup upload");
        }
        return backend.uploadSeedBackup(baseUrl, username, backup)
                .thenRun(() -> log.info("Seed backup uploaded for {}", username));
    }

    // ==================== Helpers ====================

    private SymmetricKey deriveKey(EncryptedSeedBackup.KdfParams params, byte[] salt, char[] passphrase) {
        Argon2Parameters argon2 = new Argon2Parameters.Builder(Argon2Parameters.ARGON2_id)
                .withVersion(Argon2Parameters.ARGON2_VERSION_13)
                .withSalt(salt)
                .withIterations(params.iterations())
                .withMemoryAsKB(params.memoryKib())
                .withParallelism(params.parallelism())
                .build();
        Argon2BytesGenerator generator = new Argon2BytesGenerator();
        generator.init(argon2);
        byte[] key = new byte[params.hashLength()];
        generator.generateBytes(passphrase, key);
        try {
            return SymmetricKey.of(key);
        } finally {
            Arrays.fill(key, (byte) 0);
        }
    }

    private void validate(EncryptedSeedBackup.KdfParams params) {
        if (params == null || !KDF_TYPE.equals(params.type())) {
            throw new KeyFormatException("type", "Unsupported backup KDF");
        }
        if (params.iterations() < 1 || params.iterations() > policy.maxIterations()) {
            throw new KeyFormatException("iterations", "Iterations out of range: " + params.iterations());
        }
        if (params.parallelism() < 1 || params.parallelism() > policy.maxParallelism()) {
            throw new KeyFormatException("parallelism", "Parallelism out of range: " + params.parallelism());
        }
        if (params.memoryKib() < 8 * params.parallelism() || params.memoryKib() > policy.maxMemoryKib()) {
            throw new KeyFormatException("memory_kib", "Memory out of range: " + params.memoryKib());
        }
        if (params.hashLength() != SymmetricKey.LENGTH) {
            throw new KeyFormatException("hash_length", "Unsupported hash length: " + params.hashLength());
        }
        if (params.nonceLength() != SymmetricCipher.GCM_IV_LENGTH) {
            throw new KeyFormatException("nonce_length", "Unsupported nonce length: " + params.nonceLength());
        }
        if (params.macLength() != SymmetricCipher.TAG_BYTES) {
            throw new KeyFormatException("mac_length", "Unsupported MAC length: " + params.macLength());
        }
    }

    private static byte[] concat(SealedBox box) {
        byte[] nonce = box.nonce();
        byte[] ciphertext = box.ciphertext();
        byte[] tag = box.tag();
        byte[] out = new byte[nonce.length + ciphertext.length + tag.length];
        System.arraycopy(nonce, 0, out, 0, nonce.length);
        System.arraycopy(ciphertext, 0, out, nonce.length, ciphertext.length);
        System.arraycopy(tag, 0, out, nonce.length + ciphertext.length, tag.length);
        return out;
    }

    private static byte[] decode(String field, String value) {
        if (value == null) {
            throw new KeyFormatException(field, "Missing " + field);
        }
        try {
            return Base64.getDecoder().decode(value);
        } catch (IllegalArgumentException e) {
            throw new KeyFormatException(field, "Field is not valid base64", e);
        }
    }

    /**
     * Argon2id cost for new backups, and the upper bounds accepted on restore.
     */
    public record KdfPolicy(
            int iterations,
            int memoryKib,
            int parallelism,
            int minPassphraseLength,
            int maxIterations,
            int maxMemoryKib,
            int maxParallelism
    ) {
        public KdfPolicy {
            if (iterations < 1 || parallelism < 1 || memoryKib < 8 * parallelism) {
                throw new IllegalArgumentException("Invalid Argon2 cost parameters");
            }
            if (iterations > maxIterations || memoryKib > maxMemoryKib || parallelism > maxParallelism) {
                throw new IllegalArgumentException("Argon2 cost exceeds the accepted maximum");
            }
        }

        public static KdfPolicy defaults() {
            return new KdfPolicy(3, 64 * 1024, 1, 8, 10, 1024 * 1024, 8);
        }

        public KdfPolicy withCost(int iterations, int memoryKib, int parallelism) {
            return new KdfPolicy(iterations, memoryKib, parallelism, minPassphraseLength,
                    maxIterations, maxMemoryKib, maxParallelism);
        }
    }
}
