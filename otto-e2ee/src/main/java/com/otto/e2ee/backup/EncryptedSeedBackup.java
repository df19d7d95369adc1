package com.otto.e2ee.backup;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Passphrase-encrypted identity seed, safe to store on the backend.
 *
 * @param kdf Parameters needed to re-derive the wrapping key from the passphrase
 * @param ciphertext Base64 of nonce, ciphertext and tag, concatenated
 * @param createdAt When the backup was made
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EncryptedSeedBackup(
        @JsonProperty("kdf") KdfParams kdf,
        @JsonProperty("ciphertext") String ciphertext,
        @JsonProperty("created_at") Instant createdAt
) {

    public EncryptedSeedBackup {
        if (kdf == null || ciphertext == null || createdAt == null) {
            throw new IllegalArgumentException("KDF parameters, ciphertext, and creation time are required");
        }
    }

    /**
     * Argon2id settings used for one backup.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record KdfParams(
            @JsonProperty("type") String type,
            @JsonProperty("salt") String salt,
            @JsonProperty("iterations") int iterations,
            @JsonProperty("memory_kib") int memoryKib,
            @JsonProperty("parallelism") int parallelism,
            @JsonProperty("hash_length") int hashLength,
            @JsonProperty("nonce_length") int nonceLength,
            @JsonProperty("mac_length") int macLength
    ) {
    }
}
