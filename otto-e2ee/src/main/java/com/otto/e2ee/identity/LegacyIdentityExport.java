package com.otto.e2ee.identity;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.otto.e2ee.codec.KeyCodec;
import com.otto.e2ee.codec.KeyFormatException;
import com.otto.e2ee.config.ObjectMappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.interfaces.RSAPrivateKey;
import java.security.interfaces.RSAPublicKey;

/**
 * QR/clipboard transfer of the legacy RSA keypair between devices.
 *
 * Payload: {@code {"version":1,"type":"otto_e2ee_keypair","private_key_pem":..,"public_key_pem":..}}.
 */
public class LegacyIdentityExport {

    private static final Logger log = LoggerFactory.getLogger(LegacyIdentityExport.class);

    public static final int VERSION = 1;
    public static final String TYPE = "otto_e2ee_keypair";

    private final LegacyIdentityStore legacyStore;
    private final ObjectMapper objectMapper;

    public LegacyIdentityExport(LegacyIdentityStore legacyStore, ObjectMapper objectMapper) {
        if (legacyStore == null) {
            throw new IllegalArgumentException("Legacy store cannot be null");
        }
        this.legacyStore = legacyStore;
        this.objectMapper = objectMapper != null ? objectMapper : ObjectMappers.create();
    }

    /**
     * Serializes the stored legacy keypair.
     *
     * @throws KeysUnavailableException if no legacy keypair is stored
     */
    public String exportPayload() {
        LegacyRsaIdentity identity = legacyStore.load()
                .orElseThrow(() -> new KeysUnavailableException("No legacy keypair stored on this device"));
        return toJson(identity);
    }

    public String toJson(LegacyRsaIdentity identity) {
        ExportPayload payload = new ExportPayload(VERSION, TYPE, identity.privateKeyPem(), identity.publicKeyPem());
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize key export", e);
        }
    }

    /**
     * Validates a scanned payload and replaces the stored legacy keypair with it.
     *
     * @throws KeyFormatException if the payload is malformed, has the wrong marker or version,
     *         or its two keys do not form a pair
     */
    public LegacyRsaIdentity importPayload(String json) {
        LegacyRsaIdentity identity = parse(json);
        legacyStore.save(identity);
        log.info("Imported legacy keypair, fingerprint {}", KeyCodec.fingerprint(identity.publicKey()));
        return identity;
    }

    public LegacyRsaIdentity parse(String json) {
        if (json == null || json.isBlank()) {
            throw new KeyFormatException("payload", "Key export payload is empty");
        }
        ExportPayload payload;
        try {
            payload = objectMapper.readValue(json, ExportPayload.class);
        } catch (JsonProcessingException e) {
            throw new KeyFormatException("payload", "Key export payload is not valid JSON", e);
        }
        if (!TYPE.equals(payload.type())) {
            throw new KeyFormatException("type", "Not an Otto keypair export: " + payload.type());
        }
        if (payload.version() == null || payload.version() != VERSION) {
            throw new KeyFormatException("version", "Unsupported key export version: " + payload.version());
        }
        if (payload.privateKeyPem() == null || payload.publicKeyPem() == null) {
            throw new KeyFormatException("payload", "Key export is missing key data");
        }

        RSAPrivateKey privateKey = KeyCodec.decodePrivateKeyPem(payload.privateKeyPem());
        RSAPublicKey publicKey = KeyCodec.decodePublicKeyPem(payload.publicKeyPem());
        try {
            return new LegacyRsaIdentity(publicKey, privateKey);
        } catch (IllegalArgumentException e) {
            throw new KeyFormatException("public_key_pem", "Public key does not match private key", e);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ExportPayload(
            @JsonProperty("version") Integer version,
            @JsonProperty("type") String type,
            @JsonProperty("private_key_pem") String privateKeyPem,
            @JsonProperty("public_key_pem") String publicKeyPem
    ) {
    }
}
