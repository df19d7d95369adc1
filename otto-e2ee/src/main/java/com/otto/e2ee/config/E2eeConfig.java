package com.otto.e2ee.config;

import com.otto.e2ee.backup.SeedBackupService;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Properties;

/**
 * Settings for an {@link com.otto.e2ee.E2eeSession}.
 *
 * {@link #load()} reads {@value #RESOURCE} from the classpath, then applies any
 * system property with the same {@code otto.e2ee.*} name on top.
 *
 * @param backendBaseUrl Base URL of the chat backend, null to disable network calls
 * @param username Account the identity key is published under, null before login
 * @param storageDirectory Directory for file-backed key storage, null for memory only
 * @param connectTimeout HTTP connect timeout
 * @param requestTimeout HTTP request timeout, also bounding server key fetches
 * @param backupPolicy Argon2id cost for seed backups
 */
public record E2eeConfig(
        String backendBaseUrl,
        String username,
        Path storageDirectory,
        Duration connectTimeout,
        Duration requestTimeout,
        SeedBackupService.KdfPolicy backupPolicy
) {

    public static final String RESOURCE = "otto-e2ee.properties";

    static final String PREFIX = "otto.e2ee.";
    static final String BACKEND_BASE_URL = PREFIX + "backend.base-url";
    static final String USERNAME = PREFIX + "username";
    static final String STORAGE_DIRECTORY = PREFIX + "storage.directory";
    static final String CONNECT_TIMEOUT_MS = PREFIX + "http.connect-timeout-ms";
    static final String REQUEST_TIMEOUT_MS = PREFIX + "http.request-timeout-ms";
    static final String BACKUP_ITERATIONS = PREFIX + "backup.argon2.iterations";
    static final String BACKUP_MEMORY_KIB = PREFIX + "backup.argon2.memory-kib";
    static final String BACKUP_PARALLELISM = PREFIX + "backup.argon2.parallelism";

    public E2eeConfig {
        if (connectTimeout == null || connectTimeout.isNegative() || connectTimeout.isZero()) {
            throw new IllegalArgumentException("Connect timeout must be positive");
        }
        if (requestTimeout == null || requestTimeout.isNegative() || requestTimeout.isZero()) {
            throw new IllegalArgumentException("Request timeout must be positive");
        }
        backupPolicy = backupPolicy != null ? backupPolicy : SeedBackupService.KdfPolicy.defaults();
    }

    /**
     * Memory-only storage, no backend, 10s connect and 15s request timeouts.
     */
    public static E2eeConfig defaults() {
        return new E2eeConfig(
                null,
                null,
                null,
                Duration.ofSeconds(10),
                Duration.ofSeconds(15),
                SeedBackupService.KdfPolicy.defaults()
        );
    }

    public static E2eeConfig load() {
        Properties properties = new Properties();
        try (InputStream in = E2eeConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null) {
                properties.load(in);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + RESOURCE, e);
        }
        for (String name : System.getProperties().stringPropertyNames()) {
            if (name.startsWith(PREFIX)) {
                properties.setProperty(name, System.getProperty(name));
            }
        }
        return fromProperties(properties);
    }

    /**
     * Builds a config from {@code otto.e2ee.*} properties; absent keys keep their defaults.
     */
    public static E2eeConfig fromProperties(Properties properties) {
        E2eeConfig defaults = defaults();
        SeedBackupService.KdfPolicy policy = defaults.backupPolicy().withCost(
                intValue(properties, BACKUP_ITERATIONS, defaults.backupPolicy().iterations()),
                intValue(properties, BACKUP_MEMORY_KIB, defaults.backupPolicy().memoryKib()),
                intValue(properties, BACKUP_PARALLELISM, defaults.backupPolicy().parallelism()));
        String storage = text(properties, STORAGE_DIRECTORY);
        return new E2eeConfig(
                text(properties, BACKEND_BASE_URL),
                text(properties, USERNAME),
                storage != null ? Path.of(storage) : null,
                Duration.ofMillis(intValue(properties, CONNECT_TIMEOUT_MS, (int) defaults.connectTimeout().toMillis())),
                Duration.ofMillis(intValue(properties, REQUEST_TIMEOUT_MS, (int) defaults.requestTimeout().toMillis())),
                policy
        );
    }

    public E2eeConfig withBackendBaseUrl(String baseUrl) {
        return new E2eeConfig(baseUrl, username, storageDirectory, connectTimeout, requestTimeout, backupPolicy);
    }

    public E2eeConfig withUsername(String name) {
        return new E2eeConfig(backendBaseUrl, name, storageDirectory, connectTimeout, requestTimeout, backupPolicy);
    }

    public E2eeConfig withStorageDirectory(Path directory) {
        return new E2eeConfig(backendBaseUrl, username, directory, connectTimeout, requestTimeout, backupPolicy);
    }

    public E2eeConfig withBackupPolicy(SeedBackupService.KdfPolicy policy) {
        return new E2eeConfig(backendBaseUrl, username, storageDirectory, connectTimeout, requestTimeout, policy);
    }

    private static String text(Properties properties, String key) {
        String value = properties.getProperty(key);
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static int intValue(Properties properties, String key, int fallback) {
        String value = text(properties, key);
        if (value == null) {
            return fallback;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Property " + key + " must be an integer: " + value, e);
        }
    }
}
