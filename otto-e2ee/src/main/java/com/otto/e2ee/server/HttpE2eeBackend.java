package com.otto.e2ee.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.otto.e2ee.backup.EncryptedSeedBackup;
import com.otto.e2ee.config.ObjectMappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Function;

/**
 * {@link E2eeBackend} over HTTP with JSON bodies.
 */
public class HttpE2eeBackend implements E2eeBackend {

    private static final Logger log = LoggerFactory.getLogger(HttpE2eeBackend.class);

    static final String USERNAME_HEADER = "X-Username";

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Duration requestTimeout;
    private final Executor executor;

    public HttpE2eeBackend(Duration connectTimeout, Duration requestTimeout, ObjectMapper objectMapper, Executor executor) {
        if (connectTimeout == null || requestTimeout == null) {
            throw new IllegalArgumentException("Timeouts cannot be null");
        }
        if (executor == null) {
            throw new IllegalArgumentException("Executor cannot be null");
        }
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .build();
        this.objectMapper = objectMapper != null ? objectMapper : ObjectMappers.create();
        this.requestTimeout = requestTimeout;
        this.executor = executor;
    }

    // ==================== Server Key ====================

    @Override
    public CompletableFuture<String> fetchServerPublicKeyPem(String baseUrl) {
        HttpRequest request = newRequest(baseUrl, "/users/server-public-key", null)
                .GET()
                .build();
        return send(request, "fetch server public key", body -> requireText(body, "public_key"));
    }

    // ==================== Identity Keys ====================

    @Override
    public CompletableFuture<Void> uploadIdentityPublicKey(String baseUrl, String username, String publicKeyBase64) {
        requireUsername(username);
        if (publicKeyBase64 == null || publicKeyBase64.isBlank()) {
            throw new IllegalArgumentException("Public key cannot be null or blank");
        }
        HttpRequest request = newRequest(baseUrl, "/users/me/public-key", username)
                .POST(jsonBody(Map.of("public_key", publicKeyBase64)))
                .build();
        return send(request, "upload identity public key", null);
    }

    @Override
    public CompletableFuture<byte[]> fetchPeerPublicKey(String baseUrl, String username) {
        requireUsername(username);
        String path = "/users/" + URLEncoder.encode(username, StandardCharsets.UTF_8).replace("+", "%20") + "/public-key";
        HttpRequest request = newRequest(baseUrl, path, null)
                .GET()
                .build();
        return send(request, "fetch public key of " + username, body -> {
            String encoded = requireText(body, "public_key");
            try {
                return Base64.getDecoder().decode(encoded);
            } catch (IllegalArgumentException e) {
                throw new E2eeBackendException(200, "Peer public key is not valid base64", e);
            }
        });
    }

    // ==================== Backup ====================

    @Override
    public CompletableFuture<Void> uploadSeedBackup(String baseUrl, String username, EncryptedSeedBackup backup) {
        requireUsername(username);
        if (backup == null) {
            throw new IllegalArgumentException("Backup cannot be null");
        }
        HttpRequest request = newRequest(baseUrl, "/users/me/seed-backup", username)
                .POST(jsonBody(backup))
                .build();
        return send(request, "upload seed backup", null);
    }

    // ==================== HTTP Methods ====================

    private HttpRequest.Builder newRequest(String baseUrl, String path, String username) {
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new IllegalArgumentException("Base URL cannot be null or blank");
        }
        String base = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(base + path))
                .timeout(requestTimeout)
                .header("Content-Type", "application/json")
                .header("Accept", "application/json");
        if (username != null) {
            builder.header(USERNAME_HEADER, username);
        }
        return builder;
    }

    private HttpRequest.BodyPublisher jsonBody(Object body) {
        try {
            return HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize request body", e);
        }
    }

    /**
     * Sends on the executor. A null parser ignores the response body.
     */
    private <T> CompletableFuture<T> send(HttpRequest request, String operation, Function<JsonNode, T> parser) {
        return CompletableFuture.supplyAsync(() -> {
            HttpResponse<String> response;
            try {
                response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            } catch (HttpTimeoutException e) {
                log.warn("Timed out trying to {} at {}", operation, request.uri());
                throw new FetchTimeoutException("Timed out trying to " + operation, e);
            } catch (IOException e) {
                throw new E2eeBackendException(E2eeBackendException.NO_RESPONSE, "Failed to " + operation, e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new E2eeBackendException(E2eeBackendException.NO_RESPONSE, "Interrupted trying to " + operation, e);
            }

            int status = response.statusCode();
            if (status < 200 || status >= 300) {
                log.warn("Failed to {}: HTTP {}", operation, status);
                throw new E2eeBackendException(status, "Failed to " + operation + ": HTTP " + status);
            }
            return parser != null ? parser.apply(readBody(response, operation)) : null;
        }, executor);
    }

    private JsonNode readBody(HttpResponse<String> response, String operation) {
        String body = response.body();
        if (body == null || body.isBlank()) {
            return objectMapper.missingNode();
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new E2eeBackendException(response.statusCode(), "Malformed response trying to " + operation, e);
        }
    }

    private static String requireText(JsonNode body, String field) {
        JsonNode value = body.path(field);
        if (!value.isTextual() || value.asText().isBlank()) {
            throw new E2eeBackendException(200, "Response is missing '" + field + "'");
        }
        return value.asText();
    }

    private static void requireUsername(String username) {
        if (username == null || username.isBlank()) {
            throw new IllegalArgumentException("Username cannot be null or blank");
        }
    }
}
