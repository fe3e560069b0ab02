package com.slipway.secrets;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.slipway.core.exception.AccessDeniedException;
import com.slipway.core.exception.SecretNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;

/**
 * HTTP client for the CredHub data API.
 *
 * <p>Authentication uses a UAA client-credentials grant. The UAA URL is taken from
 * configuration or discovered through CredHub's {@code /info} endpoint.
 *
 * <p>Supported credential types: {@code password}, {@code value}, {@code user}
 * (field {@code username} or {@code password}, default password) and {@code json}
 * (field required, top-level key).
 */
public class CredHubSecretStore implements SecretStore {

    private static final Logger log = LoggerFactory.getLogger(CredHubSecretStore.class);

    private final SecretsProperties.CredHub config;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    private String accessToken;
    private Instant tokenExpiry = Instant.MIN;
    private String uaaUrl;

    public CredHubSecretStore(SecretsProperties.CredHub config) {
        this.config = config;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(config.getTimeoutSeconds()))
                .build();
        this.objectMapper = new ObjectMapper();
        this.uaaUrl = config.getUaaUrl() == null || config.getUaaUrl().isBlank() ? null : config.getUaaUrl();
    }

    @Override
    public String fetch(String stage, String path, String field) {
        var response = send(stage, path, HttpRequest.newBuilder()
                .uri(URI.create(config.getUrl() + "/api/v1/data?name=" + encode(path) + "&current=true"))
                .header("Authorization", "Bearer " + getToken(stage))
                .header("Accept", "application/json")
                .GET()
                .build());

        int status = response.statusCode();
        if (status == 404) {
            throw new SecretNotFoundException(stage, path);
        }
        if (status == 401 || status == 403) {
            throw new AccessDeniedException(stage, "CredHub denied access to " + path + " (HTTP " + status + ")");
        }
        if (status >= 400) {
            throw new SecretNotFoundException(stage, path, "CredHub returned HTTP " + status);
        }

        JsonNode data;
        try {
            data = objectMapper.readTree(response.body()).path("data");
        } catch (IOException e) {
            throw new SecretNotFoundException(stage, path, "unreadable CredHub response");
        }
        if (!data.isArray() || data.isEmpty()) {
            throw new SecretNotFoundException(stage, path);
        }
        var credential = data.get(0);
        String value = extract(credential.path("type").asText(), credential.path("value"), field);
        if (value == null || value.isEmpty()) {
            throw new SecretNotFoundException(stage, path,
                    "no value for field '" + field + "' in " + credential.path("type").asText() + " credential");
        }
        log.debug("Fetched credential {} ({})", path, credential.path("type").asText());
        return value;
    }

    @Override
    public String name() {
        return "credhub";
    }

    static String extract(String type, JsonNode value, String field) {
        boolean hasField = field != null && !field.isBlank();
        return switch (type) {
            case "user" -> value.path(hasField ? field : "password").asText(null);
            case "json" -> {
                if (!hasField) {
                    yield null;
                }
                var node = value.path(field);
                yield node.isValueNode() ? node.asText() : node.isMissingNode() ? null : node.toString();
            }
            default -> value.isValueNode() ? value.asText() : null;
        };
    }

    private synchronized String getToken(String stage) {
        if (accessToken != null && Instant.now().isBefore(tokenExpiry)) {
            return accessToken;
        }
        if (uaaUrl == null) {
            discoverUaaUrl(stage);
        }

        var body = "grant_type=client_credentials&client_id=%s&client_secret=%s"
                .formatted(encode(config.getClientId()), encode(config.getClientSecret()));
        var response = send(stage, "oauth/token", HttpRequest.newBuilder()
                .uri(URI.create(uaaUrl + "/oauth/token"))
                .header("Content-Type", "application/x-www-form-urlencoded")
                .header("Accept", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build());

        if (response.statusCode() != 200) {
            throw new AccessDeniedException(stage,
                    "UAA token request failed (HTTP %d)".formatted(response.statusCode()));
        }
        try {
            var json = objectMapper.readTree(response.body());
            if (!json.hasNonNull("access_token")) {
                throw new AccessDeniedException(stage, "UAA token response carries no access_token");
            }
            accessToken = json.get("access_token").asText();
            int expiresIn = json.path("expires_in").asInt(300);
            tokenExpiry = Instant.now().plusSeconds(Math.max(expiresIn - 60, 10));
            log.info("Obtained CredHub UAA token (expires in {}s)", expiresIn);
            return accessToken;
        } catch (IOException e) {
            throw new AccessDeniedException(stage, "Unreadable UAA token response");
        }
    }

    private void discoverUaaUrl(String stage) {
        var response = send(stage, "info", HttpRequest.newBuilder()
                .uri(URI.create(config.getUrl() + "/info"))
                .header("Accept", "application/json")
                .GET()
                .build());
        try {
            var url = objectMapper.readTree(response.body()).path("auth-server").path("url").asText("");
            if (url.isBlank()) {
                throw new AccessDeniedException(stage, "Cannot discover UAA URL from CredHub at " + config.getUrl());
            }
            uaaUrl = url;
            log.info("Discovered CredHub UAA URL: {}", uaaUrl);
        } catch (IOException e) {
            throw new AccessDeniedException(stage, "Cannot discover UAA URL from CredHub at " + config.getUrl());
        }
    }

    private HttpResponse<String> send(String stage, String what, HttpRequest request) {
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new SecretNotFoundException(stage, what, "CredHub unreachable: " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SecretNotFoundException(stage, what, "interrupted");
        }
    }

    private static String encode(String value) {
        return URLEncoder.encode(value == null ? "" : value, StandardCharsets.UTF_8);
    }
}
