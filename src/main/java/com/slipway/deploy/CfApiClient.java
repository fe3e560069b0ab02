package com.slipway.deploy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
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
 * HTTP client for the Cloud Foundry Cloud Controller API v3, scoped to one API endpoint
 * and one set of credentials.
 *
 * <p>Authentication uses a UAA password grant with the "cf" client, the same grant the
 * CF CLI uses. The UAA URL is discovered from the API root.
 */
public class CfApiClient {

    private static final Logger log = LoggerFactory.getLogger(CfApiClient.class);

    private final String apiUrl;
    private final String username;
    private final String password;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    private String accessToken;
    private Instant tokenExpiry = Instant.MIN;
    private String uaaUrl;

    public CfApiClient(String apiUrl, String username, String password, Duration connectTimeout) {
        this.apiUrl = apiUrl.endsWith("/") ? apiUrl.substring(0, apiUrl.length() - 1) : apiUrl;
        this.username = username;
        this.password = password;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .build();
        this.objectMapper = new ObjectMapper();
    }

    String resolveSpaceGuid(String orgName, String spaceName) {
        var orgResources = cfGet("/v3/organizations?names=" + encode(orgName)).get("resources");
        if (orgResources == null || orgResources.isEmpty()) {
            throw new CfApiException(404, "CF org not found: " + orgName);
        }
        var orgGuid = orgResources.get(0).get("guid").asText();

        var spaceResources = cfGet("/v3/spaces?names=" + encode(spaceName)
                + "&organization_guids=" + orgGuid).get("resources");
        if (spaceResources == null || spaceResources.isEmpty()) {
            throw new CfApiException(404, "CF space not found: %s in org %s".formatted(spaceName, orgName));
        }
        var guid = spaceResources.get(0).get("guid").asText();
        log.debug("Resolved CF space '{}/{}' to GUID {}", orgName, spaceName, guid);
        return guid;
    }

    String resolveAppGuid(String appName, String spaceGuid) {
        var resources = cfGet("/v3/apps?names=" + encode(appName) + "&space_guids=" + spaceGuid).get("resources");
        if (resources == null || resources.isEmpty()) {
            throw new CfApiException(404, "CF app not found: " + appName);
        }
        return resources.get(0).get("guid").asText();
    }

    /**
     * Rolling redeploy of the app's current droplet. For docker apps the platform re-pulls
     * the image reference, so a floating tag picks up the newest push.
     */
    String createRollingDeployment(String appGuid) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("strategy", "rolling");
        body.putObject("relationships").putObject("app").putObject("data").put("guid", appGuid);
        return cfPost("/v3/deployments", body.toString()).get("guid").asText();
    }

    String createDropletDeployment(String appGuid, String dropletGuid) {
        ObjectNode body = objectMapper.createObjectNode();
        body.putObject("droplet").put("guid", dropletGuid);
        body.put("strategy", "rolling");
        body.putObject("relationships").putObject("app").putObject("data").put("guid", appGuid);
        return cfPost("/v3/deployments", body.toString()).get("guid").asText();
    }

    String createDockerPackage(String appGuid, String image) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("type", "docker");
        body.putObject("data").put("image", image);
        body.putObject("relationships").putObject("app").putObject("data").put("guid", appGuid);
        return cfPost("/v3/packages", body.toString()).get("guid").asText();
    }

    String createBuild(String packageGuid) {
        ObjectNode body = objectMapper.createObjectNode();
        body.putObject("package").put("guid", packageGuid);
        return cfPost("/v3/builds", body.toString()).get("guid").asText();
    }

    /** Current build as returned by the API: {@code state}, {@code droplet.guid}, {@code error}. */
    JsonNode getBuild(String buildGuid) {
        return cfGet("/v3/builds/" + buildGuid);
    }

    private synchronized String getToken() {
        if (accessToken != null && Instant.now().isBefore(tokenExpiry)) {
            return accessToken;
        }
        if (uaaUrl == null) {
            discoverUaaUrl();
        }
        if (username == null || username.isBlank() || password == null || password.isBlank()) {
            throw new CfApiException(401, "CF credentials not configured for " + apiUrl);
        }

        var body = "grant_type=password&client_id=cf&client_secret=&username=%s&password=%s"
                .formatted(encode(username), encode(password));
        var request = HttpRequest.newBuilder()
                .uri(URI.create(uaaUrl + "/oauth/token"))
                .header("Content-Type", "application/x-www-form-urlencoded")
                .header("Accept", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();

        var response = send(request, "POST /oauth/token");
        if (response.statusCode() != 200) {
            // UAA answers 400/401 for bad credentials; both mean the trigger is not authorized
            throw new CfApiException(401, "UAA token request failed (HTTP %d)".formatted(response.statusCode()));
        }
        var json = readTree(response.body());
        accessToken = json.path("access_token").asText();
        int expiresIn = json.path("expires_in").asInt(300);
        tokenExpiry = Instant.now().plusSeconds(Math.max(expiresIn - 60, 10));
        log.info("Obtained CF UAA token (expires in {}s)", expiresIn);
        return accessToken;
    }

    private void discoverUaaUrl() {
        var request = HttpRequest.newBuilder()
                .uri(URI.create(apiUrl + "/"))
                .header("Accept", "application/json")
                .GET()
                .build();
        var json = readTree(send(request, "GET /").body());

        if (json.has("links") && json.get("links").has("uaa")) {
            uaaUrl = json.get("links").get("uaa").get("href").asText();
        } else if (json.has("token_endpoint")) {
            uaaUrl = json.get("token_endpoint").asText();
        } else {
            throw new CfApiException(0, "Cannot discover UAA URL from CF API at " + apiUrl);
        }
        log.info("Discovered CF UAA URL: {}", uaaUrl);
    }

    JsonNode cfGet(String path) {
        var request = HttpRequest.newBuilder()
                .uri(URI.create(apiUrl + path))
                .header("Authorization", "Bearer " + getToken())
                .header("Accept", "application/json")
                .GET()
                .build();
        return checked(send(request, "GET " + path), "GET " + path);
    }

    JsonNode cfPost(String path, String body) {
        var request = HttpRequest.newBuilder()
                .uri(URI.create(apiUrl + path))
                .header("Authorization", "Bearer " + getToken())
                .header("Content-Type", "application/json")
                .header("Accept", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();
        return checked(send(request, "POST " + path), "POST " + path);
    }

    private JsonNode checked(HttpResponse<String> response, String what) {
        if (response.statusCode() >= 400) {
            throw new CfApiException(response.statusCode(), "CF API %s failed (HTTP %d): %s"
                    .formatted(what, response.statusCode(), response.body()));
        }
        return readTree(response.body());
    }

    private HttpResponse<String> send(HttpRequest request, String what) {
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new CfApiException("CF API request failed: " + what, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CfApiException("Interrupted during CF API request: " + what, e);
        }
    }

    private JsonNode readTree(String body) {
        try {
            return objectMapper.readTree(body);
        } catch (IOException e) {
            throw new CfApiException("Unreadable CF API response", e);
        }
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
