package com.slipway.deploy;

import com.slipway.core.model.DeploymentTarget;
import com.slipway.core.model.ImageReferenceMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;

/**
 * Converges a Cloud Foundry app on a new image through the v3 API.
 *
 * <ul>
 *   <li>{@link ImageReferenceMode#LATEST}: rolling deployment of the current droplet; the
 *       platform re-pulls the floating tag</li>
 *   <li>{@link ImageReferenceMode#VERSION}: docker package for the pinned reference, staged
 *       into a droplet, then a rolling deployment of that droplet</li>
 * </ul>
 *
 * <p>Neither mode waits for the rollout. VERSION mode does wait for staging, bounded by
 * {@code slipway.deploy.staging-timeout-seconds}, since its deployment needs the droplet.
 *
 * <p>The target's cluster is {@code org/space}; its region selects the API endpoint.
 * A fresh {@link CfApiClient} is built per call so credentials never outlive the stage.
 */
public class CloudFoundryDeploymentClient implements DeploymentClient {

    private static final Logger log = LoggerFactory.getLogger(CloudFoundryDeploymentClient.class);

    private final DeployProperties properties;

    public CloudFoundryDeploymentClient(DeployProperties properties) {
        this.properties = properties;
    }

    @Override
    public String updateService(DeploymentRequest request, DeploymentCredentials credentials) {
        DeploymentTarget target = request.target();
        String[] orgSpace = splitCluster(target.cluster());
        var client = new CfApiClient(apiUrlFor(target.region()), credentials.username(), credentials.password(),
                Duration.ofSeconds(properties.getConnectTimeoutSeconds()));

        String spaceGuid = client.resolveSpaceGuid(orgSpace[0], orgSpace[1]);
        String appGuid = client.resolveAppGuid(target.service(), spaceGuid);

        String deploymentGuid;
        if (request.mode() == ImageReferenceMode.VERSION) {
            String packageGuid = client.createDockerPackage(appGuid, request.imageReference());
            String dropletGuid = stage(client, client.createBuild(packageGuid));
            deploymentGuid = client.createDropletDeployment(appGuid, dropletGuid);
        } else {
            deploymentGuid = client.createRollingDeployment(appGuid);
        }
        log.info("Enqueued CF deployment {} of {} to {}", deploymentGuid, request.imageReference(), target);
        return deploymentGuid;
    }

    String apiUrlFor(String region) {
        String url = properties.getRegions().get(region);
        if (url == null || url.isBlank()) {
            throw new CfApiException(404, "No Cloud Foundry API configured for region " + region);
        }
        return url;
    }

    static String[] splitCluster(String cluster) {
        String[] parts = cluster.split("/", 2);
        if (parts.length != 2 || parts[0].isBlank() || parts[1].isBlank()) {
            throw new CfApiException(404, "Cloud Foundry cluster must be 'org/space', was " + cluster);
        }
        return parts;
    }

    /** Polls the build until it is staged and returns its droplet guid. */
    private String stage(CfApiClient client, String buildGuid) {
        Instant deadline = Instant.now().plusSeconds(properties.getStagingTimeoutSeconds());
        while (true) {
            var build = client.getBuild(buildGuid);
            String state = build.path("state").asText();
            switch (state) {
                case "STAGED" -> {
                    return build.path("droplet").path("guid").asText();
                }
                case "FAILED" -> throw new CfApiException(0,
                        "CF build " + buildGuid + " failed: " + build.path("error").asText());
                default -> log.debug("CF build {} is {}", buildGuid, state);
            }
            if (Instant.now().isAfter(deadline)) {
                throw new CfApiException(0, "CF build " + buildGuid + " did not stage within "
                        + properties.getStagingTimeoutSeconds() + "s");
            }
            try {
                Thread.sleep(properties.getBuildPollIntervalMs());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new CfApiException("Interrupted while waiting for CF build " + buildGuid, e);
            }
        }
    }
}
