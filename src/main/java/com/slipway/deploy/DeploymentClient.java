package com.slipway.deploy;

/**
 * Narrow contract to the external deployment service.
 * Implementations: CloudFoundryDeploymentClient.
 */
public interface DeploymentClient {

    /**
     * Enqueues a rollout of the requested image on the target service.
     *
     * @return the platform's identifier for the rollout
     * @throws CfApiException or another runtime exception when the platform rejects the request
     */
    String updateService(DeploymentRequest request, DeploymentCredentials credentials);
}
