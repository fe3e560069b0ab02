package com.slipway.core.model;

import java.io.Serializable;

/**
 * The service a trigger stage asks to converge.
 *
 * @param cluster cluster identifier; on Cloud Foundry an {@code org/space} pair
 * @param service service (app) name within the cluster
 * @param region  region key used to pick the platform API endpoint
 */
public record DeploymentTarget(
    String cluster,
    String service,
    String region
) implements Serializable {

    public DeploymentTarget {
        if (cluster == null || cluster.isBlank() || service == null || service.isBlank()) {
            throw new IllegalArgumentException("cluster and service are required");
        }
        region = region != null && !region.isBlank() ? region : "default";
    }

    @Override
    public String toString() {
        return region + "/" + cluster + "/" + service;
    }
}
