package com.slipway.deploy;

import com.slipway.core.model.DeploymentTarget;

import java.time.Instant;

/**
 * The target accepted the convergence request. Convergence itself is not awaited.
 */
public record DeploymentAck(
    String deploymentId,
    String imageReference,
    DeploymentTarget target,
    Instant requestedAt
) {}
