package com.slipway.deploy;

import com.slipway.core.model.DeploymentTarget;
import com.slipway.core.model.ImageReferenceMode;

/**
 * Ask {@code target} to run {@code imageReference}. Repeating the same request leaves
 * the target in the same state.
 */
public record DeploymentRequest(
    DeploymentTarget target,
    String imageReference,
    ImageReferenceMode mode
) {}
