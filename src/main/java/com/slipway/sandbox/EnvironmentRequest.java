package com.slipway.sandbox;

import com.slipway.core.model.EnvironmentSpec;

/**
 * Everything needed to acquire one stage environment.
 *
 * @param runNumber the run the environment serves
 * @param stageName the stage the environment is bound to
 * @param attempt   1-based attempt number; retries get a fresh environment
 * @param spec      image, mounts, working directory and capabilities
 */
public record EnvironmentRequest(
    long runNumber,
    String stageName,
    int attempt,
    EnvironmentSpec spec
) {}
