package com.slipway.dispatch.api;

/**
 * Manual run trigger body for {@code POST /api/v1/runs}.
 */
public record RunRequest(
    String branch,
    String commit,
    String repositoryUrl
) {}
