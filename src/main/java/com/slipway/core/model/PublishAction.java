package com.slipway.core.model;

import java.util.List;

/**
 * Pushes the run's artifact to a registry under its version tag plus {@code additionalTags}.
 *
 * @param registryUrl    registry host to authenticate against
 * @param usernameSecret credential name holding the registry username
 * @param passwordSecret credential name holding the registry password or token
 * @param additionalTags floating tags pushed next to the version tag, {@code latest} by default
 */
public record PublishAction(
    String registryUrl,
    String usernameSecret,
    String passwordSecret,
    List<String> additionalTags
) implements StageAction {

    public PublishAction {
        if (registryUrl == null || registryUrl.isBlank()) {
            throw new IllegalArgumentException("registryUrl is required");
        }
        additionalTags = additionalTags != null && !additionalTags.isEmpty()
                ? List.copyOf(additionalTags)
                : List.of("latest");
    }

    @Override
    public Kind kind() {
        return Kind.PUBLISH;
    }
}
