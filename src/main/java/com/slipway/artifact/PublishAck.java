package com.slipway.artifact;

import com.slipway.core.model.Artifact;

import java.util.List;
import java.util.Map;

/**
 * Registry acknowledgement of a completed publish.
 *
 * @param artifact          the artifact that was pushed
 * @param pushedReferences  every reference pushed, version tag first
 * @param registryDigests   manifest digest the registry reported per reference (may be empty)
 */
public record PublishAck(
    Artifact artifact,
    List<String> pushedReferences,
    Map<String, String> registryDigests
) {
    public PublishAck {
        pushedReferences = List.copyOf(pushedReferences);
        registryDigests = Map.copyOf(registryDigests);
    }
}
