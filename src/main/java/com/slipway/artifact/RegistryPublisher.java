package com.slipway.artifact;

import com.slipway.core.exception.PublishException;
import com.slipway.core.logging.StageLog;
import com.slipway.core.model.Artifact;
import com.slipway.core.model.PublishAction;
import com.slipway.sandbox.EnvironmentHandle;
import com.slipway.secrets.ResolvedSecrets;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Pushes a built artifact under its version tag and every additional tag, then checks
 * that each pushed tag still names the artifact's digest.
 */
@Component
public class RegistryPublisher {

    private final RegistryClient registry;

    public RegistryPublisher(RegistryClient registry) {
        this.registry = registry;
    }

    public PublishAck publish(EnvironmentHandle env, Artifact artifact, PublishAction action,
                              ResolvedSecrets secrets, StageLog log) {
        String stage = env.stageName();
        if (artifact == null) {
            throw PublishException.unexpected(stage,
                    new IllegalStateException("no artifact was built before stage " + stage));
        }

        boolean authenticated = action.usernameSecret() != null && action.passwordSecret() != null;
        if (authenticated) {
            registry.login(env, action.registryUrl(),
                    secrets.require(action.usernameSecret()), secrets.require(action.passwordSecret()), log);
            log.info("Logged in to " + action.registryUrl());
        }

        try {
            var tags = new LinkedHashSet<String>();
            tags.add(artifact.versionTag());
            tags.addAll(action.additionalTags());

            List<String> references = new ArrayList<>();
            for (String tag : tags) {
                String reference = artifact.reference(tag);
                if (!tag.equals(artifact.versionTag())) {
                    registry.tag(env, artifact.reference(), reference, log);
                }
                references.add(reference);
            }

            var registryDigests = new LinkedHashMap<String, String>();
            for (String reference : references) {
                String digest = registry.push(env, reference, log);
                if (digest != null) {
                    registryDigests.put(reference, digest);
                }
                log.info("Pushed " + reference + (digest != null ? " (" + digest + ")" : ""));
            }

            for (String reference : references) {
                String id = registry.imageId(env, reference);
                if (!artifact.digest().equals(id)) {
                    throw new PublishException(stage,
                            "Tag " + reference + " resolves to " + id + ", expected " + artifact.digest());
                }
            }
            return new PublishAck(artifact, references, registryDigests);
        } finally {
            if (authenticated) {
                logoutQuietly(env, action.registryUrl(), log);
            }
        }
    }

    private void logoutQuietly(EnvironmentHandle env, String registryUrl, StageLog log) {
        try {
            registry.logout(env, registryUrl, log);
        } catch (RuntimeException e) {
            log.info("Logout from " + registryUrl + " failed: " + e.getMessage());
        }
    }
}
