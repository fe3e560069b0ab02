package com.slipway.core.engine;

import com.slipway.core.exception.PipelineDefinitionException;
import com.slipway.core.model.BuildAction;
import com.slipway.core.model.Capability;
import com.slipway.core.model.DeploymentTarget;
import com.slipway.core.model.EnvironmentSpec;
import com.slipway.core.model.ImageReferenceMode;
import com.slipway.core.model.MountRequest;
import com.slipway.core.model.PipelineDefinition;
import com.slipway.core.model.PublishAction;
import com.slipway.core.model.RetryPolicy;
import com.slipway.core.model.StageAction;
import com.slipway.core.model.StageSpec;
import com.slipway.core.model.TriggerAction;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Turns the configured stage list into a validated {@link PipelineDefinition}.
 * Any problem is reported as {@link PipelineDefinitionException} before a run can start.
 */
public final class PipelineDefinitionFactory {

    private PipelineDefinitionFactory() {}

    public static PipelineDefinition create(PipelineProperties properties) {
        if (properties.getRepository() == null || properties.getRepository().isBlank()) {
            throw new PipelineDefinitionException("slipway.pipeline.repository is required");
        }
        if (properties.getStages() == null || properties.getStages().isEmpty()) {
            throw new PipelineDefinitionException("slipway.pipeline.stages must declare at least one stage");
        }

        DeploymentTarget target = toTarget(properties.getTarget());
        var stages = new ArrayList<StageSpec>();
        var names = new HashSet<String>();
        boolean built = false;
        boolean published = false;
        boolean pushesLatest = false;

        for (int i = 0; i < properties.getStages().size(); i++) {
            var configured = properties.getStages().get(i);
            StageSpec stage = toStage(i, configured);
            if (!names.add(stage.name())) {
                throw new PipelineDefinitionException("Duplicate stage name: " + stage.name());
            }

            StageAction action = stage.action();
            if (action instanceof BuildAction) {
                built = true;
            } else if (action instanceof PublishAction publish) {
                if (!built) {
                    throw new PipelineDefinitionException(
                            "Stage " + stage.name() + " publishes before any build stage");
                }
                requireDeclared(stage, publish.usernameSecret(), publish.passwordSecret());
                published = true;
                pushesLatest |= publish.additionalTags().contains(ImageReferenceMode.LATEST_TAG);
            } else if (action instanceof TriggerAction trigger) {
                if (target == null) {
                    throw new PipelineDefinitionException(
                            "Stage " + stage.name() + " triggers a deployment but slipway.pipeline.target is not set");
                }
                if (properties.getImageReferenceMode() == ImageReferenceMode.VERSION && !built) {
                    throw new PipelineDefinitionException(
                            "Stage " + stage.name() + " deploys a version tag but no build stage precedes it");
                }
                if (properties.getImageReferenceMode() == ImageReferenceMode.LATEST && published && !pushesLatest) {
                    throw new PipelineDefinitionException("Stage " + stage.name() + " deploys "
                            + ImageReferenceMode.LATEST_TAG + " but no publish stage before it pushes that tag");
                }
                requireDeclared(stage, trigger.usernameSecret(), trigger.passwordSecret());
            }
            stages.add(stage);
        }

        return new PipelineDefinition(properties.getRepository(), stages, target,
                properties.getImageReferenceMode());
    }

    private static StageSpec toStage(int index, PipelineProperties.Stage configured) {
        String label = configured.getName() != null ? configured.getName() : "#" + (index + 1);
        try {
            if (configured.getImage() == null || configured.getImage().isBlank()) {
                throw new IllegalArgumentException("image is required");
            }
            var mounts = new ArrayList<MountRequest>();
            for (var mount : configured.getMounts()) {
                mounts.add(new MountRequest(mount.getHostPath(), mount.getContainerPath(), mount.isReadOnly()));
            }
            var environment = new EnvironmentSpec(configured.getImage(), mounts, configured.getWorkingDir(),
                    configured.getEntrypoint(), toCapabilities(configured.getCapabilities()));

            var retry = configured.getRetry() != null ? configured.getRetry() : new PipelineProperties.Retry();
            var policy = new RetryPolicy(retry.getMaxAttempts(), retry.getInitialBackoff(), retry.getMultiplier(),
                    retry.getTimeout(), retry.isRetryProvisioning());

            return new StageSpec(configured.getName(), environment, toAction(configured),
                    new LinkedHashSet<>(configured.getSecretScopes()), policy);
        } catch (IllegalArgumentException e) {
            throw new PipelineDefinitionException("Invalid stage " + label + ": " + e.getMessage(), e);
        }
    }

    private static StageAction toAction(PipelineProperties.Stage configured) {
        if (configured.getAction() == null) {
            throw new IllegalArgumentException("action is required (build, publish or trigger)");
        }
        return switch (configured.getAction().toLowerCase(Locale.ROOT)) {
            case "build" -> new BuildAction(configured.getContextDir(), configured.getDockerfile());
            case "publish" -> new PublishAction(configured.getRegistryUrl(), configured.getUsernameSecret(),
                    configured.getPasswordSecret(), configured.getTags());
            case "trigger" -> new TriggerAction(configured.getUsernameSecret(), configured.getPasswordSecret());
            default -> throw new IllegalArgumentException("unknown action '" + configured.getAction() + "'");
        };
    }

    private static Set<Capability> toCapabilities(List<String> names) {
        var capabilities = new HashSet<Capability>();
        for (String name : names) {
            try {
                capabilities.add(Capability.valueOf(name.trim().toUpperCase(Locale.ROOT).replace('-', '_')));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("unknown capability '" + name + "'");
            }
        }
        return capabilities;
    }

    private static DeploymentTarget toTarget(PipelineProperties.Target target) {
        if (target == null || target.getCluster() == null || target.getCluster().isBlank()) {
            return null;
        }
        try {
            return new DeploymentTarget(target.getCluster(), target.getService(), target.getRegion());
        } catch (IllegalArgumentException e) {
            throw new PipelineDefinitionException("Invalid deployment target: " + e.getMessage(), e);
        }
    }

    private static void requireDeclared(StageSpec stage, String... secretNames) {
        for (String secret : secretNames) {
            if (secret != null && !stage.declares(secret)) {
                throw new PipelineDefinitionException(
                        "Stage " + stage.name() + " uses secret " + secret + " without declaring it in secret-scopes");
            }
        }
    }
}
