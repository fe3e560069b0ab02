package com.slipway.deploy;

import com.slipway.core.exception.PipelineException;
import com.slipway.core.exception.TriggerException;
import com.slipway.core.logging.StageLog;
import com.slipway.core.model.Artifact;
import com.slipway.core.model.PipelineRun;
import com.slipway.core.model.TriggerAction;
import com.slipway.secrets.ResolvedSecrets;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Asks the run's deployment target to converge on the newest artifact. The request names
 * an image reference rather than an operation, so sending it twice changes nothing.
 * Never rolls back a publish.
 */
@Component
public class DeploymentTrigger {

    private final DeploymentClient client;

    public DeploymentTrigger(DeploymentClient client) {
        this.client = client;
    }

    public DeploymentAck trigger(String stage, PipelineRun run, Artifact artifact, TriggerAction action,
                                 ResolvedSecrets secrets, StageLog log) {
        var target = run.target();
        if (target == null) {
            throw new TriggerException(stage, "No deployment target configured");
        }

        String imageReference;
        try {
            imageReference = run.imageReferenceMode().resolve(run.repository(), artifact);
        } catch (IllegalStateException e) {
            throw new TriggerException(stage, e.getMessage(), e);
        }

        var credentials = action.usernameSecret() != null && action.passwordSecret() != null
                ? new DeploymentCredentials(secrets.require(action.usernameSecret()),
                        secrets.require(action.passwordSecret()))
                : DeploymentCredentials.none();

        log.info("Requesting " + target + " to run " + imageReference);
        Instant requestedAt = Instant.now();
        String deploymentId;
        try {
            deploymentId = client.updateService(
                    new DeploymentRequest(target, imageReference, run.imageReferenceMode()), credentials);
        } catch (PipelineException e) {
            throw e;
        } catch (CfApiException e) {
            String reason = e.isAuthOrNotFound()
                    ? "Deployment target " + target + " rejected the request (HTTP " + e.status() + ")"
                    : "Deployment request to " + target + " failed";
            throw new TriggerException(stage, reason + ": " + e.getMessage(), e);
        } catch (RuntimeException e) {
            throw new TriggerException(stage, "Deployment request to " + target + " failed: " + e.getMessage(), e);
        }

        log.info("Deployment " + deploymentId + " enqueued on " + target);
        return new DeploymentAck(deploymentId, imageReference, target, requestedAt);
    }
}
