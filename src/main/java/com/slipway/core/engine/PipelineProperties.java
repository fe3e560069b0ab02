package com.slipway.core.engine;

import com.slipway.core.model.ImageReferenceMode;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "slipway")
public class PipelineProperties {

    private Pipeline pipeline = new Pipeline();

    public String getRepository() { return pipeline.repository; }
    public ImageReferenceMode getImageReferenceMode() { return pipeline.imageReferenceMode; }
    public int getMaxConcurrentRuns() { return pipeline.maxConcurrentRuns; }
    public boolean isSupersedeRunning() { return pipeline.supersedeRunning; }
    public String getArchiveDir() { return pipeline.archiveDir; }
    public List<String> getBranches() { return pipeline.branches; }
    public String getWebhookSecret() { return pipeline.webhookSecret; }
    public Target getTarget() { return pipeline.target; }
    public List<Stage> getStages() { return pipeline.stages; }

    /** Whether pushes to {@code branch} start a run. An empty branch list accepts every branch. */
    public boolean acceptsBranch(String branch) {
        return pipeline.branches == null || pipeline.branches.isEmpty() || pipeline.branches.contains(branch);
    }

    public Pipeline getPipeline() { return pipeline; }
    public void setPipeline(Pipeline pipeline) { this.pipeline = pipeline; }

    public static class Pipeline {
        /** Image repository artifacts are tagged under, e.g. registry.example.com/team/app. */
        private String repository = "";
        private ImageReferenceMode imageReferenceMode = ImageReferenceMode.LATEST;
        private int maxConcurrentRuns = 2;
        private boolean supersedeRunning = false;
        private String archiveDir = ".slipway/runs";
        private List<String> branches = new ArrayList<>();
        private String webhookSecret = "";
        private Target target = new Target();
        private List<Stage> stages = new ArrayList<>();

        public String getRepository() { return repository; }
        public void setRepository(String repository) { this.repository = repository; }
        public ImageReferenceMode getImageReferenceMode() { return imageReferenceMode; }
        public void setImageReferenceMode(ImageReferenceMode imageReferenceMode) { this.imageReferenceMode = imageReferenceMode; }
        public int getMaxConcurrentRuns() { return maxConcurrentRuns; }
        public void setMaxConcurrentRuns(int maxConcurrentRuns) { this.maxConcurrentRuns = maxConcurrentRuns; }
        public boolean isSupersedeRunning() { return supersedeRunning; }
        public void setSupersedeRunning(boolean supersedeRunning) { this.supersedeRunning = supersedeRunning; }
        public String getArchiveDir() { return archiveDir; }
        public void setArchiveDir(String archiveDir) { this.archiveDir = archiveDir; }
        public List<String> getBranches() { return branches; }
        public void setBranches(List<String> branches) { this.branches = branches; }
        public String getWebhookSecret() { return webhookSecret; }
        public void setWebhookSecret(String webhookSecret) { this.webhookSecret = webhookSecret; }
        public Target getTarget() { return target; }
        public void setTarget(Target target) { this.target = target; }
        public List<Stage> getStages() { return stages; }
        public void setStages(List<Stage> stages) { this.stages = stages; }
    }

    public static class Target {
        /** On Cloud Foundry: org/space. Empty means no deployment target. */
        private String cluster = "";
        private String service = "";
        private String region = "default";

        public String getCluster() { return cluster; }
        public void setCluster(String cluster) { this.cluster = cluster; }
        public String getService() { return service; }
        public void setService(String service) { this.service = service; }
        public String getRegion() { return region; }
        public void setRegion(String region) { this.region = region; }
    }

    public static class Stage {
        private String name;
        /** build, publish or trigger. */
        private String action;
        private String image;
        private String workingDir;
        private List<String> entrypoint = new ArrayList<>();
        private List<String> capabilities = new ArrayList<>();
        private List<Mount> mounts = new ArrayList<>();
        private List<String> secretScopes = new ArrayList<>();

        // build
        private String contextDir;
        private String dockerfile;

        // publish
        private String registryUrl;
        private List<String> tags = new ArrayList<>();

        // publish and trigger
        private String usernameSecret;
        private String passwordSecret;

        private Retry retry = new Retry();

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }
        public String getAction() { return action; }
        public void setAction(String action) { this.action = action; }
        public String getImage() { return image; }
        public void setImage(String image) { this.image = image; }
        public String getWorkingDir() { return workingDir; }
        public void setWorkingDir(String workingDir) { this.workingDir = workingDir; }
        public List<String> getEntrypoint() { return entrypoint; }
        public void setEntrypoint(List<String> entrypoint) { this.entrypoint = entrypoint; }
        public List<String> getCapabilities() { return capabilities; }
        public void setCapabilities(List<String> capabilities) { this.capabilities = capabilities; }
        public List<Mount> getMounts() { return mounts; }
        public void setMounts(List<Mount> mounts) { this.mounts = mounts; }
        public List<String> getSecretScopes() { return secretScopes; }
        public void setSecretScopes(List<String> secretScopes) { this.secretScopes = secretScopes; }
        public String getContextDir() { return contextDir; }
        public void setContextDir(String contextDir) { this.contextDir = contextDir; }
        public String getDockerfile() { return dockerfile; }
        public void setDockerfile(String dockerfile) { this.dockerfile = dockerfile; }
        public String getRegistryUrl() { return registryUrl; }
        public void setRegistryUrl(String registryUrl) { this.registryUrl = registryUrl; }
        public List<String> getTags() { return tags; }
        public void setTags(List<String> tags) { this.tags = tags; }
        public String getUsernameSecret() { return usernameSecret; }
        public void setUsernameSecret(String usernameSecret) { this.usernameSecret = usernameSecret; }
        public String getPasswordSecret() { return passwordSecret; }
        public void setPasswordSecret(String passwordSecret) { this.passwordSecret = passwordSecret; }
        public Retry getRetry() { return retry; }
        public void setRetry(Retry retry) { this.retry = retry; }
    }

    public static class Mount {
        private String hostPath;
        private String containerPath;
        private boolean readOnly = false;

        public String getHostPath() { return hostPath; }
        public void setHostPath(String hostPath) { this.hostPath = hostPath; }
        public String getContainerPath() { return containerPath; }
        public void setContainerPath(String containerPath) { this.containerPath = containerPath; }
        public boolean isReadOnly() { return readOnly; }
        public void setReadOnly(boolean readOnly) { this.readOnly = readOnly; }
    }

    public static class Retry {
        private int maxAttempts = 1;
        private Duration initialBackoff = Duration.ofSeconds(2);
        private double multiplier = 2.0;
        private Duration timeout = Duration.ofMinutes(30);
        private boolean retryProvisioning = false;

        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }
        public Duration getInitialBackoff() { return initialBackoff; }
        public void setInitialBackoff(Duration initialBackoff) { this.initialBackoff = initialBackoff; }
        public double getMultiplier() { return multiplier; }
        public void setMultiplier(double multiplier) { this.multiplier = multiplier; }
        public Duration getTimeout() { return timeout; }
        public void setTimeout(Duration timeout) { this.timeout = timeout; }
        public boolean isRetryProvisioning() { return retryProvisioning; }
        public void setRetryProvisioning(boolean retryProvisioning) { this.retryProvisioning = retryProvisioning; }
    }
}
