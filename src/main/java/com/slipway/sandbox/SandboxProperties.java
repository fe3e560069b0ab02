package com.slipway.sandbox;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "slipway")
public class SandboxProperties {

    public enum PullPolicy { IF_NOT_PRESENT, ALWAYS, NEVER }

    private Sandbox sandbox = new Sandbox();

    public String getProvider() { return sandbox.provider; }
    public String getDockerHost() { return sandbox.dockerHost; }
    public String getDockerSocketPath() { return sandbox.dockerSocketPath; }
    public PullPolicy getPullPolicy() { return sandbox.pullPolicy; }
    public int getPullTimeoutSeconds() { return sandbox.pullTimeoutSeconds; }
    public int getMemoryLimitMb() { return sandbox.memoryLimitMb; }
    public int getCpuCount() { return sandbox.cpuCount; }
    public int getStopTimeoutSeconds() { return sandbox.stopTimeoutSeconds; }
    public String getNamePrefix() { return sandbox.namePrefix; }
    public boolean isVerifyMounts() { return sandbox.verifyMounts; }

    public Sandbox getSandbox() { return sandbox; }
    public void setSandbox(Sandbox sandbox) { this.sandbox = sandbox; }

    public static class Sandbox {
        private String provider = "docker";
        /** Empty means DOCKER_HOST, falling back to the local unix socket. */
        private String dockerHost = "";
        private String dockerSocketPath = "/var/run/docker.sock";
        private PullPolicy pullPolicy = PullPolicy.IF_NOT_PRESENT;
        private int pullTimeoutSeconds = 600;
        private int memoryLimitMb = 4096;
        private int cpuCount = 2;
        private int stopTimeoutSeconds = 5;
        private String namePrefix = "slipway";
        private boolean verifyMounts = true;

        public String getProvider() { return provider; }
        public void setProvider(String provider) { this.provider = provider; }
        public String getDockerHost() { return dockerHost; }
        public void setDockerHost(String dockerHost) { this.dockerHost = dockerHost; }
        public String getDockerSocketPath() { return dockerSocketPath; }
        public void setDockerSocketPath(String dockerSocketPath) { this.dockerSocketPath = dockerSocketPath; }
        public PullPolicy getPullPolicy() { return pullPolicy; }
        public void setPullPolicy(PullPolicy pullPolicy) { this.pullPolicy = pullPolicy; }
        public int getPullTimeoutSeconds() { return pullTimeoutSeconds; }
        public void setPullTimeoutSeconds(int pullTimeoutSeconds) { this.pullTimeoutSeconds = pullTimeoutSeconds; }
        public int getMemoryLimitMb() { return memoryLimitMb; }
        public void setMemoryLimitMb(int memoryLimitMb) { this.memoryLimitMb = memoryLimitMb; }
        public int getCpuCount() { return cpuCount; }
        public void setCpuCount(int cpuCount) { this.cpuCount = cpuCount; }
        public int getStopTimeoutSeconds() { return stopTimeoutSeconds; }
        public void setStopTimeoutSeconds(int stopTimeoutSeconds) { this.stopTimeoutSeconds = stopTimeoutSeconds; }
        public String getNamePrefix() { return namePrefix; }
        public void setNamePrefix(String namePrefix) { this.namePrefix = namePrefix; }
        public boolean isVerifyMounts() { return verifyMounts; }
        public void setVerifyMounts(boolean verifyMounts) { this.verifyMounts = verifyMounts; }
    }
}
