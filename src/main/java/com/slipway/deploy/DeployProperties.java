package com.slipway.deploy;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "slipway")
public class DeployProperties {

    private Deploy deploy = new Deploy();

    public String getProvider() { return deploy.provider; }
    public Map<String, String> getRegions() { return deploy.regions; }
    public int getConnectTimeoutSeconds() { return deploy.connectTimeoutSeconds; }
    public long getBuildPollIntervalMs() { return deploy.buildPollIntervalMs; }
    public int getStagingTimeoutSeconds() { return deploy.stagingTimeoutSeconds; }

    public Deploy getDeploy() { return deploy; }
    public void setDeploy(Deploy deploy) { this.deploy = deploy; }

    public static class Deploy {
        private String provider = "cloudfoundry";
        /** Region key to Cloud Controller API URL. */
        private Map<String, String> regions = new LinkedHashMap<>();
        private int connectTimeoutSeconds = 10;
        private long buildPollIntervalMs = 2000;
        private int stagingTimeoutSeconds = 600;

        public String getProvider() { return provider; }
        public void setProvider(String provider) { this.provider = provider; }
        public Map<String, String> getRegions() { return regions; }
        public void setRegions(Map<String, String> regions) { this.regions = regions; }
        public int getConnectTimeoutSeconds() { return connectTimeoutSeconds; }
        public void setConnectTimeoutSeconds(int connectTimeoutSeconds) { this.connectTimeoutSeconds = connectTimeoutSeconds; }
        public long getBuildPollIntervalMs() { return buildPollIntervalMs; }
        public void setBuildPollIntervalMs(long buildPollIntervalMs) { this.buildPollIntervalMs = buildPollIntervalMs; }
        public int getStagingTimeoutSeconds() { return stagingTimeoutSeconds; }
        public void setStagingTimeoutSeconds(int stagingTimeoutSeconds) { this.stagingTimeoutSeconds = stagingTimeoutSeconds; }
    }
}
