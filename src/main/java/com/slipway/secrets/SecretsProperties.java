package com.slipway.secrets;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "slipway")
public class SecretsProperties {

    private Secrets secrets = new Secrets();

    public String getStore() { return secrets.store; }
    public CredHub getCredhub() { return secrets.credhub; }
    public Map<String, Credential> getCredentials() { return secrets.credentials; }

    public Secrets getSecrets() { return secrets; }
    public void setSecrets(Secrets secrets) { this.secrets = secrets; }

    public static class Secrets {
        /** "environment" (process env, local runs) or "credhub". */
        private String store = "environment";
        private CredHub credhub = new CredHub();
        private Map<String, Credential> credentials = new LinkedHashMap<>();

        public String getStore() { return store; }
        public void setStore(String store) { this.store = store; }
        public CredHub getCredhub() { return credhub; }
        public void setCredhub(CredHub credhub) { this.credhub = credhub; }
        public Map<String, Credential> getCredentials() { return credentials; }
        public void setCredentials(Map<String, Credential> credentials) { this.credentials = credentials; }
    }

    public static class CredHub {
        private String url = "";
        /** Empty means discover from CredHub's /info endpoint. */
        private String uaaUrl = "";
        private String clientId = "";
        private String clientSecret = "";
        private int timeoutSeconds = 10;

        public String getUrl() { return url; }
        public void setUrl(String url) { this.url = url; }
        public String getUaaUrl() { return uaaUrl; }
        public void setUaaUrl(String uaaUrl) { this.uaaUrl = uaaUrl; }
        public String getClientId() { return clientId; }
        public void setClientId(String clientId) { this.clientId = clientId; }
        public String getClientSecret() { return clientSecret; }
        public void setClientSecret(String clientSecret) { this.clientSecret = clientSecret; }
        public int getTimeoutSeconds() { return timeoutSeconds; }
        public void setTimeoutSeconds(int timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }
    }

    /**
     * A named credential: where its value lives and which stages may read it.
     */
    public static class Credential {
        /** Store path (CredHub name or env var). Empty means the credential's own name. */
        private String path = "";
        private List<String> stages = new ArrayList<>();
        /** Sub-field for structured credentials ("username"/"password" for user, any key for json). */
        private String field = "";

        public String getPath() { return path; }
        public void setPath(String path) { this.path = path; }
        public List<String> getStages() { return stages; }
        public void setStages(List<String> stages) { this.stages = stages; }
        public String getField() { return field; }
        public void setField(String field) { this.field = field; }
    }
}
