package com.slipway.secrets;

import com.slipway.core.exception.AccessDeniedException;
import com.slipway.core.exception.SecretNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Set;
import java.util.TreeSet;

/**
 * Resolves the credentials a stage declared, enforcing each credential's allowed-stage list.
 * Values are fetched from the {@link SecretStore} at resolve time, right before the stage runs.
 */
@Service
public class SecretResolver {

    private static final Logger log = LoggerFactory.getLogger(SecretResolver.class);

    private final SecretsProperties properties;
    private final SecretStore store;

    public SecretResolver(SecretsProperties properties, SecretStore store) {
        this.properties = properties;
        this.store = store;
    }

    public ResolvedSecrets resolve(String stage, Set<String> scopes) {
        if (scopes == null || scopes.isEmpty()) {
            return ResolvedSecrets.empty(stage);
        }
        var values = new LinkedHashMap<String, String>();
        for (String scope : new TreeSet<>(scopes)) {
            var credential = properties.getCredentials().get(scope);
            if (credential == null) {
                throw new SecretNotFoundException(stage, scope, "not configured");
            }
            if (credential.getStages() == null || !credential.getStages().contains(stage)) {
                throw new AccessDeniedException(stage,
                        "Stage " + stage + " is not allowed to read secret " + scope);
            }
            String path = credential.getPath() == null || credential.getPath().isBlank()
                    ? scope
                    : credential.getPath();
            values.put(scope, store.fetch(stage, path, credential.getField()));
        }
        log.info("Resolved {} secret(s) for stage {} from {}: {}",
                values.size(), stage, store.name(), values.keySet());
        return new ResolvedSecrets(stage, values);
    }

    /** Store identifier for health reporting. */
    public String storeName() {
        return store.name();
    }
}
