package com.slipway.secrets;

/**
 * Read-only access to the backing secret store.
 * Implementations: CredHubSecretStore, EnvironmentSecretStore.
 */
public interface SecretStore {

    /**
     * Fetches the current value of a credential.
     *
     * @param stage requesting stage, used for error attribution only
     * @param path  store-specific location of the credential
     * @param field sub-field of a structured credential, empty for plain values
     * @throws com.slipway.core.exception.SecretNotFoundException if the credential does not exist
     * @throws com.slipway.core.exception.AccessDeniedException   if the store refuses access
     */
    String fetch(String stage, String path, String field);

    /** Short identifier for health and log output. */
    String name();
}
