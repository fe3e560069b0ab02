package com.slipway.core.exception;

/**
 * A declared credential is not configured or does not exist in the secret store.
 */
public class SecretNotFoundException extends PipelineException {

    public SecretNotFoundException(String stage, String secretName) {
        super(stage, "Secret not found: " + secretName);
    }

    public SecretNotFoundException(String stage, String secretName, String detail) {
        super(stage, "Secret not found: " + secretName + " (" + detail + ")");
    }
}
