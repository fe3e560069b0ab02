package com.slipway.core.exception;

/**
 * The stage is not allowed to read the credential, or the secret store refused access.
 */
public class AccessDeniedException extends PipelineException {

    public AccessDeniedException(String stage, String message) {
        super(stage, message);
    }
}
