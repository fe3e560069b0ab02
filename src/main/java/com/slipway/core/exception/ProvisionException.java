package com.slipway.core.exception;

/**
 * The stage environment could not be created: image unavailable, mount missing,
 * or the container runtime refused the request.
 */
public class ProvisionException extends PipelineException {

    public ProvisionException(String stage, String message) {
        super(stage, message);
    }

    public ProvisionException(String stage, String message, Throwable cause) {
        super(stage, message, cause);
    }
}
