package com.slipway.core.exception;

/**
 * The artifact could not be built. A broken build is not transient and is never retried.
 */
public class BuildException extends PipelineException {

    public BuildException(String stage, String message) {
        super(stage, message);
    }

    public BuildException(String stage, String message, Throwable cause) {
        super(stage, message, cause);
    }
}
