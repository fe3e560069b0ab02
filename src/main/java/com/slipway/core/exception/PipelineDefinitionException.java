package com.slipway.core.exception;

/**
 * The configured stage list is invalid. Raised at startup, before any run exists.
 */
public class PipelineDefinitionException extends PipelineException {

    public PipelineDefinitionException(String message) {
        super(null, message);
    }

    public PipelineDefinitionException(String message, Throwable cause) {
        super(null, message, cause);
    }
}
