package com.slipway.core.exception;

/**
 * The deployment target rejected or could not find the convergence request.
 * Fails the run; already-published artifacts stay where they are.
 */
public class TriggerException extends PipelineException {

    public TriggerException(String stage, String message) {
        super(stage, message);
    }

    public TriggerException(String stage, String message, Throwable cause) {
        super(stage, message, cause);
    }
}
