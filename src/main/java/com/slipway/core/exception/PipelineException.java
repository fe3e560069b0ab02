package com.slipway.core.exception;

import java.util.function.UnaryOperator;

/**
 * Base for every failure a stage can end with.
 *
 * <p>Messages may carry captured command output. {@link #redact} rewrites the message in
 * place so that anything logged or archived afterwards is free of secret values.
 */
public abstract class PipelineException extends RuntimeException {

    private final String stage;
    private volatile String redactedMessage;

    protected PipelineException(String stage, String message) {
        super(message);
        this.stage = stage;
    }

    protected PipelineException(String stage, String message, Throwable cause) {
        super(message, cause);
        this.stage = stage;
    }

    public String stage() {
        return stage;
    }

    /**
     * Whether the failure may clear up on its own. Only transient failures are retried,
     * and only within the stage's retry policy.
     */
    public boolean isTransient() {
        return false;
    }

    public PipelineException redact(UnaryOperator<String> redactor) {
        String current = getMessage();
        if (current != null) {
            redactedMessage = redactor.apply(current);
        }
        return this;
    }

    @Override
    public String getMessage() {
        return redactedMessage != null ? redactedMessage : super.getMessage();
    }

    /** Short name used in run records, e.g. {@code BuildException}. */
    public String errorType() {
        return getClass().getSimpleName();
    }
}
