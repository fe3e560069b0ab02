package com.slipway.core.exception;

/**
 * Registry authentication or push failed. Treated as transient, except when it wraps
 * an unexpected error raised by the publish action itself.
 */
public class PublishException extends PipelineException {

    private final boolean retryable;

    public PublishException(String stage, String message) {
        this(stage, message, null, true);
    }

    public PublishException(String stage, String message, Throwable cause) {
        this(stage, message, cause, true);
    }

    private PublishException(String stage, String message, Throwable cause, boolean retryable) {
        super(stage, message, cause);
        this.retryable = retryable;
    }

    /** Wraps a non-registry failure; never retried. */
    public static PublishException unexpected(String stage, Throwable cause) {
        return new PublishException(stage, "Publish failed unexpectedly: " + cause.getMessage(), cause, false);
    }

    @Override
    public boolean isTransient() {
        return retryable;
    }
}
