package com.slipway.core.exception;

/**
 * The run was cancelled while this stage was in flight.
 */
public class RunAbortedException extends PipelineException {

    public RunAbortedException(String stage, String reason) {
        super(stage, reason != null ? reason : "Run aborted");
    }
}
