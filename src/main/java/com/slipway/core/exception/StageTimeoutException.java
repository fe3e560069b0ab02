package com.slipway.core.exception;

import java.time.Duration;

/**
 * A stage action outlived its retry policy's timeout.
 */
public class StageTimeoutException extends PipelineException {

    public StageTimeoutException(String stage, Duration timeout) {
        super(stage, "Stage " + stage + " timed out after " + timeout.toSeconds() + "s");
    }
}
