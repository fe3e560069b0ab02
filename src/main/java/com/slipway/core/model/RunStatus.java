package com.slipway.core.model;

/**
 * Lifecycle status of a pipeline run.
 */
public enum RunStatus {
    PENDING,
    RUNNING,
    SUCCEEDED,
    FAILED,
    ABORTED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == ABORTED;
    }
}
