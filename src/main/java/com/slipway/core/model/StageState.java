package com.slipway.core.model;

/**
 * Status of an individual stage within a run.
 * A stage walks ACQUIRING, SECRET_RESOLVING, EXECUTING, RELEASING once per attempt
 * before settling in one of the terminal states.
 */
public enum StageState {
    PENDING,
    ACQUIRING,
    SECRET_RESOLVING,
    EXECUTING,
    RELEASING,
    SUCCEEDED,
    FAILED,
    SKIPPED,    // never started because an earlier stage failed
    ABORTED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == SKIPPED || this == ABORTED;
    }
}
