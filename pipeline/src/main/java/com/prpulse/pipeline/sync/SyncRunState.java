package com.prpulse.pipeline.sync;

/**
 * Lifecycle of one sync run: {@code PENDING -> RUNNING -> COMPLETED | COMPLETED_WITH_ERRORS | FAILED}.
 */
public enum SyncRunState {
    PENDING,
    RUNNING,
    COMPLETED,
    COMPLETED_WITH_ERRORS,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == COMPLETED_WITH_ERRORS || this == FAILED;
    }
}
