package com.prpulse.pipeline.sync;

public enum SyncMode {
    /** Process every pull request the source returns. */
    FULL,
    /** Stop a repository's pull-request pagination at the first record that is already up to date. */
    INCREMENTAL
}
