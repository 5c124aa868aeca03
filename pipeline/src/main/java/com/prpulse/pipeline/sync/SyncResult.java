package com.prpulse.pipeline.sync;

import java.time.Instant;
import java.util.List;

/**
 * Outcome of a sync run as reported to the trigger that requested it.
 * Counts cover every reconciled entity (repositories, pull requests and reviews).
 */
public record SyncResult(
        String runId,
        String scope,
        SyncRunState status,
        List<String> synced,
        int newCount,
        int updatedCount,
        int unchangedCount,
        List<SyncError> errors,
        Instant startedAt,
        Instant finishedAt
) {

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public long durationMs() {
        return finishedAt.toEpochMilli() - startedAt.toEpochMilli();
    }
}
