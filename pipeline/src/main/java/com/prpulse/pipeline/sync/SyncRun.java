package com.prpulse.pipeline.sync;

import com.prpulse.pipeline.client.FailureKind;
import com.prpulse.pipeline.reconcile.UpsertOutcome;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Mutable tally of one sync run, shared by the worker threads syncing its
 * repositories. State transitions are synchronized; counters and lists are
 * safe for concurrent use.
 */
public class SyncRun {

    private final String runId;
    private final String scope;
    private final Clock clock;

    private final List<String> synced = Collections.synchronizedList(new ArrayList<>());
    private final List<SyncError> errors = Collections.synchronizedList(new ArrayList<>());
    private final AtomicInteger newCount = new AtomicInteger();
    private final AtomicInteger updatedCount = new AtomicInteger();
    private final AtomicInteger unchangedCount = new AtomicInteger();

    private SyncRunState state = SyncRunState.PENDING;
    private volatile boolean aborted;
    private Instant startedAt;
    private Instant finishedAt;

    public SyncRun(String scope, Clock clock) {
        this.runId = UUID.randomUUID().toString().substring(0, 8);
        this.scope = scope;
        this.clock = clock;
    }

    public String runId() {
        return runId;
    }

    public synchronized SyncRunState state() {
        return state;
    }

    public synchronized void start() {
        requireState(SyncRunState.PENDING, SyncRunState.RUNNING);
        state = SyncRunState.RUNNING;
        startedAt = clock.instant();
    }

    /**
     * Ends the run: {@code FAILED} if it was aborted, otherwise completed with or without errors.
     */
    public synchronized SyncResult finish() {
        requireState(SyncRunState.RUNNING, SyncRunState.COMPLETED);
        if (aborted) {
            state = SyncRunState.FAILED;
        } else {
            state = errors.isEmpty() ? SyncRunState.COMPLETED : SyncRunState.COMPLETED_WITH_ERRORS;
        }
        finishedAt = clock.instant();
        return toResult();
    }

    /**
     * Ends a running run as {@code FAILED} right away, recording the fatal cause.
     */
    public synchronized SyncResult fail(String resource, FailureKind kind, String message) {
        recordError(resource, kind, message);
        aborted = true;
        return finish();
    }

    /**
     * Marks the run as failed without ending it, so that sibling workers stop at
     * their next page boundary. {@link #finish()} then reports {@code FAILED}.
     */
    public void abort(String resource, FailureKind kind, String message) {
        recordError(resource, kind, message);
        aborted = true;
    }

    public boolean isAborted() {
        return aborted;
    }

    public void recordSynced(String resource) {
        synced.add(resource);
    }

    public void recordError(String resource, FailureKind kind, String message) {
        errors.add(new SyncError(resource, kind, message));
    }

    public void record(UpsertOutcome outcome) {
        switch (outcome) {
            case INSERTED:
                newCount.incrementAndGet();
                break;
            case UPDATED:
                updatedCount.incrementAndGet();
                break;
            default:
                unchangedCount.incrementAndGet();
                break;
        }
    }

    private void requireState(SyncRunState expected, SyncRunState target) {
        if (state != expected) {
            throw new IllegalStateException("Sync run " + runId + " cannot move from " + state + " to " + target);
        }
    }

    private SyncResult toResult() {
        List<String> syncedCopy;
        List<SyncError> errorsCopy;
        synchronized (synced) {
            syncedCopy = List.copyOf(synced);
        }
        synchronized (errors) {
            errorsCopy = List.copyOf(errors);
        }
        return new SyncResult(runId, scope, state, syncedCopy, newCount.get(), updatedCount.get(),
                unchangedCount.get(), errorsCopy, startedAt, finishedAt);
    }
}
