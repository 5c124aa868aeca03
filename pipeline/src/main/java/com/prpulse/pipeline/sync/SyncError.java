package com.prpulse.pipeline.sync;

import com.prpulse.pipeline.client.FailureKind;

/**
 * One resource that could not be synced, and why.
 *
 * @param resource repository full name, {@code owner/repo#number} for a pull request,
 *                 or an organization login
 */
public record SyncError(String resource, FailureKind kind, String message) {}
