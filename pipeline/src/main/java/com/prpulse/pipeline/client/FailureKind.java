package com.prpulse.pipeline.client;

/**
 * Classification of everything that can go wrong while syncing a single resource.
 * The first five kinds originate from the remote source; {@link #VALIDATION} also
 * covers single records the reconciler rejects, {@link #STORE} covers local
 * write failures and {@link #INTERNAL} anything unexpected.
 */
public enum FailureKind {
    UNAUTHORIZED,
    RATE_LIMITED,
    NOT_FOUND,
    TRANSIENT,
    VALIDATION,
    STORE,
    INTERNAL
}
