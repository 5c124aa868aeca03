package com.prpulse.pipeline.reconcile;

public enum UpsertOutcome {
    INSERTED,
    UPDATED,
    UNCHANGED
}
