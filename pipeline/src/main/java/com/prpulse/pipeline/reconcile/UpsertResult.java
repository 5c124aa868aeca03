package com.prpulse.pipeline.reconcile;

/**
 * The stored record after an upsert, and what the upsert did to get there.
 */
public record UpsertResult<T>(T record, UpsertOutcome outcome) {

    public static <T> UpsertResult<T> inserted(T record) {
        return new UpsertResult<>(record, UpsertOutcome.INSERTED);
    }

    public static <T> UpsertResult<T> updated(T record) {
        return new UpsertResult<>(record, UpsertOutcome.UPDATED);
    }

    public static <T> UpsertResult<T> unchanged(T record) {
        return new UpsertResult<>(record, UpsertOutcome.UNCHANGED);
    }
}
