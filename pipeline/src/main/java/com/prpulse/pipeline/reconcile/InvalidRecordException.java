package com.prpulse.pipeline.reconcile;

import java.util.Locale;

/**
 * A remote record is missing something the store requires. The record is
 * skipped; its siblings are unaffected.
 */
public class InvalidRecordException extends RuntimeException {

    private final EntityKind kind;

    public InvalidRecordException(EntityKind kind, String message) {
        super(kind.name().toLowerCase(Locale.ROOT) + ": " + message);
        this.kind = kind;
    }

    public EntityKind kind() {
        return kind;
    }
}
