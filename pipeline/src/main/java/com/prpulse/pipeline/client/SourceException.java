package com.prpulse.pipeline.client;

/**
 * Base type for failures reported by a {@link SourceClient}. Each subclass maps
 * to exactly one {@link FailureKind}.
 */
public abstract class SourceException extends Exception {

    protected SourceException(String message) {
        super(message);
    }

    protected SourceException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract FailureKind kind();
}
