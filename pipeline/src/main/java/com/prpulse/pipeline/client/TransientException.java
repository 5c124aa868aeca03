package com.prpulse.pipeline.client;

/**
 * Network failure, timeout or 5xx response. Safe to retry.
 */
public class TransientException extends SourceException {

    public TransientException(String message) {
        super(message);
    }

    public TransientException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public FailureKind kind() {
        return FailureKind.TRANSIENT;
    }
}
