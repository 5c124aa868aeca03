package com.prpulse.pipeline.client;

/**
 * The credential was rejected (invalid, expired, or lacking access).
 */
public class UnauthorizedException extends SourceException {

    public UnauthorizedException(String message) {
        super(message);
    }

    @Override
    public FailureKind kind() {
        return FailureKind.UNAUTHORIZED;
    }
}
