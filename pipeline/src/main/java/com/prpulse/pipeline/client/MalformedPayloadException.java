package com.prpulse.pipeline.client;

/**
 * The source answered, but with something that cannot be decoded or that
 * the request itself caused (a 4xx other than auth, rate limit or not found).
 */
public class MalformedPayloadException extends SourceException {

    public MalformedPayloadException(String message) {
        super(message);
    }

    public MalformedPayloadException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public FailureKind kind() {
        return FailureKind.VALIDATION;
    }
}
