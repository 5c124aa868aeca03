package com.prpulse.pipeline.client;

import java.time.Duration;

/**
 * The source refused the call because the rate limit was exhausted.
 * {@link #retryAfter()} is the source's hint for when to try again.
 */
public class RateLimitedException extends SourceException {

    private final Duration retryAfter;

    public RateLimitedException(String message, Duration retryAfter) {
        super(message);
        this.retryAfter = retryAfter;
    }

    public Duration retryAfter() {
        return retryAfter;
    }

    @Override
    public FailureKind kind() {
        return FailureKind.RATE_LIMITED;
    }
}
