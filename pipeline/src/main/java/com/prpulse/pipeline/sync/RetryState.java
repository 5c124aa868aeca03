package com.prpulse.pipeline.sync;

import com.prpulse.pipeline.client.RateLimitedException;
import com.prpulse.pipeline.client.SourceException;

import java.time.Duration;

/**
 * Retry bookkeeping for one remote call: the attempt in progress and the backoff
 * that the next transient failure will wait. Not thread-safe; one per call.
 */
public final class RetryState {

    private final RetryPolicy policy;
    private int attempt = 1;
    private Duration nextBackoff;

    RetryState(RetryPolicy policy) {
        this.policy = policy;
        this.nextBackoff = policy.initialBackoff();
    }

    public int attempt() {
        return attempt;
    }

    public Duration nextBackoff() {
        return nextBackoff;
    }

    public boolean shouldRetry(SourceException failure) {
        return policy.isRetryable(failure) && attempt < policy.maxAttempts();
    }

    /**
     * Advances to the next attempt and returns how long to wait before it.
     * A rate-limit hint wins over the backoff, capped at the policy maximum.
     */
    public Duration advance(SourceException failure) {
        Duration hint = failure instanceof RateLimitedException
                ? ((RateLimitedException) failure).retryAfter()
                : null;
        Duration delay;
        if (hint != null) {
            delay = policy.cap(hint);
        } else {
            delay = nextBackoff;
            nextBackoff = policy.cap(nextBackoff.multipliedBy(2));
        }
        attempt++;
        return delay;
    }
}
