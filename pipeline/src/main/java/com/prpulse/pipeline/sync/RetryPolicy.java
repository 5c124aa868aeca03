package com.prpulse.pipeline.sync;

import com.prpulse.pipeline.client.FailureKind;
import com.prpulse.pipeline.client.SourceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Bounded retry for remote calls. Rate-limited and transient failures are retried
 * up to {@code maxAttempts} attempts in total; every other failure is rethrown at once.
 */
public class RetryPolicy {

    private static final Logger logger = LoggerFactory.getLogger(RetryPolicy.class);

    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final Duration DEFAULT_INITIAL_BACKOFF = Duration.ofSeconds(1);
    public static final Duration DEFAULT_MAX_BACKOFF = Duration.ofSeconds(60);

    private final int maxAttempts;
    private final Duration initialBackoff;
    private final Duration maxBackoff;
    private final Sleeper sleeper;

    public RetryPolicy(int maxAttempts, Duration initialBackoff, Duration maxBackoff, Sleeper sleeper) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, got " + maxAttempts);
        }
        this.maxAttempts = maxAttempts;
        this.initialBackoff = initialBackoff;
        this.maxBackoff = maxBackoff;
        this.sleeper = sleeper;
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(DEFAULT_MAX_ATTEMPTS, DEFAULT_INITIAL_BACKOFF, DEFAULT_MAX_BACKOFF, Sleeper.THREAD);
    }

    public RetryState begin() {
        return new RetryState(this);
    }

    /**
     * Runs {@code call}, sleeping and retrying as the failure kind allows.
     *
     * @param resource identifies the call in log output
     * @throws SourceException the last failure once retries are exhausted, or the
     *         first non-retryable one
     */
    public <T> T execute(String resource, SourceCall<T> call) throws SourceException, InterruptedException {
        RetryState state = begin();
        while (true) {
            try {
                return call.execute();
            } catch (SourceException e) {
                if (!state.shouldRetry(e)) {
                    throw e;
                }
                int failedAttempt = state.attempt();
                Duration delay = state.advance(e);
                logger.warn("{} on {}: {}. Retrying in {}ms (attempt {}/{})",
                        e.kind(), resource, e.getMessage(), delay.toMillis(), failedAttempt + 1, maxAttempts);
                sleeper.sleep(delay);
            }
        }
    }

    public boolean isRetryable(SourceException failure) {
        return failure.kind() == FailureKind.RATE_LIMITED || failure.kind() == FailureKind.TRANSIENT;
    }

    Duration cap(Duration duration) {
        return duration.compareTo(maxBackoff) > 0 ? maxBackoff : duration;
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    public Duration initialBackoff() {
        return initialBackoff;
    }

    public Duration maxBackoff() {
        return maxBackoff;
    }
}
