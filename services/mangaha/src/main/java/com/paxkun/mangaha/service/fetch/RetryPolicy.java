package com.paxkun.mangaha.service.fetch;

import lombok.Getter;

import java.time.Duration;
import java.util.Set;

/**
 * Bounded retry with exponential backoff.
 * <p>
 * The wait before attempt {@code k + 1} is {@code backoffFactor * 2^(k - 1)} seconds,
 * so with the default factor of 0.3 the waits are 0.3s, 0.6s, 1.2s, ...
 */
@Getter
public class RetryPolicy {

    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final double DEFAULT_BACKOFF_FACTOR = 0.3;
    public static final Set<Integer> DEFAULT_RETRY_STATUSES = Set.of(500, 502, 504);

    private final int maxAttempts;
    private final double backoffFactor;
    private final Set<Integer> retryStatuses;

    public RetryPolicy(int maxAttempts, double backoffFactor, Set<Integer> retryStatuses) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, got " + maxAttempts);
        }
        if (backoffFactor < 0) {
            throw new IllegalArgumentException("backoffFactor must not be negative, got " + backoffFactor);
        }
        this.maxAttempts = maxAttempts;
        this.backoffFactor = backoffFactor;
        this.retryStatuses = Set.copyOf(retryStatuses);
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(DEFAULT_MAX_ATTEMPTS, DEFAULT_BACKOFF_FACTOR, DEFAULT_RETRY_STATUSES);
    }

    public boolean isRetryableStatus(int status) {
        return retryStatuses.contains(status);
    }

    /**
     * @param attemptsMade attempts already performed, starting at 1
     */
    public boolean canRetry(int attemptsMade) {
        return attemptsMade < maxAttempts;
    }

    /**
     * Delay to wait after the given failed attempt before trying again.
     *
     * @param failedAttempt 1-based number of the attempt that just failed
     */
    public Duration backoffAfter(int failedAttempt) {
        double seconds = backoffFactor * Math.pow(2, failedAttempt - 1);
        return Duration.ofMillis(Math.round(seconds * 1000));
    }
}
