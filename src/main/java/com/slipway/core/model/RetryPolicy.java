package com.slipway.core.model;

import java.io.Serializable;
import java.time.Duration;

/**
 * Per-stage retry and timeout settings.
 *
 * @param maxAttempts       total attempts including the first, at least 1
 * @param initialBackoff    wait before the second attempt
 * @param backoffMultiplier growth factor applied to each later wait
 * @param timeout           upper bound for a single attempt's action
 * @param retryProvisioning whether environment provisioning failures are retried
 */
public record RetryPolicy(
    int maxAttempts,
    Duration initialBackoff,
    double backoffMultiplier,
    Duration timeout,
    boolean retryProvisioning
) implements Serializable {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofMinutes(30);

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, was " + maxAttempts);
        }
        if (backoffMultiplier < 1.0) {
            throw new IllegalArgumentException("backoffMultiplier must be >= 1.0, was " + backoffMultiplier);
        }
        initialBackoff = initialBackoff != null ? initialBackoff : Duration.ZERO;
        timeout = timeout != null ? timeout : DEFAULT_TIMEOUT;
        if (initialBackoff.isNegative() || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("backoff must be >= 0 and timeout > 0");
        }
    }

    public static RetryPolicy noRetry() {
        return new RetryPolicy(1, Duration.ZERO, 1.0, DEFAULT_TIMEOUT, false);
    }

    public static RetryPolicy attempts(int maxAttempts, Duration initialBackoff) {
        return new RetryPolicy(maxAttempts, initialBackoff, 2.0, DEFAULT_TIMEOUT, false);
    }

    public RetryPolicy withTimeout(Duration newTimeout) {
        return new RetryPolicy(maxAttempts, initialBackoff, backoffMultiplier, newTimeout, retryProvisioning);
    }

    /**
     * Wait before the given attempt. Attempt 1 never waits.
     */
    public Duration backoffBefore(int attempt) {
        if (attempt <= 1) {
            return Duration.ZERO;
        }
        double factor = Math.pow(backoffMultiplier, attempt - 2);
        return Duration.ofMillis(Math.round(initialBackoff.toMillis() * factor));
    }
}
