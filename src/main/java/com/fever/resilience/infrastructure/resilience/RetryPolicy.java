package com.fever.resilience.infrastructure.resilience;

import java.time.Duration;

/**
 * Exponential backoff configuration.
 * A call is attempted at most {@code maxRetries + 1} times.
 *
 * @param maxRetries    retries after the first attempt
 * @param baseDelay     delay after the first failure
 * @param maxDelay      cap applied before jitter
 * @param backoffFactor multiplier between consecutive delays
 * @param jitter        scale each delay by a random factor in [0.5, 1.0]
 */
public record RetryPolicy(
        int maxRetries,
        Duration baseDelay,
        Duration maxDelay,
        double backoffFactor,
        boolean jitter
) {
    public RetryPolicy {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative: " + maxRetries);
        }
        if (baseDelay.isNegative() || maxDelay.isNegative()) {
            throw new IllegalArgumentException("delays must not be negative");
        }
        if (backoffFactor < 1.0) {
            throw new IllegalArgumentException("backoffFactor must be >= 1.0: " + backoffFactor);
        }
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(3, Duration.ofSeconds(1), Duration.ofSeconds(60), 2.0, true);
    }

    public static RetryPolicy noRetry() {
        return new RetryPolicy(0, Duration.ZERO, Duration.ZERO, 1.0, false);
    }

    public int maxAttempts() {
        return maxRetries + 1;
    }

    /**
     * Un-jittered delay after the n-th failure: {@code min(base * factor^(n-1), max)}
     */
    public Duration backoffAfterFailure(int failureNumber) {
        if (failureNumber < 1) {
            throw new IllegalArgumentException("failureNumber starts at 1: " + failureNumber);
        }
        double nanos = baseDelay.toNanos() * Math.pow(backoffFactor, failureNumber - 1);
        double capped = Math.min(nanos, maxDelay.toNanos());
        return Duration.ofNanos((long) capped);
    }
}
