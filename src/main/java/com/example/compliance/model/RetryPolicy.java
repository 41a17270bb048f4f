package com.example.compliance.model;

import java.time.Duration;

/**
 * Provider retry policy of one run: up to {@code maxRetries} extra attempts, the n-th after
 * {@code n * backoff}.
 */
public record RetryPolicy(int maxRetries, Duration backoff) {

    public RetryPolicy {
        if (maxRetries < 0) throw new IllegalArgumentException("maxRetries must not be negative");
        if (backoff == null || backoff.isNegative()) backoff = Duration.ZERO;
    }

    public static RetryPolicy none() {
        return new RetryPolicy(0, Duration.ZERO);
    }
}
