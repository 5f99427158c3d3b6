package com.ragingest.embed;

import java.time.Duration;

public record RetryPolicy(int maxRetries, Duration baseBackoff) {

    public RetryPolicy {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
        if (baseBackoff == null || baseBackoff.isNegative()) {
            throw new IllegalArgumentException("baseBackoff must be >= 0");
        }
    }

    public int maxAttempts() {
        return maxRetries + 1;
    }

    public Duration backoffBeforeRetry(int retryIndex) {
        return baseBackoff.multipliedBy(1L << Math.min(retryIndex, 30));
    }
}
