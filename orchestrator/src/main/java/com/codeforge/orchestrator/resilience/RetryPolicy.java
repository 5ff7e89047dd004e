package com.codeforge.orchestrator.resilience;

import java.time.Duration;

/**
 * Exponential backoff: {@code baseDelay * 2^(attempt-1)}, capped at
 * {@code maxDelay}, plus up to 30% jitter.
 *
 * @param maxRetries total attempts per call, including the first
 */
public record RetryPolicy(int maxRetries, Duration baseDelay, Duration maxDelay) {

    public static final double MAX_JITTER = 0.3;

    public static final RetryPolicy DEFAULTS = new RetryPolicy(3, Duration.ofSeconds(2), Duration.ofSeconds(30));

    public RetryPolicy {
        if (maxRetries < 1) throw new IllegalArgumentException("maxRetries must be >= 1");
        if (baseDelay.isNegative() || maxDelay.isNegative()) {
            throw new IllegalArgumentException("delays must be >= 0");
        }
    }

    /**
     * Delay to wait after failed attempt number {@code attempt} (1-based).
     *
     * @param jitterFraction a value in [0, 1); scaled to at most 30% of the capped delay
     */
    public Duration delayAfter(int attempt, double jitterFraction) {
        long cap   = maxDelay.toMillis();
        long delay = baseDelay.toMillis();
        for (int i = 1; i < attempt && delay < cap; i++) {
            delay *= 2;
        }
        long capped = Math.min(delay, cap);
        long jitter = (long) (capped * MAX_JITTER * Math.max(0.0, Math.min(1.0, jitterFraction)));
        return Duration.ofMillis(capped + jitter);
    }
}
