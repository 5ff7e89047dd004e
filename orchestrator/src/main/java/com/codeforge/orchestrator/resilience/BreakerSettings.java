package com.codeforge.orchestrator.resilience;

import java.time.Duration;

/** Thresholds shared by every breaker the registry creates. */
public record BreakerSettings(int failureThreshold, Duration recoveryTimeout, int halfOpenMaxCalls) {

    public static final BreakerSettings DEFAULTS = new BreakerSettings(5, Duration.ofSeconds(60), 2);

    public BreakerSettings {
        if (failureThreshold < 1)  throw new IllegalArgumentException("failureThreshold must be >= 1");
        if (halfOpenMaxCalls < 1)  throw new IllegalArgumentException("halfOpenMaxCalls must be >= 1");
        if (recoveryTimeout == null || recoveryTimeout.isNegative()) {
            throw new IllegalArgumentException("recoveryTimeout must be >= 0");
        }
    }
}
