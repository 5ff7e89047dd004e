package com.codeforge.orchestrator.resilience;

import java.time.Instant;

public record BreakerSnapshot(String provider, CircuitState state, int failureCount, Instant lastFailureAt) {}
