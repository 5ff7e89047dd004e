package com.codeforge.orchestrator.resilience;

/**
 * Thrown instead of invoking a call while the provider's breaker is open,
 * or while its half-open trial call budget is used up. Never retried.
 */
public class CircuitBreakerOpenException extends RuntimeException {

    private final String provider;

    public CircuitBreakerOpenException(String provider, CircuitState state) {
        super("Circuit breaker for provider '" + provider + "' is " + state + "; call rejected");
        this.provider = provider;
    }

    public String getProvider() { return provider; }
}
