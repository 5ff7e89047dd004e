package com.codeforge.orchestrator.resilience;

import io.micrometer.core.instrument.MeterRegistry;

import java.time.Clock;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-wide breakers, one per provider, created on first use and kept
 * for the life of the process. Every transition is counted as
 * {@code codeforge.breaker.transitions{provider, to}}.
 */
public class CircuitBreakerRegistry {

    private final Map<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();
    private final BreakerSettings settings;
    private final Clock           clock;
    private final MeterRegistry   meterRegistry;

    public CircuitBreakerRegistry(BreakerSettings settings, Clock clock, MeterRegistry meterRegistry) {
        this.settings      = settings;
        this.clock         = clock;
        this.meterRegistry = meterRegistry;
    }

    public CircuitBreaker get(String provider) {
        return breakers.computeIfAbsent(provider, p -> new CircuitBreaker(p, settings, clock,
                (name, from, to) -> meterRegistry.counter("codeforge.breaker.transitions",
                        "provider", name, "to", to.name().toLowerCase()).increment()));
    }

    /** State of every breaker created so far, sorted by provider. */
    public Map<String, BreakerSnapshot> snapshot() {
        Map<String, BreakerSnapshot> out = new TreeMap<>();
        breakers.forEach((provider, breaker) -> out.put(provider, breaker.snapshot()));
        return out;
    }

    /** @return false if no breaker exists for the provider yet */
    public boolean reset(String provider) {
        CircuitBreaker breaker = breakers.get(provider);
        if (breaker == null) return false;
        breaker.reset();
        return true;
    }
}
