package com.codeforge.orchestrator.resilience;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;
import java.util.function.Supplier;

/**
 * Runs a generation call under its provider's circuit breaker with
 * classified retry.
 *
 * <ul>
 *   <li>breaker open → {@link CircuitBreakerOpenException}, operation not invoked</li>
 *   <li>permanent failure → rethrown after one attempt</li>
 *   <li>transient failure → backoff and retry, up to {@code maxRetries} attempts;
 *       the last failure is rethrown</li>
 *   <li>{@link Error} → counted as a breaker failure and rethrown, never retried</li>
 * </ul>
 *
 * Metrics:
 * <pre>
 *   codeforge.step.calls{provider, outcome="success|retry|failure|rejected"}
 *   codeforge.step.duration{provider}
 * </pre>
 */
public class ResilientCaller {

    private static final Logger log = LoggerFactory.getLogger(ResilientCaller.class);

    private final CircuitBreakerRegistry breakers;
    private final RetryPolicy            defaultPolicy;
    private final MeterRegistry          meterRegistry;
    private final Sleeper                sleeper;
    private final DoubleSupplier         jitter;

    public ResilientCaller(CircuitBreakerRegistry breakers, RetryPolicy defaultPolicy,
                           MeterRegistry meterRegistry, Sleeper sleeper, DoubleSupplier jitter) {
        this.breakers      = breakers;
        this.defaultPolicy = defaultPolicy;
        this.meterRegistry = meterRegistry;
        this.sleeper       = sleeper;
        this.jitter        = jitter;
    }

    public ResilientCaller(CircuitBreakerRegistry breakers, RetryPolicy defaultPolicy, MeterRegistry meterRegistry) {
        this(breakers, defaultPolicy, meterRegistry, Sleeper.THREAD, () -> ThreadLocalRandom.current().nextDouble());
    }

    public <T> T call(String provider, Supplier<T> operation) {
        return call(provider, defaultPolicy, operation);
    }

    public <T> T call(String provider, RetryPolicy policy, Supplier<T> operation) {
        CircuitBreaker breaker = breakers.get(provider);
        Timer.Sample sample = Timer.start(meterRegistry);
        String previousProvider = MDC.get("provider");
        MDC.put("provider", provider);
        try {
            for (int attempt = 1; ; attempt++) {
                try {
                    breaker.acquirePermission();
                } catch (CircuitBreakerOpenException e) {
                    count(provider, "rejected");
                    throw e;
                }

                try {
                    T result = operation.get();
                    breaker.onSuccess();
                    count(provider, "success");
                    return result;
                } catch (RuntimeException e) {
                    breaker.onFailure();
                    boolean retryable = ErrorClassifier.isTransient(e);
                    if (!retryable || attempt >= policy.maxRetries()) {
                        count(provider, "failure");
                        log.warn("Call to provider '{}' failed on attempt {}/{} ({}): {}",
                                provider, attempt, policy.maxRetries(),
                                retryable ? "retries exhausted" : "permanent", e.getMessage());
                        throw e;
                    }
                    Duration delay = policy.delayAfter(attempt, jitter.getAsDouble());
                    count(provider, "retry");
                    log.info("Transient failure from provider '{}' (attempt {}/{}), retrying in {} ms: {}",
                            provider, attempt, policy.maxRetries(), delay.toMillis(), e.getMessage());
                    pause(delay);
                } catch (Error e) {
                    // every admitted attempt settles the breaker
                    breaker.onFailure();
                    count(provider, "failure");
                    log.error("Call to provider '{}' raised {} on attempt {}",
                            provider, e.getClass().getSimpleName(), attempt, e);
                    throw e;
                }
            }
        } finally {
            sample.stop(meterRegistry.timer("codeforge.step.duration", "provider", provider));
            if (previousProvider == null) MDC.remove("provider");
            else MDC.put("provider", previousProvider);
        }
    }

    private void pause(Duration delay) {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted during retry backoff");
        }
    }

    private void count(String provider, String outcome) {
        meterRegistry.counter("codeforge.step.calls", "provider", provider, "outcome", outcome).increment();
    }
}
