package com.codeforge.orchestrator.resilience;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.function.Supplier;

/**
 * Consecutive-failure circuit breaker for one provider.
 *
 * <pre>
 *   CLOSED    --threshold consecutive failures-->  OPEN
 *   OPEN      --first call after recoveryTimeout--> HALF_OPEN   (lazy, no timer)
 *   HALF_OPEN --any success-->                      CLOSED
 *   HALF_OPEN --any failure-->                      OPEN
 * </pre>
 *
 * {@link #acquirePermission()} and the two completion callbacks are each
 * synchronized; the wrapped call itself runs outside the lock.
 */
public class CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    /** Notified on every state change, while the breaker lock is held. */
    @FunctionalInterface
    public interface TransitionListener {
        void onTransition(String provider, CircuitState from, CircuitState to);
    }

    private final String             provider;
    private final BreakerSettings    settings;
    private final Clock              clock;
    private final TransitionListener listener;

    private CircuitState state = CircuitState.CLOSED;
    private int          failureCount;
    private int          halfOpenCalls;
    private Instant      lastFailureAt;

    public CircuitBreaker(String provider, BreakerSettings settings, Clock clock, TransitionListener listener) {
        this.provider = provider;
        this.settings = settings;
        this.clock    = clock;
        this.listener = listener;
    }

    public CircuitBreaker(String provider, BreakerSettings settings, Clock clock) {
        this(provider, settings, clock, (p, from, to) -> {});
    }

    // ------------------------------------------------------------------
    // Guard protocol
    // ------------------------------------------------------------------

    /**
     * Admit one call or throw.
     *
     * @throws CircuitBreakerOpenException while open, or when the half-open trial call budget is spent
     */
    public synchronized void acquirePermission() {
        if (state == CircuitState.OPEN) {
            if (lastFailureAt != null
                    && !clock.instant().isBefore(lastFailureAt.plus(settings.recoveryTimeout()))) {
                transitionTo(CircuitState.HALF_OPEN);
                halfOpenCalls = 0;
            } else {
                throw new CircuitBreakerOpenException(provider, state);
            }
        }
        if (state == CircuitState.HALF_OPEN) {
            if (halfOpenCalls >= settings.halfOpenMaxCalls()) {
                throw new CircuitBreakerOpenException(provider, state);
            }
            halfOpenCalls++;
        }
    }

    public synchronized void onSuccess() {
        if (state == CircuitState.HALF_OPEN) {
            transitionTo(CircuitState.CLOSED);
        }
        failureCount  = 0;
        halfOpenCalls = 0;
    }

    public synchronized void onFailure() {
        lastFailureAt = clock.instant();
        if (state == CircuitState.HALF_OPEN) {
            open();
            return;
        }
        failureCount++;
        if (state == CircuitState.CLOSED && failureCount >= settings.failureThreshold()) {
            open();
        }
    }

    /** Run {@code call} under the guard protocol. */
    public <T> T execute(Supplier<T> call) {
        acquirePermission();
        try {
            T result = call.get();
            onSuccess();
            return result;
        } catch (RuntimeException | Error e) {
            onFailure();
            throw e;
        }
    }

    /** Force the breaker back to CLOSED with all counters cleared. */
    public synchronized void reset() {
        if (state != CircuitState.CLOSED) {
            transitionTo(CircuitState.CLOSED);
        }
        failureCount  = 0;
        halfOpenCalls = 0;
        lastFailureAt = null;
        log.info("Circuit breaker for provider '{}' manually reset", provider);
    }

    // ------------------------------------------------------------------
    // Introspection
    // ------------------------------------------------------------------

    public String getProvider() { return provider; }

    public synchronized CircuitState getState() { return state; }

    public synchronized int getFailureCount() { return failureCount; }

    public synchronized BreakerSnapshot snapshot() {
        return new BreakerSnapshot(provider, state, failureCount, lastFailureAt);
    }

    // ------------------------------------------------------------------
    // Helpers (lock held)
    // ------------------------------------------------------------------

    private void open() {
        transitionTo(CircuitState.OPEN);
        halfOpenCalls = 0;
    }

    private void transitionTo(CircuitState next) {
        CircuitState previous = state;
        state = next;
        if (next == CircuitState.OPEN) {
            log.warn("Circuit breaker for provider '{}' OPEN after {} consecutive failure(s)",
                    provider, failureCount);
        } else {
            log.info("Circuit breaker for provider '{}' {} → {}", provider, previous, next);
        }
        listener.onTransition(provider, previous, next);
    }
}
