package com.codeforge.orchestrator.config;

import com.codeforge.orchestrator.resilience.BreakerSettings;
import com.codeforge.orchestrator.resilience.CircuitBreakerRegistry;
import com.codeforge.orchestrator.resilience.ResilientCaller;
import com.codeforge.orchestrator.resilience.RetryPolicy;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

@Configuration
public class ResilienceConfig {

    @Bean
    public BreakerSettings breakerSettings(
            @Value("${codeforge.resilience.failure-threshold:5}") int failureThreshold,
            @Value("${codeforge.resilience.recovery-timeout:60s}") Duration recoveryTimeout,
            @Value("${codeforge.resilience.half-open-max-calls:2}") int halfOpenMaxCalls) {
        return new BreakerSettings(failureThreshold, recoveryTimeout, halfOpenMaxCalls);
    }

    @Bean
    public RetryPolicy retryPolicy(
            @Value("${codeforge.resilience.max-retries:3}") int maxRetries,
            @Value("${codeforge.resilience.base-delay:2s}") Duration baseDelay,
            @Value("${codeforge.resilience.max-delay:30s}") Duration maxDelay) {
        return new RetryPolicy(maxRetries, baseDelay, maxDelay);
    }

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry(BreakerSettings settings, Clock clock,
                                                         MeterRegistry meterRegistry) {
        return new CircuitBreakerRegistry(settings, clock, meterRegistry);
    }

    @Bean
    public ResilientCaller resilientCaller(CircuitBreakerRegistry registry, RetryPolicy policy,
                                           MeterRegistry meterRegistry) {
        return new ResilientCaller(registry, policy, meterRegistry);
    }
}
