package com.codeforge.orchestrator.resilience;

import com.codeforge.orchestrator.step.StepException;
import com.codeforge.orchestrator.step.StepException.Kind;
import com.codeforge.orchestrator.step.StepTimeoutException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.net.ConnectException;
import java.time.Duration;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;

class ErrorClassifierTest {

    @ParameterizedTest
    @EnumSource(value = Kind.class, names = {"RATE_LIMITED", "SERVER_ERROR", "OVERLOADED", "CONNECTION", "TIMEOUT"})
    void transientKinds(Kind kind) {
        assertThat(ErrorClassifier.classify(new StepException(kind, "openai", "x")))
                .isEqualTo(ErrorCategory.TRANSIENT);
    }

    @ParameterizedTest
    @EnumSource(value = Kind.class, names = {"AUTHENTICATION", "VALIDATION", "MALFORMED_REQUEST"})
    void permanentKinds(Kind kind) {
        assertThat(ErrorClassifier.classify(new StepException(kind, "openai", "x")))
                .isEqualTo(ErrorCategory.PERMANENT);
    }

    @ParameterizedTest
    @ValueSource(ints = {429, 500, 502, 503, 529})
    void transientHttpStatuses(int status) {
        assertThat(ErrorClassifier.isTransient(StepException.fromHttpStatus(status, "google", ""))).isTrue();
    }

    @ParameterizedTest
    @ValueSource(ints = {400, 401, 403, 422})
    void permanentHttpStatuses(int status) {
        assertThat(ErrorClassifier.isTransient(StepException.fromHttpStatus(status, "google", ""))).isFalse();
    }

    @Test
    void transportExceptions_areTransient() {
        assertThat(ErrorClassifier.isTransient(new ConnectException("refused"))).isTrue();
        assertThat(ErrorClassifier.isTransient(new CompletionException(new TimeoutException()))).isTrue();
        assertThat(ErrorClassifier.isTransient(new StepTimeoutException("openai", "qa", Duration.ofSeconds(1)))).isTrue();
        assertThat(ErrorClassifier.isTransient(
                new StepException(Kind.UNKNOWN, "openai", "wrapped", new ConnectException("refused")))).isTrue();
    }

    @Test
    void messageHeuristic_catchesUntypedTransientErrors() {
        assertThat(ErrorClassifier.isTransient(new IllegalStateException("Model is overloaded, try later"))).isTrue();
        assertThat(ErrorClassifier.isTransient(new IllegalStateException("Rate limit exceeded"))).isTrue();
    }

    @Test
    void unknownErrors_arePermanent() {
        assertThat(ErrorClassifier.classify(new IllegalArgumentException("bad schema")))
                .isEqualTo(ErrorCategory.PERMANENT);
        assertThat(ErrorClassifier.classify(new NullPointerException())).isEqualTo(ErrorCategory.PERMANENT);
    }

    @Test
    void breakerOpen_isNeverRetried() {
        assertThat(ErrorClassifier.classify(new CircuitBreakerOpenException("openai", CircuitState.OPEN)))
                .isEqualTo(ErrorCategory.PERMANENT);
    }
}
