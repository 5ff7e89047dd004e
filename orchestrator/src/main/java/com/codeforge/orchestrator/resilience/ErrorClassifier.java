package com.codeforge.orchestrator.resilience;

import com.codeforge.orchestrator.step.StepException;

import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Decides whether a failed generation call is worth retrying.
 *
 * Order: typed step failures, then HTTP status, then known transport
 * exceptions, then a message heuristic. Anything unrecognised is permanent.
 */
public final class ErrorClassifier {

    private static final List<String> TRANSIENT_HINTS = List.of(
            "rate limit", "rate_limit", "too many requests", "overloaded", "capacity",
            "timeout", "timed out", "connection", "temporarily unavailable");

    private ErrorClassifier() {}

    public static ErrorCategory classify(Throwable error) {
        Throwable e = unwrap(error);

        if (e instanceof CircuitBreakerOpenException) {
            return ErrorCategory.PERMANENT;
        }
        if (e instanceof StepException step) {
            if (step.getKind() != StepException.Kind.UNKNOWN) {
                return step.getKind().isTransient() ? ErrorCategory.TRANSIENT : ErrorCategory.PERMANENT;
            }
            if (step.getStatusCode() != null) {
                return classifyStatus(step.getStatusCode());
            }
            if (step.getCause() != null && step.getCause() != step) {
                ErrorCategory byCause = classifyTransport(unwrap(step.getCause()));
                if (byCause != null) return byCause;
            }
        }

        ErrorCategory byTransport = classifyTransport(e);
        if (byTransport != null) return byTransport;

        return matchesHint(e.getMessage()) ? ErrorCategory.TRANSIENT : ErrorCategory.PERMANENT;
    }

    public static boolean isTransient(Throwable error) {
        return classify(error) == ErrorCategory.TRANSIENT;
    }

    static ErrorCategory classifyStatus(int status) {
        if (status == 429 || status >= 500) return ErrorCategory.TRANSIENT;
        return ErrorCategory.PERMANENT;
    }

    private static ErrorCategory classifyTransport(Throwable e) {
        if (e instanceof ConnectException
                || e instanceof HttpTimeoutException
                || e instanceof SocketTimeoutException
                || e instanceof TimeoutException) {
            return ErrorCategory.TRANSIENT;
        }
        return null;
    }

    private static boolean matchesHint(String message) {
        if (message == null) return false;
        String lower = message.toLowerCase(Locale.ROOT);
        return TRANSIENT_HINTS.stream().anyMatch(lower::contains);
    }

    private static Throwable unwrap(Throwable e) {
        Throwable current = e;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
