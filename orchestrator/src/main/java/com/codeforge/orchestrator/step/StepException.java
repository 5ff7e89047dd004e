package com.codeforge.orchestrator.step;

/**
 * Failure reported by a generation step.
 *
 * The kind decides whether the resilience layer retries the call; the
 * provider message stays in {@link #getMessage()} for the logs and is never
 * copied into a job's user-facing error.
 */
public class StepException extends RuntimeException {

    public enum Kind {
        RATE_LIMITED(true),
        SERVER_ERROR(true),
        OVERLOADED(true),
        CONNECTION(true),
        TIMEOUT(true),
        AUTHENTICATION(false),
        VALIDATION(false),
        MALFORMED_REQUEST(false),
        UNKNOWN(false);

        private final boolean transientFailure;

        Kind(boolean transientFailure) { this.transientFailure = transientFailure; }

        public boolean isTransient() { return transientFailure; }
    }

    private final Kind    kind;
    private final String  provider;
    private final Integer statusCode;

    public StepException(Kind kind, String provider, String message) {
        this(kind, provider, null, message, null);
    }

    public StepException(Kind kind, String provider, String message, Throwable cause) {
        this(kind, provider, null, message, cause);
    }

    public StepException(Kind kind, String provider, Integer statusCode, String message, Throwable cause) {
        super("[" + kind + "] " + message, cause);
        this.kind       = kind;
        this.provider   = provider;
        this.statusCode = statusCode;
    }

    /** Map a non-2xx response from a generation service to a failure kind. */
    public static StepException fromHttpStatus(int status, String provider, String body) {
        Kind kind = switch (status) {
            case 429           -> Kind.RATE_LIMITED;
            case 529           -> Kind.OVERLOADED;
            case 401, 403      -> Kind.AUTHENTICATION;
            case 422           -> Kind.VALIDATION;
            case 400, 404, 413 -> Kind.MALFORMED_REQUEST;
            default            -> status >= 500 ? Kind.SERVER_ERROR : Kind.UNKNOWN;
        };
        return new StepException(kind, provider, status,
                "Generation service returned HTTP %d: %s".formatted(status, abbreviate(body)), null);
    }

    public Kind    getKind()       { return kind; }
    public String  getProvider()   { return provider; }
    public Integer getStatusCode() { return statusCode; }

    private static String abbreviate(String body) {
        if (body == null) return "";
        return body.length() <= 500 ? body : body.substring(0, 500) + "...";
    }
}
