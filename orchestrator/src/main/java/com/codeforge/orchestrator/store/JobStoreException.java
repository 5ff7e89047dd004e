package com.codeforge.orchestrator.store;

/**
 * Thrown when the persistence backend is unreachable or a write could not
 * be applied. Callers must not drop it: a lost status update corrupts the
 * job state machine.
 */
public class JobStoreException extends RuntimeException {

    public JobStoreException(String message) {
        super(message);
    }

    public JobStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
