package com.codeforge.orchestrator.model;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * Thrown when an operation is not allowed from the job's current status,
 * e.g. cancelling a completed job or resuming one that is not waiting.
 */
@ResponseStatus(HttpStatus.CONFLICT)
public class InvalidJobStateException extends RuntimeException {

    private final JobStatus current;

    public InvalidJobStateException(JobStatus current, String message) {
        super(message);
        this.current = current;
    }

    public JobStatus getCurrent() { return current; }
}
