package com.codeforge.orchestrator.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle states of a Job.
 *
 * Transitions:
 *   QUEUED  → RUNNING            (first progress report)
 *   QUEUED  → CANCELLED | FAILED
 *   RUNNING → COMPLETED | FAILED | WAITING_FOR_INPUT | CANCELLED
 *
 * CANCELLED, COMPLETED and FAILED are terminal. WAITING_FOR_INPUT is not
 * terminal, but the job is frozen: answering it creates a new job.
 */
public enum JobStatus {
    QUEUED,
    RUNNING,
    WAITING_FOR_INPUT,
    CANCELLED,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == CANCELLED || this == COMPLETED || this == FAILED;
    }

    /** True once the job may no longer be mutated. */
    public boolean isFrozen() {
        return isTerminal() || this == WAITING_FOR_INPUT;
    }

    public boolean canTransitionTo(JobStatus next) {
        return successors().contains(next);
    }

    private Set<JobStatus> successors() {
        return switch (this) {
            case QUEUED  -> EnumSet.of(RUNNING, CANCELLED, FAILED);
            case RUNNING -> EnumSet.of(COMPLETED, FAILED, WAITING_FOR_INPUT, CANCELLED);
            case WAITING_FOR_INPUT, CANCELLED, COMPLETED, FAILED -> EnumSet.noneOf(JobStatus.class);
        };
    }
}
