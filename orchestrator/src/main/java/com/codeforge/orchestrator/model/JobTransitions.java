package com.codeforge.orchestrator.model;

import java.time.Instant;

/**
 * The job state machine, shared by every JobStore backend so they expose
 * identical semantics.
 */
public final class JobTransitions {

    private JobTransitions() {}

    /**
     * Apply {@code update} to {@code job} in place.
     *
     * Rules:
     *  - a frozen job (terminal or WAITING_FOR_INPUT) is never changed
     *  - {@code error} forces FAILED, clears any result and stamps completed_at
     *  - a progress report on a QUEUED job moves it to RUNNING
     *  - progress is clamped to [0, 100] and never decreases
     *  - the first RUNNING stamps started_at; freezing stamps completed_at
     *  - a result is only accepted by a COMPLETED or WAITING_FOR_INPUT job
     *
     * @return true if anything changed
     * @throws InvalidJobStateException if the status change is not a legal edge
     */
    public static boolean apply(Job job, JobUpdate update, Instant now) {
        JobStatus from = job.getStatus();
        if (from.isFrozen()) {
            return false;
        }

        JobStatus target = update.status();
        if (update.error() != null) {
            target = JobStatus.FAILED;
        } else if (target == null && update.progress() != null && from == JobStatus.QUEUED) {
            target = JobStatus.RUNNING;
        }
        if (target == null) {
            target = from;
        }
        if (target != from && !from.canTransitionTo(target)) {
            throw new InvalidJobStateException(from,
                    "Illegal job transition " + from + " → " + target + " for job " + job.getJobId());
        }
        if (update.result() != null
                && target != JobStatus.COMPLETED && target != JobStatus.WAITING_FOR_INPUT) {
            throw new InvalidJobStateException(from,
                    "A result can only be recorded on completion (job " + job.getJobId() + ")");
        }

        boolean changed = false;

        // Progress is frozen once cancelled.
        if (update.progress() != null && target != JobStatus.CANCELLED) {
            double clamped = Math.max(0.0, Math.min(100.0, update.progress()));
            if (clamped > job.getProgress()) {
                job.setProgress(clamped);
                changed = true;
            }
        }

        if (update.checkpoint() != null && !target.isTerminal()) {
            job.setCheckpoint(update.checkpoint());
            changed = true;
        }

        if (target != from) {
            job.setStatus(target);
            changed = true;
            if (target == JobStatus.RUNNING && job.getStartedAt() == null) {
                job.setStartedAt(now);
            }
            if (target.isFrozen()) {
                job.setCompletedAt(now);
            }
        }

        if (update.error() != null) {
            job.setError(update.error());
            job.setResult(null);
        } else if (update.result() != null) {
            job.setResult(update.result());
        }

        if (update.clarificationData() != null && target == JobStatus.WAITING_FOR_INPUT) {
            job.setClarificationData(update.clarificationData());
        }

        return changed || update.error() != null || update.result() != null;
    }
}
