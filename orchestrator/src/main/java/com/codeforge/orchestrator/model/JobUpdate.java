package com.codeforge.orchestrator.model;

import java.util.Map;

/**
 * A requested change to a Job. Null fields mean "leave unchanged".
 *
 * Setting {@code error} forces the job to FAILED regardless of {@code status}.
 */
public record JobUpdate(
        JobStatus           status,
        Double              progress,
        Map<String, Object> result,
        String              error,
        Map<String, Object> checkpoint,
        Map<String, Object> clarificationData
) {

    public static JobUpdate status(JobStatus status) {
        return new JobUpdate(status, null, null, null, null, null);
    }

    public static JobUpdate progress(double progress) {
        return new JobUpdate(null, progress, null, null, null, null);
    }

    public static JobUpdate running(double progress) {
        return new JobUpdate(JobStatus.RUNNING, progress, null, null, null, null);
    }

    public static JobUpdate completed(Map<String, Object> result) {
        return new JobUpdate(JobStatus.COMPLETED, 100.0, result, null, null, null);
    }

    public static JobUpdate failed(String error) {
        return new JobUpdate(null, null, null, error, null, null);
    }

    public static JobUpdate waitingForInput(Map<String, Object> result, Map<String, Object> clarification) {
        return new JobUpdate(JobStatus.WAITING_FOR_INPUT, null, result, null, null, clarification);
    }

    public JobUpdate withProgress(double value) {
        return new JobUpdate(status, value, result, error, checkpoint, clarificationData);
    }

    public JobUpdate withCheckpoint(Map<String, Object> value) {
        return new JobUpdate(status, progress, result, error, value, clarificationData);
    }
}
