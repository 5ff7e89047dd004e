package com.codeforge.orchestrator.service;

import com.codeforge.orchestrator.model.Job;
import com.codeforge.orchestrator.model.JobStatus;

import java.util.Map;

/**
 * Push notification about a job: a PROGRESS event after every node, and
 * exactly one TERMINAL event once the job settles.
 */
public record JobEvent(
        String              jobId,
        Type                type,
        JobStatus           status,
        double              progress,
        String              node,
        Map<String, Object> result,
        String              error
) {
    public enum Type { PROGRESS, TERMINAL }

    public static JobEvent progress(String jobId, double progress, String node) {
        return new JobEvent(jobId, Type.PROGRESS, JobStatus.RUNNING, progress, node, null, null);
    }

    public static JobEvent terminal(Job job) {
        return new JobEvent(job.getJobId(), Type.TERMINAL, job.getStatus(), job.getProgress(),
                null, job.getResult(), job.getError());
    }

    public boolean isTerminal() { return type == Type.TERMINAL; }
}
