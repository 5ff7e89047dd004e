package com.codeforge.orchestrator.api.dto;

import com.codeforge.orchestrator.model.Job;
import com.codeforge.orchestrator.model.JobStatus;

/** Returned by POST /jobs, POST /jobs/{id}/resume and POST /jobs/{id}/cancel. */
public record JobResponse(String jobId, JobStatus status, double progress) {

    public static JobResponse from(Job job) {
        return new JobResponse(job.getJobId(), job.getStatus(), job.getProgress());
    }
}
