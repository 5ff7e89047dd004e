package com.codeforge.orchestrator.api.dto;

import com.codeforge.orchestrator.model.AgentType;
import com.codeforge.orchestrator.model.Job;
import com.codeforge.orchestrator.model.JobStatus;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/** One row of GET /projects/{projectId}/jobs. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobSummary(
        String    jobId,
        AgentType agentType,
        JobStatus status,
        double    progress,
        String    error,
        Instant   createdAt,
        Instant   completedAt
) {
    public static JobSummary from(Job job) {
        return new JobSummary(job.getJobId(), job.getAgentType(), job.getStatus(), job.getProgress(),
                job.getError(), job.getCreatedAt(), job.getCompletedAt());
    }
}
