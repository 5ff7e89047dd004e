package com.codeforge.orchestrator.api.dto;

import com.codeforge.orchestrator.model.AgentType;
import com.codeforge.orchestrator.model.Job;
import com.codeforge.orchestrator.model.JobStatus;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.Map;

/**
 * Full view of a job for GET /jobs/{id}. Absent values are omitted, so a
 * failed job carries {@code error} and never {@code result}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobStatusResponse(
        String              jobId,
        String              projectId,
        String              ownerId,
        AgentType           agentType,
        JobStatus           status,
        double              progress,
        Map<String, Object> result,
        String              error,
        Map<String, Object> checkpoint,
        Map<String, Object> clarificationData,
        Instant             createdAt,
        Instant             startedAt,
        Instant             completedAt,
        Double              durationSeconds
) {
    public static JobStatusResponse from(Job job) {
        return new JobStatusResponse(
                job.getJobId(),
                job.getProjectId(),
                job.getOwnerId(),
                job.getAgentType(),
                job.getStatus(),
                job.getProgress(),
                job.getResult(),
                job.getError(),
                job.getCheckpoint(),
                job.getClarificationData(),
                job.getCreatedAt(),
                job.getStartedAt(),
                job.getCompletedAt(),
                job.getDurationSeconds()
        );
    }
}
