package com.codeforge.orchestrator.service;

import com.codeforge.orchestrator.model.AgentType;
import com.codeforge.orchestrator.model.InvalidJobStateException;
import com.codeforge.orchestrator.model.Job;
import com.codeforge.orchestrator.model.JobPage;
import com.codeforge.orchestrator.model.JobStatus;
import com.codeforge.orchestrator.model.JobUpdate;
import com.codeforge.orchestrator.store.JobStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Job control surface: submit, inspect, list, cancel and resume.
 *
 * Execution happens in {@link JobRunner}; this class only validates
 * requests and moves jobs through the store.
 */
@Service
public class JobService {

    private static final Logger log = LoggerFactory.getLogger(JobService.class);

    static final String CLARIFICATION_ANSWERS = "clarification_answers";

    private final JobStore          store;
    private final JobRunner         runner;
    private final JobEventPublisher events;
    private final ObjectMapper      json;
    private final int               maxInputBytes;

    public JobService(JobStore store,
                      JobRunner runner,
                      JobEventPublisher events,
                      ObjectMapper objectMapper,
                      @Value("${codeforge.job-store.max-input-bytes:50000}") int maxInputBytes) {
        this.store         = store;
        this.runner        = runner;
        this.events        = events;
        this.json          = objectMapper;
        this.maxInputBytes = maxInputBytes;
    }

    // ------------------------------------------------------------------
    // Submission
    // ------------------------------------------------------------------

    /**
     * Create a QUEUED job and hand it to the runner.
     *
     * @throws InvalidJobRequestException for an unknown agent type, a blank
     *         project id, or an input context over the size limit
     */
    public Job submit(String projectId, String agentType, Map<String, Object> inputContext, String ownerId) {
        if (projectId == null || projectId.isBlank()) {
            throw new InvalidJobRequestException("projectId is required");
        }
        AgentType type;
        try {
            type = AgentType.fromWireName(agentType);
        } catch (IllegalArgumentException e) {
            throw new InvalidJobRequestException(e.getMessage(), e);
        }
        Map<String, Object> input = inputContext == null ? Map.of() : inputContext;
        checkInputSize(input);

        Job job = store.create(UUID.randomUUID().toString(), projectId, type, input, ownerId);
        log.info("Submitted job {} (project={}, type={})", job.getJobId(), projectId, type.wireName());
        runner.start(job.getJobId());
        return job;
    }

    // ------------------------------------------------------------------
    // Queries
    // ------------------------------------------------------------------

    public Job getStatus(String jobId) {
        return store.get(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
    }

    public JobPage list(String projectId, int page, int pageSize) {
        try {
            JobPage.checkBounds(page, pageSize);
        } catch (IllegalArgumentException e) {
            throw new InvalidJobRequestException(e.getMessage(), e);
        }
        return store.listForProject(projectId, page, pageSize);
    }

    // ------------------------------------------------------------------
    // Control
    // ------------------------------------------------------------------

    /**
     * Cancel a QUEUED or RUNNING job. A running node finishes but its output
     * is discarded.
     *
     * @throws InvalidJobStateException if the job is already terminal or waiting for input
     */
    public Job cancel(String jobId) {
        Job current = getStatus(jobId);
        if (current.getStatus().isFrozen()) {
            throw new InvalidJobStateException(current.getStatus(),
                    "Job " + jobId + " is " + current.getStatus() + " and cannot be cancelled");
        }
        Job cancelled = store.update(jobId, JobUpdate.status(JobStatus.CANCELLED))
                .orElseThrow(() -> new JobNotFoundException(jobId));
        if (cancelled.getStatus() != JobStatus.CANCELLED) {
            throw new InvalidJobStateException(cancelled.getStatus(),
                    "Job " + jobId + " finished as " + cancelled.getStatus() + " before it could be cancelled");
        }
        log.info("Cancelled job {} at progress {}", jobId, cancelled.getProgress());
        events.publishTerminal(cancelled);
        return cancelled;
    }

    /**
     * Continue a job that stopped for clarification. The original job is left
     * as it is; a new job runs with the original input plus the answers.
     *
     * @return the new job
     * @throws InvalidJobStateException unless the job is WAITING_FOR_INPUT
     */
    public Job resume(String jobId, Map<String, Object> answers) {
        Job original = getStatus(jobId);
        if (original.getStatus() != JobStatus.WAITING_FOR_INPUT) {
            throw new InvalidJobStateException(original.getStatus(),
                    "Job " + jobId + " is " + original.getStatus() + ", only WAITING_FOR_INPUT jobs can be resumed");
        }
        Map<String, Object> input = new LinkedHashMap<>(original.getInputContext());
        input.put(CLARIFICATION_ANSWERS, answers == null ? Map.of() : answers);
        checkInputSize(input);

        Job resumed = store.create(UUID.randomUUID().toString(), original.getProjectId(),
                original.getAgentType(), input, original.getOwnerId());
        log.info("Resumed job {} as {}", jobId, resumed.getJobId());
        runner.start(resumed.getJobId());
        return resumed;
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private void checkInputSize(Map<String, Object> input) {
        int size;
        try {
            size = json.writeValueAsBytes(input).length;
        } catch (JsonProcessingException e) {
            throw new InvalidJobRequestException("inputContext is not serialisable", e);
        }
        if (size > maxInputBytes) {
            throw new InvalidJobRequestException(
                    "inputContext is " + size + " bytes; the limit is " + maxInputBytes);
        }
    }
}
