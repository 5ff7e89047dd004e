package com.codeforge.orchestrator.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * One unit of durable work: a single generation step or the full pipeline.
 *
 * Instances handed out by a JobStore are detached copies; mutating one never
 * changes what the store holds. All state changes go through
 * {@link JobTransitions#apply}.
 */
public class Job {

    private String    jobId;
    private String    projectId;
    private String    ownerId;
    private AgentType agentType;
    private JobStatus status = JobStatus.QUEUED;

    // Opaque, bounded at submission time.
    private Map<String, Object> inputContext = Map.of();

    private double progress;

    // Present only once COMPLETED or WAITING_FOR_INPUT.
    private Map<String, Object> result;

    // User-safe message, present only when FAILED.
    private String error;

    // Outputs accumulated so far, written at every node boundary.
    // Survives a failure so partial work is not lost.
    private Map<String, Object> checkpoint;

    // Questions a WAITING_FOR_INPUT job needs answered.
    private Map<String, Object> clarificationData;

    private Instant createdAt;
    private Instant startedAt;
    private Instant completedAt;

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    public Job() {}

    public Job(String jobId, String projectId, AgentType agentType,
               Map<String, Object> inputContext, String ownerId, Instant createdAt) {
        this.jobId        = jobId;
        this.projectId    = projectId;
        this.agentType    = agentType;
        this.inputContext = freeze(inputContext);
        this.ownerId      = ownerId;
        this.createdAt    = createdAt;
    }

    /** Detached copy. Payload maps are deep read-only copies, so sharing them is safe. */
    public Job copy() {
        Job c = new Job(jobId, projectId, agentType, inputContext, ownerId, createdAt);
        c.status            = status;
        c.progress          = progress;
        c.result            = result;
        c.error             = error;
        c.checkpoint        = checkpoint;
        c.clarificationData = clarificationData;
        c.startedAt         = startedAt;
        c.completedAt       = completedAt;
        return c;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public String    getJobId()     { return jobId; }
    public String    getProjectId() { return projectId; }
    public String    getOwnerId()   { return ownerId; }
    public AgentType getAgentType() { return agentType; }
    public JobStatus getStatus()    { return status; }
    public double    getProgress()  { return progress; }
    public String    getError()     { return error; }
    public Instant   getCreatedAt()   { return createdAt; }
    public Instant   getStartedAt()   { return startedAt; }
    public Instant   getCompletedAt() { return completedAt; }

    public Map<String, Object> getInputContext()      { return inputContext; }
    public Map<String, Object> getResult()            { return result; }
    public Map<String, Object> getCheckpoint()        { return checkpoint; }
    public Map<String, Object> getClarificationData() { return clarificationData; }

    public void setJobId(String jobId)              { this.jobId = jobId; }
    public void setProjectId(String projectId)      { this.projectId = projectId; }
    public void setOwnerId(String ownerId)          { this.ownerId = ownerId; }
    public void setAgentType(AgentType agentType)   { this.agentType = agentType; }
    public void setStatus(JobStatus status)         { this.status = status; }
    public void setProgress(double progress)        { this.progress = progress; }
    public void setError(String error)              { this.error = error; }
    public void setCreatedAt(Instant t)             { this.createdAt = t; }
    public void setStartedAt(Instant t)             { this.startedAt = t; }
    public void setCompletedAt(Instant t)           { this.completedAt = t; }

    public void setInputContext(Map<String, Object> v)      { this.inputContext = v == null ? Map.of() : freeze(v); }
    public void setResult(Map<String, Object> v)            { this.result = freeze(v); }
    public void setCheckpoint(Map<String, Object> v)        { this.checkpoint = freeze(v); }
    public void setClarificationData(Map<String, Object> v) { this.clarificationData = freeze(v); }

    /** Seconds between start and completion, or null while either is unset. */
    public Double getDurationSeconds() {
        if (startedAt == null || completedAt == null) return null;
        return Duration.between(startedAt, completedAt).toMillis() / 1000.0;
    }

    private static Map<String, Object> freeze(Map<String, Object> m) {
        return Payloads.freeze(m);
    }

    @Override
    public String toString() {
        return "Job{" + jobId + ", project=" + projectId + ", type=" + agentType
                + ", status=" + status + ", progress=" + progress + "}";
    }
}
