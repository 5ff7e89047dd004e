package com.codeforge.orchestrator.store;

import com.codeforge.orchestrator.model.AgentType;
import com.codeforge.orchestrator.model.Job;
import com.codeforge.orchestrator.model.JobStatus;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Converts a Job to and from the flat hash stored in Redis.
 *
 * Every field is a string: enums by name, timestamps as ISO-8601, opaque
 * payloads as JSON. Absent values are simply omitted from the hash.
 */
public class JobRecordMapper {

    static final String JOB_ID       = "job_id";
    static final String PROJECT_ID   = "project_id";
    static final String OWNER_ID     = "owner_id";
    static final String AGENT_TYPE   = "agent_type";
    static final String STATUS       = "status";
    static final String INPUT        = "input_context";
    static final String PROGRESS     = "progress";
    static final String RESULT       = "result";
    static final String ERROR        = "error";
    static final String CHECKPOINT   = "checkpoint";
    static final String CLARIFY      = "clarification_data";
    static final String CREATED_AT   = "created_at";
    static final String STARTED_AT   = "started_at";
    static final String COMPLETED_AT = "completed_at";

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper json;

    public JobRecordMapper(ObjectMapper json) {
        this.json = json;
    }

    public Map<String, String> toHash(Job job) {
        Map<String, String> h = new LinkedHashMap<>();
        h.put(JOB_ID,     job.getJobId());
        h.put(PROJECT_ID, job.getProjectId());
        h.put(AGENT_TYPE, job.getAgentType().wireName());
        h.put(STATUS,     job.getStatus().name());
        h.put(PROGRESS,   Double.toString(job.getProgress()));
        h.put(INPUT,      write(job.getInputContext()));
        putIfPresent(h, OWNER_ID,     job.getOwnerId());
        putIfPresent(h, ERROR,        job.getError());
        putIfPresent(h, RESULT,       job.getResult() == null ? null : write(job.getResult()));
        putIfPresent(h, CHECKPOINT,   job.getCheckpoint() == null ? null : write(job.getCheckpoint()));
        putIfPresent(h, CLARIFY,      job.getClarificationData() == null ? null : write(job.getClarificationData()));
        putIfPresent(h, CREATED_AT,   iso(job.getCreatedAt()));
        putIfPresent(h, STARTED_AT,   iso(job.getStartedAt()));
        putIfPresent(h, COMPLETED_AT, iso(job.getCompletedAt()));
        return h;
    }

    public Job fromHash(Map<String, String> h) {
        Job job = new Job();
        job.setJobId(h.get(JOB_ID));
        job.setProjectId(h.get(PROJECT_ID));
        job.setOwnerId(h.get(OWNER_ID));
        job.setAgentType(AgentType.fromWireName(h.get(AGENT_TYPE)));
        job.setStatus(JobStatus.valueOf(h.get(STATUS)));
        job.setProgress(h.containsKey(PROGRESS) ? Double.parseDouble(h.get(PROGRESS)) : 0.0);
        job.setInputContext(read(h.get(INPUT)));
        job.setResult(read(h.get(RESULT)));
        job.setError(h.get(ERROR));
        job.setCheckpoint(read(h.get(CHECKPOINT)));
        job.setClarificationData(read(h.get(CLARIFY)));
        job.setCreatedAt(instant(h.get(CREATED_AT)));
        job.setStartedAt(instant(h.get(STARTED_AT)));
        job.setCompletedAt(instant(h.get(COMPLETED_AT)));
        return job;
    }

    private String write(Map<String, Object> value) {
        try {
            return json.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new JobStoreException("Could not serialise job payload", e);
        }
    }

    private Map<String, Object> read(String value) {
        if (value == null) return null;
        try {
            return json.readValue(value, MAP_TYPE);
        } catch (JsonProcessingException e) {
            throw new JobStoreException("Corrupt job payload in store", e);
        }
    }

    private static void putIfPresent(Map<String, String> h, String key, String value) {
        if (value != null) h.put(key, value);
    }

    private static String iso(Instant t) {
        return t == null ? null : t.toString();
    }

    private static Instant instant(String s) {
        return s == null ? null : Instant.parse(s);
    }
}
