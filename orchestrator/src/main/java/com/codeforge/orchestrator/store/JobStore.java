package com.codeforge.orchestrator.store;

import com.codeforge.orchestrator.model.AgentType;
import com.codeforge.orchestrator.model.Job;
import com.codeforge.orchestrator.model.JobPage;
import com.codeforge.orchestrator.model.JobUpdate;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Durable job identity, status, progress and result.
 *
 * Both backends apply {@link com.codeforge.orchestrator.model.JobTransitions}
 * so the state machine and the paging contract are identical. Missing jobs
 * yield an empty Optional; backend connectivity problems surface as
 * {@link JobStoreException} and are never swallowed.
 */
public interface JobStore {

    Job create(String jobId, String projectId, AgentType agentType,
               Map<String, Object> inputContext, String ownerId);

    Optional<Job> get(String jobId);

    /**
     * Apply an update atomically. A frozen job is returned unchanged.
     *
     * @return the job after the update, or empty if it does not exist
     */
    Optional<Job> update(String jobId, JobUpdate update);

    /**
     * Jobs of one project, newest first.
     * <p>
     * {@link JobPage#total()} counts the project's index entries. On a shared
     * backend where records expire on their own, that count can include ids
     * whose record is already gone but whose index entry the janitor has not
     * swept yet. Such ids are skipped from {@code jobs}, so a page may hold
     * fewer items than {@code pageSize} while {@code total} stays unchanged
     * until the next {@link #cleanup(Duration)}.
     */
    JobPage listForProject(String projectId, int page, int pageSize);

    /** Jobs still QUEUED. */
    List<Job> listPending();

    /**
     * Remove finished jobs whose completion is older than {@code olderThan}.
     *
     * @return number of removed jobs (and, for shared backends, dangling index entries)
     */
    int cleanup(Duration olderThan);
}
