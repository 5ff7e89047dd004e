package com.codeforge.orchestrator.store;

import com.codeforge.orchestrator.model.AgentType;
import com.codeforge.orchestrator.model.Job;
import com.codeforge.orchestrator.model.JobPage;
import com.codeforge.orchestrator.model.JobStatus;
import com.codeforge.orchestrator.model.JobTransitions;
import com.codeforge.orchestrator.model.JobUpdate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local job store. Data is lost on restart.
 *
 * Each job is mutated inside {@link ConcurrentHashMap#compute}, which makes
 * every update atomic per job id. The project index is likewise only changed
 * inside {@code compute} calls on the project key. Callers always receive copies.
 */
public class InMemoryJobStore implements JobStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryJobStore.class);

    private static final Comparator<Job> NEWEST_FIRST =
            Comparator.comparing(Job::getCreatedAt).reversed().thenComparing(Job::getJobId);

    private final Map<String, Job>         jobs         = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> projectIndex = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryJobStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Job create(String jobId, String projectId, AgentType agentType,
                      Map<String, Object> inputContext, String ownerId) {
        Job job = new Job(jobId, projectId, agentType, inputContext, ownerId, clock.instant());
        if (jobs.putIfAbsent(jobId, job) != null) {
            throw new JobStoreException("Job already exists: " + jobId);
        }
        projectIndex.compute(projectId, (p, ids) -> {
            Set<String> index = ids != null ? ids : ConcurrentHashMap.newKeySet();
            index.add(jobId);
            return index;
        });
        log.info("[InMemory] Created job {} for project {} (type={})", jobId, projectId, agentType.wireName());
        return job.copy();
    }

    @Override
    public Optional<Job> get(String jobId) {
        Job job = jobs.get(jobId);
        return job == null ? Optional.empty() : Optional.of(snapshot(job));
    }

    @Override
    public Optional<Job> update(String jobId, JobUpdate update) {
        Job[] after = new Job[1];
        jobs.computeIfPresent(jobId, (id, job) -> {
            if (JobTransitions.apply(job, update, clock.instant())) {
                log.info("[InMemory] Updated job {}: status={}, progress={}",
                        id, job.getStatus(), job.getProgress());
            }
            after[0] = job.copy();
            return job;
        });
        return Optional.ofNullable(after[0]);
    }

    @Override
    public JobPage listForProject(String projectId, int page, int pageSize) {
        long offset = JobPage.offset(page, pageSize);
        List<Job> all = projectIndex.getOrDefault(projectId, Set.of()).stream()
                .map(jobs::get)
                .filter(j -> j != null)
                .map(this::snapshot)
                .sorted(NEWEST_FIRST)
                .toList();
        List<Job> slice = all.stream().skip(offset).limit(pageSize).toList();
        return new JobPage(slice, page, pageSize, all.size());
    }

    @Override
    public List<Job> listPending() {
        return jobs.values().stream()
                .map(this::snapshot)
                .filter(j -> j.getStatus() == JobStatus.QUEUED)
                .sorted(Comparator.comparing(Job::getCreatedAt))
                .toList();
    }

    @Override
    public int cleanup(Duration olderThan) {
        Instant cutoff = clock.instant().minus(olderThan);
        int removed = 0;
        for (String jobId : List.copyOf(jobs.keySet())) {
            boolean[] dropped = new boolean[1];
            jobs.computeIfPresent(jobId, (id, job) -> {
                if (isExpired(job, cutoff)) {
                    dropped[0] = true;
                    unindex(job.getProjectId(), id);
                    return null;
                }
                return job;
            });
            if (dropped[0]) removed++;
        }
        log.info("[InMemory] Cleaned up {} old jobs", removed);
        return removed;
    }

    // Removal and the emptiness check share the project's map lock, so a concurrent create cannot lose its entry.
    private void unindex(String projectId, String jobId) {
        projectIndex.computeIfPresent(projectId, (p, ids) -> {
            ids.remove(jobId);
            return ids.isEmpty() ? null : ids;
        });
    }

    private static boolean isExpired(Job job, Instant cutoff) {
        return job.getStatus().isFrozen()
                && job.getCompletedAt() != null
                && job.getCompletedAt().isBefore(cutoff);
    }

    // Reads take a copy under the map's per-key lock so they never observe a half-applied update.
    private Job snapshot(Job job) {
        Job[] copy = new Job[1];
        jobs.computeIfPresent(job.getJobId(), (id, j) -> {
            copy[0] = j.copy();
            return j;
        });
        return copy[0] != null ? copy[0] : job.copy();
    }
}
