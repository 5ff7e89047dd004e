package com.codeforge.orchestrator.store;

import com.codeforge.orchestrator.model.AgentType;
import com.codeforge.orchestrator.model.Job;
import com.codeforge.orchestrator.model.JobPage;
import com.codeforge.orchestrator.model.JobStatus;
import com.codeforge.orchestrator.model.JobTransitions;
import com.codeforge.orchestrator.model.JobUpdate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisOperations;
import org.springframework.data.redis.core.SessionCallback;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Redis-backed job store, shared by every orchestrator instance.
 *
 * Key layout:
 * <pre>
 *   job:{jobId}                 HASH  flat job record (see JobRecordMapper)
 *   project_jobs:{projectId}    ZSET  job ids scored by created_at epoch millis
 *   pending_jobs                SET   ids of QUEUED jobs
 *   job_projects                SET   project ids that own an index (janitor scan list)
 * </pre>
 *
 * Every mutation is a single MULTI/EXEC. Updates are read-modify-write under
 * WATCH on the job key: if another instance writes the job between our read
 * and EXEC, Redis discards the transaction and we retry with fresh data.
 * Frozen jobs get a TTL so they expire on their own; the janitor removes
 * index entries whose record has already expired.
 */
public class RedisJobStore implements JobStore {

    private static final Logger log = LoggerFactory.getLogger(RedisJobStore.class);

    static final String PENDING_KEY  = "pending_jobs";
    static final String PROJECTS_KEY = "job_projects";

    private static final int MAX_WATCH_RETRIES = 10;

    private final StringRedisTemplate redis;
    private final JobRecordMapper     mapper;
    private final Clock               clock;
    private final Duration            completedRetention;

    public RedisJobStore(StringRedisTemplate redis, JobRecordMapper mapper,
                         Clock clock, Duration completedRetention) {
        this.redis              = redis;
        this.mapper             = mapper;
        this.clock              = clock;
        this.completedRetention = completedRetention;
    }

    static String jobKey(String jobId)         { return "job:" + jobId; }
    static String projectKey(String projectId) { return "project_jobs:" + projectId; }

    // ------------------------------------------------------------------
    // JobStore
    // ------------------------------------------------------------------

    @Override
    public Job create(String jobId, String projectId, AgentType agentType,
                      Map<String, Object> inputContext, String ownerId) {
        Job job = new Job(jobId, projectId, agentType, inputContext, ownerId, clock.instant());
        Map<String, String> hash = mapper.toHash(job);

        List<Object> results = guarded("create job " + jobId, () -> redis.execute(new SessionCallback<List<Object>>() {
            @Override
            @SuppressWarnings("unchecked")
            public <K, V> List<Object> execute(RedisOperations<K, V> operations) throws DataAccessException {
                RedisOperations<String, String> ops = (RedisOperations<String, String>) operations;
                ops.multi();
                ops.opsForHash().putAll(jobKey(jobId), hash);
                ops.opsForZSet().add(projectKey(projectId), jobId, job.getCreatedAt().toEpochMilli());
                ops.opsForSet().add(PENDING_KEY, jobId);
                ops.opsForSet().add(PROJECTS_KEY, projectId);
                return ops.exec();
            }
        }));
        if (results == null || results.isEmpty()) {
            throw new JobStoreException("Create transaction for job " + jobId + " was discarded");
        }
        log.info("[Redis] Created job {} for project {} (type={})", jobId, projectId, agentType.wireName());
        return job;
    }

    @Override
    public Optional<Job> get(String jobId) {
        Map<String, String> hash = guarded("get job " + jobId,
                () -> redis.<String, String>opsForHash().entries(jobKey(jobId)));
        if (hash == null || hash.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(mapper.fromHash(hash));
    }

    @Override
    public Optional<Job> update(String jobId, JobUpdate update) {
        for (int attempt = 1; attempt <= MAX_WATCH_RETRIES; attempt++) {
            UpdateOutcome outcome = guarded("update job " + jobId,
                    () -> redis.execute(new UpdateCallback(jobId, update)));
            if (outcome != null && outcome.committed()) {
                return Optional.ofNullable(outcome.job());
            }
            log.debug("[Redis] Concurrent write on job {}, retrying update (attempt {}/{})",
                    jobId, attempt, MAX_WATCH_RETRIES);
        }
        throw new JobStoreException("Job " + jobId + " kept changing underneath the update; gave up after "
                + MAX_WATCH_RETRIES + " attempts");
    }

    @Override
    public JobPage listForProject(String projectId, int page, int pageSize) {
        long start = JobPage.offset(page, pageSize);
        long end   = start + pageSize - 1;
        String key = projectKey(projectId);

        // ZCARD, so expired-but-unswept ids are still counted
        Long total = guarded("count project jobs", () -> redis.opsForZSet().zCard(key));
        Set<String> ids = guarded("list project jobs", () -> redis.opsForZSet().reverseRange(key, start, end));

        List<Job> jobs = new ArrayList<>();
        if (ids != null) {
            for (String id : ids) {
                // Index entries can outlive their expired record until the janitor runs.
                get(id).ifPresent(jobs::add);
            }
        }
        return new JobPage(jobs, page, pageSize, total == null ? 0 : total);
    }

    @Override
    public List<Job> listPending() {
        Set<String> ids = guarded("list pending jobs", () -> redis.opsForSet().members(PENDING_KEY));
        if (ids == null) return List.of();
        return ids.stream()
                .map(this::get)
                .flatMap(Optional::stream)
                .filter(j -> j.getStatus() == JobStatus.QUEUED)
                .sorted(Comparator.comparing(Job::getCreatedAt))
                .toList();
    }

    /**
     * Sweep every project index for entries older than the cutoff: entries
     * whose record has expired are dropped, and frozen jobs completed before
     * the cutoff are deleted together with their index entry.
     */
    @Override
    public int cleanup(Duration olderThan) {
        Instant cutoff = clock.instant().minus(olderThan);
        Set<String> projects = guarded("list indexed projects", () -> redis.opsForSet().members(PROJECTS_KEY));
        if (projects == null) return 0;

        int removed = 0;
        for (String projectId : projects) {
            String key = projectKey(projectId);
            Set<String> oldIds = guarded("scan project index",
                    () -> redis.opsForZSet().rangeByScore(key, Double.NEGATIVE_INFINITY, cutoff.toEpochMilli()));
            if (oldIds != null) {
                for (String id : oldIds) {
                    Optional<Job> job = get(id);
                    if (job.isEmpty()) {
                        guarded("remove dangling index entry", () -> redis.opsForZSet().remove(key, id));
                        removed++;
                    } else if (isExpired(job.get(), cutoff)) {
                        delete(job.get());
                        removed++;
                    }
                }
            }
            dropIfEmpty(projectId);
        }
        log.info("[Redis] Cleaned up {} old jobs / dangling index entries", removed);
        return removed;
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private void delete(Job job) {
        guarded("delete job " + job.getJobId(), () -> redis.execute(new SessionCallback<List<Object>>() {
            @Override
            @SuppressWarnings("unchecked")
            public <K, V> List<Object> execute(RedisOperations<K, V> operations) throws DataAccessException {
                RedisOperations<String, String> ops = (RedisOperations<String, String>) operations;
                ops.multi();
                ops.delete(jobKey(job.getJobId()));
                ops.opsForZSet().remove(projectKey(job.getProjectId()), job.getJobId());
                ops.opsForSet().remove(PENDING_KEY, job.getJobId());
                return ops.exec();
            }
        }));
    }

    /**
     * Remove the project from the janitor scan list if its index is empty.
     * The index key is watched, so a create that lands in between discards
     * the removal and the project stays listed.
     */
    private void dropIfEmpty(String projectId) {
        String key = projectKey(projectId);
        guarded("drop empty project " + projectId, () -> redis.execute(new SessionCallback<List<Object>>() {
            @Override
            @SuppressWarnings("unchecked")
            public <K, V> List<Object> execute(RedisOperations<K, V> operations) throws DataAccessException {
                RedisOperations<String, String> ops = (RedisOperations<String, String>) operations;
                ops.watch(key);
                Long left = ops.opsForZSet().zCard(key);
                if (left == null || left > 0) {
                    ops.unwatch();
                    return List.of();
                }
                ops.multi();
                ops.opsForSet().remove(PROJECTS_KEY, projectId);
                List<Object> results = ops.exec();
                if (results == null || results.isEmpty()) {
                    log.debug("[Redis] Project {} gained a job during cleanup; keeping it listed", projectId);
                }
                return results;
            }
        }));
    }

    private static boolean isExpired(Job job, Instant cutoff) {
        return job.getStatus().isFrozen()
                && job.getCompletedAt() != null
                && job.getCompletedAt().isBefore(cutoff);
    }

    /** Translate Spring's DataAccessException into a StoreError so it cannot be mistaken for a step failure. */
    private static <T> T guarded(String operation, Supplier<T> call) {
        try {
            return call.get();
        } catch (DataAccessException e) {
            log.error("[Redis] {} failed: {}", operation, e.getMessage(), e);
            throw new JobStoreException("Job store unavailable during " + operation, e);
        }
    }

    private record UpdateOutcome(boolean committed, Job job) {}

    /**
     * WATCH job → read → apply transition → MULTI/EXEC.
     * EXEC returns an empty result when the watched key changed; the caller retries.
     */
    private final class UpdateCallback implements SessionCallback<UpdateOutcome> {

        private final String    jobId;
        private final JobUpdate update;

        UpdateCallback(String jobId, JobUpdate update) {
            this.jobId  = jobId;
            this.update = update;
        }

        @Override
        @SuppressWarnings("unchecked")
        public <K, V> UpdateOutcome execute(RedisOperations<K, V> operations) throws DataAccessException {
            RedisOperations<String, String> ops = (RedisOperations<String, String>) operations;
            String key = jobKey(jobId);

            ops.watch(key);
            Map<String, String> hash = ops.<String, String>opsForHash().entries(key);
            if (hash == null || hash.isEmpty()) {
                ops.unwatch();
                return new UpdateOutcome(true, null);
            }

            Job job = mapper.fromHash(hash);
            boolean changed;
            try {
                changed = JobTransitions.apply(job, update, clock.instant());
            } catch (RuntimeException e) {
                ops.unwatch();
                throw e;
            }
            if (!changed) {
                ops.unwatch();
                return new UpdateOutcome(true, job);
            }

            ops.multi();
            // Rewrite the whole record so cleared fields (e.g. result on failure) disappear too.
            ops.delete(key);
            ops.opsForHash().putAll(key, mapper.toHash(job));
            if (job.getStatus() != JobStatus.QUEUED) {
                ops.opsForSet().remove(PENDING_KEY, jobId);
            }
            if (job.getStatus().isFrozen()) {
                ops.expire(key, completedRetention);
            }
            List<Object> results = ops.exec();
            if (results == null || results.isEmpty()) {
                return new UpdateOutcome(false, null);
            }
            log.info("[Redis] Updated job {}: status={}, progress={}", jobId, job.getStatus(), job.getProgress());
            return new UpdateOutcome(true, job);
        }
    }
}
