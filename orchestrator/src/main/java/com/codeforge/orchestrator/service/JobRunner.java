package com.codeforge.orchestrator.service;

import com.codeforge.orchestrator.model.AgentType;
import com.codeforge.orchestrator.model.Job;
import com.codeforge.orchestrator.model.JobStatus;
import com.codeforge.orchestrator.model.JobUpdate;
import com.codeforge.orchestrator.resilience.CircuitBreakerOpenException;
import com.codeforge.orchestrator.step.StepTimeoutException;
import com.codeforge.orchestrator.store.JobStore;
import com.codeforge.orchestrator.workflow.ExecutionControl;
import com.codeforge.orchestrator.workflow.PipelineState;
import com.codeforge.orchestrator.workflow.WorkflowExecutor;
import com.codeforge.orchestrator.workflow.WorkflowGraph;
import com.codeforge.orchestrator.workflow.WorkflowGraphException;
import com.codeforge.orchestrator.workflow.WorkflowGraphs;
import com.codeforge.orchestrator.workflow.WorkflowOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Executes queued jobs on the worker pool.
 *
 * One run:
 * <ol>
 *   <li>QUEUED → RUNNING at progress 5 (skipped if the job was cancelled first)</li>
 *   <li>build the graph for the job's agent type and drive it, under a
 *       wall-clock watchdog that interrupts the worker on expiry</li>
 *   <li>record the outcome: COMPLETED, WAITING_FOR_INPUT, or FAILED with a
 *       user-safe message (full detail goes to the log only)</li>
 *   <li>publish the terminal event</li>
 * </ol>
 * The JobStore stays the source of truth; the returned future is only a handle.
 */
@Service
public class JobRunner {

    private static final Logger log = LoggerFactory.getLogger(JobRunner.class);

    static final double START_PROGRESS = 5.0;

    static final String PIPELINE_TIMEOUT_MESSAGE = "Builder pipeline timed out";
    static final String AGENT_TIMEOUT_MESSAGE    = "Agent execution timed out";
    static final String AGENT_FAILED_MESSAGE     = "Agent execution failed";
    static final String INTERNAL_ERROR_MESSAGE   = "Internal workflow error";

    private final JobStore                 store;
    private final WorkflowExecutor         executor;
    private final JobEventPublisher        events;
    private final ExecutorService          workers;
    private final ScheduledExecutorService watchdogs;
    private final int                      maxIterations;
    private final Duration                 timeout;

    public JobRunner(JobStore store,
                     WorkflowExecutor executor,
                     JobEventPublisher events,
                     @Qualifier("jobWorkerPool") ExecutorService workers,
                     @Qualifier("jobWatchdogScheduler") ScheduledExecutorService watchdogs,
                     @Value("${codeforge.pipeline.max-iterations:5}") int maxIterations,
                     @Value("${codeforge.pipeline.timeout:360s}") Duration timeout) {
        if (maxIterations < 1) {
            throw new IllegalArgumentException("max-iterations must be >= 1, was " + maxIterations);
        }
        this.store         = store;
        this.executor      = executor;
        this.events        = events;
        this.workers       = workers;
        this.watchdogs     = watchdogs;
        this.maxIterations = maxIterations;
        this.timeout       = timeout;
    }

    /** Queue the job for execution and return a handle to the run. */
    public CompletableFuture<Void> start(String jobId) {
        return CompletableFuture.runAsync(() -> execute(jobId), workers);
    }

    void execute(String jobId) {
        MDC.put("jobId", jobId);
        try {
            run(jobId);
        } catch (RuntimeException e) {
            log.error("Job {} could not be finalised: {}", jobId, e.getMessage(), e);
            throw e;
        } finally {
            MDC.remove("jobId");
        }
    }

    // ------------------------------------------------------------------
    // One run
    // ------------------------------------------------------------------

    private void run(String jobId) {
        Optional<Job> loaded = store.get(jobId);
        if (loaded.isEmpty()) {
            log.warn("Job {} disappeared before it could start", jobId);
            return;
        }
        Job job = loaded.get();
        if (job.getStatus() != JobStatus.QUEUED) {
            log.info("Job {} is {} and will not be started", jobId, job.getStatus());
            return;
        }

        Optional<Job> started = store.update(jobId, JobUpdate.running(START_PROGRESS));
        if (started.isEmpty() || started.get().getStatus() != JobStatus.RUNNING) {
            log.info("Job {} was settled before it could start", jobId);
            return;
        }
        log.info("Job {} RUNNING (type={}, project={})",
                jobId, job.getAgentType().wireName(), job.getProjectId());
        events.publishProgress(jobId, START_PROGRESS, null);

        AgentType     type  = job.getAgentType();
        WorkflowGraph graph = WorkflowGraphs.forAgent(type, maxIterations);
        PipelineState state = new PipelineState(jobId, job.getInputContext(), maxIterations);

        WorkflowOutcome outcome = null;
        Throwable       failure = null;
        Watchdog watchdog = new Watchdog(Thread.currentThread());
        try (watchdog) {
            watchdog.arm();
            outcome = executor.run(graph, state, new StoreBackedControl(jobId, watchdog),
                    (progress, node) -> events.publishProgress(jobId, progress, node));
        } catch (RuntimeException | Error e) {
            failure = e;
        }

        if (failure != null) {
            recordFailure(job, failure, watchdog.fired());
        } else {
            recordOutcome(job, outcome, watchdog.fired());
        }
    }

    private void recordOutcome(Job job, WorkflowOutcome outcome, boolean timedOut) {
        switch (outcome.kind()) {
            case COMPLETED -> {
                Map<String, Object> result = new LinkedHashMap<>(outcome.outputs());
                if (job.getAgentType().isPipeline()) {
                    result.put("iteration_count", outcome.iterationCount());
                }
                settle(job, JobUpdate.completed(result), JobStatus.COMPLETED);
            }
            case WAITING_FOR_INPUT ->
                    settle(job, JobUpdate.waitingForInput(outcome.outputs(), outcome.clarification()),
                            JobStatus.WAITING_FOR_INPUT);
            case CANCELLED -> {
                if (timedOut) {
                    log.error("Job {} hit the {}s timeout at node '{}'",
                            job.getJobId(), timeout.toSeconds(), outcome.lastNode());
                    settle(job, JobUpdate.failed(timeoutMessage(job)), JobStatus.FAILED);
                } else {
                    log.info("Job {} cancelled; stopped after node '{}'", job.getJobId(), outcome.lastNode());
                }
            }
        }
    }

    private void recordFailure(Job job, Throwable e, boolean timedOut) {
        String message;
        if (timedOut) {
            message = timeoutMessage(job);
        } else if (e instanceof CircuitBreakerOpenException open) {
            message = "Generation provider '" + open.getProvider() + "' is temporarily unavailable";
        } else if (e instanceof StepTimeoutException) {
            message = AGENT_TIMEOUT_MESSAGE;
        } else if (e instanceof WorkflowGraphException) {
            message = INTERNAL_ERROR_MESSAGE;
        } else {
            message = AGENT_FAILED_MESSAGE;
        }
        log.error("Job {} failed ({}): {}", job.getJobId(), message, e.getMessage(), e);
        settle(job, JobUpdate.failed(message), JobStatus.FAILED);
    }

    /** Apply the final update and publish the terminal event if it took effect. */
    private void settle(Job job, JobUpdate update, JobStatus expected) {
        Optional<Job> settled = store.update(job.getJobId(), update);
        if (settled.isPresent() && settled.get().getStatus() == expected) {
            events.publishTerminal(settled.get());
        } else {
            log.info("Job {} was already {}; {} not recorded", job.getJobId(),
                    settled.map(Job::getStatus).orElse(null), expected);
        }
    }

    private String timeoutMessage(Job job) {
        return job.getAgentType().isPipeline() ? PIPELINE_TIMEOUT_MESSAGE : AGENT_TIMEOUT_MESSAGE;
    }

    // ------------------------------------------------------------------
    // Collaborators
    // ------------------------------------------------------------------

    /** Stops the run once the job leaves RUNNING; mirrors node results into the job. */
    private final class StoreBackedControl implements ExecutionControl {

        private final String   jobId;
        private final Watchdog watchdog;

        StoreBackedControl(String jobId, Watchdog watchdog) {
            this.jobId    = jobId;
            this.watchdog = watchdog;
        }

        @Override
        public boolean shouldStop() {
            if (watchdog.fired()) return true;
            return store.get(jobId)
                    .map(j -> j.getStatus() != JobStatus.RUNNING)
                    .orElse(true);
        }

        @Override
        public void checkpoint(String node, double progress, Map<String, Object> outputs) {
            store.update(jobId, JobUpdate.progress(progress).withCheckpoint(outputs));
        }
    }

    /**
     * Interrupts the worker thread when the wall-clock budget runs out.
     * Closing it disarms the timer and clears any pending interrupt so the
     * pooled thread is clean for the next job.
     */
    private final class Watchdog implements AutoCloseable {

        private final Thread worker;
        private ScheduledFuture<?> timer;
        private boolean fired;
        private boolean closed;

        Watchdog(Thread worker) {
            this.worker = worker;
        }

        void arm() {
            timer = watchdogs.schedule(this::expire, timeout.toMillis(), TimeUnit.MILLISECONDS);
        }

        private synchronized void expire() {
            if (closed) return;
            fired = true;
            log.warn("Job exceeded its {}s wall-clock budget; interrupting worker {}",
                    timeout.toSeconds(), worker.getName());
            worker.interrupt();
        }

        synchronized boolean fired() {
            return fired;
        }

        @Override
        public synchronized void close() {
            closed = true;
            if (timer != null) timer.cancel(false);
            Thread.interrupted();
        }
    }
}
