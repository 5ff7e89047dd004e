package com.codeforge.orchestrator.api;

import com.codeforge.orchestrator.api.dto.JobPageResponse;
import com.codeforge.orchestrator.api.dto.JobResponse;
import com.codeforge.orchestrator.api.dto.JobStatusResponse;
import com.codeforge.orchestrator.api.dto.ResumeJobRequest;
import com.codeforge.orchestrator.api.dto.SubmitJobRequest;
import com.codeforge.orchestrator.model.Job;
import com.codeforge.orchestrator.service.JobEvent;
import com.codeforge.orchestrator.service.JobEventPublisher;
import com.codeforge.orchestrator.service.JobService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * REST API for the job lifecycle.
 *
 * POST /jobs                         : submit a job (single step or "pipeline")
 * GET  /jobs/{id}                    : current status, progress, result or error
 * GET  /projects/{projectId}/jobs    : a project's jobs, newest first
 * POST /jobs/{id}/cancel             : cancel a queued or running job
 * POST /jobs/{id}/resume             : answer clarification questions; starts a new job
 * GET  /jobs/{id}/events             : Server-Sent Events: progress, then one terminal event
 */
@RestController
public class JobController {

    private static final Logger log = LoggerFactory.getLogger(JobController.class);

    static final long SSE_TIMEOUT_MS = 15 * 60 * 1000L;

    private final JobService        jobService;
    private final JobEventPublisher events;

    public JobController(JobService jobService, JobEventPublisher events) {
        this.jobService = jobService;
        this.events     = events;
    }

    /**
     * Example:
     *   curl -X POST http://localhost:8080/jobs \
     *     -H "Content-Type: application/json" \
     *     -d '{"projectId":"p-1","agentType":"pipeline","inputContext":{"prompt":"todo app"}}'
     */
    @PostMapping("/jobs")
    public ResponseEntity<JobResponse> submit(@RequestBody SubmitJobRequest req) {
        Job job = jobService.submit(req.projectId(), req.agentType(), req.inputContext(), req.ownerId());
        return ResponseEntity.status(HttpStatus.CREATED).body(JobResponse.from(job));
    }

    @GetMapping("/jobs/{id}")
    public JobStatusResponse getJob(@PathVariable String id) {
        return JobStatusResponse.from(jobService.getStatus(id));
    }

    @GetMapping("/projects/{projectId}/jobs")
    public JobPageResponse listJobs(@PathVariable String projectId,
                                    @RequestParam(defaultValue = "1") int page,
                                    @RequestParam(defaultValue = "20") int pageSize) {
        return JobPageResponse.from(jobService.list(projectId, page, pageSize));
    }

    /** 202 on success, 409 if the job is already settled, 404 if unknown. */
    @PostMapping("/jobs/{id}/cancel")
    public ResponseEntity<JobResponse> cancel(@PathVariable String id) {
        return ResponseEntity.accepted().body(JobResponse.from(jobService.cancel(id)));
    }

    /** 201 with the new job, 409 unless the job is waiting for input. */
    @PostMapping("/jobs/{id}/resume")
    public ResponseEntity<JobResponse> resume(@PathVariable String id,
                                              @RequestBody(required = false) ResumeJobRequest req) {
        Job resumed = jobService.resume(id, req == null ? null : req.answers());
        return ResponseEntity.status(HttpStatus.CREATED).body(JobResponse.from(resumed));
    }

    @GetMapping(path = "/jobs/{id}/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter streamEvents(@PathVariable String id) {
        Job job = jobService.getStatus(id);
        SseEmitter emitter = new SseEmitter(SSE_TIMEOUT_MS);
        AtomicBoolean done = new AtomicBoolean();

        if (job.getStatus().isFrozen()) {
            finish(emitter, done, JobEvent.terminal(job));
            return emitter;
        }

        Runnable unsubscribe = events.subscribe(id, event -> {
            if (event.isTerminal()) {
                finish(emitter, done, event);
            } else if (!done.get()) {
                send(emitter, event);
            }
        });
        emitter.onCompletion(unsubscribe);
        emitter.onTimeout(unsubscribe);
        emitter.onError(e -> unsubscribe.run());

        // The job may have settled between the first read and the subscription.
        Job latest = jobService.getStatus(id);
        if (latest.getStatus().isFrozen()) {
            unsubscribe.run();
            finish(emitter, done, JobEvent.terminal(latest));
        }
        return emitter;
    }

    private static void finish(SseEmitter emitter, AtomicBoolean done, JobEvent terminal) {
        if (!done.compareAndSet(false, true)) return;
        try {
            send(emitter, terminal);
            emitter.complete();
        } catch (UncheckedIOException e) {
            log.debug("Client for job {} went away before the terminal event", terminal.jobId());
            emitter.completeWithError(e.getCause());
        }
    }

    private static void send(SseEmitter emitter, JobEvent event) {
        try {
            emitter.send(SseEmitter.event()
                    .name(event.type().name().toLowerCase())
                    .data(event, MediaType.APPLICATION_JSON));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
