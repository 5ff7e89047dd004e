package com.codeforge.orchestrator.service;

import com.codeforge.orchestrator.model.Job;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-process fan-out of job events to per-job subscribers (e.g. SSE streams).
 *
 * A failing subscriber is logged and skipped; it never affects the job.
 * Subscribers of a job are dropped after its terminal event.
 */
@Component
public class JobEventPublisher {

    private static final Logger log = LoggerFactory.getLogger(JobEventPublisher.class);

    private final Map<String, List<JobEventListener>> listeners = new ConcurrentHashMap<>();
    private final MeterRegistry meterRegistry;

    public JobEventPublisher(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    /** @return a handle that removes the subscription */
    public Runnable subscribe(String jobId, JobEventListener listener) {
        listeners.computeIfAbsent(jobId, id -> new CopyOnWriteArrayList<>()).add(listener);
        return () -> unsubscribe(jobId, listener);
    }

    public void publishProgress(String jobId, double progress, String node) {
        deliver(JobEvent.progress(jobId, progress, node));
    }

    /** Counts the job as finished under {@code codeforge.jobs.finished{status}} and notifies subscribers. */
    public void publishTerminal(Job job) {
        meterRegistry.counter("codeforge.jobs.finished",
                "status", job.getStatus().name().toLowerCase()).increment();
        log.info("Job {} settled as {} (progress {})", job.getJobId(), job.getStatus(), job.getProgress());
        deliver(JobEvent.terminal(job));
        listeners.remove(job.getJobId());
    }

    public int subscriberCount(String jobId) {
        List<JobEventListener> list = listeners.get(jobId);
        return list == null ? 0 : list.size();
    }

    private void deliver(JobEvent event) {
        List<JobEventListener> list = listeners.get(event.jobId());
        if (list == null) return;
        for (JobEventListener listener : list) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                log.warn("Subscriber for job {} failed on {} event: {}",
                        event.jobId(), event.type(), e.getMessage());
                unsubscribe(event.jobId(), listener);
            }
        }
    }

    private void unsubscribe(String jobId, JobEventListener listener) {
        listeners.computeIfPresent(jobId, (id, list) -> {
            list.remove(listener);
            return list.isEmpty() ? null : list;
        });
    }
}
