package com.codeforge.orchestrator.service;

import com.codeforge.orchestrator.store.JobStore;
import com.codeforge.orchestrator.store.JobStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Periodic sweep of old settled jobs and dangling index entries, plus a
 * pending-queue gauge in the log.
 */
@Component
public class JobJanitor {

    private static final Logger log = LoggerFactory.getLogger(JobJanitor.class);

    private final JobStore store;
    private final Duration olderThan;

    public JobJanitor(JobStore store,
                      @Value("${codeforge.job-store.cleanup-older-than:24h}") Duration olderThan) {
        this.store     = store;
        this.olderThan = olderThan;
    }

    @Scheduled(fixedDelayString = "${codeforge.job-store.janitor-interval-ms:600000}",
               initialDelayString = "${codeforge.job-store.janitor-interval-ms:600000}")
    public void sweep() {
        try {
            int removed = store.cleanup(olderThan);
            int pending = store.listPending().size();
            log.info("Janitor removed {} entries older than {}; {} job(s) pending", removed, olderThan, pending);
        } catch (JobStoreException e) {
            // next tick retries
            log.error("Janitor sweep failed: {}", e.getMessage(), e);
        }
    }
}
