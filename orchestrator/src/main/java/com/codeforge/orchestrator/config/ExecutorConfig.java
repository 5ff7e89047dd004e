package com.codeforge.orchestrator.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread pools for job execution.
 *
 * jobWorkerPool        : one thread per running job (bounded by thread-count)
 * stepCallPool         : runs individual step attempts so they can be timed out
 * jobWatchdogScheduler : fires whole-job timeouts
 * taskScheduler        : {@code @Scheduled} housekeeping, kept off the watchdog thread
 */
@Configuration
public class ExecutorConfig {

    @Value("${codeforge.workers.thread-count:4}")
    private int workerThreadCount;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(name = "jobWorkerPool", destroyMethod = "shutdownNow")
    public ExecutorService jobWorkerPool() {
        return Executors.newFixedThreadPool(workerThreadCount, named("job-worker-", false));
    }

    @Bean(name = "stepCallPool", destroyMethod = "shutdownNow")
    public ExecutorService stepCallPool() {
        return Executors.newCachedThreadPool(named("step-call-", true));
    }

    @Bean(name = "jobWatchdogScheduler", destroyMethod = "shutdownNow")
    public ScheduledExecutorService jobWatchdogScheduler() {
        return Executors.newSingleThreadScheduledExecutor(named("job-watchdog-", true));
    }

    @Bean
    public ThreadPoolTaskScheduler taskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("janitor-");
        return scheduler;
    }

    private static ThreadFactory named(String prefix, boolean daemon) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread thread = new Thread(r);
            thread.setName(prefix + counter.incrementAndGet());
            thread.setDaemon(daemon);
            return thread;
        };
    }
}
