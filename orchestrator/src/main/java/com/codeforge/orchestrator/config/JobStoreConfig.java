package com.codeforge.orchestrator.config;

import com.codeforge.orchestrator.store.InMemoryJobStore;
import com.codeforge.orchestrator.store.JobRecordMapper;
import com.codeforge.orchestrator.store.JobStore;
import com.codeforge.orchestrator.store.RedisJobStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;
import java.time.Duration;

/**
 * Selects the job store backend.
 *
 * codeforge.job-store.backend=memory (default): single process, lost on restart
 * codeforge.job-store.backend=redis           : shared by every instance
 */
@Configuration
public class JobStoreConfig {

    private static final Logger log = LoggerFactory.getLogger(JobStoreConfig.class);

    private static final String BACKEND = "codeforge.job-store.backend";

    @Bean
    @ConditionalOnProperty(name = BACKEND, havingValue = "memory", matchIfMissing = true)
    public JobStore inMemoryJobStore(Clock clock) {
        log.info("Using in-memory job store");
        return new InMemoryJobStore(clock);
    }

    @Bean
    @ConditionalOnProperty(name = BACKEND, havingValue = "redis")
    public JobStore redisJobStore(StringRedisTemplate redis, ObjectMapper objectMapper, Clock clock,
                                  @Value("${codeforge.job-store.completed-retention:48h}") Duration retention) {
        log.info("Using Redis job store (completed-job retention {})", retention);
        return new RedisJobStore(redis, new JobRecordMapper(objectMapper), clock, retention);
    }
}
