package com.example.authservice.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Async configuration for audit writes.
 *
 * Audit entries are persisted on a bounded pool so a request never waits for a second
 * connection while holding its own.
 *
 * - Queue is bounded; a full queue rejects (AbortPolicy) and the entry is logged as lost.
 *   CallerRunsPolicy would put the write back on the request thread.
 * - MDC (correlation id) is carried to the worker threads.
 * - Pending writes are drained on shutdown.
 */
@Configuration
@EnableAsync
@Slf4j
public class AsyncConfig {

    public static final String AUDIT_EXECUTOR = "auditExecutor";

    @Bean(name = AUDIT_EXECUTOR)
    public ThreadPoolTaskExecutor auditExecutor(
            @Value("${app.audit.async.core-pool-size:2}") int corePoolSize,
            @Value("${app.audit.async.max-pool-size:4}") int maxPoolSize,
            @Value("${app.audit.async.queue-capacity:1000}") int queueCapacity) {

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("audit-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.setTaskDecorator(new MdcTaskDecorator());
        executor.initialize();

        log.info("Initialized auditExecutor - core={}, max={}, queue={}", corePoolSize, maxPoolSize, queueCapacity);
        return executor;
    }
}
