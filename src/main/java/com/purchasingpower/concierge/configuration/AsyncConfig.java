package com.purchasingpower.concierge.configuration;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Thread pools for the turn's bounded I/O calls and for delayed fact extraction.
 *
 * The turn itself runs on the caller's thread; only calls that may block on an
 * external collaborator (LLM safety check, fact store, catalog) are handed to
 * {@code turnIoExecutor} so they can be abandoned on timeout.
 */
@Slf4j
@Configuration
public class AsyncConfig {

    @Bean(name = "turnIoExecutor")
    public ThreadPoolTaskExecutor turnIoExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();

        executor.setCorePoolSize(8);
        executor.setMaxPoolSize(32);
        executor.setQueueCapacity(200);
        executor.setThreadNamePrefix("turn-io-");

        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);

        executor.initialize();

        log.info("✅ Turn I/O executor configured: core={}, max={}, queue={}",
                executor.getCorePoolSize(),
                executor.getMaxPoolSize(),
                executor.getQueueCapacity());

        return executor;
    }

    @Bean(name = "extractionScheduler")
    public ThreadPoolTaskScheduler extractionScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.setThreadNamePrefix("fact-extraction-");
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.initialize();

        log.info("✅ Fact extraction scheduler configured: pool={}", scheduler.getPoolSize());
        return scheduler;
    }
}
