package com.salesops.crmsync.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Worker pool for batch draining and sync passes, plus the scheduler that fires batch
 * timeouts, retries and cron jobs.
 */
@Slf4j
@Configuration
public class AsyncConfig {

    @Bean
    public Clock clock() {
        // microseconds, the precision timestamps are stored with
        return Clock.tick(Clock.systemUTC(), Duration.ofNanos(1_000));
    }

    @Bean(name = "syncExecutor")
    public ThreadPoolTaskExecutor syncExecutor(CrmSyncProperties properties) {
        CrmSyncProperties.Workers workers = properties.getWorkers();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(workers.getCorePoolSize());
        executor.setMaxPoolSize(workers.getMaxPoolSize());
        executor.setQueueCapacity(workers.getQueueCapacity());
        executor.setThreadNamePrefix("crm-sync-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        log.info("Initialized sync worker pool: core={}, max={}, queue={}",
                workers.getCorePoolSize(), workers.getMaxPoolSize(), workers.getQueueCapacity());
        return executor;
    }

    @Bean
    @Primary
    public ThreadPoolTaskScheduler taskScheduler(CrmSyncProperties properties) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(properties.getWorkers().getSchedulerPoolSize());
        scheduler.setThreadNamePrefix("crm-sched-");
        // delayed tasks are dropped at shutdown; open batches drain on context close and
        // pending retries are recovered on restart
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        scheduler.setAwaitTerminationSeconds(30);
        scheduler.initialize();
        return scheduler;
    }
}
