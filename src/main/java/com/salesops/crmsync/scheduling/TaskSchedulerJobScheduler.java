package com.salesops.crmsync.scheduling;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.support.CronTrigger;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;

@Slf4j
@Component
public class TaskSchedulerJobScheduler implements JobScheduler {

    private final TaskScheduler taskScheduler;
    private final Map<String, ScheduledFuture<?>> jobs = new ConcurrentHashMap<>();

    public TaskSchedulerJobScheduler(TaskScheduler taskScheduler) {
        this.taskScheduler = taskScheduler;
    }

    @Override
    public void schedule(String name, String cron, Runnable job) {
        ScheduledFuture<?> future = taskScheduler.schedule(() -> runGuarded(name, job), new CronTrigger(cron));
        ScheduledFuture<?> previous = jobs.put(name, future);
        if (previous != null) {
            previous.cancel(false);
        }
        log.info("Scheduled job '{}' with cron '{}'", name, cron);
    }

    @Override
    public boolean cancel(String name) {
        ScheduledFuture<?> future = jobs.remove(name);
        if (future == null) {
            return false;
        }
        future.cancel(false);
        log.info("Cancelled job '{}'", name);
        return true;
    }

    @PreDestroy
    public void cancelAll() {
        if (!jobs.isEmpty()) {
            log.info("Cancelling {} scheduled jobs", jobs.size());
        }
        jobs.keySet().forEach(this::cancel);
    }

    private void runGuarded(String name, Runnable job) {
        try {
            job.run();
        } catch (Exception e) {
            log.error("Scheduled job '{}' failed", name, e);
        }
    }
}
