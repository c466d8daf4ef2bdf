package com.salesops.crmsync.scheduling;

import com.salesops.crmsync.config.AsyncConfig;
import com.salesops.crmsync.config.CrmSyncProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.Trigger;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ScheduledFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
@DisplayName("TaskSchedulerJobScheduler Tests")
class TaskSchedulerJobSchedulerTest {

    @Mock
    private TaskScheduler taskScheduler;

    @Mock
    private ScheduledFuture<Object> fullSync;

    @Mock
    private ScheduledFuture<Object> backup;

    @Test
    @DisplayName("Should cancel every registered job on shutdown")
    void shouldCancelAllJobs() {
        // Given
        doReturn(fullSync, backup).when(taskScheduler).schedule(any(Runnable.class), any(Trigger.class));
        TaskSchedulerJobScheduler jobScheduler = new TaskSchedulerJobScheduler(taskScheduler);
        jobScheduler.schedule("sync-full", "0 0 2 * * *", () -> { });
        jobScheduler.schedule("backup", "0 30 3 * * *", () -> { });

        // When
        jobScheduler.cancelAll();

        // Then
        verify(fullSync).cancel(false);
        verify(backup).cancel(false);
        assertThat(jobScheduler.cancel("sync-full")).isFalse();
    }

    @Test
    @DisplayName("Should shut the scheduler down without waiting for future cron fires or delayed tasks")
    void shouldNotWaitForDelayedTasksOnShutdown() {
        // Given
        ThreadPoolTaskScheduler scheduler = new AsyncConfig().taskScheduler(new CrmSyncProperties());
        TaskSchedulerJobScheduler jobScheduler = new TaskSchedulerJobScheduler(scheduler);
        jobScheduler.schedule("yearly", "0 0 0 1 1 *", () -> { });
        scheduler.schedule(() -> { }, Instant.now().plus(Duration.ofHours(1)));

        // When
        long started = System.nanoTime();
        scheduler.shutdown();

        // Then
        assertThat(Duration.ofNanos(System.nanoTime() - started)).isLessThan(Duration.ofSeconds(10));
        assertThat(scheduler.getScheduledExecutor().isTerminated()).isTrue();
    }
}
