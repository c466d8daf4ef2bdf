package com.salesops.crmsync.service.sync;

import com.salesops.crmsync.config.CrmSyncProperties;
import com.salesops.crmsync.exception.SyncInProgressException;
import com.salesops.crmsync.model.dto.SyncRequest;
import com.salesops.crmsync.scheduling.JobScheduler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CompletionException;

/**
 * Registers the full and incremental sync schedules. The jobs only start passes; the work runs
 * on the sync worker pool.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ScheduledSyncJobs {

    static final String FULL_SYNC_JOB = "sync-full";
    static final String INCREMENTAL_SYNC_JOB = "sync-incremental";

    private final JobScheduler jobScheduler;
    private final SyncOrchestrator orchestrator;
    private final CrmSyncProperties properties;

    @EventListener(ApplicationReadyEvent.class)
    public void registerSchedules() {
        CrmSyncProperties.Sync sync = properties.getSync();
        if (!sync.isSchedulesEnabled()) {
            log.info("Scheduled syncs are disabled");
            return;
        }
        jobScheduler.schedule(FULL_SYNC_JOB, sync.getFullCron(), () -> start(SyncRequest.full(List.of())));
        jobScheduler.schedule(INCREMENTAL_SYNC_JOB, sync.getIncrementalCron(), () -> start(SyncRequest.incremental(List.of())));
    }

    void start(SyncRequest request) {
        log.info("🌙 Scheduled {} sync starting", request.mode());
        orchestrator.triggerSyncAsync(request).whenComplete((report, ex) -> {
            Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
            if (cause instanceof SyncInProgressException) {
                log.warn("Scheduled {} sync skipped: {}", request.mode(), cause.getMessage());
            } else if (cause != null) {
                log.error("Scheduled {} sync failed", request.mode(), cause);
            } else {
                log.info("Scheduled {} sync done, all succeeded: {}", request.mode(), report.allSucceeded());
            }
        });
    }
}
