package com.salesops.crmsync.service.backup;

import com.salesops.crmsync.config.CrmSyncProperties;
import com.salesops.crmsync.model.domain.BackupMetadata;
import com.salesops.crmsync.scheduling.JobScheduler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Nightly backup of every configured module followed by retention cleanup.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ScheduledBackupJobs {

    static final String BACKUP_JOB = "backup";

    private final JobScheduler jobScheduler;
    private final BackupRecoveryService backupService;
    private final CrmSyncProperties properties;

    @EventListener(ApplicationReadyEvent.class)
    public void registerSchedule() {
        CrmSyncProperties.Backup backup = properties.getBackup();
        if (!backup.isScheduleEnabled()) {
            log.info("Scheduled backups are disabled");
            return;
        }
        jobScheduler.schedule(BACKUP_JOB, backup.getCron(), this::runScheduledBackups);
    }

    void runScheduledBackups() {
        for (String module : properties.getSync().getModules()) {
            try {
                Optional<BackupMetadata> base = properties.getBackup().isIncremental()
                        ? backupService.latestCompleted(module)
                        : Optional.empty();
                BackupMetadata result = base.isPresent()
                        ? backupService.createIncrementalBackup(module, base.get().getId(), "Scheduled incremental backup")
                        : backupService.createFullBackup(module, "Scheduled full backup");
                log.info("🌙 Scheduled {} backup of {} finished as {}", result.getType(), module, result.getStatus());
            } catch (RuntimeException e) {
                log.error("Scheduled backup of {} failed: {}", module, e.getMessage(), e);
            }
            try {
                backupService.applyRetention(module);
            } catch (RuntimeException e) {
                log.error("Retention cleanup of {} failed: {}", module, e.getMessage(), e);
            }
        }
    }
}
