package com.salesops.crmsync.model.dto;

import java.time.Instant;

/**
 * Per-module backup summary. {@code successRate} is the percentage of finished backups that
 * completed.
 */
public record BackupStatistics(
        String module,
        int totalBackups,
        int completedBackups,
        int failedBackups,
        long totalSize,
        Instant newestBackup,
        Instant oldestBackup,
        double successRate
) {}
