package com.salesops.crmsync.service.backup;

import com.salesops.crmsync.config.CrmSyncProperties;
import com.salesops.crmsync.model.domain.BackupMetadata;
import com.salesops.crmsync.model.domain.BackupStatus;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.temporal.IsoFields;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Decides which backups of one module have aged out.
 *
 * <p>Completed backups younger than {@code daily} days are all kept, younger than {@code weekly}
 * days the newest per ISO week, younger than {@code monthly} days the newest per calendar month.
 * The newest completed backup is always kept, as is every backup a kept incremental depends on.
 * Failed backups are removed once older than {@code daily} days.
 */
@Component
public class RetentionPolicy {

    private final CrmSyncProperties.Retention retention;

    public RetentionPolicy(CrmSyncProperties properties) {
        this.retention = properties.getBackup().getRetention();
    }

    public List<BackupMetadata> selectExpired(List<BackupMetadata> backups, Instant now) {
        Duration daily = Duration.ofDays(retention.getDaily());
        Duration weekly = Duration.ofDays(retention.getWeekly());
        Duration monthly = Duration.ofDays(retention.getMonthly());

        List<BackupMetadata> completed = backups.stream()
                .filter(b -> b.getStatus() == BackupStatus.COMPLETED)
                .sorted(Comparator.comparing(BackupMetadata::getTimestamp).reversed())
                .toList();

        Set<String> keep = new HashSet<>();
        Set<String> seenWeeks = new HashSet<>();
        Set<YearMonth> seenMonths = new HashSet<>();
        for (BackupMetadata backup : completed) {
            Duration age = Duration.between(backup.getTimestamp(), now);
            ZonedDateTime at = backup.getTimestamp().atZone(ZoneOffset.UTC);
            if (age.compareTo(daily) < 0) {
                keep.add(backup.getId());
            } else if (age.compareTo(weekly) < 0) {
                String week = at.get(IsoFields.WEEK_BASED_YEAR) + "-W" + at.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR);
                if (seenWeeks.add(week)) {
                    keep.add(backup.getId());
                }
            } else if (age.compareTo(monthly) < 0) {
                if (seenMonths.add(YearMonth.from(at))) {
                    keep.add(backup.getId());
                }
            }
        }
        if (!completed.isEmpty()) {
            keep.add(completed.get(0).getId());
        }
        keepBaseChains(completed, keep);

        List<BackupMetadata> expired = new ArrayList<>();
        for (BackupMetadata backup : backups) {
            if (backup.getStatus() == BackupStatus.COMPLETED && !keep.contains(backup.getId())) {
                expired.add(backup);
            } else if (backup.getStatus() == BackupStatus.FAILED
                    && Duration.between(backup.getTimestamp(), now).compareTo(daily) >= 0) {
                expired.add(backup);
            }
        }
        return expired;
    }

    private static void keepBaseChains(List<BackupMetadata> completed, Set<String> keep) {
        Map<String, BackupMetadata> byId = new HashMap<>();
        completed.forEach(b -> byId.put(b.getId(), b));
        for (String id : new ArrayList<>(keep)) {
            BackupMetadata current = byId.get(id);
            while (current != null && current.getBaseBackupId() != null) {
                keep.add(current.getBaseBackupId());
                current = byId.get(current.getBaseBackupId());
            }
        }
    }
}
