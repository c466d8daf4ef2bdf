package com.salesops.crmsync.service.backup;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.salesops.crmsync.cache.DistributedCache;
import com.salesops.crmsync.config.CrmSyncProperties;
import com.salesops.crmsync.exception.BackupException;
import com.salesops.crmsync.exception.BackupInProgressException;
import com.salesops.crmsync.exception.CrmSyncException;
import com.salesops.crmsync.exception.IntegrityException;
import com.salesops.crmsync.exception.NotFoundException;
import com.salesops.crmsync.exception.PayloadValidationException;
import com.salesops.crmsync.exception.RecordRestoreException;
import com.salesops.crmsync.model.domain.BackupMetadata;
import com.salesops.crmsync.model.domain.BackupStatus;
import com.salesops.crmsync.model.domain.BackupType;
import com.salesops.crmsync.model.domain.RecoveryPoint;
import com.salesops.crmsync.model.dto.BackupDocument;
import com.salesops.crmsync.model.dto.BackupStatistics;
import com.salesops.crmsync.model.dto.CrmRecord;
import com.salesops.crmsync.model.dto.FieldConflict;
import com.salesops.crmsync.model.dto.RecordConflict;
import com.salesops.crmsync.model.dto.RestoreRequest;
import com.salesops.crmsync.model.dto.RestoreResult;
import com.salesops.crmsync.repository.BackupMetadataRepository;
import com.salesops.crmsync.repository.RecoveryPointRepository;
import com.salesops.crmsync.service.events.LifecycleEvent;
import com.salesops.crmsync.service.events.LifecycleEventDispatcher;
import com.salesops.crmsync.service.events.LifecycleEventType;
import com.salesops.crmsync.service.sync.ConflictResolutionEngine;
import com.salesops.crmsync.service.sync.ConflictService;
import com.salesops.crmsync.service.sync.LocalRecordStore;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Full and incremental backups of the local record store, restores with conflict handling, and
 * point-in-time recovery along incremental chains.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BackupRecoveryService {

    public static final String SCHEMA_VERSION = "1.0.0";
    static final String CACHE_PREFIX = "backup:meta:";

    private final BackupMetadataRepository metadataRepository;
    private final RecoveryPointRepository recoveryPointRepository;
    private final BackupStorage storage;
    private final BackupCodec codec;
    private final RetentionPolicy retentionPolicy;
    private final OperationTracker operations;
    private final LocalRecordStore store;
    private final ConflictResolutionEngine engine;
    private final ConflictService conflictService;
    private final DistributedCache cache;
    private final LifecycleEventDispatcher dispatcher;
    private final CrmSyncProperties properties;
    private final ObjectMapper objectMapper;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    private final Set<String> backupsInProgress = ConcurrentHashMap.newKeySet();

    public BackupMetadata createFullBackup(String module, String description) {
        return createBackup(BackupType.FULL, module, null, description);
    }

    /**
     * Backs up what changed since {@code baseBackupId}, which must be a completed backup of the
     * same module.
     */
    public BackupMetadata createIncrementalBackup(String module, String baseBackupId, String description) {
        BackupMetadata base = getBackup(baseBackupId);
        if (base.getStatus() != BackupStatus.COMPLETED || !base.getModule().equals(module)) {
            throw new PayloadValidationException("Backup " + baseBackupId
                    + " is not a completed backup of module " + module);
        }
        return createBackup(BackupType.INCREMENTAL, module, base, description);
    }

    private BackupMetadata createBackup(BackupType type, String module, BackupMetadata base, String description) {
        if (!backupsInProgress.add(module)) {
            throw new BackupInProgressException(module);
        }
        BackupMetadata metadata = new BackupMetadata();
        metadata.setId(UUID.randomUUID().toString());
        metadata.setType(type);
        metadata.setModule(module);
        metadata.setTimestamp(clock.instant());
        metadata.setSchemaVersion(SCHEMA_VERSION);
        metadata.setStatus(BackupStatus.IN_PROGRESS);
        metadata.setBaseBackupId(base == null ? null : base.getId());
        metadata.setDescription(description != null ? description
                : (type == BackupType.FULL ? "Full" : "Incremental") + " backup of " + module);
        OperationTracker.Operation operation = operations.start("BACKUP", module, metadata.getId());
        try {
            save(metadata);
            log.info("🔄 Starting {} backup {} of {}", type, metadata.getId(), module);

            operation.step("collecting records");
            List<CrmRecord> records = base == null
                    ? store.listActive(module)
                    : store.locallyChangedSince(module, base.getTimestamp());
            List<String> deleted = base == null ? null : store.deletedSince(module, base.getTimestamp());

            if (base != null && records.isEmpty() && deleted.isEmpty()) {
                metadata.setStatus(BackupStatus.COMPLETED);
                metadata.setCompletedAt(clock.instant());
                save(metadata);
                publish(LifecycleEventType.BACKUP_COMPLETED, metadata, Map.of("recordCount", 0, "empty", true));
                log.info("Nothing changed in {} since backup {}, recorded empty backup {}", module, base.getId(), metadata.getId());
                return metadata;
            }

            operation.step("serializing");
            BackupDocument document = new BackupDocument(
                    new BackupDocument.Header(metadata.getId(), type, module, metadata.getTimestamp(), SCHEMA_VERSION,
                            records.size(), metadata.getBaseBackupId(), metadata.getDescription()),
                    records,
                    deleted == null || deleted.isEmpty() ? null : deleted);
            BackupCodec.Encoded encoded = codec.encode(document, properties.getBackup().isCompression());

            operation.step("writing");
            storage.write(metadata.getId(), encoded.data());
            String checksum = codec.checksum(encoded.data());

            if (properties.getBackup().isVerifyIntegrity()) {
                operation.step("verifying");
                verifyChecksum(metadata.getId(), checksum);
            }

            metadata.setSize(encoded.size());
            metadata.setCompressedSize(encoded.compressedSize());
            metadata.setChecksum(checksum);
            metadata.setRecordCount(records.size());
            metadata.setStatus(BackupStatus.COMPLETED);
            metadata.setCompletedAt(clock.instant());
            save(metadata);
            createRecoveryPoint(metadata);

            meterRegistry.counter("crm.backup.runs", "module", module, "status", "completed").increment();
            publish(LifecycleEventType.BACKUP_COMPLETED, metadata,
                    Map.of("recordCount", records.size(), "size", encoded.size(), "type", type.name()));
            log.info("✅ Backup {} of {} completed: {} records, {} bytes", metadata.getId(), module,
                    records.size(), encoded.size());
        } catch (RuntimeException e) {
            failBackup(metadata, e);
            throw e instanceof CrmSyncException ? e : new BackupException("Backup of " + module + " failed", e);
        } finally {
            operations.finish(operation);
            backupsInProgress.remove(module);
        }

        try {
            applyRetention(module);
        } catch (RuntimeException e) {
            log.warn("Retention cleanup for {} failed after backup {}: {}", module, metadata.getId(), e.getMessage(), e);
        }
        return metadata;
    }

    private void failBackup(BackupMetadata metadata, RuntimeException cause) {
        log.error("❌ Backup {} of {} failed: {}", metadata.getId(), metadata.getModule(), cause.getMessage(), cause);
        metadata.setStatus(BackupStatus.FAILED);
        metadata.setError(cause.getMessage());
        try {
            storage.delete(metadata.getId());
            save(metadata);
        } catch (RuntimeException cleanup) {
            cause.addSuppressed(cleanup);
            log.error("Could not clean up failed backup {}", metadata.getId(), cleanup);
        }
        meterRegistry.counter("crm.backup.runs", "module", metadata.getModule(), "status", "failed").increment();
        publish(LifecycleEventType.BACKUP_FAILED, metadata,
                Map.of("error", String.valueOf(cause.getMessage())));
    }

    private void createRecoveryPoint(BackupMetadata metadata) {
        RecoveryPoint point = new RecoveryPoint();
        point.setId(UUID.randomUUID().toString());
        point.setTimestamp(metadata.getTimestamp());
        point.setModule(metadata.getModule());
        point.setBackupId(metadata.getId());
        point.setRecordCount(metadata.getRecordCount());
        point.setDescription(metadata.getDescription());
        recoveryPointRepository.save(point);
    }

    /**
     * Restores the records held by one backup. The checksum is verified before anything is
     * written.
     *
     * @throws IntegrityException if the backup file is missing or does not match its checksum
     */
    public RestoreResult restoreFromBackup(String backupId, RestoreRequest request) {
        BackupMetadata metadata = getBackup(backupId);
        if (metadata.getStatus() != BackupStatus.COMPLETED) {
            throw new PayloadValidationException("Backup " + backupId + " is " + metadata.getStatus()
                    + " and cannot be restored");
        }
        String target = request.targetModule() != null ? request.targetModule() : metadata.getModule();
        Instant started = clock.instant();
        if (metadata.isEmpty()) {
            return new RestoreResult(backupId, target, request.dryRun(), 0, 0, 0, 0, List.of(), List.of(), Duration.ZERO);
        }

        OperationTracker.Operation operation = operations.start("RESTORE", target, backupId);
        try {
            operation.step("verifying");
            byte[] data = verifyChecksum(backupId, metadata.getChecksum());
            operation.step("decoding");
            BackupDocument document = codec.decode(data, metadata.isCompressed());

            operation.step("restoring records");
            RestoreResult result = restoreDocument(document, metadata, target, request, started);
            if (!request.dryRun()) {
                meterRegistry.counter("crm.backup.restores", "module", target, "status", "completed").increment();
                publish(LifecycleEventType.RESTORE_COMPLETED, metadata, Map.of(
                        "targetModule", target,
                        "restored", result.recordsRestored(),
                        "skipped", result.recordsSkipped(),
                        "failed", result.recordsFailed()));
            }
            log.info("{} backup {} into {}: {} restored, {} skipped, {} failed, {} deleted",
                    request.dryRun() ? "Dry-run restore of" : "Restored", backupId, target, result.recordsRestored(),
                    result.recordsSkipped(), result.recordsFailed(), result.recordsDeleted());
            return result;
        } catch (RuntimeException e) {
            log.error("❌ Restore of backup {} into {} failed: {}", backupId, target, e.getMessage());
            if (!request.dryRun()) {
                meterRegistry.counter("crm.backup.restores", "module", target, "status", "failed").increment();
                publish(LifecycleEventType.RESTORE_FAILED, metadata,
                        Map.of("targetModule", target, "error", String.valueOf(e.getMessage())));
            }
            throw e;
        } finally {
            operations.finish(operation);
        }
    }

    private RestoreResult restoreDocument(BackupDocument document, BackupMetadata metadata, String target,
                                          RestoreRequest request, Instant started) {
        Set<String> only = new HashSet<>(request.recordIds());
        int restored = 0;
        int skipped = 0;
        int failed = 0;
        int deleted = 0;
        List<RecordConflict> conflicts = new ArrayList<>();
        List<String> errors = new ArrayList<>();

        List<CrmRecord> records = document.records() == null ? List.of() : document.records();
        for (CrmRecord record : records) {
            if (!only.isEmpty() && !only.contains(record.id())) {
                continue;
            }
            try {
                Map<String, Object> backupFields = ConflictResolutionEngine.stripMetadata(record.fields());
                Optional<CrmRecord> current = store.find(target, record.id());
                Map<String, Object> fields;
                if (current.isEmpty()) {
                    fields = backupFields;
                } else {
                    Map<String, Object> currentFields = current.get().fields();
                    List<FieldConflict> fieldConflicts = engine.detectConflicts(backupFields, currentFields);
                    if (!fieldConflicts.isEmpty()) {
                        conflicts.add(new RecordConflict(record.id(), fieldConflicts, request.conflictPolicy().name()));
                        if (!request.dryRun()) {
                            conflictService.recordRestoreConflict(target, record.id(), fieldConflicts,
                                    backupFields, currentFields, request.conflictPolicy().name());
                        }
                    }
                    fields = switch (request.conflictPolicy()) {
                        case SKIP -> fieldConflicts.isEmpty() ? overlay(currentFields, backupFields) : null;
                        case OVERWRITE -> backupFields;
                        case MERGE -> mergeNonConflicting(currentFields, backupFields, fieldConflicts);
                    };
                }
                if (fields == null) {
                    skipped++;
                    continue;
                }
                if (!request.dryRun()) {
                    store.upsert(target, record.id(), fields, clock.instant(), false);
                }
                restored++;
            } catch (RuntimeException e) {
                failed++;
                errors.add(new RecordRestoreException(record.id(), e).getMessage());
                log.warn("Could not restore {} record {} from backup {}: {}", target, record.id(),
                        metadata.getId(), e.getMessage());
            }
        }

        List<String> deletedRecords = document.deletedRecords() == null ? List.of() : document.deletedRecords();
        for (String recordId : deletedRecords) {
            if (!only.isEmpty() && !only.contains(recordId)) {
                continue;
            }
            try {
                boolean removed = request.dryRun()
                        ? store.find(target, recordId).isPresent()
                        : store.softDelete(target, recordId);
                if (removed) {
                    deleted++;
                }
            } catch (RuntimeException e) {
                failed++;
                errors.add(new RecordRestoreException(recordId, e).getMessage());
            }
        }

        return new RestoreResult(metadata.getId(), target, request.dryRun(), restored, skipped, failed, deleted,
                conflicts, errors, Duration.between(started, clock.instant()));
    }

    /**
     * Restores {@code module} to its state at {@code pointInTime}: the full backup behind the
     * latest recovery point at or before that instant, then each incremental on top of it.
     */
    public List<RestoreResult> restoreToPointInTime(String module, Instant pointInTime, RestoreRequest request) {
        RecoveryPoint point = recoveryPointRepository.findByModuleOrderByTimestampDesc(module).stream()
                .filter(RecoveryPoint::isRecoverable)
                .filter(p -> !p.getTimestamp().isAfter(pointInTime))
                .findFirst()
                .orElseThrow(() -> new NotFoundException("No recovery point for " + module + " at or before " + pointInTime));

        LinkedList<BackupMetadata> chain = new LinkedList<>();
        BackupMetadata current = getBackup(point.getBackupId());
        chain.addFirst(current);
        while (current.getType() == BackupType.INCREMENTAL) {
            String baseId = current.getBaseBackupId();
            current = metadataRepository.findById(baseId)
                    .orElseThrow(() -> new IntegrityException("Backup chain broken: base backup " + baseId + " is gone"));
            chain.addFirst(current);
        }
        log.info("Point-in-time restore of {} to {} via recovery point {} ({} backups)", module, pointInTime,
                point.getId(), chain.size());

        List<RestoreResult> results = new ArrayList<>();
        for (BackupMetadata backup : chain) {
            results.add(restoreFromBackup(backup.getId(), request));
        }
        return results;
    }

    public List<BackupMetadata> listBackups(String module) {
        return module == null
                ? metadataRepository.findAllByOrderByTimestampDesc()
                : metadataRepository.findByModuleOrderByTimestampDesc(module);
    }

    /** Cache first; the database row is authoritative and refills the cache on a miss. */
    public BackupMetadata getBackup(String backupId) {
        Optional<BackupMetadata> cached = cache.get(CACHE_PREFIX + backupId).flatMap(this::fromJson);
        if (cached.isPresent()) {
            return cached.get();
        }
        BackupMetadata metadata = metadataRepository.findById(backupId)
                .orElseThrow(() -> new NotFoundException("Backup " + backupId + " not found"));
        cacheMetadata(metadata);
        return metadata;
    }

    public Optional<BackupMetadata> latestCompleted(String module) {
        return metadataRepository.findFirstByModuleAndStatusOrderByTimestampDesc(module, BackupStatus.COMPLETED);
    }

    public List<RecoveryPoint> getRecoveryPoints(String module) {
        return recoveryPointRepository.findByModuleOrderByTimestampDesc(module);
    }

    public List<OperationTracker.Operation> runningOperations() {
        return operations.list();
    }

    public void deleteBackup(String backupId) {
        BackupMetadata metadata = metadataRepository.findById(backupId)
                .orElseThrow(() -> new NotFoundException("Backup " + backupId + " not found"));
        OperationTracker.Operation operation = operations.start("DELETE", metadata.getModule(), backupId);
        try {
            operation.step("removing file");
            storage.delete(backupId);
            operation.step("removing metadata");
            recoveryPointRepository.deleteByBackupId(backupId);
            metadataRepository.delete(metadata);
            cache.delete(CACHE_PREFIX + backupId);
        } finally {
            operations.finish(operation);
        }
        publish(LifecycleEventType.BACKUP_DELETED, metadata, Map.of("status", metadata.getStatus().name()));
        log.info("🗑️ Deleted backup {} of {}", backupId, metadata.getModule());
    }

    /**
     * @return the number of backups removed
     */
    public int applyRetention(String module) {
        List<BackupMetadata> expired = retentionPolicy.selectExpired(
                metadataRepository.findByModuleOrderByTimestampDesc(module), clock.instant());
        int removed = 0;
        for (BackupMetadata backup : expired) {
            try {
                deleteBackup(backup.getId());
                removed++;
            } catch (RuntimeException e) {
                log.warn("Retention could not delete backup {}: {}", backup.getId(), e.getMessage());
            }
        }
        if (removed > 0) {
            log.info("Retention removed {} backups of {}", removed, module);
        }
        return removed;
    }

    public Map<String, BackupStatistics> getStatistics() {
        Map<String, List<BackupMetadata>> byModule = new LinkedHashMap<>();
        for (BackupMetadata backup : metadataRepository.findAllByOrderByTimestampDesc()) {
            byModule.computeIfAbsent(backup.getModule(), m -> new ArrayList<>()).add(backup);
        }
        Map<String, BackupStatistics> statistics = new LinkedHashMap<>();
        byModule.forEach((module, backups) -> statistics.put(module, statisticsFor(module, backups)));
        return statistics;
    }

    private static BackupStatistics statisticsFor(String module, List<BackupMetadata> backups) {
        int completed = (int) backups.stream().filter(b -> b.getStatus() == BackupStatus.COMPLETED).count();
        int failed = (int) backups.stream().filter(b -> b.getStatus() == BackupStatus.FAILED).count();
        long totalSize = backups.stream().mapToLong(BackupMetadata::getSize).sum();
        Instant newest = backups.stream().map(BackupMetadata::getTimestamp).max(Comparator.naturalOrder()).orElse(null);
        Instant oldest = backups.stream().map(BackupMetadata::getTimestamp).min(Comparator.naturalOrder()).orElse(null);
        int finished = completed + failed;
        double successRate = finished == 0 ? 100.0 : completed * 100.0 / finished;
        return new BackupStatistics(module, backups.size(), completed, failed, totalSize, newest, oldest, successRate);
    }

    private byte[] verifyChecksum(String backupId, String expected) {
        byte[] data = storage.read(backupId)
                .orElseThrow(() -> new IntegrityException("Backup file for " + backupId + " is missing"));
        String actual = codec.checksum(data);
        if (!actual.equals(expected)) {
            throw new IntegrityException("Checksum mismatch for backup " + backupId
                    + ": expected " + expected + ", found " + actual);
        }
        return data;
    }

    private void save(BackupMetadata metadata) {
        metadataRepository.save(metadata);
        cacheMetadata(metadata);
    }

    private void cacheMetadata(BackupMetadata metadata) {
        try {
            cache.put(CACHE_PREFIX + metadata.getId(), objectMapper.writeValueAsString(metadata), null);
        } catch (JsonProcessingException e) {
            log.warn("Could not cache metadata of backup {}: {}", metadata.getId(), e.getMessage());
        }
    }

    private Optional<BackupMetadata> fromJson(String json) {
        try {
            return Optional.of(objectMapper.readValue(json, BackupMetadata.class));
        } catch (JsonProcessingException e) {
            log.warn("Ignoring unreadable cached backup metadata: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private void publish(LifecycleEventType type, BackupMetadata metadata, Map<String, Object> attributes) {
        dispatcher.publish(LifecycleEvent.of(type, metadata.getId(), metadata.getModule(), attributes));
    }

    private static Map<String, Object> overlay(Map<String, Object> current, Map<String, Object> backup) {
        Map<String, Object> merged = new LinkedHashMap<>(current);
        merged.putAll(backup);
        return merged;
    }

    private static Map<String, Object> mergeNonConflicting(Map<String, Object> current, Map<String, Object> backup,
                                                           List<FieldConflict> conflicts) {
        Set<String> conflicting = new HashSet<>();
        conflicts.forEach(c -> conflicting.add(c.field()));
        Map<String, Object> merged = new LinkedHashMap<>(current);
        backup.forEach((field, value) -> {
            if (!conflicting.contains(field)) {
                merged.put(field, value);
            }
        });
        return merged;
    }
}
