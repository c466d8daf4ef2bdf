package com.salesops.crmsync.service.sync;

import com.salesops.crmsync.config.CrmSyncProperties;
import com.salesops.crmsync.exception.NotFoundException;
import com.salesops.crmsync.exception.PayloadValidationException;
import com.salesops.crmsync.model.domain.ConflictPolicy;
import com.salesops.crmsync.model.domain.ConflictRecord;
import com.salesops.crmsync.model.domain.ConflictStatus;
import com.salesops.crmsync.model.domain.ResolverType;
import com.salesops.crmsync.model.dto.ConflictResolution;
import com.salesops.crmsync.model.dto.CrmRecord;
import com.salesops.crmsync.model.dto.FieldConflict;
import com.salesops.crmsync.repository.ConflictRecordRepository;
import com.salesops.crmsync.service.events.LifecycleEvent;
import com.salesops.crmsync.service.events.LifecycleEventDispatcher;
import com.salesops.crmsync.service.events.LifecycleEventType;
import com.salesops.crmsync.service.gateway.CrmGateway;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Persists detected conflicts and applies manual resolutions.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ConflictService {

    public static final String SOURCE_SYNC = "SYNC";
    public static final String SOURCE_WEBHOOK = "WEBHOOK";
    public static final String SOURCE_RESTORE = "RESTORE";

    private final ConflictRecordRepository repository;
    private final ConflictResolutionEngine engine;
    private final LocalRecordStore store;
    private final CrmGateway gateway;
    private final LifecycleEventDispatcher dispatcher;
    private final CrmSyncProperties properties;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    /**
     * Records a conflict found by the engine. A manual conflict stays PENDING; any other policy
     * is recorded as resolved automatically. A still-pending conflict on the same record is
     * updated rather than duplicated.
     */
    @Transactional
    public ConflictRecord recordDetected(String module, CrmRecord remote, CrmRecord local,
                                         ConflictResolution resolution, String source) {
        boolean manual = resolution.isPendingManual();
        ConflictRecord record = manual
                ? repository.findByModuleAndRecordIdAndStatus(module, remote.id(), ConflictStatus.PENDING).stream()
                        .findFirst().orElseGet(ConflictRecord::new)
                : new ConflictRecord();
        if (record.getId() == null) {
            record.setId(UUID.randomUUID().toString());
        }
        record.setModule(module);
        record.setRecordId(remote.id());
        record.setFields(resolution.conflictingFields());
        record.setSuggestedResolution(ConflictPolicy.MERGE.name());
        record.setSource(source);
        record.setRemoteSnapshot(new LinkedHashMap<>(remote.fields()));
        record.setLocalSnapshot(new LinkedHashMap<>(local.fields()));
        record.setRemoteModifiedAt(remote.modifiedAt());
        record.setLocalModifiedAt(local.modifiedAt());
        record.setDetectedAt(clock.instant());
        if (manual) {
            record.setStatus(ConflictStatus.PENDING);
        } else {
            record.setStatus(ConflictStatus.RESOLVED);
            record.setResolver(ResolverType.AUTOMATIC);
            record.setFinalResolution(resolution.policy().name());
            record.setResolvedFields(new LinkedHashMap<>(resolution.resolvedFields()));
            record.setResolvedAt(clock.instant());
        }
        ConflictRecord saved = repository.save(record);
        meterRegistry.counter("crm.sync.conflicts", "module", module, "source", source).increment();
        dispatcher.publish(LifecycleEvent.of(LifecycleEventType.CONFLICT_DETECTED, saved.getId(), module,
                Map.of("recordId", remote.id(),
                        "fields", resolution.conflictingFields().stream().map(FieldConflict::field).toList(),
                        "status", saved.getStatus().name(),
                        "source", source)));
        log.info("Conflict {} on {} record {} ({} fields, {})", saved.getId(), module, remote.id(),
                resolution.conflictingFields().size(), manual ? "pending manual resolution" : resolution.policy());
        return saved;
    }

    /** Audit entry for a conflict found and settled while restoring a backup. */
    @Transactional
    public ConflictRecord recordRestoreConflict(String module, String recordId, List<FieldConflict> fields,
                                                Map<String, Object> backupFields, Map<String, Object> currentFields,
                                                String policy) {
        ConflictRecord record = new ConflictRecord();
        record.setId(UUID.randomUUID().toString());
        record.setModule(module);
        record.setRecordId(recordId);
        record.setFields(fields);
        record.setSuggestedResolution(ConflictPolicy.MERGE.name());
        record.setFinalResolution(policy);
        record.setResolver(ResolverType.AUTOMATIC);
        record.setStatus(ConflictStatus.RESOLVED);
        record.setSource(SOURCE_RESTORE);
        record.setRemoteSnapshot(new LinkedHashMap<>(backupFields));
        record.setLocalSnapshot(new LinkedHashMap<>(currentFields));
        Instant now = clock.instant();
        record.setDetectedAt(now);
        record.setResolvedAt(now);
        return repository.save(record);
    }

    /**
     * Applies an operator's decision to a pending conflict. Resolving an already resolved
     * conflict changes nothing and returns it as stored.
     *
     * @param customFields explicit field values; when given they override the merged result
     *                     and {@code policy} may be {@code null}
     */
    @Transactional
    public ConflictRecord resolveConflict(String conflictId, ConflictPolicy policy, Map<String, Object> customFields) {
        ConflictRecord record = repository.findById(conflictId)
                .orElseThrow(() -> new NotFoundException("Conflict " + conflictId + " not found"));
        if (record.isResolved()) {
            log.info("Conflict {} already resolved with {}, nothing to do", conflictId, record.getFinalResolution());
            return record;
        }
        boolean custom = customFields != null && !customFields.isEmpty();
        if (!custom && (policy == null || policy == ConflictPolicy.MANUAL)) {
            throw new PayloadValidationException("A resolution needs a policy other than MANUAL or custom field values");
        }

        CrmRecord remote = new CrmRecord(record.getRecordId(), record.getModule(), record.getRemoteSnapshot(), record.getRemoteModifiedAt());
        CrmRecord local = new CrmRecord(record.getRecordId(), record.getModule(), record.getLocalSnapshot(), record.getLocalModifiedAt());
        ConflictPolicy applied = custom && policy == null ? ConflictPolicy.MERGE : policy;
        Map<String, Object> resolved = new LinkedHashMap<>(engine.resolve(remote, local, applied).resolvedFields());
        if (custom) {
            resolved.putAll(customFields);
        }

        Instant now = clock.instant();
        String module = record.getModule();
        store.upsert(module, record.getRecordId(), resolved, now, false);
        if (properties.getSync().isBidirectionalPush()
                && !ConflictResolutionEngine.sameFields(resolved, ConflictResolutionEngine.stripMetadata(remote.fields()))) {
            gateway.updateRecord(module, record.getRecordId(), resolved);
            store.markSynced(module, record.getRecordId());
        }

        record.setStatus(ConflictStatus.RESOLVED);
        record.setResolver(ResolverType.MANUAL);
        record.setFinalResolution(custom ? "CUSTOM" : applied.name());
        record.setResolvedFields(resolved);
        record.setResolvedAt(now);
        ConflictRecord saved = repository.save(record);
        dispatcher.publish(LifecycleEvent.of(LifecycleEventType.CONFLICT_RESOLVED, saved.getId(), module,
                Map.of("recordId", saved.getRecordId(), "resolution", saved.getFinalResolution())));
        log.info("✅ Conflict {} on {} record {} resolved manually with {}", conflictId, module,
                saved.getRecordId(), saved.getFinalResolution());
        return saved;
    }

    @Transactional(readOnly = true)
    public List<ConflictRecord> listPending() {
        return repository.findByStatusOrderByDetectedAtAsc(ConflictStatus.PENDING);
    }

    @Transactional(readOnly = true)
    public List<ConflictRecord> listForModule(String module) {
        return repository.findByModuleOrderByDetectedAtDesc(module);
    }

    @Transactional(readOnly = true)
    public long countPending() {
        return repository.countByStatus(ConflictStatus.PENDING);
    }
}
