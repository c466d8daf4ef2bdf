package com.salesops.crmsync.service.sync;

import com.salesops.crmsync.model.domain.LocalRecord;
import com.salesops.crmsync.model.dto.CrmRecord;
import com.salesops.crmsync.repository.LocalRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The local side of the sync: one {@link LocalRecord} row per (module, record id).
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LocalRecordStore {

    private final LocalRecordRepository repository;
    private final Clock clock;

    @Transactional(readOnly = true)
    public Optional<CrmRecord> find(String module, String recordId) {
        return repository.findByModuleAndRecordId(module, recordId)
                .filter(r -> !r.isDeleted())
                .map(LocalRecordStore::toCrmRecord);
    }

    @Transactional(readOnly = true)
    public List<CrmRecord> listActive(String module) {
        return repository.findByModuleAndDeletedFalseOrderByRecordId(module).stream()
                .map(LocalRecordStore::toCrmRecord)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<CrmRecord> changedSince(String module, Instant since) {
        return repository.findByModuleAndDeletedFalseAndModifiedAtAfter(module, since).stream()
                .map(LocalRecordStore::toCrmRecord)
                .toList();
    }

    /**
     * Live records written to this store after {@code since}, by local change time rather than
     * the CRM's modification time.
     */
    @Transactional(readOnly = true)
    public List<CrmRecord> locallyChangedSince(String module, Instant since) {
        return repository.findByModuleAndDeletedFalseAndChangedAtAfter(module, since).stream()
                .map(LocalRecordStore::toCrmRecord)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<String> deletedSince(String module, Instant since) {
        return repository.findByModuleAndDeletedTrueAndDeletedAtAfter(module, since).stream()
                .map(LocalRecord::getRecordId)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<CrmRecord> sample(String module, int size) {
        return repository.findByModuleAndDeletedFalse(module, PageRequest.of(0, size, Sort.by("recordId"))).stream()
                .map(LocalRecordStore::toCrmRecord)
                .toList();
    }

    @Transactional(readOnly = true)
    public long count(String module) {
        return repository.countByModuleAndDeletedFalse(module);
    }

    /**
     * Inserts or replaces the record's fields. A soft-deleted record is revived.
     *
     * @param synced whether the new state matches the CRM, which stamps {@code lastSyncedAt}
     * @return {@code true} if a new row was created
     */
    @Transactional
    public boolean upsert(String module, String recordId, Map<String, Object> fields, Instant modifiedAt, boolean synced) {
        Optional<LocalRecord> existing = repository.findByModuleAndRecordId(module, recordId);
        LocalRecord record = existing.orElseGet(() -> new LocalRecord(module, recordId, fields, modifiedAt));
        record.setFields(ConflictResolutionEngine.stripMetadata(fields));
        record.setModifiedAt(modifiedAt == null ? clock.instant() : modifiedAt);
        record.setDeleted(false);
        record.setDeletedAt(null);
        Instant now = clock.instant();
        record.setChangedAt(now);
        if (synced) {
            record.setLastSyncedAt(now);
        }
        repository.save(record);
        log.debug("{} local {} record {}", existing.isPresent() ? "Updated" : "Inserted", module, recordId);
        return existing.isEmpty();
    }

    /**
     * @return {@code false} if there was no live record to delete
     */
    @Transactional
    public boolean softDelete(String module, String recordId) {
        Optional<LocalRecord> existing = repository.findByModuleAndRecordId(module, recordId)
                .filter(r -> !r.isDeleted());
        if (existing.isEmpty()) {
            return false;
        }
        LocalRecord record = existing.get();
        Instant now = clock.instant();
        record.setDeleted(true);
        record.setDeletedAt(now);
        record.setModifiedAt(now);
        record.setChangedAt(now);
        repository.save(record);
        log.debug("Soft-deleted local {} record {}", module, recordId);
        return true;
    }

    @Transactional
    public void markSynced(String module, String recordId) {
        repository.findByModuleAndRecordId(module, recordId).ifPresent(record -> {
            record.setLastSyncedAt(clock.instant());
            repository.save(record);
        });
    }

    /** Re-keys a locally created record once the CRM has assigned its own id. */
    @Transactional
    public void rekey(String module, String oldRecordId, String newRecordId) {
        repository.findByModuleAndRecordId(module, oldRecordId).ifPresent(record -> {
            Instant now = clock.instant();
            record.setRecordId(newRecordId);
            record.setChangedAt(now);
            record.setLastSyncedAt(now);
            repository.save(record);
            log.info("Local {} record {} is now known to the CRM as {}", module, oldRecordId, newRecordId);
        });
    }

    static CrmRecord toCrmRecord(LocalRecord record) {
        return new CrmRecord(record.getRecordId(), record.getModule(), record.getFields(), record.getModifiedAt());
    }
}
