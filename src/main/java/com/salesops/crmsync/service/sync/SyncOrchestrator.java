package com.salesops.crmsync.service.sync;

import com.salesops.crmsync.config.CrmSyncProperties;
import com.salesops.crmsync.exception.ConflictDetectedException;
import com.salesops.crmsync.exception.CrmSyncException;
import com.salesops.crmsync.exception.PayloadValidationException;
import com.salesops.crmsync.model.domain.ChangeEvent;
import com.salesops.crmsync.model.domain.ConflictPolicy;
import com.salesops.crmsync.model.domain.ConflictRecord;
import com.salesops.crmsync.model.domain.SyncCursor;
import com.salesops.crmsync.model.domain.SyncMode;
import com.salesops.crmsync.model.domain.SyncPass;
import com.salesops.crmsync.model.domain.SyncPassStatus;
import com.salesops.crmsync.model.domain.SyncPhase;
import com.salesops.crmsync.model.dto.ConflictResolution;
import com.salesops.crmsync.model.dto.CrmRecord;
import com.salesops.crmsync.model.dto.DataQualitySummary;
import com.salesops.crmsync.model.dto.SyncReport;
import com.salesops.crmsync.model.dto.SyncRequest;
import com.salesops.crmsync.model.dto.SyncStatus;
import com.salesops.crmsync.repository.SyncCursorRepository;
import com.salesops.crmsync.repository.SyncPassRepository;
import com.salesops.crmsync.service.events.LifecycleEvent;
import com.salesops.crmsync.service.events.LifecycleEventDispatcher;
import com.salesops.crmsync.service.events.LifecycleEventType;
import com.salesops.crmsync.service.gateway.CrmGateway;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Runs sync passes between the CRM and the local store, one pass per module, and applies
 * individual webhook change events.
 *
 * A pass moves through VALIDATE, FETCH, RESOLVE, APPLY_LOCAL and APPLY_REMOTE. Every remote read
 * happens in FETCH, so a remote failure leaves local state untouched. Local writes are applied in
 * one transaction. The module's cursor only advances when the pass completes without errors.
 */
@Slf4j
@Service
public class SyncOrchestrator {

    private final CrmGateway gateway;
    private final LocalRecordStore store;
    private final ConflictResolutionEngine engine;
    private final ConflictService conflictService;
    private final RecordValidator validator;
    private final SyncLockManager lockManager;
    private final SyncPassRepository passRepository;
    private final SyncCursorRepository cursorRepository;
    private final LifecycleEventDispatcher dispatcher;
    private final TransactionTemplate transactionTemplate;
    private final TaskExecutor executor;
    private final CrmSyncProperties properties;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    private final Map<String, SyncPass> activePasses = new ConcurrentHashMap<>();
    private final Set<String> cancelRequested = ConcurrentHashMap.newKeySet();

    public SyncOrchestrator(CrmGateway gateway,
                            LocalRecordStore store,
                            ConflictResolutionEngine engine,
                            ConflictService conflictService,
                            RecordValidator validator,
                            SyncLockManager lockManager,
                            SyncPassRepository passRepository,
                            SyncCursorRepository cursorRepository,
                            LifecycleEventDispatcher dispatcher,
                            TransactionTemplate transactionTemplate,
                            @Qualifier("syncExecutor") TaskExecutor executor,
                            CrmSyncProperties properties,
                            MeterRegistry meterRegistry,
                            Clock clock) {
        this.gateway = gateway;
        this.store = store;
        this.engine = engine;
        this.conflictService = conflictService;
        this.validator = validator;
        this.lockManager = lockManager;
        this.passRepository = passRepository;
        this.cursorRepository = cursorRepository;
        this.dispatcher = dispatcher;
        this.transactionTemplate = transactionTemplate;
        this.executor = executor;
        this.properties = properties;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    /**
     * Syncs every requested module, or all configured modules when none are named. All module
     * locks are taken before any work starts.
     *
     * @throws com.salesops.crmsync.exception.SyncInProgressException if any module is already syncing
     */
    public SyncReport triggerSync(SyncRequest request) {
        List<String> modules = resolveModules(request);
        Instant started = clock.instant();
        Map<String, String> locks = lockManager.acquireAll(modules);
        log.info("🔄 Starting {} {} sync for {}", request.mode(), request.direction(), modules);
        try {
            List<CompletableFuture<SyncPass>> futures = modules.stream()
                    .map(module -> CompletableFuture.supplyAsync(() -> runPass(module, request), executor))
                    .toList();
            List<SyncPass> passes = futures.stream().map(CompletableFuture::join).toList();
            SyncReport report = new SyncReport(passes, Duration.between(started, clock.instant()));
            log.info("Sync finished in {} ms: {} records processed, {} conflicts, all succeeded: {}",
                    report.duration().toMillis(), report.totalProcessed(), report.totalConflicts(), report.allSucceeded());
            return report;
        } finally {
            lockManager.releaseAll(locks);
        }
    }

    public CompletableFuture<SyncReport> triggerSyncAsync(SyncRequest request) {
        return CompletableFuture.supplyAsync(() -> triggerSync(request), executor);
    }

    /**
     * Asks the running pass for {@code module} to stop at its next phase boundary.
     *
     * @return {@code false} if no pass is running for the module
     */
    public boolean cancelSync(String module) {
        if (!activePasses.containsKey(module)) {
            return false;
        }
        cancelRequested.add(module);
        log.info("Cancellation requested for {} sync", module);
        return true;
    }

    /**
     * Applies one webhook change event to the local store.
     *
     * @throws ConflictDetectedException when the module's policy is MANUAL and the change conflicts
     */
    @Transactional(noRollbackFor = ConflictDetectedException.class)
    public void handleChangeEvent(ChangeEvent event) {
        String module = event.getModule();
        String recordId = event.getRecordId();
        switch (event.getOperation()) {
            case DELETE -> {
                if (!store.softDelete(module, recordId)) {
                    log.info("Delete for unknown {} record {} ignored", module, recordId);
                }
            }
            case CREATE, UPDATE -> {
                Instant modifiedAt = event.getRemoteTimestamp() != null ? event.getRemoteTimestamp() : event.getReceivedAt();
                CrmRecord incoming = new CrmRecord(recordId, module,
                        ConflictResolutionEngine.stripMetadata(event.getPayload()), modifiedAt);
                Optional<CrmRecord> existing = store.find(module, recordId);
                if (existing.isEmpty()) {
                    store.upsert(module, recordId, incoming.fields(), modifiedAt, true);
                    return;
                }
                CrmRecord local = existing.get();
                ConflictResolution resolution = engine.resolve(incoming, local, properties.getSync().policyFor(module));
                if (resolution.hasConflict()) {
                    ConflictRecord conflict = conflictService.recordDetected(module, incoming, local, resolution,
                            ConflictService.SOURCE_WEBHOOK);
                    if (resolution.isPendingManual()) {
                        throw new ConflictDetectedException(conflict.getId(),
                                "Change to " + module + " record " + recordId + " needs manual resolution");
                    }
                }
                if (resolution.localChanged()) {
                    store.upsert(module, recordId, resolution.resolvedFields(), latest(incoming.modifiedAt(), local.modifiedAt()),
                            !resolution.remoteChanged());
                }
            }
            default -> throw new IllegalArgumentException("Unsupported operation " + event.getOperation());
        }
    }

    public SyncStatus getStatus() {
        Map<String, SyncPass> lastPasses = new LinkedHashMap<>();
        for (String module : properties.getSync().getModules()) {
            passRepository.findFirstByModuleOrderByStartedAtDesc(module).ifPresent(p -> lastPasses.put(module, p));
        }
        Map<String, DataQualitySummary> quality = validator.latestSummaries();
        return new SyncStatus(lastPasses, List.copyOf(activePasses.values()), conflictService.countPending(), quality);
    }

    SyncPass runPass(String module, SyncRequest request) {
        SyncPass pass = new SyncPass();
        pass.setId(UUID.randomUUID().toString());
        pass.setModule(module);
        pass.setDirection(request.direction());
        pass.setStartedAt(clock.instant());
        cancelRequested.remove(module);

        SyncCursor cursor = cursorRepository.findById(module).orElseGet(() -> new SyncCursor(module));
        SyncMode mode = request.mode();
        if (mode == SyncMode.INCREMENTAL && !cursor.hasBaseline()) {
            log.warn("No full sync baseline for {}, promoting incremental pass to FULL", module);
            mode = SyncMode.FULL;
        }
        pass.setMode(mode);
        passRepository.save(pass);
        activePasses.put(module, pass);

        Instant since = mode == SyncMode.INCREMENTAL ? cursor.getLastSuccessfulSyncAt() : null;
        try {
            enterPhase(pass, SyncPhase.VALIDATE);
            if (request.validate()) {
                DataQualitySummary summary = validator.validateSample(module);
                pass.setRecordsValidated(summary.checked());
                pass.setRecordsInvalid(summary.invalid());
            }

            enterPhase(pass, SyncPhase.FETCH);
            Fetched fetched = fetch(module, request, since);

            enterPhase(pass, SyncPhase.RESOLVE);
            Plan plan = resolve(module, request, fetched);
            pass.setRecordsProcessed(plan.processed);
            pass.setConflictsFound(plan.conflicts.size());

            enterPhase(pass, SyncPhase.APPLY_LOCAL);
            applyLocal(module, plan, pass);

            enterPhase(pass, SyncPhase.APPLY_REMOTE);
            applyRemote(module, plan, pass);

            pass.setPhase(SyncPhase.DONE);
            if (pass.getErrors() > 0) {
                pass.setStatus(SyncPassStatus.FAILED);
            } else {
                pass.setStatus(SyncPassStatus.COMPLETED);
                advanceCursor(cursor, mode, pass.getStartedAt());
            }
        } catch (PassCancelled e) {
            pass.setStatus(SyncPassStatus.CANCELLED);
            log.info("{} sync cancelled during {}", module, pass.getPhase());
        } catch (CrmSyncException e) {
            pass.setStatus(SyncPassStatus.FAILED);
            pass.setRetryable(e.isRetryable());
            pass.recordError(e.getMessage());
            log.error("❌ {} sync failed during {}: {}", module, pass.getPhase(), e.getMessage());
        } catch (RuntimeException e) {
            pass.setStatus(SyncPassStatus.FAILED);
            pass.recordError(e.getMessage());
            log.error("❌ {} sync failed during {}", module, pass.getPhase(), e);
        } finally {
            pass.setFinishedAt(clock.instant());
            passRepository.save(pass);
            activePasses.remove(module);
            cancelRequested.remove(module);
        }
        publishOutcome(pass);
        return pass;
    }

    private Fetched fetch(String module, SyncRequest request, Instant since) {
        Map<String, CrmRecord> remote = new LinkedHashMap<>();
        for (CrmRecord record : gateway.fetchRecords(module, since)) {
            remote.put(record.id(), record);
        }
        Map<String, CrmRecord> local = new LinkedHashMap<>();
        List<CrmRecord> localCandidates = since == null ? store.listActive(module) : store.changedSince(module, since);
        for (CrmRecord record : localCandidates) {
            local.put(record.id(), record);
        }
        if (since != null && request.direction().pushes()) {
            // locally changed records the remote delta did not include
            for (String id : local.keySet()) {
                if (!remote.containsKey(id)) {
                    gateway.fetchRecord(module, id).ifPresent(r -> remote.put(id, r));
                }
            }
        }
        if (since != null && request.direction().pulls()) {
            for (String id : remote.keySet()) {
                if (!local.containsKey(id)) {
                    store.find(module, id).ifPresent(r -> local.put(id, r));
                }
            }
        }
        log.info("Fetched {} remote and {} local {} records", remote.size(), local.size(), module);
        return new Fetched(remote, local);
    }

    private Plan resolve(String module, SyncRequest request, Fetched fetched) {
        Plan plan = new Plan();
        ConflictPolicy policy = properties.getSync().policyFor(module);
        Set<String> ids = new LinkedHashSet<>(fetched.remote.keySet());
        ids.addAll(fetched.local.keySet());
        for (String id : ids) {
            CrmRecord remote = fetched.remote.get(id);
            CrmRecord local = fetched.local.get(id);
            plan.processed++;
            if (remote != null && local != null) {
                ConflictResolution resolution = engine.resolve(remote, local, policy);
                if (resolution.hasConflict()) {
                    plan.conflicts.add(new DetectedConflict(remote, local, resolution));
                }
                if (resolution.isPendingManual()) {
                    continue;
                }
                Map<String, Object> merged = resolution.resolvedFields();
                if (resolution.localChanged() && request.direction().pulls()) {
                    plan.localWrites.add(new LocalWrite(id, merged, latest(remote.modifiedAt(), local.modifiedAt()),
                            !resolution.remoteChanged()));
                }
                if (resolution.remoteChanged() && request.direction().pushes()) {
                    plan.remoteWrites.add(new RemoteWrite(id, merged, false));
                }
            } else if (remote != null) {
                if (request.direction().pulls()) {
                    plan.localWrites.add(new LocalWrite(id, remote.fields(), remote.modifiedAt(), true));
                }
            } else if (request.direction().pushes()) {
                plan.remoteWrites.add(new RemoteWrite(id, local.fields(), true));
            }
        }
        return plan;
    }

    private void applyLocal(String module, Plan plan, SyncPass pass) {
        transactionTemplate.executeWithoutResult(status -> {
            for (DetectedConflict conflict : plan.conflicts) {
                conflictService.recordDetected(module, conflict.remote, conflict.local, conflict.resolution,
                        ConflictService.SOURCE_SYNC);
            }
            for (LocalWrite write : plan.localWrites) {
                boolean created = store.upsert(module, write.recordId, write.fields, write.modifiedAt, write.synced);
                if (created) {
                    pass.setRecordsCreated(pass.getRecordsCreated() + 1);
                } else {
                    pass.setRecordsUpdated(pass.getRecordsUpdated() + 1);
                }
            }
        });
        log.info("Applied {} local writes for {}", plan.localWrites.size(), module);
    }

    private void applyRemote(String module, Plan plan, SyncPass pass) {
        for (RemoteWrite write : plan.remoteWrites) {
            try {
                if (write.create) {
                    CrmRecord created = gateway.createRecord(new CrmRecord(write.recordId, module, write.fields, clock.instant()));
                    if (!created.id().equals(write.recordId)) {
                        store.rekey(module, write.recordId, created.id());
                    } else {
                        store.markSynced(module, write.recordId);
                    }
                } else {
                    gateway.updateRecord(module, write.recordId, write.fields);
                    store.markSynced(module, write.recordId);
                }
                pass.setRecordsPushed(pass.getRecordsPushed() + 1);
            } catch (CrmSyncException e) {
                pass.recordError("Push of " + module + " record " + write.recordId + " failed: " + e.getMessage());
                if (e.isRetryable()) {
                    pass.setRetryable(true);
                }
                log.error("Failed to push {} record {}: {}", module, write.recordId, e.getMessage());
            }
        }
    }

    private void enterPhase(SyncPass pass, SyncPhase phase) {
        if (cancelRequested.contains(pass.getModule())) {
            throw new PassCancelled();
        }
        pass.setPhase(phase);
        log.debug("{} sync entering {}", pass.getModule(), phase);
    }

    private void advanceCursor(SyncCursor cursor, SyncMode mode, Instant passStartedAt) {
        cursor.setLastSuccessfulSyncAt(passStartedAt);
        if (mode == SyncMode.FULL) {
            cursor.setLastFullSyncAt(passStartedAt);
        }
        cursorRepository.save(cursor);
    }

    private void publishOutcome(SyncPass pass) {
        boolean failed = pass.getStatus() == SyncPassStatus.FAILED;
        meterRegistry.counter("crm.sync.passes", "module", pass.getModule(), "status", pass.getStatus().name()).increment();
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("status", pass.getStatus().name());
        attributes.put("mode", pass.getMode().name());
        attributes.put("processed", pass.getRecordsProcessed());
        attributes.put("conflicts", pass.getConflictsFound());
        if (pass.getErrorMessage() != null) {
            attributes.put("error", pass.getErrorMessage());
            attributes.put("retryable", pass.isRetryable());
        }
        dispatcher.publish(LifecycleEvent.of(failed ? LifecycleEventType.SYNC_FAILED : LifecycleEventType.SYNC_COMPLETED,
                pass.getId(), pass.getModule(), attributes));
    }

    private List<String> resolveModules(SyncRequest request) {
        List<String> modules = request.modules().isEmpty() ? properties.getSync().getModules() : request.modules();
        for (String module : modules) {
            if (module == null || module.isBlank()) {
                throw new PayloadValidationException("Module names must not be blank");
            }
        }
        return List.copyOf(new LinkedHashSet<>(modules));
    }

    private static Instant latest(Instant a, Instant b) {
        if (a == null) {
            return b;
        }
        if (b == null) {
            return a;
        }
        return a.isAfter(b) ? a : b;
    }

    private record Fetched(Map<String, CrmRecord> remote, Map<String, CrmRecord> local) {}

    private record DetectedConflict(CrmRecord remote, CrmRecord local, ConflictResolution resolution) {}

    private record LocalWrite(String recordId, Map<String, Object> fields, Instant modifiedAt, boolean synced) {}

    private record RemoteWrite(String recordId, Map<String, Object> fields, boolean create) {}

    private static class Plan {
        int processed;
        final List<DetectedConflict> conflicts = new ArrayList<>();
        final List<LocalWrite> localWrites = new ArrayList<>();
        final List<RemoteWrite> remoteWrites = new ArrayList<>();
    }

    private static class PassCancelled extends RuntimeException {
        PassCancelled() {
            super(null, null, false, false);
        }
    }
}
