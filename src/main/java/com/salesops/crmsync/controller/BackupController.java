package com.salesops.crmsync.controller;

import com.salesops.crmsync.model.domain.BackupMetadata;
import com.salesops.crmsync.model.domain.RecoveryPoint;
import com.salesops.crmsync.model.domain.RestoreConflictPolicy;
import com.salesops.crmsync.model.dto.BackupStatistics;
import com.salesops.crmsync.model.dto.RestoreRequest;
import com.salesops.crmsync.model.dto.RestoreResult;
import com.salesops.crmsync.service.backup.BackupRecoveryService;
import com.salesops.crmsync.service.backup.OperationTracker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/backups")
@RequiredArgsConstructor
public class BackupController {

    private final BackupRecoveryService backupService;
    private final Clock clock;

    @PostMapping("/{module}/full")
    public ResponseEntity<BackupMetadata> fullBackup(@PathVariable String module,
                                                     @RequestParam(required = false) String description) {
        log.info("💾 Manual full backup requested for {}", module);
        return ResponseEntity.status(HttpStatus.CREATED).body(backupService.createFullBackup(module, description));
    }

    @PostMapping("/{module}/incremental")
    public ResponseEntity<BackupMetadata> incrementalBackup(@PathVariable String module,
                                                            @RequestParam("base") String baseBackupId,
                                                            @RequestParam(required = false) String description) {
        log.info("💾 Manual incremental backup requested for {} on top of {}", module, baseBackupId);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(backupService.createIncrementalBackup(module, baseBackupId, description));
    }

    @GetMapping
    public ResponseEntity<List<BackupMetadata>> list(@RequestParam(required = false) String module) {
        return ResponseEntity.ok(backupService.listBackups(module));
    }

    @GetMapping("/statistics")
    public ResponseEntity<Map<String, BackupStatistics>> statistics() {
        return ResponseEntity.ok(backupService.getStatistics());
    }

    @GetMapping("/operations")
    public ResponseEntity<List<OperationTracker.Operation>> operations() {
        return ResponseEntity.ok(backupService.runningOperations());
    }

    @GetMapping("/{module}/recovery-points")
    public ResponseEntity<List<RecoveryPoint>> recoveryPoints(@PathVariable String module) {
        return ResponseEntity.ok(backupService.getRecoveryPoints(module));
    }

    @PostMapping("/{id}/restore")
    public ResponseEntity<RestoreResult> restore(@PathVariable String id,
                                                 @RequestBody(required = false) RestoreRequest request) {
        RestoreRequest effective = request != null ? request : RestoreRequest.of(RestoreConflictPolicy.SKIP, false);
        log.info("♻️ Restore of backup {} requested (policy {}, dry run {})", id,
                effective.conflictPolicy(), effective.dryRun());
        return ResponseEntity.ok(backupService.restoreFromBackup(id, effective));
    }

    @PostMapping("/{module}/restore-point-in-time")
    public ResponseEntity<List<RestoreResult>> restorePointInTime(@PathVariable String module,
                                                                  @RequestBody RestoreRequest request) {
        Instant pointInTime = request.pointInTime() != null ? request.pointInTime() : clock.instant();
        log.info("♻️ Point-in-time restore of {} to {} requested", module, pointInTime);
        return ResponseEntity.ok(backupService.restoreToPointInTime(module, pointInTime, request));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable String id) {
        backupService.deleteBackup(id);
        return ResponseEntity.noContent().build();
    }
}
