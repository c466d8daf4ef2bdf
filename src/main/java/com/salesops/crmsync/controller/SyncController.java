package com.salesops.crmsync.controller;

import com.salesops.crmsync.model.domain.ConflictPolicy;
import com.salesops.crmsync.model.domain.ConflictRecord;
import com.salesops.crmsync.model.domain.SyncPassStatus;
import com.salesops.crmsync.model.dto.SyncReport;
import com.salesops.crmsync.model.dto.SyncRequest;
import com.salesops.crmsync.model.dto.SyncStatus;
import com.salesops.crmsync.service.sync.ConflictService;
import com.salesops.crmsync.service.sync.SyncOrchestrator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * Manual sync operations and the conflict queue.
 */
@Slf4j
@RestController
@RequestMapping("/api/sync")
@RequiredArgsConstructor
public class SyncController {

    private final SyncOrchestrator orchestrator;
    private final ConflictService conflictService;

    /**
     * Runs a sync and waits for it. Answers 503 when a pass could not reach the CRM, so callers
     * know a retry may help.
     */
    @PostMapping
    public ResponseEntity<SyncReport> triggerSync(@RequestBody(required = false) SyncRequest request) {
        SyncRequest effective = request != null ? request : SyncRequest.incremental(List.of());
        log.info("🔄 Manual {} sync requested for {}", effective.mode(),
                effective.modules().isEmpty() ? "all modules" : effective.modules());
        SyncReport report = orchestrator.triggerSync(effective);
        boolean remoteUnavailable = report.passes().stream()
                .anyMatch(p -> p.getStatus() == SyncPassStatus.FAILED && p.isRetryable());
        return ResponseEntity.status(remoteUnavailable ? HttpStatus.SERVICE_UNAVAILABLE : HttpStatus.OK).body(report);
    }

    @GetMapping("/status")
    public ResponseEntity<SyncStatus> status() {
        return ResponseEntity.ok(orchestrator.getStatus());
    }

    @PostMapping("/{module}/cancel")
    public ResponseEntity<Map<String, Object>> cancel(@PathVariable String module) {
        if (!orchestrator.cancelSync(module)) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(Map.of("module", module, "cancelled", false, "message", "No sync running for " + module));
        }
        return ResponseEntity.accepted().body(Map.of("module", module, "cancelled", true));
    }

    @GetMapping("/conflicts")
    public ResponseEntity<List<ConflictRecord>> conflicts(@RequestParam(required = false) String module) {
        return ResponseEntity.ok(module == null ? conflictService.listPending() : conflictService.listForModule(module));
    }

    @PostMapping("/conflicts/{id}/resolve")
    public ResponseEntity<ConflictRecord> resolve(@PathVariable String id, @RequestBody ResolveConflictRequest request) {
        log.info("Manual resolution of conflict {} with {}", id,
                request.customFields() != null ? "custom fields" : request.policy());
        return ResponseEntity.ok(conflictService.resolveConflict(id, request.policy(), request.customFields()));
    }

    public record ResolveConflictRequest(ConflictPolicy policy, Map<String, Object> customFields) {}
}
