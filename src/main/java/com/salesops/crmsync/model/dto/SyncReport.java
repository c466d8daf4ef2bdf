package com.salesops.crmsync.model.dto;

import com.salesops.crmsync.model.domain.SyncPass;
import com.salesops.crmsync.model.domain.SyncPassStatus;

import java.time.Duration;
import java.util.List;

public record SyncReport(List<SyncPass> passes, Duration duration) {

    public int totalProcessed() {
        return passes.stream().mapToInt(SyncPass::getRecordsProcessed).sum();
    }

    public int totalConflicts() {
        return passes.stream().mapToInt(SyncPass::getConflictsFound).sum();
    }

    public boolean allSucceeded() {
        return passes.stream().allMatch(p -> p.getStatus() == SyncPassStatus.COMPLETED);
    }
}
