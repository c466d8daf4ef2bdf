package com.salesops.crmsync.model.dto;

import com.salesops.crmsync.model.domain.SyncPass;

import java.util.List;
import java.util.Map;

/**
 * @param lastPasses  most recent pass per module
 * @param dataQuality latest validation summary per module
 */
public record SyncStatus(
        Map<String, SyncPass> lastPasses,
        List<SyncPass> activePasses,
        long pendingConflicts,
        Map<String, DataQualitySummary> dataQuality
) {}
