package com.salesops.crmsync.model.dto;

import com.salesops.crmsync.model.domain.RestoreConflictPolicy;

import java.time.Instant;
import java.util.List;

/**
 * @param targetModule module to restore into; defaults to the backup's own module
 * @param pointInTime  for point-in-time restores, the latest instant the data may come from
 * @param recordIds    restrict the restore to these record ids; empty means all
 */
public record RestoreRequest(
        String targetModule,
        Instant pointInTime,
        List<String> recordIds,
        boolean dryRun,
        RestoreConflictPolicy conflictPolicy
) {

    public RestoreRequest {
        recordIds = recordIds == null ? List.of() : List.copyOf(recordIds);
        conflictPolicy = conflictPolicy == null ? RestoreConflictPolicy.SKIP : conflictPolicy;
    }

    public static RestoreRequest of(RestoreConflictPolicy policy, boolean dryRun) {
        return new RestoreRequest(null, null, List.of(), dryRun, policy);
    }
}
