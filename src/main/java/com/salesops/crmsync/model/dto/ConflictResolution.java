package com.salesops.crmsync.model.dto;

import com.salesops.crmsync.model.domain.ConflictPolicy;

import java.util.List;
import java.util.Map;

/**
 * Outcome of comparing a remote and a local version of the same record.
 *
 * @param conflictingFields fields present on both sides with different values; empty when none
 * @param policy            policy that was applied, {@code null} when there was no conflict
 * @param resolvedFields    merged field values to apply; {@code null} when left for manual resolution
 * @param remoteChanged     whether {@code resolvedFields} differs from the remote version
 * @param localChanged      whether {@code resolvedFields} differs from the local version
 */
public record ConflictResolution(
        List<FieldConflict> conflictingFields,
        ConflictPolicy policy,
        Map<String, Object> resolvedFields,
        boolean remoteChanged,
        boolean localChanged
) {

    public boolean hasConflict() {
        return !conflictingFields.isEmpty();
    }

    public boolean isPendingManual() {
        return resolvedFields == null;
    }
}
