package com.salesops.crmsync.model.dto;

import java.util.List;

/**
 * Conflict found while restoring a record: backup values on the remote side of each
 * {@link FieldConflict}, current values on the local side.
 */
public record RecordConflict(String recordId, List<FieldConflict> fields, String resolution) {}
