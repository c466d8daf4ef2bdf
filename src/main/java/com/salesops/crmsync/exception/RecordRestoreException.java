package com.salesops.crmsync.exception;

import lombok.Getter;

/**
 * Failure restoring a single record; collected on the restore result, never aborts the batch.
 */
@Getter
public class RecordRestoreException extends CrmSyncException {

    private final String recordId;

    public RecordRestoreException(String recordId, Throwable cause) {
        super("Failed to restore record " + recordId + ": " + cause.getMessage(), cause, false);
        this.recordId = recordId;
    }
}
