package com.salesops.crmsync.exception;

import lombok.Getter;

/**
 * Signals a record left un-synced pending manual conflict resolution. Not fatal.
 */
@Getter
public class ConflictDetectedException extends CrmSyncException {

    private final String conflictId;

    public ConflictDetectedException(String conflictId, String message) {
        super(message, false);
        this.conflictId = conflictId;
    }
}
