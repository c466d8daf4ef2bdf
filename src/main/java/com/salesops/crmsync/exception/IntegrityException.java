package com.salesops.crmsync.exception;

/**
 * Backup checksum mismatch or unreadable backup file. The restore is aborted before any write.
 */
public class IntegrityException extends CrmSyncException {

    public IntegrityException(String message) {
        super(message, false);
    }

    public IntegrityException(String message, Throwable cause) {
        super(message, cause, false);
    }
}
