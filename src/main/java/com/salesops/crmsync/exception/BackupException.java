package com.salesops.crmsync.exception;

/**
 * A backup run failed; the backup is marked FAILED and no recovery point is left behind.
 */
public class BackupException extends CrmSyncException {

    public BackupException(String message, Throwable cause) {
        super(message, cause, false);
    }
}
