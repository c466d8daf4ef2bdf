package com.salesops.crmsync.exception;

public class BackupInProgressException extends CrmSyncException {

    public BackupInProgressException(String module) {
        super("A backup is already running for module " + module, false);
    }
}
