package com.salesops.crmsync.exception;

public class SyncInProgressException extends CrmSyncException {

    public SyncInProgressException(String module) {
        super("A sync pass is already active for module " + module, false);
    }
}
