package com.salesops.crmsync.exception;

public class NotFoundException extends CrmSyncException {

    public NotFoundException(String message) {
        super(message, false);
    }
}
