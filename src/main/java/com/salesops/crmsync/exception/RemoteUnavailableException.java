package com.salesops.crmsync.exception;

/**
 * Raised once the gateway has exhausted its retries against a transient remote failure.
 */
public class RemoteUnavailableException extends CrmSyncException {

    public RemoteUnavailableException(String message, Throwable cause) {
        super(message, cause, true);
    }
}
