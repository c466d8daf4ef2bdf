package com.salesops.crmsync.exception;

/**
 * Transient failure reported by the CRM client (5xx, timeouts, I/O).
 */
public class RetryableException extends CrmSyncException {

    public RetryableException(String message, Throwable cause) {
        super(message, cause, true);
    }
}
