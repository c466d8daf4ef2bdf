package com.salesops.crmsync.exception;

/**
 * Client-side error reported by the CRM (4xx). Retrying the same request cannot succeed.
 */
public class PermanentException extends CrmSyncException {

    public PermanentException(String message, Throwable cause) {
        super(message, cause, false);
    }
}
