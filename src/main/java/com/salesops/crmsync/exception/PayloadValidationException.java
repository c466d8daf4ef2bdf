package com.salesops.crmsync.exception;

/**
 * Malformed webhook payload or a record violating a schema rule. Never retried.
 */
public class PayloadValidationException extends CrmSyncException {

    public PayloadValidationException(String message) {
        super(message, false);
    }

    public PayloadValidationException(String message, Throwable cause) {
        super(message, cause, false);
    }
}
