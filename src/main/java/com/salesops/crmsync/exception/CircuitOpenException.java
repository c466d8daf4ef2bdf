package com.salesops.crmsync.exception;

/**
 * The remote CRM is presumed down; calls fail fast until the breaker half-opens.
 */
public class CircuitOpenException extends CrmSyncException {

    public CircuitOpenException(String message, Throwable cause) {
        super(message, cause, true);
    }
}
