package com.salesops.crmsync.exception;

/**
 * Webhook signature missing or not matching the shared secret.
 */
public class AuthenticationException extends CrmSyncException {

    public AuthenticationException(String message) {
        super(message, false);
    }
}
