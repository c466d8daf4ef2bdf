package com.salesops.crmsync.exception;

/**
 * Root of the service's error taxonomy.
 *
 * Transient failures (network, rate limit, open circuit) are flagged {@code retryable} and are
 * retried with exponential backoff by their callers. Structural failures (bad signature, malformed
 * payload, integrity mismatch) are never retried automatically.
 */
public class CrmSyncException extends RuntimeException {

    private final boolean retryable;

    public CrmSyncException(String message, boolean retryable) {
        super(message);
        this.retryable = retryable;
    }

    public CrmSyncException(String message, Throwable cause, boolean retryable) {
        super(message, cause);
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
