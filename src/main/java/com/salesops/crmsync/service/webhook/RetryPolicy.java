package com.salesops.crmsync.service.webhook;

import com.salesops.crmsync.config.CrmSyncProperties;
import com.salesops.crmsync.exception.CrmSyncException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Exponential backoff for failed change events: the n-th retry waits {@code base × 2^(n−1)}.
 */
@Component
public class RetryPolicy {

    private final CrmSyncProperties properties;

    public RetryPolicy(CrmSyncProperties properties) {
        this.properties = properties;
    }

    public boolean canRetry(int retryCount) {
        return retryCount < properties.getWebhook().getRetry().getMaxRetries();
    }

    /**
     * @param retryCount the retry about to happen, starting at 1
     */
    public Duration delayFor(int retryCount) {
        Duration base = properties.getWebhook().getRetry().getBaseDelay();
        return base.multipliedBy(1L << Math.max(0, retryCount - 1));
    }

    /** Structural errors (bad payloads, programming errors) are never retried. */
    public boolean isRetryable(Throwable error) {
        if (error instanceof CrmSyncException crmSyncException) {
            return crmSyncException.isRetryable();
        }
        return error instanceof TransientDataAccessException;
    }
}
