package com.salesops.crmsync.exception;

import java.time.Duration;

public class RateLimitExceededException extends CrmSyncException {

    private final Duration retryAfter;

    public RateLimitExceededException(String message, Duration retryAfter) {
        super(message, true);
        this.retryAfter = retryAfter;
    }

    public Duration getRetryAfter() {
        return retryAfter;
    }
}
