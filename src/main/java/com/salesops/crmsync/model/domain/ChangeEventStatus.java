package com.salesops.crmsync.model.domain;

public enum ChangeEventStatus {
    RECEIVED, BATCHED, RETRY_PENDING, PROCESSED, FAILED, FILTERED;

    public boolean isTerminal() {
        return this == PROCESSED || this == FAILED || this == FILTERED;
    }
}
