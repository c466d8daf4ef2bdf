package com.salesops.crmsync.model.domain;

public enum SyncPassStatus {
    RUNNING, COMPLETED, FAILED, CANCELLED
}
