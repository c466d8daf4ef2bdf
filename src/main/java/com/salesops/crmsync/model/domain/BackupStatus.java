package com.salesops.crmsync.model.domain;

public enum BackupStatus {
    PENDING, IN_PROGRESS, COMPLETED, FAILED
}
