package com.salesops.crmsync.service.events;

public enum LifecycleEventType {
    EVENT_PROCESSED,
    EVENT_FAILED,
    BATCH_COMPLETED,
    SYNC_COMPLETED,
    SYNC_FAILED,
    CONFLICT_DETECTED,
    CONFLICT_RESOLVED,
    BACKUP_COMPLETED,
    BACKUP_FAILED,
    BACKUP_DELETED,
    RESTORE_COMPLETED,
    RESTORE_FAILED,
    CIRCUIT_STATE_CHANGED;

    public boolean isFailure() {
        return this == EVENT_FAILED || this == SYNC_FAILED || this == BACKUP_FAILED || this == RESTORE_FAILED;
    }
}
