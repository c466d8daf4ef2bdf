package com.salesops.crmsync.model.domain;

/**
 * Ordered phases of a sync pass. Cancellation is only honoured between phases.
 */
public enum SyncPhase {
    VALIDATE, FETCH, RESOLVE, APPLY_LOCAL, APPLY_REMOTE, DONE
}
