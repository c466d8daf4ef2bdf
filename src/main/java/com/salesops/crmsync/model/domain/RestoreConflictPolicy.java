package com.salesops.crmsync.model.domain;

public enum RestoreConflictPolicy {
    SKIP, OVERWRITE, MERGE
}
