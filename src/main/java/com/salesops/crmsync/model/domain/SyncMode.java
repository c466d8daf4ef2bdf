package com.salesops.crmsync.model.domain;

public enum SyncMode {
    FULL, INCREMENTAL
}
