package com.salesops.crmsync.model.domain;

public enum BackupType {
    FULL, INCREMENTAL
}
