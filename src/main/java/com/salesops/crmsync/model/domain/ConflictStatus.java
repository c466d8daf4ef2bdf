package com.salesops.crmsync.model.domain;

public enum ConflictStatus {
    PENDING, RESOLVED
}
