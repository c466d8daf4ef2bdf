package com.salesops.crmsync.model.domain;

public enum BatchStatus {
    PENDING, PROCESSING, COMPLETED, FAILED
}
