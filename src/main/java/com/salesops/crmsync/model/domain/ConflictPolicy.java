package com.salesops.crmsync.model.domain;

public enum ConflictPolicy {
    REMOTE_WINS, LOCAL_WINS, MERGE, MANUAL
}
