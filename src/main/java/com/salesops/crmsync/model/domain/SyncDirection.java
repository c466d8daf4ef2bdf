package com.salesops.crmsync.model.domain;

public enum SyncDirection {
    PULL, PUSH, BIDIRECTIONAL;

    public boolean pulls() {
        return this == PULL || this == BIDIRECTIONAL;
    }

    public boolean pushes() {
        return this == PUSH || this == BIDIRECTIONAL;
    }
}
