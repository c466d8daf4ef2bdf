package com.salesops.crmsync.model.dto;

import com.salesops.crmsync.model.domain.SyncDirection;
import com.salesops.crmsync.model.domain.SyncMode;

import java.util.List;

public record SyncRequest(List<String> modules, SyncDirection direction, SyncMode mode, boolean validate) {

    public SyncRequest {
        modules = modules == null ? List.of() : List.copyOf(modules);
        direction = direction == null ? SyncDirection.BIDIRECTIONAL : direction;
        mode = mode == null ? SyncMode.INCREMENTAL : mode;
    }

    public static SyncRequest full(List<String> modules) {
        return new SyncRequest(modules, SyncDirection.BIDIRECTIONAL, SyncMode.FULL, true);
    }

    public static SyncRequest incremental(List<String> modules) {
        return new SyncRequest(modules, SyncDirection.BIDIRECTIONAL, SyncMode.INCREMENTAL, false);
    }
}
