package com.salesops.crmsync.model.dto;

import java.time.Duration;
import java.util.List;

public record RestoreResult(
        String backupId,
        String module,
        boolean dryRun,
        int recordsRestored,
        int recordsSkipped,
        int recordsFailed,
        int recordsDeleted,
        List<RecordConflict> conflicts,
        List<String> errors,
        Duration duration
) {

    public boolean success() {
        return recordsFailed == 0;
    }
}
