package com.salesops.crmsync.model.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.salesops.crmsync.model.domain.BackupType;

import java.time.Instant;
import java.util.List;

/**
 * Serialized form of a backup file: {@code {metadata, records[], deletedRecords[]?}}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BackupDocument(Header metadata, List<CrmRecord> records, List<String> deletedRecords) {

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Header(
            String backupId,
            BackupType type,
            String module,
            Instant timestamp,
            String schemaVersion,
            int recordCount,
            String baseBackupId,
            String description
    ) {}
}
