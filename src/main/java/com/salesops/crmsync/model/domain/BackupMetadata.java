package com.salesops.crmsync.model.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

/**
 * One row per backup invocation. Immutable once COMPLETED; a failure only sets status and error.
 */
@Getter
@Setter
@Entity
@Table(name = "backup_metadata", indexes = @Index(name = "idx_backup_module_ts", columnList = "module, backup_timestamp"))
public class BackupMetadata {

    @Id
    private String id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private BackupType type;

    @Column(nullable = false)
    private String module;

    @Column(name = "backup_timestamp", nullable = false)
    private Instant timestamp;

    private long size;

    @Column(name = "compressed_size")
    private Long compressedSize;

    @Column(length = 64)
    private String checksum;

    @Column(name = "record_count")
    private int recordCount;

    @Column(name = "schema_version")
    private String schemaVersion;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private BackupStatus status = BackupStatus.PENDING;

    @Column(length = 2048)
    private String error;

    @Column(name = "base_backup_id")
    private String baseBackupId;

    private String description;

    @Column(name = "completed_at")
    private Instant completedAt;

    @JsonIgnore
    public boolean isCompressed() {
        return compressedSize != null;
    }

    /** A completed backup that stored no payload because nothing changed since its base. */
    @JsonIgnore
    public boolean isEmpty() {
        return status == BackupStatus.COMPLETED && size == 0 && checksum == null;
    }
}
